package com.fintech.recurring.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * A movement recorded in the household ledger.
 * <p>
 * Movements produced by the generator carry the id of the template they came from.
 */
@Entity
@Table(name = "ledger_movements", indexes = {
        @Index(name = "idx_movements_household_date", columnList = "household_id, movement_date"),
        @Index(name = "idx_movements_template", columnList = "generated_from_template_id")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LedgerMovement {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "household_id", nullable = false, length = 64)
    private String householdId;

    @Column(name = "created_by_user_id", nullable = false, length = 64)
    private String createdByUserId;

    @Enumerated(EnumType.STRING)
    @Column(name = "movement_type", nullable = false, length = 20)
    private MovementType movementType;

    @Column(nullable = false, length = 200)
    private String description;

    @Column(nullable = false, precision = 15, scale = 2)
    private BigDecimal amount;

    @Column(nullable = false, length = 3)
    private String currency;

    @Column(name = "category_id", length = 64)
    private String categoryId;

    @Column(name = "movement_date", nullable = false)
    private LocalDate movementDate;

    @Embedded
    @AttributeOverrides({
            @AttributeOverride(name = "kind", column = @Column(name = "payer_kind", length = 10)),
            @AttributeOverride(name = "id", column = @Column(name = "payer_id", length = 64))
    })
    private ActorRef payer;

    @Embedded
    @AttributeOverrides({
            @AttributeOverride(name = "kind", column = @Column(name = "counterparty_kind", length = 10)),
            @AttributeOverride(name = "id", column = @Column(name = "counterparty_id", length = 64))
    })
    private ActorRef counterparty;

    @Column(name = "payment_method_id", length = 64)
    private String paymentMethodId;

    @Column(name = "receiver_account_id", length = 64)
    private String receiverAccountId;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "ledger_movement_participants",
            joinColumns = @JoinColumn(name = "movement_id"))
    @OrderColumn(name = "participant_order")
    @Builder.Default
    private List<TemplateParticipant> participants = new ArrayList<>();

    @Column(name = "generated_from_template_id")
    private Long generatedFromTemplateId;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @PrePersist
    protected void onCreate() {
        createdAt = LocalDateTime.now();
    }
}
