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
 * Definition of a financial event that keeps happening (rent, a subscription, a loan repayment).
 * <p>
 * Depending on which fields are set a template only feeds the category budget, pre-fills a manual
 * movement form, or generates ledger movements on its own schedule.
 * <p>
 * {@code lastGeneratedDate} and {@code nextScheduledDate} belong to the generation engine;
 * {@code nextScheduledDate} is non-null only while the template is active and auto-generating.
 */
@Entity
@Table(name = "recurring_movement_templates", indexes = {
        @Index(name = "idx_templates_household", columnList = "household_id"),
        @Index(name = "idx_templates_household_category", columnList = "household_id, category_id"),
        @Index(name = "idx_templates_pending_generation", columnList = "is_active, auto_generate, next_scheduled_date")
}, uniqueConstraints = {
        @UniqueConstraint(name = "uk_templates_household_name", columnNames = {"household_id", "name"})
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RecurringMovementTemplate {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "household_id", nullable = false, updatable = false, length = 64)
    private String householdId;

    @Column(name = "created_by_user_id", updatable = false, length = 64)
    private String createdByUserId;

    @Column(nullable = false, length = 200)
    private String name;

    @Column(length = 1000)
    private String description;

    @Column(name = "is_active", nullable = false)
    @Builder.Default
    private boolean active = true;

    @Enumerated(EnumType.STRING)
    @Column(name = "movement_type", length = 20)
    private MovementType movementType;

    @Column(name = "category_id", nullable = false, length = 64)
    private String categoryId;

    @Column(nullable = false, precision = 15, scale = 2)
    private BigDecimal amount;

    @Column(nullable = false, length = 3)
    private String currency;

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
    @CollectionTable(name = "recurring_movement_participants",
            joinColumns = @JoinColumn(name = "template_id"))
    @OrderColumn(name = "participant_order")
    @Builder.Default
    private List<TemplateParticipant> participants = new ArrayList<>();

    @Column(name = "auto_generate", nullable = false)
    private boolean autoGenerate;

    @Enumerated(EnumType.STRING)
    @Column(name = "recurrence_pattern", length = 10)
    private RecurrencePattern recurrencePattern;

    @Column(name = "day_of_month")
    private Integer dayOfMonth;

    @Column(name = "day_of_year")
    private Integer dayOfYear;

    @Column(name = "start_date")
    private LocalDate startDate;

    @Column(name = "last_generated_date")
    private LocalDate lastGeneratedDate;

    @Column(name = "next_scheduled_date")
    private LocalDate nextScheduledDate;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    @Version
    private Long version;

    @PrePersist
    protected void onCreate() {
        createdAt = LocalDateTime.now();
        updatedAt = LocalDateTime.now();
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = LocalDateTime.now();
    }
}
