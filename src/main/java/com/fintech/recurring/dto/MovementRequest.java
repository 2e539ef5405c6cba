package com.fintech.recurring.dto;

import com.fintech.recurring.entity.ActorRef;
import com.fintech.recurring.entity.MovementType;
import com.fintech.recurring.entity.TemplateParticipant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Request to record a movement in the ledger.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MovementRequest {

    private MovementType type;
    private String description;
    private BigDecimal amount;
    private String currency;
    private String categoryId;
    private LocalDate movementDate;

    private ActorRef payer;
    private ActorRef counterparty;
    private String paymentMethodId;
    private String receiverAccountId;

    @Builder.Default
    private List<TemplateParticipant> participants = new ArrayList<>();

    /**
     * Set when the movement is produced by a template, for traceability.
     */
    private Long generatedFromTemplateId;
}
