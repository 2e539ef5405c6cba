package com.fintech.recurring.dto;

import com.fintech.recurring.entity.MovementType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Values used to seed a manual movement form from a template. Never persisted.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PreFillData {

    private Long templateId;
    private String templateName;
    private MovementType movementType;
    private BigDecimal amount;
    private String currency;
    private String categoryId;

    private String payerUserId;
    private String payerContactId;

    private String counterpartyUserId;
    private String counterpartyContactId;

    private String paymentMethodId;
    private String receiverAccountId;

    @Builder.Default
    private List<ParticipantInput> participants = new ArrayList<>();
}
