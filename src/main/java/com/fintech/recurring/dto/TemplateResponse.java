package com.fintech.recurring.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fintech.recurring.entity.ActorRef;
import com.fintech.recurring.entity.MovementType;
import com.fintech.recurring.entity.RecurrencePattern;
import com.fintech.recurring.entity.RecurringMovementTemplate;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.stream.Collectors;

/**
 * A template as returned by the API, with actors flattened to the same id fields a request uses.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TemplateResponse {

    private Long id;
    private String householdId;
    private String createdByUserId;
    private String name;
    private String description;
    @JsonProperty("isActive")
    private boolean isActive;

    private MovementType movementType;
    private String categoryId;
    private BigDecimal amount;
    private String currency;

    private boolean autoGenerate;

    private String payerUserId;
    private String payerContactId;
    private String counterpartyUserId;
    private String counterpartyContactId;
    private String paymentMethodId;
    private String receiverAccountId;
    private List<ParticipantInput> participants;

    private RecurrencePattern recurrencePattern;
    private Integer dayOfMonth;
    private Integer dayOfYear;
    private LocalDate startDate;
    private LocalDate lastGeneratedDate;
    private LocalDate nextScheduledDate;

    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;

    public static TemplateResponse from(RecurringMovementTemplate template) {
        ActorRef payer = template.getPayer();
        ActorRef counterparty = template.getCounterparty();
        return TemplateResponse.builder()
                .id(template.getId())
                .householdId(template.getHouseholdId())
                .createdByUserId(template.getCreatedByUserId())
                .name(template.getName())
                .description(template.getDescription())
                .isActive(template.isActive())
                .movementType(template.getMovementType())
                .categoryId(template.getCategoryId())
                .amount(template.getAmount())
                .currency(template.getCurrency())
                .autoGenerate(template.isAutoGenerate())
                .payerUserId(payer != null ? payer.userId() : null)
                .payerContactId(payer != null ? payer.contactId() : null)
                .counterpartyUserId(counterparty != null ? counterparty.userId() : null)
                .counterpartyContactId(counterparty != null ? counterparty.contactId() : null)
                .paymentMethodId(template.getPaymentMethodId())
                .receiverAccountId(template.getReceiverAccountId())
                .participants(template.getParticipants().stream()
                        .map(TemplateRequest::toInput)
                        .collect(Collectors.toList()))
                .recurrencePattern(template.getRecurrencePattern())
                .dayOfMonth(template.getDayOfMonth())
                .dayOfYear(template.getDayOfYear())
                .startDate(template.getStartDate())
                .lastGeneratedDate(template.getLastGeneratedDate())
                .nextScheduledDate(template.getNextScheduledDate())
                .createdAt(template.getCreatedAt())
                .updatedAt(template.getUpdatedAt())
                .build();
    }
}
