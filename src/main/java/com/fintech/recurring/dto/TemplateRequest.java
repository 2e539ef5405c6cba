package com.fintech.recurring.dto;

import com.fintech.recurring.entity.ActorRef;
import com.fintech.recurring.entity.RecurringMovementTemplate;
import com.fintech.recurring.entity.TemplateParticipant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Body of template create and update requests.
 * <p>
 * Every field is optional at this level: on create, the validator decides what is required from the
 * fields present; on update, absent fields keep their stored value. Enumerations and the start date
 * travel as text so a bad value is reported as a validation error rather than a parse failure.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class TemplateRequest {

    private String name;
    private String description;
    private Boolean isActive;

    private String movementType;
    private String categoryId;
    private BigDecimal amount;
    private String currency;

    private Boolean autoGenerate;

    private String payerUserId;
    private String payerContactId;

    private String counterpartyUserId;
    private String counterpartyContactId;

    /**
     * On update an empty string clears the stored value.
     */
    private String paymentMethodId;

    /**
     * On update an empty string clears the stored value.
     */
    private String receiverAccountId;

    /**
     * On update a non-null list replaces the stored participants.
     */
    private List<ParticipantInput> participants;

    private String recurrencePattern;
    private Integer dayOfMonth;
    private Integer dayOfYear;

    /**
     * {@code YYYY-MM-DD} or an ISO-8601 timestamp.
     */
    private String startDate;

    /**
     * Snapshot of a stored template in request form, the base an update is merged onto.
     */
    public static TemplateRequest fromTemplate(RecurringMovementTemplate template) {
        ActorRef payer = template.getPayer();
        ActorRef counterparty = template.getCounterparty();
        return TemplateRequest.builder()
                .name(template.getName())
                .description(template.getDescription())
                .isActive(template.isActive())
                .movementType(template.getMovementType() != null ? template.getMovementType().name() : null)
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
                .recurrencePattern(template.getRecurrencePattern() != null ? template.getRecurrencePattern().name() : null)
                .dayOfMonth(template.getDayOfMonth())
                .dayOfYear(template.getDayOfYear())
                .startDate(template.getStartDate() != null ? template.getStartDate().toString() : null)
                .build();
    }

    public static ParticipantInput toInput(TemplateParticipant participant) {
        return ParticipantInput.builder()
                .userId(participant.getParticipant().userId())
                .contactId(participant.getParticipant().contactId())
                .percentage(participant.getPercentage())
                .build();
    }
}
