package com.fintech.recurring.service;

import com.fintech.recurring.entity.ActorRef;
import com.fintech.recurring.entity.MovementType;
import com.fintech.recurring.entity.RecurrencePattern;
import com.fintech.recurring.entity.RecurringMovementTemplate;
import com.fintech.recurring.entity.TemplateParticipant;
import lombok.Builder;
import lombok.Data;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A template request that passed validation, with every field parsed into its domain type.
 */
@Data
@Builder
public class ValidatedTemplate {

    private TemplateMode mode;

    private String name;
    private String description;
    private boolean active;

    private MovementType movementType;
    private String categoryId;
    private BigDecimal amount;
    private String currency;

    private boolean autoGenerate;

    private ActorRef payer;
    private ActorRef counterparty;
    private String paymentMethodId;
    private String receiverAccountId;

    @Builder.Default
    private List<TemplateParticipant> participants = new ArrayList<>();

    private RecurrencePattern recurrencePattern;
    private Integer dayOfMonth;
    private Integer dayOfYear;
    private LocalDate startDate;

    /**
     * Copies the user-authored fields onto {@code template}. Tracking fields are left alone.
     */
    public void applyTo(RecurringMovementTemplate template) {
        template.setName(name);
        template.setDescription(description);
        template.setActive(active);
        template.setMovementType(movementType);
        template.setCategoryId(categoryId);
        template.setAmount(amount);
        template.setCurrency(currency);
        template.setAutoGenerate(autoGenerate);
        template.setPayer(payer);
        template.setCounterparty(counterparty);
        template.setPaymentMethodId(paymentMethodId);
        template.setReceiverAccountId(receiverAccountId);
        if (template.getParticipants() == null) {
            template.setParticipants(new ArrayList<>(participants));
        } else {
            template.getParticipants().clear();
            template.getParticipants().addAll(participants);
        }
        template.setRecurrencePattern(recurrencePattern);
        template.setDayOfMonth(dayOfMonth);
        template.setDayOfYear(dayOfYear);
        template.setStartDate(startDate);
    }

    /**
     * True when applying this result to {@code template} would change when it next generates.
     */
    public boolean changesScheduleOf(RecurringMovementTemplate template) {
        return autoGenerate != template.isAutoGenerate()
                || active != template.isActive()
                || recurrencePattern != template.getRecurrencePattern()
                || !Objects.equals(dayOfMonth, template.getDayOfMonth())
                || !Objects.equals(dayOfYear, template.getDayOfYear())
                || !Objects.equals(startDate, template.getStartDate());
    }
}
