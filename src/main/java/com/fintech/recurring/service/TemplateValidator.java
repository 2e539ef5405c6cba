package com.fintech.recurring.service;

import com.fintech.recurring.dto.ParticipantInput;
import com.fintech.recurring.dto.TemplateRequest;
import com.fintech.recurring.entity.ActorRef;
import com.fintech.recurring.entity.MovementType;
import com.fintech.recurring.entity.RecurrencePattern;
import com.fintech.recurring.entity.TemplateParticipant;
import com.fintech.recurring.exception.TemplateValidationException;
import com.fintech.recurring.exception.ValidationError;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Validates template requests and classifies them into a {@link TemplateMode}.
 * <p>
 * Rules are checked in a fixed order and the first broken one is reported. Field formats come
 * first, then the actor tagged-choice checks, then the rules of the inferred mode, and finally the
 * participant percentage sum.
 */
@Component
public class TemplateValidator {

    private static final BigDecimal ONE = BigDecimal.ONE;
    private static final BigDecimal PERCENTAGE_TOLERANCE = new BigDecimal("0.0001");
    private static final Pattern CURRENCY_CODE = Pattern.compile("[A-Za-z]{3}");

    // Match the amount and percentage columns so a stored value equals the validated one
    private static final int AMOUNT_SCALE = 2;
    private static final BigDecimal AMOUNT_LIMIT = new BigDecimal("1E13");
    private static final int PERCENTAGE_SCALE = 4;

    private final String defaultCurrency;

    public TemplateValidator(@Value("${recurring.default-currency:COP}") String defaultCurrency) {
        this.defaultCurrency = defaultCurrency;
    }

    public ValidatedTemplate validate(TemplateRequest request) {
        String name = trimToNull(request.getName());
        if (name == null) {
            throw new TemplateValidationException(ValidationError.NAME_REQUIRED);
        }

        MovementType movementType = parseMovementType(request.getMovementType());

        BigDecimal amount = request.getAmount();
        if (amount == null || amount.signum() <= 0) {
            throw new TemplateValidationException(ValidationError.AMOUNT_REQUIRED);
        }
        if (decimals(amount) > AMOUNT_SCALE) {
            throw new TemplateValidationException(ValidationError.AMOUNT_TOO_PRECISE);
        }
        if (amount.compareTo(AMOUNT_LIMIT) >= 0) {
            throw new TemplateValidationException(ValidationError.AMOUNT_TOO_LARGE);
        }

        String categoryId = trimToNull(request.getCategoryId());
        if (categoryId == null) {
            throw new TemplateValidationException(ValidationError.CATEGORY_REQUIRED);
        }

        String currency = parseCurrency(request.getCurrency());
        RecurrencePattern pattern = parsePattern(request.getRecurrencePattern());

        Integer dayOfMonth = request.getDayOfMonth();
        if (dayOfMonth != null && (dayOfMonth < 1 || dayOfMonth > 31)) {
            throw new TemplateValidationException(ValidationError.INVALID_DAY_OF_MONTH);
        }
        Integer dayOfYear = request.getDayOfYear();
        if (dayOfYear != null && (dayOfYear < 1 || dayOfYear > 365)) {
            throw new TemplateValidationException(ValidationError.INVALID_DAY_OF_YEAR);
        }

        FlexibleDate startDate = parseStartDate(request.getStartDate());

        ActorRef payer = toActor(request.getPayerUserId(), request.getPayerContactId(),
                ValidationError.CONFLICTING_PAYER);
        ActorRef counterparty = toActor(request.getCounterpartyUserId(), request.getCounterpartyContactId(),
                ValidationError.CONFLICTING_COUNTERPARTY);
        List<TemplateParticipant> participants = toParticipants(request.getParticipants());

        String paymentMethodId = trimToNull(request.getPaymentMethodId());
        String receiverAccountId = trimToNull(request.getReceiverAccountId());
        boolean autoGenerate = Boolean.TRUE.equals(request.getAutoGenerate());

        TemplateMode mode;
        if (movementType == null) {
            mode = TemplateMode.BUDGET_ONLY;
            if (autoGenerate) {
                throw new TemplateValidationException(ValidationError.AUTO_GENERATE_REQUIRES_MOVEMENT_TYPE);
            }
            if (payer != null || counterparty != null || paymentMethodId != null || receiverAccountId != null
                    || !participants.isEmpty() || pattern != null || dayOfMonth != null || dayOfYear != null
                    || startDate.isPresent()) {
                throw new TemplateValidationException(ValidationError.FIELDS_REQUIRE_MOVEMENT_TYPE);
            }
        } else {
            mode = autoGenerate ? TemplateMode.AUTO_GENERATE : TemplateMode.PRE_FILL;
            checkNotPermitted(movementType, payer, counterparty, participants, receiverAccountId);
            if (autoGenerate) {
                checkRecurrence(pattern, dayOfMonth, dayOfYear, startDate);
                checkRequiredForGeneration(movementType, payer, counterparty, participants,
                        paymentMethodId, receiverAccountId);
            }
        }

        if (!participants.isEmpty()) {
            checkPercentageSum(participants);
        }

        return ValidatedTemplate.builder()
                .mode(mode)
                .name(name)
                .description(trimToNull(request.getDescription()))
                .active(request.getIsActive() == null || request.getIsActive())
                .movementType(movementType)
                .categoryId(categoryId)
                .amount(amount)
                .currency(currency)
                .autoGenerate(autoGenerate)
                .payer(payer)
                .counterparty(counterparty)
                .paymentMethodId(paymentMethodId)
                .receiverAccountId(receiverAccountId)
                .participants(participants)
                .recurrencePattern(pattern)
                .dayOfMonth(dayOfMonth)
                .dayOfYear(dayOfYear)
                .startDate(startDate.orNull())
                .build();
    }

    private void checkNotPermitted(MovementType movementType, ActorRef payer, ActorRef counterparty,
                                   List<TemplateParticipant> participants, String receiverAccountId) {
        switch (movementType) {
            case HOUSEHOLD:
                if (payer != null) {
                    throw new TemplateValidationException(ValidationError.PAYER_NOT_ALLOWED);
                }
                if (counterparty != null) {
                    throw new TemplateValidationException(ValidationError.COUNTERPARTY_NOT_ALLOWED);
                }
                if (!participants.isEmpty()) {
                    throw new TemplateValidationException(ValidationError.PARTICIPANTS_NOT_ALLOWED);
                }
                if (receiverAccountId != null) {
                    throw new TemplateValidationException(ValidationError.RECEIVER_ACCOUNT_NOT_ALLOWED);
                }
                break;
            case SPLIT:
                if (counterparty != null) {
                    throw new TemplateValidationException(ValidationError.COUNTERPARTY_NOT_ALLOWED);
                }
                if (receiverAccountId != null) {
                    throw new TemplateValidationException(ValidationError.RECEIVER_ACCOUNT_NOT_ALLOWED);
                }
                break;
            case DEBT_PAYMENT:
                if (!participants.isEmpty()) {
                    throw new TemplateValidationException(ValidationError.PARTICIPANTS_NOT_ALLOWED);
                }
                break;
            default:
                break;
        }
    }

    private void checkRecurrence(RecurrencePattern pattern, Integer dayOfMonth, Integer dayOfYear,
                                 FlexibleDate startDate) {
        if (pattern == null || !startDate.isPresent()) {
            throw new TemplateValidationException(ValidationError.RECURRENCE_REQUIRED);
        }
        if (pattern == RecurrencePattern.MONTHLY && dayOfMonth == null) {
            throw new TemplateValidationException(ValidationError.DAY_OF_MONTH_REQUIRED);
        }
        if (pattern == RecurrencePattern.YEARLY && dayOfYear == null) {
            throw new TemplateValidationException(ValidationError.DAY_OF_YEAR_REQUIRED);
        }
    }

    private void checkRequiredForGeneration(MovementType movementType, ActorRef payer, ActorRef counterparty,
                                            List<TemplateParticipant> participants,
                                            String paymentMethodId, String receiverAccountId) {
        switch (movementType) {
            case HOUSEHOLD:
                if (paymentMethodId == null) {
                    throw new TemplateValidationException(ValidationError.PAYMENT_METHOD_REQUIRED);
                }
                break;
            case SPLIT:
                if (payer == null) {
                    throw new TemplateValidationException(ValidationError.PAYER_REQUIRED);
                }
                if (payer.isMember() && paymentMethodId == null) {
                    throw new TemplateValidationException(ValidationError.PAYMENT_METHOD_REQUIRED);
                }
                if (participants.isEmpty()) {
                    throw new TemplateValidationException(ValidationError.PARTICIPANTS_REQUIRED);
                }
                break;
            case DEBT_PAYMENT:
                if (payer == null) {
                    throw new TemplateValidationException(ValidationError.PAYER_REQUIRED);
                }
                if (counterparty == null) {
                    throw new TemplateValidationException(ValidationError.COUNTERPARTY_REQUIRED);
                }
                if (payer.isMember() && paymentMethodId == null) {
                    throw new TemplateValidationException(ValidationError.PAYMENT_METHOD_REQUIRED);
                }
                if (counterparty.isMember() && receiverAccountId == null) {
                    throw new TemplateValidationException(ValidationError.RECEIVER_ACCOUNT_REQUIRED);
                }
                break;
            default:
                break;
        }
    }

    private void checkPercentageSum(List<TemplateParticipant> participants) {
        BigDecimal sum = participants.stream()
                .map(TemplateParticipant::getPercentage)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
        if (sum.subtract(ONE).abs().compareTo(PERCENTAGE_TOLERANCE) > 0) {
            throw new TemplateValidationException(ValidationError.INVALID_PERCENTAGE_SUM);
        }
    }

    private List<TemplateParticipant> toParticipants(List<ParticipantInput> inputs) {
        List<TemplateParticipant> participants = new ArrayList<>();
        if (inputs == null) {
            return participants;
        }
        for (ParticipantInput input : inputs) {
            String userId = trimToNull(input.getUserId());
            String contactId = trimToNull(input.getContactId());
            if ((userId == null) == (contactId == null)) {
                throw new TemplateValidationException(ValidationError.INVALID_PARTICIPANT);
            }
            BigDecimal percentage = input.getPercentage();
            if (percentage == null || percentage.signum() <= 0 || percentage.compareTo(ONE) > 0) {
                throw new TemplateValidationException(ValidationError.INVALID_PARTICIPANT_PERCENTAGE);
            }
            if (decimals(percentage) > PERCENTAGE_SCALE) {
                throw new TemplateValidationException(ValidationError.PARTICIPANT_PERCENTAGE_TOO_PRECISE);
            }
            participants.add(TemplateParticipant.builder()
                    .participant(userId != null ? ActorRef.member(userId) : ActorRef.contact(contactId))
                    .percentage(percentage)
                    .build());
        }
        return participants;
    }

    private static ActorRef toActor(String userId, String contactId, ValidationError conflict) {
        String user = trimToNull(userId);
        String contact = trimToNull(contactId);
        if (user != null && contact != null) {
            throw new TemplateValidationException(conflict);
        }
        if (user != null) {
            return ActorRef.member(user);
        }
        return contact != null ? ActorRef.contact(contact) : null;
    }

    private static MovementType parseMovementType(String value) {
        String text = trimToNull(value);
        if (text == null) {
            return null;
        }
        try {
            return MovementType.valueOf(text.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new TemplateValidationException(ValidationError.INVALID_MOVEMENT_TYPE);
        }
    }

    private static RecurrencePattern parsePattern(String value) {
        String text = trimToNull(value);
        if (text == null) {
            return null;
        }
        try {
            return RecurrencePattern.valueOf(text.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new TemplateValidationException(ValidationError.INVALID_RECURRENCE_PATTERN);
        }
    }

    private String parseCurrency(String value) {
        String text = trimToNull(value);
        if (text == null) {
            return defaultCurrency;
        }
        if (!CURRENCY_CODE.matcher(text).matches()) {
            throw new TemplateValidationException(ValidationError.INVALID_CURRENCY);
        }
        return text.toUpperCase(Locale.ROOT);
    }

    private static FlexibleDate parseStartDate(String value) {
        try {
            return FlexibleDate.parse(value);
        } catch (DateTimeParseException e) {
            throw new TemplateValidationException(ValidationError.INVALID_START_DATE);
        }
    }

    private static int decimals(BigDecimal value) {
        return Math.max(0, value.stripTrailingZeros().scale());
    }

    static String trimToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
