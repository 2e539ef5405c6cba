package com.fintech.recurring.exception;

/**
 * Rules a template create/update request can break. The message is returned to the caller as is.
 */
public enum ValidationError {

    NAME_REQUIRED("name is required"),
    INVALID_MOVEMENT_TYPE("movementType must be one of HOUSEHOLD, SPLIT, DEBT_PAYMENT"),
    AMOUNT_REQUIRED("amount is required and must be greater than 0"),
    AMOUNT_TOO_PRECISE("amount must have at most 2 decimal places"),
    AMOUNT_TOO_LARGE("amount must be less than 10000000000000"),
    CATEGORY_REQUIRED("categoryId is required"),
    INVALID_CURRENCY("currency must be a 3-letter code"),
    INVALID_RECURRENCE_PATTERN("invalid recurrence pattern"),
    INVALID_DAY_OF_MONTH("dayOfMonth must be between 1 and 31"),
    INVALID_DAY_OF_YEAR("dayOfYear must be between 1 and 365"),
    INVALID_START_DATE("startDate must be YYYY-MM-DD or an ISO-8601 timestamp"),
    CONFLICTING_PAYER("cannot specify both payerUserId and payerContactId"),
    CONFLICTING_COUNTERPARTY("cannot specify both counterpartyUserId and counterpartyContactId"),
    INVALID_PARTICIPANT("participant must have exactly one of userId or contactId"),
    INVALID_PARTICIPANT_PERCENTAGE("participant percentage must be greater than 0 and at most 1"),
    PARTICIPANT_PERCENTAGE_TOO_PRECISE("participant percentage must have at most 4 decimal places"),
    INVALID_PERCENTAGE_SUM("participant percentages must sum to 100%"),
    AUTO_GENERATE_REQUIRES_MOVEMENT_TYPE("autoGenerate requires a movementType"),
    FIELDS_REQUIRE_MOVEMENT_TYPE("payer, counterparty, payment, participant and recurrence fields require a movementType"),
    RECURRENCE_REQUIRED("recurrencePattern and startDate required when autoGenerate is true"),
    DAY_OF_MONTH_REQUIRED("dayOfMonth required for MONTHLY recurrence"),
    DAY_OF_YEAR_REQUIRED("dayOfYear required for YEARLY recurrence"),
    PAYER_NOT_ALLOWED("payer not allowed for HOUSEHOLD templates"),
    COUNTERPARTY_NOT_ALLOWED("counterparty only allowed for DEBT_PAYMENT templates"),
    PARTICIPANTS_NOT_ALLOWED("participants only allowed for SPLIT templates"),
    RECEIVER_ACCOUNT_NOT_ALLOWED("receiverAccountId only allowed for DEBT_PAYMENT templates"),
    PAYER_REQUIRED("exactly one payer (user or contact) is required"),
    COUNTERPARTY_REQUIRED("counterparty is required for DEBT_PAYMENT templates"),
    PAYMENT_METHOD_REQUIRED("paymentMethodId is required when the household or one of its members pays"),
    RECEIVER_ACCOUNT_REQUIRED("receiverAccountId is required when the counterparty is a household member"),
    PARTICIPANTS_REQUIRED("participants required for SPLIT templates");

    private final String message;

    ValidationError(String message) {
        this.message = message;
    }

    public String getMessage() {
        return message;
    }
}
