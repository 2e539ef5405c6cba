package com.fintech.recurring.exception;

/**
 * Thrown when a template request breaks a validation rule. Only the first broken rule is reported.
 */
public class TemplateValidationException extends TemplateException {

    private final ValidationError error;

    public TemplateValidationException(ValidationError error) {
        super(error.getMessage());
        this.error = error;
    }

    public ValidationError getError() {
        return error;
    }
}
