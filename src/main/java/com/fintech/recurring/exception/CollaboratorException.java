package com.fintech.recurring.exception;

/**
 * Thrown when a collaborator (ledger, budgets) fails to serve a request.
 * Generation treats these as transient: the template is left due and retried on the next pass.
 */
public class CollaboratorException extends TemplateException {

    private final String collaborator;
    private final boolean isRetryable;

    public CollaboratorException(String message, String collaborator) {
        this(message, collaborator, true);
    }

    public CollaboratorException(String message, String collaborator, boolean isRetryable) {
        super(message);
        this.collaborator = collaborator;
        this.isRetryable = isRetryable;
    }

    public CollaboratorException(String message, String collaborator, Throwable cause) {
        super(message, cause);
        this.collaborator = collaborator;
        this.isRetryable = true;
    }

    public String getCollaborator() {
        return collaborator;
    }

    /**
     * Indicates if the failure is transient and the call can be repeated later.
     */
    public boolean isRetryable() {
        return isRetryable;
    }
}
