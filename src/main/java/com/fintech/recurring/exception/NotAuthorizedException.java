package com.fintech.recurring.exception;

/**
 * The requester, or an actor named in the request, does not belong to the household.
 */
public class NotAuthorizedException extends TemplateException {

    public NotAuthorizedException(String message) {
        super(message);
    }
}
