package com.fintech.recurring.exception;

/**
 * No household member could be found to act on behalf of an auto-generating template.
 */
public class ActorResolutionException extends TemplateException {

    private final Long templateId;

    public ActorResolutionException(Long templateId, String message) {
        super(message);
        this.templateId = templateId;
    }

    public Long getTemplateId() {
        return templateId;
    }
}
