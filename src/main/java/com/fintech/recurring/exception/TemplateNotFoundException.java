package com.fintech.recurring.exception;

public class TemplateNotFoundException extends TemplateException {

    private final Long templateId;

    public TemplateNotFoundException(Long templateId) {
        super("recurring movement template not found: " + templateId);
        this.templateId = templateId;
    }

    public Long getTemplateId() {
        return templateId;
    }
}
