package com.fintech.recurring.exception;

public class GenerationInProgressException extends TemplateException {

    public GenerationInProgressException() {
        super("Movement generation already in progress");
    }
}
