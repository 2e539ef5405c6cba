package com.fintech.recurring.exception;

/**
 * Template names are unique within a household.
 */
public class DuplicateTemplateNameException extends TemplateException {

    public DuplicateTemplateNameException(String name) {
        super("a recurring movement template named '" + name + "' already exists in this household");
    }
}
