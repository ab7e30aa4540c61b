package com.vidnyan.pde.exception;

import lombok.Getter;

/**
 * A transformation asked for a template that is not registered.
 */
@Getter
public class TemplateNotFoundException extends PatternDetectionException {

    private final String templateName;

    public TemplateNotFoundException(String templateName) {
        super("No template registered for pattern: " + templateName);
        this.templateName = templateName;
    }
}
