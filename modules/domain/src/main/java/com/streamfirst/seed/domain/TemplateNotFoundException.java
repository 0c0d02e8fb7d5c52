package com.streamfirst.seed.domain;

import lombok.Getter;

/**
 * The named seed template does not exist.
 */
@Getter
public class TemplateNotFoundException extends SeedException {

    private final String templateName;

    public TemplateNotFoundException(String templateName) {
        super("Template " + templateName + " does not exist");
        this.templateName = templateName;
    }
}
