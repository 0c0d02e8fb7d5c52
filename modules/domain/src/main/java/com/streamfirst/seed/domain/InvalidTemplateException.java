package com.streamfirst.seed.domain;

import lombok.Getter;

/**
 * The named seed template exists but cannot be turned into a {@link SeedTemplate}.
 * The underlying parse or read error, when there is one, is the cause.
 */
@Getter
public class InvalidTemplateException extends SeedException {

    private final String templateName;

    public InvalidTemplateException(String templateName, String message) {
        super(message);
        this.templateName = templateName;
    }

    public InvalidTemplateException(String templateName, String message, Throwable cause) {
        super(message, cause);
        this.templateName = templateName;
    }
}
