package com.streamfirst.seed.ports;

import com.streamfirst.seed.domain.SeedTemplate;

/**
 * Port for reading named seed templates.
 */
public interface TemplatePort {

    /**
     * Loads and parses a template. Either the whole template is returned or nothing is.
     *
     * @param templateName the template name, without extension
     * @return the parsed template
     * @throws com.streamfirst.seed.domain.TemplateNotFoundException if no such template exists
     * @throws com.streamfirst.seed.domain.InvalidTemplateException if the content cannot be parsed
     */
    SeedTemplate load(String templateName);
}
