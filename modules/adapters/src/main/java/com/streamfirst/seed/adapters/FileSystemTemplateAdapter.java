package com.streamfirst.seed.adapters;

import com.streamfirst.seed.domain.InvalidTemplateException;
import com.streamfirst.seed.domain.SeedTemplate;
import com.streamfirst.seed.domain.TemplateNotFoundException;
import com.streamfirst.seed.ports.TemplatePort;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.regex.Pattern;

/**
 * TemplatePort reading {@code <name>.json} from a data directory.
 * The file is read and parsed in full on every call; nothing is cached.
 */
@Slf4j
public class FileSystemTemplateAdapter implements TemplatePort {

    static final String EXTENSION = ".json";

    private static final Pattern URL = Pattern.compile("^[A-Za-z][A-Za-z0-9+.-]*://.*");

    private final Path dataDirectory;

    public FileSystemTemplateAdapter(Path dataDirectory) {
        this.dataDirectory = dataDirectory.toAbsolutePath().normalize();
    }

    @Override
    public SeedTemplate load(String templateName) {
        if (templateName == null || templateName.isBlank()) {
            throw new InvalidTemplateException(templateName, "Template name cannot be empty");
        }
        if (URL.matcher(templateName).matches()) {
            // TODO: download templates given as http(s) URLs
            log.warn("Remote templates are not supported: {}", templateName);
            throw new TemplateNotFoundException(templateName);
        }
        if (templateName.contains("/") || templateName.contains("\\") || templateName.contains("..")) {
            throw new InvalidTemplateException(templateName, "Invalid template name " + templateName);
        }

        Path file = resolve(templateName);
        if (!Files.isRegularFile(file)) {
            log.debug("Template file {} not found", file);
            throw new TemplateNotFoundException(templateName);
        }

        String content;
        try {
            content = Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new InvalidTemplateException(templateName, "Failed to read template " + templateName, e);
        }

        SeedTemplate template = TemplateJson.parse(templateName, content);
        log.debug("Loaded {} from {}", template, file);
        return template;
    }

    public Path resolve(String templateName) {
        return dataDirectory.resolve(templateName + EXTENSION);
    }

    public Path getDataDirectory() {
        return dataDirectory;
    }
}
