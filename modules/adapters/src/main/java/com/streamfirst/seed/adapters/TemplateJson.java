package com.streamfirst.seed.adapters;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.streamfirst.seed.domain.DeviceGroup;
import com.streamfirst.seed.domain.InvalidTemplateException;
import com.streamfirst.seed.domain.Rule;
import com.streamfirst.seed.domain.SeedTemplate;
import com.streamfirst.seed.domain.SimulationModel;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.BiFunction;

/**
 * Parses seed template JSON. Property names are matched ignoring case, so both
 * {@code "Groups"/"DisplayName"} and {@code "groups"/"displayName"} spellings are accepted.
 * Properties the coordinator does not interpret are kept, in document order, as opaque attributes.
 */
public final class TemplateJson {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .findAndRegisterModules()
            .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);

    private static final String ID = "id";
    private static final String DISPLAY_NAME = "displayName";
    private static final String DESCRIPTION = "description";
    private static final String GROUP_ID = "groupId";

    private TemplateJson() {
    }

    public static ObjectMapper mapper() {
        return MAPPER;
    }

    /**
     * Parses a whole template.
     *
     * @param templateName name used in error messages and stored on the result
     * @param content the JSON document
     * @return the parsed template
     * @throws InvalidTemplateException if the content is not valid JSON or not shaped like a template
     */
    public static SeedTemplate parse(String templateName, String content) {
        JsonNode root;
        try {
            root = MAPPER.readTree(content);
        } catch (JsonProcessingException e) {
            throw new InvalidTemplateException(templateName, "Failed to parse template " + templateName, e);
        }
        if (root == null || !root.isObject()) {
            throw new InvalidTemplateException(templateName, "Template " + templateName + " is not a JSON object");
        }

        List<DeviceGroup> groups = readArray(templateName, root, "groups", TemplateJson::toGroup);
        List<Rule> rules = readArray(templateName, root, "rules", TemplateJson::toRule);
        List<SimulationModel> simulations = readArray(templateName, root, "simulations", TemplateJson::toSimulation);
        return new SeedTemplate(templateName, groups, rules, simulations);
    }

    private static <T> List<T> readArray(String templateName, JsonNode root, String name,
                                         BiFunction<String, JsonNode, T> converter) {
        JsonNode array = field(root, name);
        if (array == null || array.isNull()) {
            return List.of();
        }
        if (!array.isArray()) {
            throw new InvalidTemplateException(templateName,
                "Template " + templateName + ": '" + name + "' must be an array");
        }

        List<T> result = new ArrayList<>(array.size());
        for (int i = 0; i < array.size(); i++) {
            JsonNode element = array.get(i);
            String location = name + "[" + i + "]";
            if (!element.isObject()) {
                throw new InvalidTemplateException(templateName,
                    "Template " + templateName + ": " + location + " must be an object");
            }
            try {
                result.add(converter.apply(location, element));
            } catch (IllegalArgumentException e) {
                throw new InvalidTemplateException(templateName,
                    "Template " + templateName + ": " + e.getMessage(), e);
            }
        }
        return result;
    }

    private static DeviceGroup toGroup(String location, JsonNode node) {
        return new DeviceGroup(
            requiredText(location, node, ID),
            optionalText(node, DISPLAY_NAME),
            attributes(node, Set.of(ID, DISPLAY_NAME)));
    }

    private static Rule toRule(String location, JsonNode node) {
        return new Rule(
            requiredText(location, node, ID),
            optionalText(node, DESCRIPTION),
            optionalText(node, GROUP_ID),
            attributes(node, Set.of(ID, DESCRIPTION, GROUP_ID)));
    }

    private static SimulationModel toSimulation(String location, JsonNode node) {
        return new SimulationModel(optionalText(node, ID), attributes(node, Set.of(ID)));
    }

    private static String requiredText(String location, JsonNode node, String name) {
        String value = optionalText(node, name);
        if (value == null || value.isEmpty()) {
            throw new IllegalArgumentException(location + " has no '" + name + "'");
        }
        return value;
    }

    private static String optionalText(JsonNode node, String name) {
        JsonNode value = field(node, name);
        if (value == null || value.isNull()) {
            return null;
        }
        if (!value.isValueNode()) {
            throw new IllegalArgumentException("'" + name + "' must be a string");
        }
        return value.asText();
    }

    private static Map<String, Object> attributes(JsonNode node, Set<String> interpreted) {
        Map<String, Object> result = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> entry = fields.next();
            boolean skip = interpreted.stream().anyMatch(name -> name.equalsIgnoreCase(entry.getKey()));
            if (!skip) {
                result.put(entry.getKey(), MAPPER.convertValue(entry.getValue(), Object.class));
            }
        }
        return result;
    }

    private static JsonNode field(JsonNode node, String name) {
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> entry = fields.next();
            if (entry.getKey().equalsIgnoreCase(name)) {
                return entry.getValue();
            }
        }
        return null;
    }
}
