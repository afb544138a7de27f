package com.cronhooks.template;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.TextNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.Map;

/**
 * Renders {@code {{name}}} placeholders against a variable mapping.
 *
 * <p>String values are inserted with {@code \n}, {@code \r}, {@code \t} and {@code "} escaped so they
 * can sit inside a JSON string literal. Every other value is written as JSON. {@code {{REMINDER}}}
 * always resolves, to the empty string when no value is supplied. Other unknown placeholders are
 * left as they are. Substituted values are never scanned again.
 */
public class TemplateEngine {
    private static final Logger logger = LoggerFactory.getLogger(TemplateEngine.class);

    public static final String REMINDER = "REMINDER";

    private final ObjectMapper objectMapper;

    public TemplateEngine() {
        this(new ObjectMapper());
    }

    public TemplateEngine(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public String render(String template, Map<String, JsonNode> variables) {
        if (template == null || template.isEmpty()) {
            return template;
        }
        Map<String, JsonNode> values = variables != null ? variables : Collections.emptyMap();

        StringBuilder result = new StringBuilder(template.length());
        for (TemplateToken token : TemplateTokenizer.tokenize(template)) {
            if (!token.isPlaceholder()) {
                result.append(token.getText());
                continue;
            }

            JsonNode value = values.get(token.getName());
            if (value != null) {
                result.append(format(token.getName(), value));
            } else if (REMINDER.equals(token.getName())) {
                logger.debug("No {} value supplied, rendering it empty", REMINDER);
            } else {
                result.append(token.getText());
            }
        }
        return result.toString();
    }

    /**
     * Convenience for templates that only reference {@code {{REMINDER}}}.
     */
    public String renderReminder(String template, String reminderText) {
        return render(template, Collections.singletonMap(REMINDER, TextNode.valueOf(reminderText)));
    }

    private String format(String name, JsonNode value) {
        switch (value.getNodeType()) {
            case STRING:
                return escape(value.textValue());
            case NUMBER:
            case BOOLEAN:
            case NULL:
            case ARRAY:
            case OBJECT:
            case BINARY:
            case POJO:
            case MISSING:
            default:
                try {
                    return objectMapper.writeValueAsString(value);
                } catch (JsonProcessingException e) {
                    logger.warn("Failed to marshal value for variable '{}', using plain text: {}", name, e.getMessage());
                    return value.toString();
                }
        }
    }

    static String escape(String value) {
        StringBuilder escaped = new StringBuilder(value.length() + 8);
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case '\n': escaped.append("\\n"); break;
                case '\r': escaped.append("\\r"); break;
                case '\t': escaped.append("\\t"); break;
                case '"': escaped.append("\\\""); break;
                default: escaped.append(c);
            }
        }
        return escaped.toString();
    }
}
