package com.cronhooks.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import net.thisptr.jackson.jq.BuiltinFunctionLoader;
import net.thisptr.jackson.jq.JsonQuery;
import net.thisptr.jackson.jq.Scope;
import net.thisptr.jackson.jq.Version;
import net.thisptr.jackson.jq.Versions;
import net.thisptr.jackson.jq.exception.JsonQueryException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Pulls named values out of a JSON document with jq selectors.
 */
public class VariableExtractor {
    private static final Logger logger = LoggerFactory.getLogger(VariableExtractor.class);
    private static final Version JQ_VERSION = Versions.JQ_1_6;

    private final ObjectMapper objectMapper;
    private final Scope rootScope;

    public VariableExtractor() {
        this(new ObjectMapper());
    }

    public VariableExtractor(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
        this.rootScope = Scope.newEmptyScope();
        BuiltinFunctionLoader.getInstance().loadFunctions(JQ_VERSION, rootScope);
    }

    /**
     * Runs every selector against {@code jsonText} and keeps the first result of each.
     *
     * <p>An empty selector map returns an empty mapping without looking at the input. A selector that
     * yields nothing leaves its name absent; one that fails to compile or evaluate is logged and
     * skipped without affecting the others.
     *
     * @throws JsonDocumentException if the input is not valid JSON
     */
    public Map<String, JsonNode> extract(String jsonText, Map<String, String> selectors) throws JsonDocumentException {
        Map<String, JsonNode> variables = new LinkedHashMap<>();
        if (selectors == null || selectors.isEmpty()) {
            logger.debug("No selectors configured, nothing to extract");
            return variables;
        }

        JsonNode document;
        try {
            document = objectMapper.readTree(jsonText);
        } catch (JsonProcessingException e) {
            throw new JsonDocumentException("failed to parse JSON response: " + e.getOriginalMessage(), e);
        }
        if (document == null || document.isMissingNode()) {
            throw new JsonDocumentException("failed to parse JSON response: empty document", null);
        }

        for (Map.Entry<String, String> selector : selectors.entrySet()) {
            String name = selector.getKey();
            String expression = selector.getValue();

            JsonQuery query;
            try {
                query = JsonQuery.compile(expression, JQ_VERSION);
            } catch (JsonQueryException e) {
                logger.warn("Failed to parse jq selector '{}' for variable '{}': {}", expression, name, e.getMessage());
                continue;
            }

            List<JsonNode> results = new ArrayList<>();
            try {
                query.apply(Scope.newChildScope(rootScope), document, results::add);
            } catch (JsonQueryException e) {
                if (results.isEmpty()) {
                    logger.warn("Failed to evaluate jq selector '{}' for variable '{}': {}", expression, name, e.getMessage());
                    continue;
                }
                logger.debug("jq selector '{}' failed after its first result: {}", expression, e.getMessage());
            }

            if (results.isEmpty()) {
                logger.debug("jq selector '{}' for variable '{}' produced no result", expression, name);
                continue;
            }
            variables.put(name, results.get(0));
            logger.debug("Extracted variable '{}' = {}", name, results.get(0));
        }

        return variables;
    }

    /**
     * True when at least one variable holds something other than null or an empty string.
     */
    public static boolean hasNonEmptyValue(Map<String, JsonNode> variables) {
        return variables.values().stream()
                .anyMatch(value -> value != null && !value.isNull() && !(value.isTextual() && value.textValue().isEmpty()));
    }
}
