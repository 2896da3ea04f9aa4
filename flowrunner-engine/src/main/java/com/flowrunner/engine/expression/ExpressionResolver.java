package com.flowrunner.engine.expression;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import com.flowrunner.core.exception.FlowRunnerException;
import com.flowrunner.core.exception.InvalidInputsException;

import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Resolves {{ placeholder }} references in templated inputs against an output bag.
 * 
 * Resolution rules:
 * - a string that is exactly one placeholder keeps the value's native type
 * - any other string gets every placeholder interpolated as text
 * - objects that end up empty are dropped from their parent
 * - missing values omit their key; inside arrays they become null
 */
public class ExpressionResolver {

    private static final Pattern PLACEHOLDER = Pattern.compile("\\{\\{\\s*([^}]+)\\s*}}");
    private static final String TEMPLATE_PREFIX = "template.";

    private final ObjectMapper objectMapper;
    private final ExpressionFunctions functions;

    public ExpressionResolver(ObjectMapper objectMapper) {
        this(objectMapper, new ExpressionFunctions());
    }

    public ExpressionResolver(ObjectMapper objectMapper, ExpressionFunctions functions) {
        this.objectMapper = objectMapper;
        this.functions = functions;
    }

    /**
     * Resolve every field of a raw input mapping.
     * 
     * @param inputs Raw inputs, may be null
     * @param outputs Output bag keyed by node identity
     * @return Resolved inputs, never null
     * @throws InvalidInputsException if any placeholder cannot be evaluated
     */
    public ObjectNode resolveInputs(JsonNode inputs, Map<String, JsonNode> outputs) {
        ObjectNode resolved = objectMapper.createObjectNode();
        if (inputs == null || !inputs.isObject()) {
            return resolved;
        }
        Iterator<Map.Entry<String, JsonNode>> fields = inputs.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            JsonNode value = resolveValue(field.getValue(), outputs);
            if (!value.isMissingNode()) {
                resolved.set(field.getKey(), value);
            }
        }
        return resolved;
    }

    /**
     * Resolve a single raw value. Returns {@link MissingNode} when the value should be omitted.
     */
    public JsonNode resolveValue(JsonNode input, Map<String, JsonNode> outputs) {
        if (input == null) {
            return MissingNode.getInstance();
        }
        if (!Values.isTruthy(input)) {
            return input;
        }
        if (input.isTextual()) {
            return resolveText(input.textValue(), outputs);
        }
        if (input.isArray()) {
            ArrayNode resolved = objectMapper.createArrayNode();
            for (JsonNode element : input) {
                JsonNode value = resolveValue(element, outputs);
                resolved.add(value.isMissingNode() ? NullNode.getInstance() : value);
            }
            return resolved;
        }
        if (input.isObject()) {
            ObjectNode resolved = resolveInputs(input, outputs);
            // empty objects break strict validation on the receiving side
            return resolved.isEmpty() ? MissingNode.getInstance() : resolved;
        }
        return input;
    }

    /**
     * Evaluate a placeholder body. A bare path is a plain lookup and may be missing.
     */
    public JsonNode evaluate(String body, Map<String, JsonNode> outputs) {
        Expression expression = parse(body);
        if (expression instanceof Expression.Path) {
            return ((Expression.Path) expression).lookup(outputs);
        }
        try {
            return expression.evaluate(new ExpressionContext(outputs, functions));
        } catch (FlowRunnerException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new InvalidInputsException("Failed to evaluate '" + body + "': " + e.getMessage(), e);
        }
    }

    private Expression parse(String body) {
        try {
            return ExpressionParser.parse(body);
        } catch (FlowRunnerException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new InvalidInputsException("Malformed expression '" + body + "': " + e.getMessage(), e);
        }
    }

    private JsonNode resolveText(String input, Map<String, JsonNode> outputs) {
        Matcher matcher = PLACEHOLDER.matcher(input);
        List<MatchResult> matches = matcher.results()
            .map(m -> new MatchResult(m.group(), m.group(1).trim()))
            .collect(Collectors.toList());

        if (matches.isEmpty()) {
            return TextNode.valueOf(input);
        }
        if (matches.size() == 1 && input.trim().equals(matches.get(0).placeholder())) {
            return evaluate(matches.get(0).body(), outputs);
        }

        StringBuilder result = new StringBuilder();
        matcher.reset();
        while (matcher.find()) {
            String value = Values.stringify(evaluate(matcher.group(1).trim(), outputs));
            matcher.appendReplacement(result, Matcher.quoteReplacement(value));
        }
        matcher.appendTail(result);
        return TextNode.valueOf(result.toString());
    }

    /**
     * Collect the {@code template.<field>} names referenced by top-level string inputs.
     */
    public static Set<String> findTemplateFields(JsonNode inputs) {
        Set<String> fields = new LinkedHashSet<>();
        if (inputs == null || !inputs.isObject()) {
            return fields;
        }
        for (JsonNode value : inputs) {
            if (!value.isTextual()) {
                continue;
            }
            Matcher matcher = PLACEHOLDER.matcher(value.textValue());
            while (matcher.find()) {
                String body = matcher.group(1).trim();
                if (body.contains(TEMPLATE_PREFIX)) {
                    fields.add(body.replaceFirst(Pattern.quote(TEMPLATE_PREFIX), ""));
                }
            }
        }
        return fields;
    }

    private record MatchResult(String placeholder, String body) {}
}
