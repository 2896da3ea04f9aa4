package com.flowrunner.engine.expression;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.TextNode;
import com.flowrunner.core.exception.InvalidInputsException;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Built-in functions callable from placeholders.
 */
public final class ExpressionFunctions {

    private static final Pattern REGEX_SPECIAL = Pattern.compile("[.*+?^${}()|\\[\\]\\\\]");
    private static final Pattern ESCAPED_WILDCARD = Pattern.compile("(?:\\\\\\*){3,}");

    private final Map<String, Function<List<JsonNode>, JsonNode>> functions = new HashMap<>();

    public ExpressionFunctions() {
        register("substring", 2, 3, ExpressionFunctions::substring);
        register("lowercase", 1, 1, args -> Values.isTruthy(args.get(0))
            ? TextNode.valueOf(Values.stringify(args.get(0)).toLowerCase())
            : args.get(0));
        register("uppercase", 1, 1, args -> Values.isTruthy(args.get(0))
            ? TextNode.valueOf(Values.stringify(args.get(0)).toUpperCase())
            : args.get(0));
        register("extract", 3, 3, args -> TextNode.valueOf(extract(
            Values.stringify(args.get(0)), Values.stringify(args.get(1)), Values.stringify(args.get(2)))));
    }

    public JsonNode call(String name, List<JsonNode> arguments) {
        Function<List<JsonNode>, JsonNode> function = functions.get(name);
        if (function == null) {
            throw new InvalidInputsException("Undefined function " + name);
        }
        return function.apply(arguments);
    }

    private void register(String name, int minArgs, int maxArgs, Function<List<JsonNode>, JsonNode> function) {
        functions.put(name, args -> {
            if (args.size() < minArgs || args.size() > maxArgs) {
                throw new InvalidInputsException(String.format(
                    "Wrong number of arguments in function %s (%d provided, %d-%d expected)",
                    name, args.size(), minArgs, maxArgs));
            }
            return function.apply(args);
        });
    }

    /**
     * substring(str, start[, end]) with JavaScript semantics: indexes are clamped
     * to the string and swapped when start > end.
     */
    private static JsonNode substring(List<JsonNode> args) {
        JsonNode str = args.get(0);
        if (!Values.isTruthy(str)) {
            return str;
        }
        String text = Values.stringify(str);
        int start = clamp(args.get(1), text.length());
        int end = args.size() > 2 ? clamp(args.get(2), text.length()) : text.length();
        return TextNode.valueOf(text.substring(Math.min(start, end), Math.max(start, end)));
    }

    private static int clamp(JsonNode index, int length) {
        double value = Values.toNumber(index);
        if (Double.isNaN(value)) {
            return 0;
        }
        return (int) Math.max(0, Math.min(length, value));
    }

    /**
     * Glob-style capture: {@code ***} in the template matches any text, exposed to the
     * replacement as a numbered group. Returns an empty string when the template does not match.
     */
    static String extract(String str, String template, String replace) {
        String escaped = REGEX_SPECIAL.matcher(template).replaceAll("\\\\$0");
        String regex = ESCAPED_WILDCARD.matcher(escaped).replaceAll("(.+)");
        Matcher matcher = Pattern.compile(regex).matcher(str);
        if (!matcher.find()) {
            return "";
        }
        return matcher.replaceFirst(replace);
    }
}
