package com.flowrunner.engine.expression;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.DoubleNode;
import com.fasterxml.jackson.databind.node.IntNode;
import com.fasterxml.jackson.databind.node.LongNode;
import com.fasterxml.jackson.databind.node.POJONode;
import com.fasterxml.jackson.databind.node.TextNode;
import com.flowrunner.core.exception.InvalidInputsException;

import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.time.temporal.TemporalAccessor;
import java.util.Date;

/**
 * Conversions and operators over the JSON value model.
 */
public final class Values {

    private static final double MAX_SAFE_INTEGER = 9007199254740991d;

    private Values() {
    }

    /**
     * Numeric node for a computed result; integral values become int/long nodes.
     */
    public static JsonNode number(double value) {
        if (Double.isFinite(value) && value == Math.rint(value) && Math.abs(value) <= MAX_SAFE_INTEGER) {
            long asLong = (long) value;
            if (asLong >= Integer.MIN_VALUE && asLong <= Integer.MAX_VALUE) {
                return IntNode.valueOf((int) asLong);
            }
            return LongNode.valueOf(asLong);
        }
        return DoubleNode.valueOf(value);
    }

    public static double toNumber(JsonNode value) {
        if (value == null || value.isMissingNode() || value.isNull()) {
            return 0;
        }
        if (value.isNumber()) {
            return value.doubleValue();
        }
        if (value.isBoolean()) {
            return value.booleanValue() ? 1 : 0;
        }
        if (value.isTextual()) {
            Double parsed = parseNumber(value.textValue());
            if (parsed != null) {
                return parsed;
            }
        }
        throw new InvalidInputsException("Cannot convert \"" + stringify(value) + "\" to a number");
    }

    public static boolean isTruthy(JsonNode value) {
        if (value == null || value.isMissingNode() || value.isNull()) {
            return false;
        }
        if (value.isBoolean()) {
            return value.booleanValue();
        }
        if (value.isNumber()) {
            double d = value.doubleValue();
            return d != 0 && !Double.isNaN(d);
        }
        if (value.isTextual()) {
            return !value.textValue().isEmpty();
        }
        return true;
    }

    /**
     * Text form used when a value is interpolated into a string:
     * objects and arrays as JSON, dates as ISO-8601, null and missing as empty.
     */
    public static String stringify(JsonNode value) {
        if (value == null || value.isMissingNode() || value.isNull()) {
            return "";
        }
        if (value.isTextual()) {
            return value.textValue();
        }
        if (value instanceof POJONode) {
            Object pojo = ((POJONode) value).getPojo();
            if (pojo instanceof Date) {
                return DateTimeFormatter.ISO_INSTANT.format(((Date) pojo).toInstant());
            }
            if (pojo instanceof Instant) {
                return DateTimeFormatter.ISO_INSTANT.format((Instant) pojo);
            }
            if (pojo instanceof TemporalAccessor) {
                return pojo.toString();
            }
            return String.valueOf(pojo);
        }
        if (value.isContainerNode()) {
            return value.toString();
        }
        return value.asText();
    }

    public static JsonNode add(JsonNode left, JsonNode right) {
        if (isStringLike(left) || isStringLike(right)) {
            return TextNode.valueOf(stringify(left) + stringify(right));
        }
        return number(toNumber(left) + toNumber(right));
    }

    public static double mod(double x, double y) {
        if (y == 0) {
            return x;
        }
        return x - y * Math.floor(x / y);
    }

    public static boolean equal(JsonNode left, JsonNode right) {
        if (isNullish(left) || isNullish(right)) {
            return isNullish(left) && isNullish(right);
        }
        if (left.isTextual() && right.isTextual()) {
            return left.textValue().equals(right.textValue());
        }
        if (isNumeric(left) && isNumeric(right)) {
            return toNumber(left) == toNumber(right);
        }
        return stringify(left).equals(stringify(right));
    }

    public static int compare(JsonNode left, JsonNode right) {
        if (left.isTextual() && right.isTextual()
                && (parseNumber(left.textValue()) == null || parseNumber(right.textValue()) == null)) {
            return left.textValue().compareTo(right.textValue());
        }
        return Double.compare(toNumber(left), toNumber(right));
    }

    private static boolean isStringLike(JsonNode value) {
        return value.isTextual() || value.isContainerNode() || value instanceof POJONode;
    }

    private static boolean isNullish(JsonNode value) {
        return value == null || value.isMissingNode() || value.isNull();
    }

    private static boolean isNumeric(JsonNode value) {
        return value.isNumber() || value.isBoolean()
            || (value.isTextual() && parseNumber(value.textValue()) != null);
    }

    private static Double parseNumber(String text) {
        String trimmed = text.trim();
        if (trimmed.isEmpty()) {
            return null;
        }
        try {
            return Double.valueOf(trimmed);
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
