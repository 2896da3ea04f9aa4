package com.flowrunner.engine.expression;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.BooleanNode;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.flowrunner.core.exception.InvalidInputsException;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Node of a parsed placeholder expression.
 */
public interface Expression {

    JsonNode evaluate(ExpressionContext context);

    record Literal(JsonNode value) implements Expression {
        @Override
        public JsonNode evaluate(ExpressionContext context) {
            return value;
        }
    }

    /**
     * Lookup into the output bag, e.g. {@code foo.bar[0].baz}.
     * Inside an operator expression an unresolved path is an error.
     */
    record Path(String text, List<Object> segments) implements Expression {

        public Path {
            segments = List.copyOf(segments);
        }

        @Override
        public JsonNode evaluate(ExpressionContext context) {
            JsonNode value = lookup(context.outputs());
            if (value.isMissingNode()) {
                throw new InvalidInputsException("Undefined symbol " + text);
            }
            return value;
        }

        /**
         * Raw value at this path, {@link MissingNode} when any segment does not resolve.
         */
        public JsonNode lookup(Map<String, JsonNode> outputs) {
            JsonNode current = outputs.get(String.valueOf(segments.get(0)));
            if (current == null) {
                return MissingNode.getInstance();
            }
            for (Object segment : segments.subList(1, segments.size())) {
                current = step(current, segment);
                if (current.isMissingNode()) {
                    return current;
                }
            }
            return current;
        }

        private static JsonNode step(JsonNode node, Object segment) {
            if (node.isArray()) {
                Integer index = segment instanceof Integer ? (Integer) segment : parseIndex(segment.toString());
                return index != null ? node.path(index) : MissingNode.getInstance();
            }
            if (node.isObject()) {
                return node.path(segment.toString());
            }
            return MissingNode.getInstance();
        }

        private static Integer parseIndex(String segment) {
            try {
                return Integer.valueOf(segment);
            } catch (NumberFormatException e) {
                return null;
            }
        }
    }

    record Unary(String operator, Expression operand) implements Expression {
        @Override
        public JsonNode evaluate(ExpressionContext context) {
            JsonNode value = operand.evaluate(context);
            return switch (operator) {
                case "-" -> Values.number(-Values.toNumber(value));
                case "+" -> Values.number(Values.toNumber(value));
                case "not" -> BooleanNode.valueOf(!Values.isTruthy(value));
                default -> throw new InvalidInputsException("Unknown operator " + operator);
            };
        }
    }

    record Binary(String operator, Expression left, Expression right) implements Expression {
        @Override
        public JsonNode evaluate(ExpressionContext context) {
            // short-circuit logical operators
            if (operator.equals("and")) {
                return BooleanNode.valueOf(Values.isTruthy(left.evaluate(context))
                    && Values.isTruthy(right.evaluate(context)));
            }
            if (operator.equals("or")) {
                return BooleanNode.valueOf(Values.isTruthy(left.evaluate(context))
                    || Values.isTruthy(right.evaluate(context)));
            }
            JsonNode l = left.evaluate(context);
            JsonNode r = right.evaluate(context);
            return switch (operator) {
                case "+" -> Values.add(l, r);
                case "-" -> Values.number(Values.toNumber(l) - Values.toNumber(r));
                case "*" -> Values.number(Values.toNumber(l) * Values.toNumber(r));
                case "/" -> Values.number(Values.toNumber(l) / Values.toNumber(r));
                case "%" -> Values.number(Values.mod(Values.toNumber(l), Values.toNumber(r)));
                case "^" -> Values.number(Math.pow(Values.toNumber(l), Values.toNumber(r)));
                case "==" -> BooleanNode.valueOf(Values.equal(l, r));
                case "!=" -> BooleanNode.valueOf(!Values.equal(l, r));
                case "<" -> BooleanNode.valueOf(Values.compare(l, r) < 0);
                case "<=" -> BooleanNode.valueOf(Values.compare(l, r) <= 0);
                case ">" -> BooleanNode.valueOf(Values.compare(l, r) > 0);
                case ">=" -> BooleanNode.valueOf(Values.compare(l, r) >= 0);
                default -> throw new InvalidInputsException("Unknown operator " + operator);
            };
        }
    }

    record Conditional(Expression condition, Expression whenTrue, Expression whenFalse) implements Expression {
        @Override
        public JsonNode evaluate(ExpressionContext context) {
            return Values.isTruthy(condition.evaluate(context))
                ? whenTrue.evaluate(context)
                : whenFalse.evaluate(context);
        }
    }

    record FunctionCall(String name, List<Expression> arguments) implements Expression {

        public FunctionCall {
            arguments = List.copyOf(arguments);
        }

        @Override
        public JsonNode evaluate(ExpressionContext context) {
            List<JsonNode> values = new ArrayList<>(arguments.size());
            for (Expression argument : arguments) {
                values.add(argument.evaluate(context));
            }
            return context.functions().call(name, values);
        }
    }
}
