package com.flowrunner.engine.expression;

import com.fasterxml.jackson.databind.node.BooleanNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.TextNode;
import com.flowrunner.core.exception.InvalidInputsException;
import com.flowrunner.engine.expression.ExpressionLexer.Token;
import com.flowrunner.engine.expression.ExpressionLexer.TokenType;

import java.util.ArrayList;
import java.util.List;

/**
 * Recursive-descent parser for placeholder bodies.
 * 
 * Precedence, lowest first: ternary, or, and, equality, comparison,
 * additive, multiplicative, power (right-associative), unary, postfix path access.
 */
public final class ExpressionParser {

    private final String source;
    private final List<Token> tokens;
    private int current = 0;

    private ExpressionParser(String source) {
        this.source = source;
        this.tokens = ExpressionLexer.tokenize(source);
    }

    public static Expression parse(String source) {
        ExpressionParser parser = new ExpressionParser(source);
        Expression expression = parser.ternary();
        parser.expect(TokenType.EOF, "end of expression");
        return expression;
    }

    private Expression ternary() {
        Expression condition = or();
        if (match(TokenType.QUESTION)) {
            Expression whenTrue = ternary();
            expect(TokenType.COLON, "':'");
            Expression whenFalse = ternary();
            return new Expression.Conditional(condition, whenTrue, whenFalse);
        }
        return condition;
    }

    private Expression or() {
        Expression left = and();
        while (match(TokenType.OR)) {
            left = new Expression.Binary("or", left, and());
        }
        return left;
    }

    private Expression and() {
        Expression left = equality();
        while (match(TokenType.AND)) {
            left = new Expression.Binary("and", left, equality());
        }
        return left;
    }

    private Expression equality() {
        Expression left = comparison();
        while (check(TokenType.EQ) || check(TokenType.NEQ)) {
            String operator = advance().text();
            left = new Expression.Binary(operator, left, comparison());
        }
        return left;
    }

    private Expression comparison() {
        Expression left = additive();
        while (check(TokenType.LT) || check(TokenType.LTE) || check(TokenType.GT) || check(TokenType.GTE)) {
            String operator = advance().text();
            left = new Expression.Binary(operator, left, additive());
        }
        return left;
    }

    private Expression additive() {
        Expression left = multiplicative();
        while (check(TokenType.PLUS) || check(TokenType.MINUS)) {
            String operator = advance().text();
            left = new Expression.Binary(operator, left, multiplicative());
        }
        return left;
    }

    private Expression multiplicative() {
        Expression left = unary();
        while (check(TokenType.STAR) || check(TokenType.SLASH) || check(TokenType.PERCENT)) {
            String operator = advance().text();
            left = new Expression.Binary(operator, left, unary());
        }
        return left;
    }

    private Expression unary() {
        if (match(TokenType.MINUS)) {
            return new Expression.Unary("-", unary());
        }
        if (match(TokenType.PLUS)) {
            return new Expression.Unary("+", unary());
        }
        if (match(TokenType.NOT)) {
            return new Expression.Unary("not", unary());
        }
        return power();
    }

    private Expression power() {
        Expression base = primary();
        if (match(TokenType.CARET)) {
            return new Expression.Binary("^", base, unary());
        }
        return base;
    }

    private Expression primary() {
        Token token = advance();
        switch (token.type()) {
            case NUMBER:
                return new Expression.Literal(Values.number(Double.parseDouble(token.text())));
            case STRING:
                return new Expression.Literal(TextNode.valueOf(token.text()));
            case LPAREN: {
                Expression inner = ternary();
                expect(TokenType.RPAREN, "')'");
                return inner;
            }
            case IDENTIFIER:
                return identifier(token);
            default:
                throw error("Unexpected token '" + token.text() + "'", token);
        }
    }

    private Expression identifier(Token token) {
        switch (token.text()) {
            case "true":
                return new Expression.Literal(BooleanNode.TRUE);
            case "false":
                return new Expression.Literal(BooleanNode.FALSE);
            case "null":
                return new Expression.Literal(NullNode.getInstance());
            default:
                break;
        }
        if (match(TokenType.LPAREN)) {
            List<Expression> arguments = new ArrayList<>();
            if (!check(TokenType.RPAREN)) {
                do {
                    arguments.add(ternary());
                } while (match(TokenType.COMMA));
            }
            expect(TokenType.RPAREN, "')'");
            return new Expression.FunctionCall(token.text(), arguments);
        }
        return path(token);
    }

    private Expression path(Token first) {
        List<Object> segments = new ArrayList<>();
        segments.add(first.text());
        int end = first.position() + first.text().length();
        while (true) {
            if (match(TokenType.DOT)) {
                Token key = advance();
                if (key.type() != TokenType.IDENTIFIER && key.type() != TokenType.NUMBER) {
                    throw error("Expected property name after '.'", key);
                }
                segments.add(key.text());
                end = key.position() + key.text().length();
            } else if (match(TokenType.LBRACKET)) {
                Token index = advance();
                if (index.type() == TokenType.NUMBER && index.text().indexOf('.') < 0) {
                    segments.add(arrayIndex(index));
                } else if (index.type() == TokenType.STRING) {
                    segments.add(index.text());
                } else {
                    throw error("Expected index or quoted key inside '[]'", index);
                }
                Token close = expect(TokenType.RBRACKET, "']'");
                end = close.position() + 1;
            } else {
                break;
            }
        }
        return new Expression.Path(source.substring(first.position(), end), segments);
    }

    private boolean check(TokenType type) {
        return tokens.get(current).type() == type;
    }

    private boolean match(TokenType type) {
        if (check(type)) {
            current++;
            return true;
        }
        return false;
    }

    private Token advance() {
        Token token = tokens.get(current);
        if (token.type() != TokenType.EOF) {
            current++;
        }
        return token;
    }

    private Token expect(TokenType type, String description) {
        Token token = tokens.get(current);
        if (token.type() != type) {
            throw error("Expected " + description + " but found '" + token.text() + "'", token);
        }
        current++;
        return token;
    }

    private Integer arrayIndex(Token index) {
        try {
            return Integer.valueOf(index.text());
        } catch (NumberFormatException e) {
            throw error("Array index out of range", index);
        }
    }

    private InvalidInputsException error(String message, Token token) {
        return new InvalidInputsException(message + " at position " + token.position() + " in '" + source + "'");
    }
}
