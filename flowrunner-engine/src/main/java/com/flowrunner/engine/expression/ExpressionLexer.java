package com.flowrunner.engine.expression;

import com.flowrunner.core.exception.InvalidInputsException;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits a placeholder body into tokens.
 * 
 * Words may start with digits, since output bag keys are node ids
 * such as {@code 64b1f0c2.txHash}. A word directly after a dot is always a path key.
 */
public final class ExpressionLexer {

    private final String source;
    private final List<Token> tokens = new ArrayList<>();
    private int position = 0;

    private ExpressionLexer(String source) {
        this.source = source;
    }

    public static List<Token> tokenize(String source) {
        ExpressionLexer lexer = new ExpressionLexer(source);
        lexer.scan();
        return lexer.tokens;
    }

    private void scan() {
        while (position < source.length()) {
            char c = source.charAt(position);
            if (Character.isWhitespace(c)) {
                position++;
            } else if (c == '\'' || c == '"') {
                scanString(c);
            } else if (isWordChar(c)) {
                scanWord();
            } else {
                scanOperator(c);
            }
        }
        tokens.add(new Token(TokenType.EOF, "", position));
    }

    private void scanWord() {
        int start = position;
        boolean afterDot = !tokens.isEmpty() && tokens.get(tokens.size() - 1).type() == TokenType.DOT;
        while (position < source.length() && isWordChar(source.charAt(position))) {
            position++;
        }
        String word = source.substring(start, position);

        if (!afterDot && isDigits(word)) {
            // decimal part, e.g. 3.25
            if (position + 1 < source.length()
                    && source.charAt(position) == '.'
                    && Character.isDigit(source.charAt(position + 1))) {
                position++;
                while (position < source.length() && Character.isDigit(source.charAt(position))) {
                    position++;
                }
            }
            tokens.add(new Token(TokenType.NUMBER, source.substring(start, position), start));
            return;
        }

        TokenType type = switch (word) {
            case "and" -> TokenType.AND;
            case "or" -> TokenType.OR;
            case "not" -> TokenType.NOT;
            default -> TokenType.IDENTIFIER;
        };
        tokens.add(new Token(afterDot ? TokenType.IDENTIFIER : type, word, start));
    }

    private void scanString(char quote) {
        int start = position;
        position++;
        StringBuilder value = new StringBuilder();
        while (position < source.length()) {
            char c = source.charAt(position);
            if (c == quote) {
                position++;
                tokens.add(new Token(TokenType.STRING, value.toString(), start));
                return;
            }
            if (c == '\\' && position + 1 < source.length()) {
                char escaped = source.charAt(position + 1);
                switch (escaped) {
                    case 'n' -> value.append('\n');
                    case 't' -> value.append('\t');
                    case 'r' -> value.append('\r');
                    case 'u' -> {
                        if (position + 6 > source.length()) {
                            throw error("Invalid unicode escape", position);
                        }
                        try {
                            value.append((char) Integer.parseInt(source.substring(position + 2, position + 6), 16));
                        } catch (NumberFormatException e) {
                            throw error("Invalid unicode escape", position);
                        }
                        position += 4;
                    }
                    default -> value.append(escaped);
                }
                position += 2;
                continue;
            }
            value.append(c);
            position++;
        }
        throw error("Unterminated string", start);
    }

    private void scanOperator(char c) {
        int start = position;
        char next = position + 1 < source.length() ? source.charAt(position + 1) : '\0';
        TokenType type;
        int length = 1;
        switch (c) {
            case '.' -> type = TokenType.DOT;
            case ',' -> type = TokenType.COMMA;
            case '(' -> type = TokenType.LPAREN;
            case ')' -> type = TokenType.RPAREN;
            case '[' -> type = TokenType.LBRACKET;
            case ']' -> type = TokenType.RBRACKET;
            case '?' -> type = TokenType.QUESTION;
            case ':' -> type = TokenType.COLON;
            case '+' -> type = TokenType.PLUS;
            case '-' -> type = TokenType.MINUS;
            case '*' -> type = TokenType.STAR;
            case '/' -> type = TokenType.SLASH;
            case '%' -> type = TokenType.PERCENT;
            case '^' -> type = TokenType.CARET;
            case '=' -> {
                if (next != '=') {
                    throw error("Unexpected '='", start);
                }
                type = TokenType.EQ;
                length = 2;
            }
            case '!' -> {
                if (next == '=') {
                    type = TokenType.NEQ;
                    length = 2;
                } else {
                    type = TokenType.NOT;
                }
            }
            case '<' -> {
                type = next == '=' ? TokenType.LTE : TokenType.LT;
                length = next == '=' ? 2 : 1;
            }
            case '>' -> {
                type = next == '=' ? TokenType.GTE : TokenType.GT;
                length = next == '=' ? 2 : 1;
            }
            case '&' -> {
                if (next != '&') {
                    throw error("Unexpected '&'", start);
                }
                type = TokenType.AND;
                length = 2;
            }
            case '|' -> {
                if (next != '|') {
                    throw error("Unexpected '|'", start);
                }
                type = TokenType.OR;
                length = 2;
            }
            default -> throw error("Unexpected character '" + c + "'", start);
        }
        position += length;
        tokens.add(new Token(type, source.substring(start, position), start));
    }

    private InvalidInputsException error(String message, int at) {
        return new InvalidInputsException(message + " at position " + at + " in '" + source + "'");
    }

    private static boolean isWordChar(char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '$';
    }

    private static boolean isDigits(String word) {
        for (int i = 0; i < word.length(); i++) {
            if (!Character.isDigit(word.charAt(i))) {
                return false;
            }
        }
        return true;
    }

    public enum TokenType {
        NUMBER, STRING, IDENTIFIER,
        DOT, COMMA, LPAREN, RPAREN, LBRACKET, RBRACKET, QUESTION, COLON,
        PLUS, MINUS, STAR, SLASH, PERCENT, CARET,
        EQ, NEQ, LT, LTE, GT, GTE,
        AND, OR, NOT,
        EOF
    }

    public record Token(TokenType type, String text, int position) {}
}
