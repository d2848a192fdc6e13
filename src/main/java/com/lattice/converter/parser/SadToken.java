package com.lattice.converter.parser;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import lombok.Value;

/**
 * Represents a token from the SAD lexer. Non-number tokens hold NaN as value.
 */
@Value
@EqualsAndHashCode(doNotUseGetters = true)
@ToString(doNotUseGetters = true)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class SadToken {
    TokenType type;
    String text;
    @Getter(AccessLevel.NONE)
    double value;
    int line;
    int column;

    public enum TokenType {
        NUMBER,
        ASSIGN,
        EQUAL,
        TERMINATOR,
        COMMENT,
        LPAREN,
        RPAREN,
        UNIT,
        ELEMENT_TYPE,
        IDENTIFIER,
        OPERATOR,
        ERROR
    }

    public static SadToken of(TokenType type, String text, int line, int column) {
        if (type == TokenType.NUMBER) {
            return number(text, line, column);
        }
        return new SadToken(type, text, Double.NaN, line, column);
    }

    public static SadToken number(String text, int line, int column) {
        return new SadToken(TokenType.NUMBER, text, Double.parseDouble(text), line, column);
    }

    public boolean is(TokenType expected) {
        return type == expected;
    }

    public boolean isOperator(String symbol) {
        return type == TokenType.OPERATOR && text.equals(symbol);
    }

    /**
     * Parsed value of a NUMBER token.
     */
    public double getValue() {
        if (type != TokenType.NUMBER) {
            throw new IllegalStateException("Token " + type + " '" + text + "' carries no numeric value");
        }
        return value;
    }

    /**
     * Position text used in diagnostics, e.g. {@code line 3, column 12}.
     */
    public String position() {
        return "line " + line + ", column " + column;
    }
}
