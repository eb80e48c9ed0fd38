package org.dxworks.texframe.parser;

import org.dxworks.texframe.lexer.Token;
import org.dxworks.texframe.lexer.TokenType;

import java.util.Optional;

public class UnexpectedTokenException extends ParseException {

    private final TokenType expected;
    private final Token actual;

    public UnexpectedTokenException(String context, TokenType expected, Token actual) {
        super(describe(context, expected, actual), actual == null ? null : actual.getPosition());
        this.expected = expected;
        this.actual = actual;
    }

    private static String describe(String context, TokenType expected, Token actual) {
        String found = actual == null
                ? "end of input"
                : actual.getType().name() + " '" + actual.getValue().replace("\n", "\\n") + "'";
        return context + ": expected " + expected.name() + ", got " + found;
    }

    public TokenType getExpected() {
        return expected;
    }

    /** The offending token; empty when input ran out. */
    public Optional<Token> getActual() {
        return Optional.ofNullable(actual);
    }
}
