package org.dxworks.texframe.parser;

import org.dxworks.texframe.lexer.Token;

import java.util.Optional;

/**
 * Structural failure while building the syntax tree. A failed parse leaves no
 * usable tree behind.
 */
public class ParseException extends RuntimeException {

    private final Token.Position position;

    public ParseException(String message) {
        this(message, null);
    }

    public ParseException(String message, Token.Position position) {
        super(message);
        this.position = position;
    }

    public Optional<Token.Position> getPosition() {
        return Optional.ofNullable(position);
    }

    @Override
    public String getMessage() {
        if (position == null) {
            return super.getMessage();
        }
        return super.getMessage() + " at " + position;
    }
}
