package org.dxworks.texframe.lexer;

import java.util.Objects;

/**
 * A lexical token: its kind, the source text it stands for and the 1-based
 * (line, column) where it starts.
 */
public final class Token {

    private final TokenType type;
    private final String value;
    private final Position position;

    public Token(TokenType type, String value, Position position) {
        this.type = Objects.requireNonNull(type, "type");
        this.value = Objects.requireNonNull(value, "value");
        this.position = Objects.requireNonNull(position, "position");
    }

    public TokenType getType() {
        return type;
    }

    public String getValue() {
        return value;
    }

    public Position getPosition() {
        return position;
    }

    public boolean is(TokenType expected) {
        return type == expected;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Token)) return false;
        Token other = (Token) o;
        return type == other.type && value.equals(other.value) && position.equals(other.position);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, value, position);
    }

    @Override
    public String toString() {
        return "Token(" + type.name() + ", '" + value + "', " + position + ")";
    }

    public static final class Position {
        private final int line;
        private final int column;

        public Position(int line, int column) {
            this.line = line;
            this.column = column;
        }

        public int getLine() {
            return line;
        }

        public int getColumn() {
            return column;
        }

        public Position shift(int columns) {
            return new Position(line, column + columns);
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Position)) return false;
            Position other = (Position) o;
            return line == other.line && column == other.column;
        }

        @Override
        public int hashCode() {
            return 31 * line + column;
        }

        @Override
        public String toString() {
            return "(" + line + ", " + column + ")";
        }
    }
}
