package org.dxworks.texframe.lexer;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Set;

/**
 * Character-level state machine turning LaTeX source into a token list.
 * <p>
 * The lexer never fails: unterminated math, dangling backslashes and similar
 * malformed input degrade into best-effort tokens. Every line, including an
 * unterminated last one, ends with a {@link TokenType#NEWLINE} token and the
 * list always ends with a single {@link TokenType#EOF}.
 * <p>
 * An instance is reusable but not thread-safe; each {@link #tokenize(String)}
 * call starts from a clean state.
 */
public class LatexLexer {

    private static final char NO_CHAR = '\0';

    private static final Set<Character> ESCAPABLE_CHARS =
            Set.of('$', '%', '&', '#', '_', '{', '}', '\\', ' ', '~', '^');

    private static final Set<Character> SPECIAL_CHARS = Set.of('&', '_', '^', '~');

    private final boolean debug;

    private LexerState state = LexerState.NORMAL;
    private List<Token> tokens = new ArrayList<>();
    private final StringBuilder buffer = new StringBuilder();
    private final Deque<TokenType> mathDelimiters = new ArrayDeque<>();
    private Token.Position pendingStart;
    private String environmentCommand = "";
    private int line = 1;
    private int column = 1;

    public LatexLexer() {
        this(false);
    }

    public LatexLexer(boolean debug) {
        this.debug = debug;
    }

    public boolean isDebug() {
        return debug;
    }

    public List<Token> tokenize(String source) {
        reset();
        List<String> lines = splitLines(source == null ? "" : source);

        for (int i = 0; i < lines.size(); i++) {
            line = i + 1;
            String text = lines.get(i) + "\n";
            int col = 0;
            while (col < text.length()) {
                column = col + 1;
                char ch = text.charAt(col);
                char next = col + 1 < text.length() ? text.charAt(col + 1) : NO_CHAR;
                col = dispatch(ch, next, text, col) + 1;
            }
        }

        flush();
        tokens.add(new Token(TokenType.EOF, "", here()));
        if (debug) {
            tokens.forEach(t -> System.err.println("[LatexLexer] " + t));
        }
        return tokens;
    }

    private void reset() {
        state = LexerState.NORMAL;
        tokens = new ArrayList<>();
        buffer.setLength(0);
        mathDelimiters.clear();
        pendingStart = null;
        environmentCommand = "";
        line = 1;
        column = 1;
    }

    // Lines end at \n, \r\n or a lone \r. A trailing terminator does not open
    // another (empty) line.
    private static List<String> splitLines(String source) {
        List<String> lines = new ArrayList<>();
        int start = 0;
        for (int i = 0; i < source.length(); i++) {
            char ch = source.charAt(i);
            if (ch == '\n' || ch == '\r') {
                lines.add(source.substring(start, i));
                if (ch == '\r' && i + 1 < source.length() && source.charAt(i + 1) == '\n') {
                    i++;
                }
                start = i + 1;
            }
        }
        if (start < source.length()) {
            lines.add(source.substring(start));
        }
        return lines;
    }

    // Returns the index of the last character consumed.
    private int dispatch(char ch, char next, String text, int col) {
        return switch (state) {
            case NORMAL -> handleNormal(ch, next, col);
            case ESCAPE -> handleEscape(ch, text, col);
            case MATH_INLINE -> handleMath(ch, next, col, TokenType.MATH_INLINE);
            case MATH_DISPLAY -> handleMath(ch, next, col, TokenType.MATH_FORMULA);
            case COMMENT -> handleComment(ch, col);
            case ENVIRONMENT -> handleEnvironment(ch, col);
            case PARAMETER -> handleParameter(ch, next, col);
        };
    }

    private int handleNormal(char ch, char next, int col) {
        if (ch == '\\') {
            flush();
            markStart();
            state = LexerState.ESCAPE;
        } else if (ch == '$' && next == '$') {
            flush();
            markStart();
            state = LexerState.MATH_DISPLAY;
            mathDelimiters.push(TokenType.MATH_FORMULA);
            return col + 1;
        } else if (ch == '$') {
            flush();
            markStart();
            state = LexerState.MATH_INLINE;
            mathDelimiters.push(TokenType.MATH_INLINE);
        } else if (ch == '%') {
            flush();
            state = LexerState.COMMENT;
            append(ch);
        } else if (ch == '{' || ch == '}') {
            flush();
            emit(ch == '{' ? TokenType.BRACE_OPEN : TokenType.BRACE_CLOSE, String.valueOf(ch));
        } else if (ch == '[' || ch == ']') {
            flush();
            emit(ch == '[' ? TokenType.BRACKET_OPEN : TokenType.BRACKET_CLOSE, String.valueOf(ch));
        } else if (ch == '#') {
            flush();
            state = LexerState.PARAMETER;
            append(ch);
        } else if (SPECIAL_CHARS.contains(ch)) {
            flush();
            emit(TokenType.SPECIAL_CHAR, String.valueOf(ch));
        } else if (ch == '\n') {
            flush();
            emit(TokenType.NEWLINE, "\n");
        } else if (Character.isWhitespace(ch)) {
            flush();
            emit(TokenType.SPACE, String.valueOf(ch));
        } else {
            append(ch);
        }
        return col;
    }

    private int handleEscape(char ch, String text, int col) {
        if (ESCAPABLE_CHARS.contains(ch)) {
            append(ch);
            flushAs(TokenType.ESCAPE_SEQUENCE);
            state = ambientState();
            return col;
        }

        if (isCommandChar(ch)) {
            int end = col + 1;
            while (end < text.length() && isCommandChar(text.charAt(end))) {
                end++;
            }
            String name = text.substring(col, end);
            if (name.equals("begin") || name.equals("end")) {
                environmentCommand = name;
                state = LexerState.ENVIRONMENT;
            } else {
                buffer.append(name);
                flushAs(TokenType.COMMAND);
                state = ambientState();
            }
            return end - 1;
        }

        // unknown escape, kept verbatim
        append(ch);
        int last = col;
        if (Character.isHighSurrogate(ch) && col + 1 < text.length()
                && Character.isLowSurrogate(text.charAt(col + 1))) {
            last = col + 1;
            append(text.charAt(last));
        }
        flushAs(TokenType.ESCAPE_SEQUENCE);
        state = ambientState();
        return last;
    }

    private int handleMath(char ch, char next, int col, TokenType mathType) {
        if (ch == '$' && mathType == TokenType.MATH_FORMULA && next == '$') {
            if (mathDelimiters.peek() == TokenType.MATH_FORMULA) {
                mathDelimiters.pop();
                flush();
                state = ambientState();
                return col + 1;
            }
            append(ch);
        } else if (ch == '$' && mathType == TokenType.MATH_INLINE) {
            if (mathDelimiters.peek() == TokenType.MATH_INLINE) {
                mathDelimiters.pop();
                flush();
                state = ambientState();
                return col;
            }
            append(ch);
        } else if (ch == '\\') {
            append(ch);
            if (next != NO_CHAR) {
                append(next);
                return col + 1;
            }
        } else {
            append(ch);
        }
        return col;
    }

    private int handleComment(char ch, int col) {
        append(ch);
        if (ch == '\n') {
            flushAs(TokenType.COMMENT);
            state = LexerState.NORMAL;
        }
        return col;
    }

    private int handleEnvironment(char ch, int col) {
        if (ch == '{') {
            buffer.setLength(0);
        } else if (ch == '}') {
            TokenType type = environmentCommand.equals("begin") ? TokenType.ENV_BEGIN : TokenType.ENV_END;
            tokens.add(new Token(type, buffer.toString(), pendingStart != null ? pendingStart : here()));
            buffer.setLength(0);
            pendingStart = null;
            environmentCommand = "";
            state = LexerState.NORMAL;
        } else {
            buffer.append(ch);
        }
        return col;
    }

    private int handleParameter(char ch, char next, int col) {
        if (Character.isDigit(ch)) {
            append(ch);
            flushAs(TokenType.PARAM_MARKER);
            state = LexerState.NORMAL;
            return col;
        }
        flushAs(TokenType.SPECIAL_CHAR);
        state = LexerState.NORMAL;
        return handleNormal(ch, next, col);
    }

    private LexerState ambientState() {
        TokenType innermost = mathDelimiters.peek();
        if (innermost == null) {
            return LexerState.NORMAL;
        }
        return innermost == TokenType.MATH_FORMULA ? LexerState.MATH_DISPLAY : LexerState.MATH_INLINE;
    }

    private static boolean isCommandChar(char ch) {
        return Character.isLetter(ch) || ch == '*';
    }

    private Token.Position here() {
        return new Token.Position(line, column);
    }

    private void markStart() {
        pendingStart = here();
    }

    private void append(char ch) {
        if (buffer.length() == 0 && pendingStart == null) {
            pendingStart = here();
        }
        buffer.append(ch);
    }

    private void emit(TokenType type, String value) {
        tokens.add(new Token(type, value, here()));
    }

    // Flushes the pending text typed by the state the lexer is currently in.
    private void flush() {
        flushAs(tokenTypeFor(state));
    }

    private void flushAs(TokenType type) {
        if (buffer.length() > 0) {
            Token.Position start = pendingStart != null ? pendingStart : here();
            tokens.add(new Token(type, buffer.toString(), start));
            buffer.setLength(0);
        }
        pendingStart = null;
    }

    private static TokenType tokenTypeFor(LexerState state) {
        return switch (state) {
            case MATH_INLINE -> TokenType.MATH_INLINE;
            case MATH_DISPLAY -> TokenType.MATH_FORMULA;
            case COMMENT -> TokenType.COMMENT;
            case ESCAPE -> TokenType.ESCAPE_SEQUENCE;
            case PARAMETER -> TokenType.PARAM_MARKER;
            case NORMAL, ENVIRONMENT -> TokenType.TEXT;
        };
    }
}
