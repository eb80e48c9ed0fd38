package org.dxworks.texframe.lexer;

public enum TokenType {
    // delimiters
    BRACE_OPEN,
    BRACE_CLOSE,
    BRACKET_OPEN,
    BRACKET_CLOSE,

    COMMAND,
    ENV_BEGIN,
    ENV_END,

    TEXT,
    MATH_INLINE,
    MATH_FORMULA, // display math ($$...$$)
    COMMENT,
    ESCAPE_SEQUENCE,

    SPECIAL_CHAR, // & _ ^ ~

    SPACE,
    NEWLINE,

    PARAM_MARKER, // #1, #2, ...

    EOF,
    ERROR
}
