package org.dxworks.texframe.lexer;

enum LexerState {
    NORMAL,
    ESCAPE,        // right after a backslash
    MATH_INLINE,   // $...$
    MATH_DISPLAY,  // $$...$$
    COMMENT,       // % up to end of line
    ENVIRONMENT,   // name of \begin{...} / \end{...}
    PARAMETER      // # waiting for its digit
}
