package org.dxworks.texframe.parser;

import java.util.Objects;

/**
 * Per-parser switches, fixed for a whole parse.
 */
public final class ParserOptions {

    private static final ParserOptions DEFAULTS = new ParserOptions(false, NewlineMode.DEFAULT);

    private final boolean textMerge;
    private final NewlineMode newlineMode;

    private ParserOptions(boolean textMerge, NewlineMode newlineMode) {
        this.textMerge = textMerge;
        this.newlineMode = Objects.requireNonNull(newlineMode, "newlineMode");
    }

    public static ParserOptions defaults() {
        return DEFAULTS;
    }

    public static ParserOptions of(boolean textMerge, NewlineMode newlineMode) {
        return new ParserOptions(textMerge, newlineMode);
    }

    public boolean isTextMerge() {
        return textMerge;
    }

    public NewlineMode getNewlineMode() {
        return newlineMode;
    }

    @Override
    public String toString() {
        return "ParserOptions{textMerge=" + textMerge + ", newlineMode=" + newlineMode.getName() + "}";
    }
}
