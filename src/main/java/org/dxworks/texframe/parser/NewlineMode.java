package org.dxworks.texframe.parser;

import java.util.Locale;
import java.util.Optional;

public enum NewlineMode {
    DEFAULT("default"),   // paragraph breaks on blank lines, single newlines become spaces
    LITERAL("literal"),   // every newline kept as "\n" text
    COMPACT("compact");   // every newline becomes a space

    private final String name;

    NewlineMode(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }

    public static Optional<NewlineMode> fromName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        for (NewlineMode mode : values()) {
            if (mode.name.equals(normalized)) {
                return Optional.of(mode);
            }
        }
        return Optional.empty();
    }
}
