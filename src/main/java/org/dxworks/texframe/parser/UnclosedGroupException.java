package org.dxworks.texframe.parser;

import org.dxworks.texframe.lexer.Token;

/**
 * A brace or bracket group was still open when the input ended. The position is
 * that of the opening delimiter.
 */
public class UnclosedGroupException extends ParseException {

    private final String groupKind;

    public UnclosedGroupException(String groupKind, Token.Position openedAt) {
        super("Unclosed " + groupKind + " group", openedAt);
        this.groupKind = groupKind;
    }

    public String getGroupKind() {
        return groupKind;
    }
}
