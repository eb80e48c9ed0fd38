package org.dxworks.texframe.ast;

/**
 * Content of a {@code {...}} group or, when optional, a {@code [...]} group.
 */
public class GroupNode extends AstNode {

    private final boolean optional;

    public GroupNode(boolean optional) {
        this.optional = optional;
    }

    public boolean isOptional() {
        return optional;
    }

    public String getDelimiterName() {
        return optional ? "bracket" : "brace";
    }

    @Override
    String renderAsChild() {
        return optional ? "[" + getTextContent() + "]" : "{" + getTextContent() + "}";
    }

    @Override
    protected String getDescription() {
        return "Group (" + (optional ? "optional" : "required") + ")";
    }

    @Override
    public String toString() {
        return "GroupNode(optional=" + optional + ", children=" + getChildren().size() + ")";
    }
}
