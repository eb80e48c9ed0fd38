package org.dxworks.texframe.ast;

/**
 * A formula. The content is kept as written; it is never parsed further.
 */
public class MathNode extends AstNode {

    private final String content;
    private final boolean display;

    public MathNode(String content, boolean display) {
        this.content = content;
        this.display = display;
    }

    public String getContent() {
        return content;
    }

    public boolean isDisplay() {
        return display;
    }

    @Override
    public String getTextContent() {
        return getTextContent(true);
    }

    /**
     * @param pack whether to wrap the formula in its {@code $} / {@code $$} delimiters
     */
    public String getTextContent(boolean pack) {
        if (!pack) {
            return content;
        }
        return display ? "$$" + content + "$$" : "$" + content + "$";
    }

    @Override
    protected String getDescription() {
        return "Math (" + (display ? "Display" : "Inline") + "): '" + abbreviate(content) + "'";
    }

    @Override
    public String toString() {
        return "MathNode(" + (display ? "display" : "inline") + ", '" + content + "')";
    }
}
