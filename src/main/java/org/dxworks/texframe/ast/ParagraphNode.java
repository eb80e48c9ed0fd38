package org.dxworks.texframe.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * A run of body content between paragraph breaks.
 * <p>
 * The flattened text is computed on first use and cached; later tree
 * mutations are only picked up through {@link #getTextContent(boolean)}.
 */
public class ParagraphNode extends AstNode {

    private String content;

    @Override
    public String getTextContent() {
        return getTextContent(false);
    }

    public String getTextContent(boolean refresh) {
        if (content == null || refresh) {
            List<String> texts = new ArrayList<>();
            for (AstNode child : getChildren()) {
                String text = child.getTextContent();
                if (!text.equals(" ")) {
                    texts.add(text);
                }
            }
            content = String.join(" ", texts);
        }
        return content;
    }

    public boolean isBlank() {
        return getTextContent().isBlank();
    }

    @Override
    protected String getDescription() {
        return "Paragraph";
    }
}
