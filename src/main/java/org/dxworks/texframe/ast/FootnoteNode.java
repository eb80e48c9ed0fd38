package org.dxworks.texframe.ast;

public class FootnoteNode extends CommandNode {

    private GroupNode content;

    public FootnoteNode(String name) {
        super(name);
    }

    public GroupNode getContent() {
        return content;
    }

    public void setContent(GroupNode content) {
        this.content = content;
    }

    public String getContentText() {
        return content == null ? "" : content.getTextContent();
    }
}
