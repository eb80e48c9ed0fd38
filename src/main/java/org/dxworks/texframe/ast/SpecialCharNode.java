package org.dxworks.texframe.ast;

public class SpecialCharNode extends AstNode {

    private final char character;

    public SpecialCharNode(char character) {
        this.character = character;
    }

    public char getCharacter() {
        return character;
    }

    @Override
    public String getTextContent() {
        return String.valueOf(character);
    }

    @Override
    protected String getDescription() {
        return "SpecialChar: '" + character + "'";
    }

    @Override
    public String toString() {
        return "SpecialCharNode('" + character + "')";
    }
}
