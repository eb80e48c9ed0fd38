package org.dxworks.texframe.model.latex;

public class LatexMath {
    public String content;
    public boolean display;

    public LatexMath(String content, boolean display) {
        this.content = content;
        this.display = display;
    }
}
