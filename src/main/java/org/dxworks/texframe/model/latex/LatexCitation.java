package org.dxworks.texframe.model.latex;

import java.util.ArrayList;
import java.util.List;

public class LatexCitation {
    public String command; // cite, citep or citet
    public List<String> keys = new ArrayList<>();

    public LatexCitation(String command, List<String> keys) {
        this.command = command;
        this.keys = new ArrayList<>(keys);
    }
}
