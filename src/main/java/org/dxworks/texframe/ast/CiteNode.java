package org.dxworks.texframe.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A citation ({@code \cite}, {@code \citep}, {@code \citet}). Keys come from the
 * first required argument; {@code citations} is filled by bibliography
 * resolution, which happens outside the parser.
 */
public class CiteNode extends CommandNode {

    private List<String> keys = new ArrayList<>();
    private final List<String> citations = new ArrayList<>();

    public CiteNode(String name) {
        super(name);
    }

    public List<String> getKeys() {
        return Collections.unmodifiableList(keys);
    }

    public void setKeys(List<String> keys) {
        this.keys = new ArrayList<>(keys);
    }

    public List<String> getCitations() {
        return citations;
    }

    /** Splits a comma separated key list, trimming each key. */
    public static List<String> splitKeys(String text) {
        List<String> keys = new ArrayList<>();
        for (String key : text.split(",", -1)) {
            keys.add(key.trim());
        }
        return keys;
    }
}
