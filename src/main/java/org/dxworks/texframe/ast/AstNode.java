package org.dxworks.texframe.ast;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Base of the LaTeX syntax tree.
 * <p>
 * A node owns an ordered list of children and keeps a back reference to its
 * parent together with its index among its siblings. Argument groups of
 * commands and environments are not children: they hang off their owner's
 * option/parameter lists and have no parent.
 */
public abstract class AstNode {

    private final List<AstNode> children = new ArrayList<>();
    private AstNode parent;
    private int index;

    public List<AstNode> getChildren() {
        return Collections.unmodifiableList(children);
    }

    public AstNode getParent() {
        return parent;
    }

    public int getIndex() {
        return index;
    }

    public boolean hasChildren() {
        return !children.isEmpty();
    }

    public void addChild(AstNode node) {
        node.parent = this;
        node.index = children.size();
        children.add(node);
    }

    /**
     * Drops the children at the given sibling indexes and renumbers the rest.
     *
     * @return how many children were removed
     */
    public int removeChildren(Collection<Integer> indexes) {
        Set<Integer> doomed = new HashSet<>(indexes);
        List<AstNode> kept = new ArrayList<>(children.size());
        int removed = 0;
        for (AstNode child : children) {
            if (doomed.contains(child.index)) {
                child.parent = null;
                removed++;
            } else {
                child.index = kept.size();
                kept.add(child);
            }
        }
        children.clear();
        children.addAll(kept);
        return removed;
    }

    /**
     * Nodes searched and dumped below this one: argument groups first (for
     * nodes that have them), then children.
     */
    protected List<AstNode> nestedNodes() {
        return getChildren();
    }

    /** Depth-first, document-order search of every nested node of the given kind. */
    public <T extends AstNode> List<T> findAll(Class<T> type) {
        List<T> results = new ArrayList<>();
        collect(type, results);
        return results;
    }

    private <T extends AstNode> void collect(Class<T> type, List<T> results) {
        for (AstNode node : nestedNodes()) {
            if (type.isInstance(node)) {
                results.add(type.cast(node));
            }
            node.collect(type, results);
        }
    }

    /** First environment in document order, optionally restricted to a name. */
    public Optional<EnvironmentNode> findEnvironment(String name) {
        return findAll(EnvironmentNode.class).stream()
                .filter(env -> name == null || env.getName().equals(name))
                .findFirst();
    }

    /** First command in document order, optionally restricted to a name. */
    public Optional<CommandNode> findCommand(String name) {
        return findAll(CommandNode.class).stream()
                .filter(cmd -> name == null || cmd.getName().equals(name))
                .findFirst();
    }

    /** LaTeX-ish reconstruction of this node. */
    public String getTextContent() {
        StringBuilder text = new StringBuilder();
        for (AstNode child : children) {
            text.append(child.renderAsChild());
        }
        return text.toString();
    }

    // How this node reads when embedded in its parent's reconstruction.
    String renderAsChild() {
        return getTextContent();
    }

    public String toTree() {
        StringBuilder tree = new StringBuilder();
        appendTree(tree, "", true);
        return tree.toString();
    }

    private void appendTree(StringBuilder tree, String prefix, boolean last) {
        tree.append(prefix)
                .append(last ? "└── " : "├── ")
                .append(getDescription())
                .append('\n');

        String childPrefix = prefix + (last ? "    " : "│   ");
        List<AstNode> nested = nestedNodes();
        for (int i = 0; i < nested.size(); i++) {
            nested.get(i).appendTree(tree, childPrefix, i == nested.size() - 1);
        }
    }

    protected String getDescription() {
        return getClass().getSimpleName();
    }

    static String abbreviate(String content) {
        String escaped = content.replace("\n", "\\n");
        if (escaped.length() > 20) {
            return escaped.substring(0, 20) + "...";
        }
        return escaped;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "(" + children.size() + ")";
    }
}
