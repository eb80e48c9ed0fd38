package org.dxworks.texframe.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A {@code \begin{name} ... \end{name}} block.
 */
public class EnvironmentNode extends AstNode {

    private final String name;
    private final List<GroupNode> options = new ArrayList<>();
    private final List<GroupNode> parameters = new ArrayList<>();

    public EnvironmentNode(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }

    public List<GroupNode> getOptions() {
        return Collections.unmodifiableList(options);
    }

    public List<GroupNode> getParameters() {
        return Collections.unmodifiableList(parameters);
    }

    public void addOption(GroupNode option) {
        options.add(option);
    }

    public void addParameter(GroupNode parameter) {
        parameters.add(parameter);
    }

    /** The body alone, without the begin/end markup. */
    public String getBodyText() {
        return super.getTextContent();
    }

    @Override
    public String getTextContent() {
        StringBuilder text = new StringBuilder("\\begin{").append(name).append('}');
        for (GroupNode option : options) {
            text.append('[').append(option.getTextContent()).append(']');
        }
        for (GroupNode parameter : parameters) {
            text.append('{').append(parameter.getTextContent()).append('}');
        }
        text.append(getBodyText());
        return text.append("\\end{").append(name).append('}').toString();
    }

    @Override
    protected List<AstNode> nestedNodes() {
        List<AstNode> nested = new ArrayList<>(options);
        nested.addAll(parameters);
        nested.addAll(getChildren());
        return nested;
    }

    @Override
    protected String getDescription() {
        return "Environment: \\" + name;
    }
}
