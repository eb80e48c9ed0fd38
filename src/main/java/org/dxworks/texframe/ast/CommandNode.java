package org.dxworks.texframe.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;

/**
 * A generic {@code \name[opt]{req}} invocation.
 */
public class CommandNode extends AstNode {

    private static final Set<String> CITE_COMMANDS = Set.of("cite", "citep", "citet");

    private final String name;
    private final List<GroupNode> options = new ArrayList<>();
    private final List<GroupNode> parameters = new ArrayList<>();

    public CommandNode(String name) {
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

    public List<GroupNode> getOptionalArgs() {
        return options.stream().filter(GroupNode::isOptional).toList();
    }

    public List<GroupNode> getRequiredArgs() {
        return parameters.stream().filter(group -> !group.isOptional()).toList();
    }

    public boolean isSection() {
        return SectionNode.isHeading(name);
    }

    public boolean isFootnote() {
        return name.equals("footnote");
    }

    public boolean isCite() {
        return CITE_COMMANDS.contains(name);
    }

    /** Text of the required arguments, concatenated. */
    @Override
    public String getTextContent() {
        StringBuilder text = new StringBuilder();
        for (GroupNode parameter : parameters) {
            text.append(parameter.getTextContent());
        }
        return text.toString();
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
        return "Command: \\" + name;
    }
}
