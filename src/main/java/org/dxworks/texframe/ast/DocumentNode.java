package org.dxworks.texframe.ast;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Root of a parsed document.
 */
public class DocumentNode extends AstNode {

    /** Top-level headings; nested ones hang below their parent section. */
    public List<SectionNode> getSections() {
        return getChildren().stream()
                .filter(SectionNode.class::isInstance)
                .map(SectionNode.class::cast)
                .collect(Collectors.toList());
    }

    public List<EnvironmentNode> getEnvironments() {
        return findAll(EnvironmentNode.class);
    }

    public List<CommandNode> getCommands() {
        return findAll(CommandNode.class);
    }

    public Optional<EnvironmentNode> getAbstract() {
        return findEnvironment("abstract");
    }

    public Optional<CommandNode> getTitle() {
        return findCommand("title");
    }

    @Override
    protected String getDescription() {
        return "Document";
    }
}
