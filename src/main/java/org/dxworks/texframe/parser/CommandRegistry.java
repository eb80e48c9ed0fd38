package org.dxworks.texframe.parser;

import org.dxworks.texframe.ast.CommandNode;

import java.util.HashMap;
import java.util.Map;
import java.util.function.Function;

/**
 * Maps command names to the node kind they materialize as. Names registered
 * with a trailing {@code *} are stored under their base name; lookups of starred
 * names fall back to the base name, then to a plain {@link CommandNode}.
 */
public class CommandRegistry {

    private final Map<String, Function<String, ? extends CommandNode>> factories = new HashMap<>();
    private final Function<String, ? extends CommandNode> defaultFactory = CommandNode::new;

    public void register(String commandName, Function<String, ? extends CommandNode> factory) {
        factories.put(stripStars(commandName), factory);
    }

    public boolean isRegistered(String commandName) {
        return factories.containsKey(commandName) || factories.containsKey(stripStars(commandName));
    }

    /** Always returns a node; unknown names become generic commands. */
    public CommandNode createCommandNode(String commandName) {
        Function<String, ? extends CommandNode> factory = factories.get(commandName);
        if (factory == null) {
            factory = factories.getOrDefault(stripStars(commandName), defaultFactory);
        }
        return factory.apply(commandName);
    }

    private static String stripStars(String name) {
        int end = name.length();
        while (end > 0 && name.charAt(end - 1) == '*') {
            end--;
        }
        return name.substring(0, end);
    }
}
