package org.dxworks.texframe.ast;

import java.util.Map;

/**
 * A heading command ({@code \section}, {@code \subsection*}, ...). Headings nest
 * by level; the body of a heading lives in paragraph children.
 */
public class SectionNode extends CommandNode {

    private static final Map<String, Integer> LEVELS = Map.of(
            "section", 1,
            "subsection", 2,
            "subsubsection", 3,
            "paragraph", 4,
            "subparagraph", 5
    );

    private GroupNode title;
    private GroupNode shortTitle;
    private int level;
    private String label;
    private boolean numbered;

    public SectionNode(String name) {
        super(name);
        this.level = levelOf(name);
        this.numbered = !name.endsWith("*");
    }

    /** Level derived from the command name; unknown names count as level 1. */
    public static int levelOf(String commandName) {
        String baseName = stripStars(commandName);
        return LEVELS.getOrDefault(baseName, 1);
    }

    /** Whether the command name, stars aside, is one of the heading commands. */
    public static boolean isHeading(String commandName) {
        return LEVELS.containsKey(stripStars(commandName));
    }

    static String stripStars(String name) {
        int end = name.length();
        while (end > 0 && name.charAt(end - 1) == '*') {
            end--;
        }
        return name.substring(0, end);
    }

    /** Pulls title, short title, level and numbering out of the parsed arguments. */
    public void applyArguments() {
        if (!getParameters().isEmpty()) {
            title = getParameters().get(0);
        }
        if (!getOptions().isEmpty()) {
            shortTitle = getOptions().get(0);
        }
        level = levelOf(getName());
        numbered = !getName().endsWith("*");
    }

    public GroupNode getTitle() {
        return title;
    }

    public GroupNode getShortTitle() {
        return shortTitle;
    }

    public int getLevel() {
        return level;
    }

    public String getLabel() {
        return label;
    }

    public void setLabel(String label) {
        this.label = label;
    }

    public boolean isNumbered() {
        return numbered;
    }

    public String getTitleText() {
        return title == null ? "" : title.getTextContent();
    }

    public String getShortTitleText() {
        return shortTitle == null ? "" : shortTitle.getTextContent();
    }

    /** Title followed by the body, one child per line. */
    @Override
    public String getTextContent() {
        StringBuilder text = new StringBuilder(getTitleText());
        for (AstNode child : getChildren()) {
            text.append('\n').append(child.renderAsChild());
        }
        return text.toString();
    }

    @Override
    protected String getDescription() {
        String kind = switch (level) {
            case 1 -> "Section";
            case 2 -> "Subsection";
            case 3 -> "Subsubsection";
            default -> "Level " + level;
        };
        return kind + ": " + getTitleText();
    }
}
