package org.dxworks.texframe.ast;

import org.dxworks.texframe.lexer.Token;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Plain text. Nodes built in merge mode carry one {@link SourceRange} per token
 * folded into them, so offsets into {@link #getContent()} map back to source
 * positions.
 */
public class TextNode extends AstNode {

    private final String content;
    private final List<SourceRange> sourceRanges;
    private final Token.Position position;
    private boolean newlineConverted;

    public TextNode(String content) {
        this(content, null, List.of());
    }

    public TextNode(String content, Token.Position position) {
        this(content, position, List.of());
    }

    public TextNode(String content, Token.Position position, List<SourceRange> sourceRanges) {
        this.content = content;
        this.position = position;
        this.sourceRanges = List.copyOf(sourceRanges);
    }

    /** A space standing in for a single line break. */
    public static TextNode newlineSpace() {
        TextNode space = new TextNode(" ");
        space.newlineConverted = true;
        return space;
    }

    public String getContent() {
        return content;
    }

    public List<SourceRange> getSourceRanges() {
        return sourceRanges;
    }

    /** Start of the text in the source; empty for text the parser synthesized. */
    public Optional<Token.Position> getPosition() {
        return Optional.ofNullable(position);
    }

    public boolean isNewlineConverted() {
        return newlineConverted;
    }

    public boolean isMerged() {
        return !sourceRanges.isEmpty();
    }

    /** Source position of every character of the content, in order. */
    public List<Token.Position> getOriginalPositions() {
        if (sourceRanges.isEmpty()) {
            if (position == null) {
                return Collections.emptyList();
            }
            List<Token.Position> positions = new ArrayList<>(content.length());
            for (int i = 0; i < content.length(); i++) {
                positions.add(position.shift(i));
            }
            return positions;
        }

        List<Token.Position> positions = new ArrayList<>(content.length());
        for (SourceRange range : sourceRanges) {
            for (int i = 0; i < range.length(); i++) {
                positions.add(new Token.Position(range.getStartLine(), range.getStartColumn() + i));
            }
        }
        return positions;
    }

    public Optional<Token.Position> sourcePositionAt(int offset) {
        if (offset < 0 || offset >= content.length()) {
            return Optional.empty();
        }
        List<Token.Position> positions = getOriginalPositions();
        return offset < positions.size() ? Optional.of(positions.get(offset)) : Optional.empty();
    }

    @Override
    public String getTextContent() {
        return content;
    }

    @Override
    protected String getDescription() {
        return "Text: '" + abbreviate(content) + "'";
    }

    @Override
    public String toString() {
        if (isMerged()) {
            return "TextNode(merged, len=" + content.length() + ", chunks=" + sourceRanges.size() + ")";
        }
        return "TextNode('" + content + "')";
    }
}
