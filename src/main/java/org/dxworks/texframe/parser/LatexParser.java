package org.dxworks.texframe.parser;

import org.dxworks.texframe.ast.AstNode;
import org.dxworks.texframe.ast.CiteNode;
import org.dxworks.texframe.ast.CommandNode;
import org.dxworks.texframe.ast.DocumentNode;
import org.dxworks.texframe.ast.EnvironmentNode;
import org.dxworks.texframe.ast.FootnoteNode;
import org.dxworks.texframe.ast.GroupNode;
import org.dxworks.texframe.ast.MathNode;
import org.dxworks.texframe.ast.ParagraphNode;
import org.dxworks.texframe.ast.SectionNode;
import org.dxworks.texframe.ast.SourceRange;
import org.dxworks.texframe.ast.SpecialCharNode;
import org.dxworks.texframe.ast.TextNode;
import org.dxworks.texframe.lexer.Token;
import org.dxworks.texframe.lexer.TokenType;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Recursive-descent parser building a {@link DocumentNode} from a token list.
 * <p>
 * The parser keeps a cursor, the node new content is appended to. It moves into
 * commands, groups and environments and is put back when they are done. Headings
 * are the exception: a heading is attached below the nearest enclosing heading of
 * a lower level (or the document root), wherever it appears lexically, and the
 * cursor stays in its body.
 * <p>
 * A parser instance handles one token list and is not thread-safe.
 */
public class LatexParser {

    private static final Set<String> SINGLE_LINE_ENVIRONMENTS = Set.of("tabular", "matrix", "array");

    private final List<Token> tokens;
    private final ParserOptions options;
    private final CommandRegistry commandRegistry = new CommandRegistry();
    private final DocumentNode document = new DocumentNode();

    private int index;
    private AstNode cursor = document;
    private boolean inDocumentEnvironment;
    private boolean parsed;

    public LatexParser(List<Token> tokens) {
        this(tokens, ParserOptions.defaults());
    }

    public LatexParser(List<Token> tokens, ParserOptions options) {
        this.tokens = List.copyOf(tokens);
        this.options = options;
        registerSpecialCommands();
    }

    private void registerSpecialCommands() {
        commandRegistry.register("section", SectionNode::new);
        commandRegistry.register("subsection", SectionNode::new);
        commandRegistry.register("subsubsection", SectionNode::new);
        commandRegistry.register("footnote", FootnoteNode::new);
        commandRegistry.register("cite", CiteNode::new);
        commandRegistry.register("citep", CiteNode::new);
        commandRegistry.register("citet", CiteNode::new);
    }

    public ParserOptions getOptions() {
        return options;
    }

    /**
     * Parses the whole token list. Calling it again returns the same tree.
     *
     * @throws ParseException when an argument or group is not closed properly
     */
    public DocumentNode parse() {
        if (!parsed) {
            parsed = true;
            while (current() != null) {
                parseToken();
            }
        }
        return document;
    }

    private void parseToken() {
        Token token = current();
        switch (token.getType()) {
            case COMMAND -> parseCommand();
            case ENV_BEGIN, ENV_END -> parseEnvironment();
            case MATH_INLINE -> parseMath(false);
            case MATH_FORMULA -> parseMath(true);
            case BRACE_OPEN -> parseGroup();
            case TEXT, SPACE -> parseText();
            case NEWLINE -> parseNewline();
            case SPECIAL_CHAR -> parseSpecialChar();
            default -> advance();
        }
    }

    // ---- commands ----

    private void parseCommand() {
        String name = current().getValue();
        advance();

        CommandNode node = commandRegistry.createCommandNode(name);
        if (node instanceof SectionNode section) {
            processSection(section);
            return;
        }

        cursor.addChild(node);
        withCursor(node, () -> parseCommandArguments(node));

        if (node instanceof FootnoteNode footnote) {
            processFootnote(footnote);
        } else if (node instanceof CiteNode cite) {
            processCite(cite);
        } else if (node.getName().equals("label")) {
            processLabel(node);
        }
    }

    private void parseCommandArguments(CommandNode command) {
        while (currentIs(TokenType.BRACKET_OPEN)) {
            Token opening = current();
            advance();
            GroupNode option = new GroupNode(true);
            command.addOption(option);
            parseGroupContent(option, opening);
            expect(TokenType.BRACKET_CLOSE, "Expected ] to close optional argument");
            advance();
        }

        while (currentIs(TokenType.BRACE_OPEN)) {
            Token opening = current();
            advance();
            GroupNode parameter = new GroupNode(false);
            command.addParameter(parameter);
            parseGroupContent(parameter, opening);
            expect(TokenType.BRACE_CLOSE, "Expected } to close required argument");
            advance();
        }
    }

    private void processSection(SectionNode section) {
        parseCommandArguments(section);
        section.applyArguments();
        // \section{Title\label{key}}
        section.findCommand("label").flatMap(LatexParser::labelKey).ifPresent(section::setLabel);

        AstNode parent = cursor;
        while (true) {
            if (parent instanceof SectionNode enclosing && enclosing.getLevel() < section.getLevel()) {
                break;
            }
            if (parent == document) {
                break;
            }
            parent = parent.getParent();
            if (parent == null) {
                // detached argument group
                parent = document;
            }
        }

        parent.addChild(section);
        cursor = section;
        startNewParagraph();
    }

    private void processFootnote(FootnoteNode footnote) {
        if (!footnote.getParameters().isEmpty()) {
            footnote.setContent(footnote.getParameters().get(0));
        }
    }

    private void processCite(CiteNode cite) {
        if (!cite.getParameters().isEmpty()) {
            cite.setKeys(CiteNode.splitKeys(cite.getParameters().get(0).getTextContent()));
        }
    }

    // \label{...} names the heading whose body it sits in, first one wins
    private void processLabel(CommandNode label) {
        labelKey(label).ifPresent(key -> labelledSection()
                .filter(section -> section.getLabel() == null)
                .ifPresent(section -> section.setLabel(key)));
    }

    // Labels inside an environment (figure, table, equation) name that environment.
    private Optional<SectionNode> labelledSection() {
        for (AstNode node = cursor; node != null; node = node.getParent()) {
            if (node instanceof SectionNode section) {
                return Optional.of(section);
            }
            if (node instanceof EnvironmentNode) {
                return Optional.empty();
            }
        }
        return Optional.empty();
    }

    private static Optional<String> labelKey(CommandNode label) {
        if (label.getParameters().isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(label.getParameters().get(0).getTextContent().trim());
    }

    // ---- environments ----

    private void parseEnvironment() {
        Token token = current();
        String name = token.getValue();

        if (token.is(TokenType.ENV_BEGIN)) {
            EnvironmentNode environment = new EnvironmentNode(name);
            if (name.equals("document")) {
                inDocumentEnvironment = true;
            }
            cursor.addChild(environment);
            cursor = environment;
        } else {
            // a mismatched \end leaves the innermost environment open
            EnvironmentNode innermost = innermostEnvironment();
            if (innermost != null && innermost.getName().equals(name)) {
                cursor = innermost.getParent();
            }
        }
        advance();
    }

    private EnvironmentNode innermostEnvironment() {
        for (AstNode node = cursor; node != null; node = node.getParent()) {
            if (node instanceof EnvironmentNode environment) {
                return environment;
            }
        }
        return null;
    }

    // ---- groups ----

    private void parseGroup() {
        Token opening = expect(TokenType.BRACE_OPEN, "Expected { to open group");
        advance();

        GroupNode group = new GroupNode(false);
        cursor.addChild(group);
        parseGroupContent(group, opening);

        expect(TokenType.BRACE_CLOSE, "Expected } to close group");
        advance();
    }

    /**
     * Parses up to, not including, the delimiter closing {@code group}. Nested
     * brace and bracket groups become child groups; any closing delimiter closes
     * the innermost open group.
     */
    private void parseGroupContent(GroupNode group, Token opening) {
        Deque<AstNode> savedCursors = new ArrayDeque<>();
        Deque<GroupNode> openGroups = new ArrayDeque<>();
        Deque<Token> openings = new ArrayDeque<>();
        openGroups.push(group);
        openings.push(opening);

        AstNode saved = cursor;
        cursor = group;
        try {
            int depth = 1;
            while (depth > 0) {
                Token token = current();
                if (token == null || token.is(TokenType.EOF)) {
                    throw new UnclosedGroupException(
                            openGroups.peek().getDelimiterName(), openings.peek().getPosition());
                }

                switch (token.getType()) {
                    case BRACE_OPEN, BRACKET_OPEN -> {
                        GroupNode nested = new GroupNode(token.is(TokenType.BRACKET_OPEN));
                        cursor.addChild(nested);
                        savedCursors.push(cursor);
                        openGroups.push(nested);
                        openings.push(token);
                        cursor = nested;
                        depth++;
                        advance();
                    }
                    case BRACE_CLOSE, BRACKET_CLOSE -> {
                        depth--;
                        if (depth > 0) {
                            cursor = savedCursors.pop();
                            openGroups.pop();
                            openings.pop();
                            advance();
                        }
                    }
                    default -> parseToken();
                }
            }
        } finally {
            cursor = saved;
        }
    }

    // ---- leaves ----

    private void parseMath(boolean display) {
        cursor.addChild(new MathNode(current().getValue(), display));
        advance();
    }

    private void parseSpecialChar() {
        cursor.addChild(new SpecialCharNode(current().getValue().charAt(0)));
        advance();
    }

    private void parseText() {
        Token first = current();
        if (!options.isTextMerge()) {
            cursor.addChild(new TextNode(first.getValue(), first.getPosition()));
            advance();
            return;
        }

        StringBuilder merged = new StringBuilder();
        List<SourceRange> ranges = new ArrayList<>();
        while (currentIs(TokenType.TEXT) || currentIs(TokenType.SPACE)) {
            Token token = current();
            Token.Position start = token.getPosition();
            merged.append(token.getValue());
            ranges.add(new SourceRange(start.getLine(), start.getColumn(),
                    start.getLine(), start.getColumn() + token.getValue().length()));
            advance();
        }
        cursor.addChild(new TextNode(merged.toString(), first.getPosition(), ranges));
    }

    private void parseNewline() {
        switch (options.getNewlineMode()) {
            case LITERAL -> {
                cursor.addChild(new TextNode("\n"));
                advance();
                return;
            }
            case COMPACT -> {
                cursor.addChild(new TextNode(" "));
                advance();
                return;
            }
            default -> {
                // smart handling below
            }
        }

        EnvironmentNode environment = innermostEnvironment();
        if (environment != null && SINGLE_LINE_ENVIRONMENTS.contains(environment.getName())) {
            cursor.addChild(new TextNode(" "));
            advance();
            return;
        }

        int run = 1;
        while (peekIs(TokenType.NEWLINE)) {
            run++;
            advance();
        }

        if (inDocumentEnvironment) {
            if (run > 1) {
                startNewParagraph();
            } else if (cursor.hasChildren()) {
                cursor.addChild(TextNode.newlineSpace());
            }
        }
        advance();
    }

    private void startNewParagraph() {
        if (cursor instanceof ParagraphNode) {
            cursor = cursor.getParent();
        }
        ParagraphNode paragraph = new ParagraphNode();
        cursor.addChild(paragraph);
        cursor = paragraph;
    }

    // ---- token cursor ----

    private void withCursor(AstNode node, Runnable action) {
        AstNode saved = cursor;
        cursor = node;
        try {
            action.run();
        } finally {
            cursor = saved;
        }
    }

    private Token current() {
        return index < tokens.size() ? tokens.get(index) : null;
    }

    private boolean currentIs(TokenType type) {
        Token token = current();
        return token != null && token.is(type);
    }

    private boolean peekIs(TokenType type) {
        return index + 1 < tokens.size() && tokens.get(index + 1).is(type);
    }

    private void advance() {
        index++;
    }

    private Token expect(TokenType type, String context) {
        Token token = current();
        if (token == null || !token.is(type)) {
            throw new UnexpectedTokenException(context, type, token);
        }
        return token;
    }
}
