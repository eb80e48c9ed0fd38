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
import org.dxworks.texframe.ast.TextNode;
import org.dxworks.texframe.lexer.LatexLexer;
import org.dxworks.texframe.lexer.Token;
import org.dxworks.texframe.lexer.TokenType;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class LatexParserTest {

    private static DocumentNode parse(String source) {
        return parse(source, ParserOptions.defaults());
    }

    private static DocumentNode parse(String source, ParserOptions options) {
        return new LatexParser(new LatexLexer().tokenize(source), options).parse();
    }

    @Test
    void simpleDocument() {
        DocumentNode document = parse("\\documentclass{article}\n"
                + "\\begin{document}\n"
                + "\\section{Introduction}\n"
                + "Hello, world!\n"
                + "\\end{document}\n");

        List<SectionNode> sections = document.getSections();
        assertEquals(1, sections.size());
        SectionNode section = sections.get(0);
        assertEquals("Introduction", section.getTitleText());
        assertEquals(1, section.getLevel());
        assertTrue(section.isNumbered());

        ParagraphNode paragraph = (ParagraphNode) section.getChildren().get(0);
        assertEquals("Hello, world!", paragraph.getTextContent());

        assertEquals("article", document.findCommand("documentclass").orElseThrow().getTextContent());
        assertTrue(document.findEnvironment("document").isPresent());
    }

    @Test
    void inlineAndDisplayMath() {
        DocumentNode document = parse("$E=mc^2$ and $$\\int_a^b f(x)dx$$");

        List<AstNode> children = document.getChildren();
        assertEquals(5, children.size());
        MathNode inline = (MathNode) children.get(0);
        assertEquals("E=mc^2", inline.getContent());
        assertFalse(inline.isDisplay());
        assertEquals("and", children.get(2).getTextContent());
        MathNode display = (MathNode) children.get(4);
        assertEquals("\\int_a^b f(x)dx", display.getContent());
        assertTrue(display.isDisplay());
        assertEquals("$$\\int_a^b f(x)dx$$", display.getTextContent());
    }

    @Test
    void formattingCommands() {
        DocumentNode document = parse("\\textbf{Bold text} \\emph{Italic text}");

        List<AstNode> children = document.getChildren();
        assertEquals(3, children.size());
        CommandNode bold = (CommandNode) children.get(0);
        assertEquals("textbf", bold.getName());
        assertEquals("Bold text", bold.getTextContent());
        assertEquals(" ", children.get(1).getTextContent());
        CommandNode emph = (CommandNode) children.get(2);
        assertEquals("emph", emph.getName());
        assertEquals("Italic text", emph.getTextContent());
        assertFalse(bold.hasChildren());
    }

    @Test
    void argumentGroupsAreDetachedFromTheTree() {
        DocumentNode document = parse("\\includegraphics[width=5cm]{figure.png}");

        CommandNode command = (CommandNode) document.getChildren().get(0);
        assertEquals(1, command.getOptionalArgs().size());
        assertEquals(1, command.getRequiredArgs().size());
        assertEquals("width=5cm", command.getOptions().get(0).getTextContent());
        assertNull(command.getParameters().get(0).getParent());
        assertEquals(2, document.findAll(GroupNode.class).size());
    }

    @Test
    void sectionsNestByLevel() {
        DocumentNode document = parse("\\section{A}\ntext\n\\subsection*{B}\nmore\n\\section{C}\n");

        List<SectionNode> sections = document.getSections();
        assertEquals(2, sections.size());
        SectionNode first = sections.get(0);
        assertEquals("A", first.getTitleText());
        assertEquals("C", sections.get(1).getTitleText());

        SectionNode nested = (SectionNode) first.getChildren().get(1);
        assertEquals("B", nested.getTitleText());
        assertEquals(2, nested.getLevel());
        assertFalse(nested.isNumbered());
        assertSame(first, nested.getParent());
        assertEquals(1, nested.getIndex());
    }

    @Test
    void headingChainNestsOneLevelAtATime() {
        DocumentNode document = parse("\\section{First}\n\\subsection{Second}\n\\subsubsection*{Third}\n");

        assertEquals(1, document.getSections().size());
        SectionNode first = document.getSections().get(0);
        SectionNode second = (SectionNode) first.getChildren().get(1);
        SectionNode third = (SectionNode) second.getChildren().get(1);
        assertEquals("Second", second.getTitleText());
        assertEquals(2, second.getLevel());
        assertEquals("Third", third.getTitleText());
        assertEquals(3, third.getLevel());
        assertFalse(third.isNumbered());
    }

    @Test
    void sectionShortTitleComesFromOptionalArgument() {
        DocumentNode document = parse("\\section[Short]{A much longer title}");

        SectionNode section = document.getSections().get(0);
        assertEquals("Short", section.getShortTitleText());
        assertEquals("A much longer title", section.getTitleText());
    }

    @Test
    void sectionInsideEnvironmentAttachesToRoot() {
        DocumentNode document = parse("\\begin{document}\n\\section{Inside}\nBody\n\\end{document}\n");

        EnvironmentNode environment = document.findEnvironment("document").orElseThrow();
        assertFalse(environment.hasChildren());
        assertEquals(1, document.getSections().size());
        assertSame(document, document.getSections().get(0).getParent());
    }

    @Test
    void labelNamesTheEnclosingSection() {
        DocumentNode document = parse("\\section{Intro}\\label{sec:intro}\n\\label{other}\n");

        assertEquals("sec:intro", document.getSections().get(0).getLabel());
    }

    @Test
    void labelInsideEnvironmentDoesNotNameTheSection() {
        DocumentNode document = parse("\\section{Intro}\nText\n\\begin{figure}\\label{fig:plot}\\end{figure}\n");

        assertNull(document.getSections().get(0).getLabel());
    }

    @Test
    void labelAfterEnvironmentStillNamesTheSection() {
        DocumentNode document = parse("\\section{Intro}\n"
                + "\\begin{figure}\\label{fig:plot}\\end{figure}\n"
                + "\\label{sec:intro}\n");

        assertEquals("sec:intro", document.getSections().get(0).getLabel());
    }

    @Test
    void labelInsideTitleNamesTheSection() {
        DocumentNode document = parse("\\section{Intro\\label{sec:intro}}\n\\label{later}\n");

        assertEquals("sec:intro", document.getSections().get(0).getLabel());
    }

    @Test
    void citationKeysAreSplitAndTrimmed() {
        DocumentNode document = parse("See \\cite{knuth84, lamport94} and \\citep{a,,b}.");

        List<CiteNode> cites = document.findAll(CiteNode.class);
        assertEquals(2, cites.size());
        assertEquals(List.of("knuth84", "lamport94"), cites.get(0).getKeys());
        assertEquals(List.of("a", "", "b"), cites.get(1).getKeys());
        assertTrue(cites.get(1).isCite());
    }

    @Test
    void footnoteContent() {
        DocumentNode document = parse("Text\\footnote{A short note.}");

        FootnoteNode footnote = document.findAll(FootnoteNode.class).get(0);
        assertEquals("A short note.", footnote.getContentText());
        assertSame(footnote.getParameters().get(0), footnote.getContent());
    }

    @Test
    void blankLinesStartParagraphsInsideDocument() {
        DocumentNode document = parse("\\begin{document}\nFirst.\n\nSecond\nline.\n\\end{document}");

        EnvironmentNode environment = document.findEnvironment("document").orElseThrow();
        assertEquals(2, environment.getChildren().size());
        assertEquals("First.", environment.getChildren().get(0).getTextContent());
        ParagraphNode paragraph = (ParagraphNode) environment.getChildren().get(1);
        assertEquals("Second line.", paragraph.getTextContent());

        TextNode joint = (TextNode) paragraph.getChildren().get(1);
        assertTrue(joint.isNewlineConverted());
    }

    @Test
    void windowsLineEndingsStillBreakParagraphs() {
        DocumentNode document = parse("\\begin{document}\r\nFirst.\r\n\r\nSecond.\r\n\\end{document}\r\n");

        EnvironmentNode environment = document.findEnvironment("document").orElseThrow();
        assertEquals(2, environment.getChildren().size());
        ParagraphNode paragraph = (ParagraphNode) environment.getChildren().get(1);
        assertEquals("Second.", paragraph.getTextContent());
        assertTrue(document.findAll(TextNode.class).stream().noneMatch(text -> text.getContent().contains("\r")));
    }

    @Test
    void newlinesOutsideDocumentAreDropped() {
        DocumentNode document = parse("a\nb");

        assertEquals(2, document.getChildren().size());
    }

    @Test
    void literalNewlineMode() {
        DocumentNode document = parse("a\nb", ParserOptions.of(false, NewlineMode.LITERAL));

        assertEquals("a\nb\n", document.getTextContent());
    }

    @Test
    void compactNewlineMode() {
        DocumentNode document = parse("\\begin{document}\na\n\nb\n\\end{document}",
                ParserOptions.of(false, NewlineMode.COMPACT));

        assertTrue(document.findAll(ParagraphNode.class).isEmpty());
        assertEquals(" a  b ", document.findEnvironment("document").orElseThrow().getBodyText());
    }

    @Test
    void tabularNewlinesBecomeSpaces() {
        DocumentNode document = parse("\\begin{tabular}{cc}\na & b \\\\\nc & d\n\\end{tabular}");

        EnvironmentNode tabular = document.findEnvironment("tabular").orElseThrow();
        assertTrue(tabular.findAll(ParagraphNode.class).isEmpty());
        assertEquals("{cc} a & b  c & d ", tabular.getBodyText());
    }

    @Test
    void mismatchedEndIsIgnored() {
        DocumentNode document = parse("\\begin{itemize}x\\end{enumerate}y\\end{itemize}z");

        EnvironmentNode itemize = document.findEnvironment("itemize").orElseThrow();
        assertEquals(2, itemize.getChildren().size());
        assertEquals("xy", itemize.getBodyText());
        assertEquals("z", document.getChildren().get(1).getTextContent());
    }

    @Test
    void nestedGroupsAreKept() {
        DocumentNode document = parse("{a {b} c}");

        GroupNode outer = (GroupNode) document.getChildren().get(0);
        assertEquals("a {b} c", outer.getTextContent());
        assertEquals(2, document.findAll(GroupNode.class).size());
    }

    @Test
    void textMergeCombinesAdjacentTextAndSpaces() {
        DocumentNode document = parse("Hello world", ParserOptions.of(true, NewlineMode.DEFAULT));

        assertEquals(1, document.getChildren().size());
        TextNode text = (TextNode) document.getChildren().get(0);
        assertEquals("Hello world", text.getContent());
        assertTrue(text.isMerged());
        assertEquals(3, text.getSourceRanges().size());
        assertEquals(11, text.getOriginalPositions().size());
        assertEquals(new Token.Position(1, 7), text.sourcePositionAt(6).orElseThrow());
    }

    @Test
    void textWithoutMergeKeepsOneNodePerToken() {
        DocumentNode document = parse("Hello world");

        assertEquals(3, document.getChildren().size());
        TextNode text = (TextNode) document.getChildren().get(2);
        assertEquals(new Token.Position(1, 7), text.getPosition().orElseThrow());
    }

    @Test
    void unclosedGroupFails() {
        UnclosedGroupException e = assertThrows(UnclosedGroupException.class, () -> parse("\\textbf{abc"));

        assertEquals("brace", e.getGroupKind());
        assertEquals(new Token.Position(1, 8), e.getPosition().orElseThrow());
        assertEquals("Unclosed brace group at (1, 8)", e.getMessage());
    }

    @Test
    void unclosedNestedGroupReportsInnermostOpening() {
        UnclosedGroupException e = assertThrows(UnclosedGroupException.class, () -> parse("{a [b"));

        assertEquals("bracket", e.getGroupKind());
        assertEquals(new Token.Position(1, 4), e.getPosition().orElseThrow());
    }

    @Test
    void optionalArgumentClosedByBraceFails() {
        UnexpectedTokenException e = assertThrows(UnexpectedTokenException.class, () -> parse("\\cmd[a}"));

        assertEquals(TokenType.BRACKET_CLOSE, e.getExpected());
        assertEquals(TokenType.BRACE_CLOSE, e.getActual().orElseThrow().getType());
        assertEquals("Expected ] to close optional argument: expected BRACKET_CLOSE, got BRACE_CLOSE '}' at (1, 7)",
                e.getMessage());
    }

    @Test
    void truncatedTokenStreamFails() {
        List<Token> tokens = List.of(
                new Token(TokenType.COMMAND, "emph", new Token.Position(1, 1)),
                new Token(TokenType.BRACE_OPEN, "{", new Token.Position(1, 6)));

        assertThrows(UnclosedGroupException.class, () -> new LatexParser(tokens).parse());
    }

    @Test
    void strayTokensAreSkipped() {
        DocumentNode document = parse("a } % note\n\\# ]");

        assertEquals("a   ", document.getTextContent());
    }

    @Test
    void parseIsIdempotent() {
        LatexParser parser = new LatexParser(new LatexLexer().tokenize("\\section{A}\nx"));

        DocumentNode first = parser.parse();
        assertSame(first, parser.parse());
        assertEquals(1, first.getSections().size());
    }
}
