package org.dxworks.texframe.analyzer;

import org.dxworks.texframe.TexframeConfig;
import org.dxworks.texframe.ast.AstNode;
import org.dxworks.texframe.ast.CiteNode;
import org.dxworks.texframe.ast.DocumentNode;
import org.dxworks.texframe.ast.EnvironmentNode;
import org.dxworks.texframe.ast.FootnoteNode;
import org.dxworks.texframe.ast.MathNode;
import org.dxworks.texframe.ast.ParagraphNode;
import org.dxworks.texframe.ast.SectionNode;
import org.dxworks.texframe.lexer.LatexLexer;
import org.dxworks.texframe.lexer.Token;
import org.dxworks.texframe.model.Analysis;
import org.dxworks.texframe.model.latex.LatexCitation;
import org.dxworks.texframe.model.latex.LatexFileAnalysis;
import org.dxworks.texframe.model.latex.LatexMath;
import org.dxworks.texframe.model.latex.LatexSection;
import org.dxworks.texframe.parser.LatexParser;
import org.dxworks.texframe.parser.ParseException;
import org.dxworks.texframe.parser.ParserOptions;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Parses a LaTeX source and extracts the parts downstream tools care about:
 * title, abstract, heading outline, citations, footnotes and formulas.
 */
public class LatexAnalyzer {

    private final ParserOptions parserOptions;

    public LatexAnalyzer() {
        this(TexframeConfig.load());
    }

    public LatexAnalyzer(TexframeConfig config) {
        this.parserOptions = config.toParserOptions();
    }

    public Analysis analyze(String filePath, String sourceCode) {
        LatexFileAnalysis analysis = new LatexFileAnalysis();
        analysis.filePath = filePath;

        // Remove BOM if present
        String source = sourceCode == null ? "" : sourceCode;
        if (source.startsWith("\uFEFF")) {
            source = source.substring(1);
        }

        DocumentNode document = parse(source, analysis);
        if (document == null) {
            return analysis;
        }

        analysis.title = document.getTitle()
                .map(title -> normalizeWhitespace(title.getTextContent()))
                .orElse(null);
        analysis.abstractText = document.getAbstract()
                .map(abstractEnv -> normalizeWhitespace(abstractEnv.getBodyText()))
                .orElse(null);

        for (SectionNode section : document.getSections()) {
            analysis.sections.add(createSection(section));
        }
        for (CiteNode cite : document.findAll(CiteNode.class)) {
            analysis.citations.add(new LatexCitation(cite.getName(), cite.getKeys()));
        }
        for (FootnoteNode footnote : document.findAll(FootnoteNode.class)) {
            analysis.footnotes.add(normalizeWhitespace(footnote.getContentText()));
        }
        for (MathNode math : document.findAll(MathNode.class)) {
            analysis.math.add(new LatexMath(math.getContent(), math.isDisplay()));
        }
        analysis.environments = collectEnvironmentNames(document.getEnvironments());

        return analysis;
    }

    private DocumentNode parse(String source, LatexFileAnalysis analysis) {
        List<Token> tokens = new LatexLexer().tokenize(source);
        try {
            return new LatexParser(tokens, parserOptions).parse();
        } catch (ParseException e) {
            System.err.println("[LatexAnalyzer] Parse exception in " + analysis.filePath + ": " + e.getMessage());
            analysis.error = e.getMessage();
            return null;
        }
    }

    private LatexSection createSection(SectionNode node) {
        LatexSection section = new LatexSection();
        section.heading = normalizeWhitespace(node.getTitleText());
        section.shortHeading = node.getShortTitle() != null
                ? normalizeWhitespace(node.getShortTitleText())
                : null;
        section.level = node.getLevel();
        section.numbered = node.isNumbered();
        section.label = node.getLabel();

        for (AstNode child : node.getChildren()) {
            if (child instanceof ParagraphNode paragraph && !paragraph.isBlank()) {
                section.paragraphs++;
            } else if (child instanceof SectionNode subsection) {
                section.subsections.add(createSection(subsection));
            }
        }
        return section;
    }

    private List<String> collectEnvironmentNames(List<EnvironmentNode> environments) {
        Set<String> names = new LinkedHashSet<>();
        for (EnvironmentNode environment : environments) {
            names.add(environment.getName());
        }
        return List.copyOf(names);
    }

    private static String normalizeWhitespace(String text) {
        return text.replaceAll("\\s+", " ").trim();
    }
}
