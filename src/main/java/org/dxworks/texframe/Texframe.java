package org.dxworks.texframe;

import org.dxworks.texframe.analyzer.LatexAnalyzer;
import org.dxworks.texframe.ast.DocumentNode;
import org.dxworks.texframe.lexer.LatexLexer;
import org.dxworks.texframe.lexer.Token;
import org.dxworks.texframe.model.Analysis;
import org.dxworks.texframe.parser.LatexParser;
import org.dxworks.texframe.parser.ParserOptions;

import java.util.List;

/**
 * Entry points for callers that do not need to hold on to a lexer or parser.
 * Every call works on its own lexer and parser, so calls may run concurrently.
 */
public final class Texframe {

    private Texframe() {
        // utility class
    }

    public static List<Token> tokenize(String source) {
        return new LatexLexer().tokenize(source);
    }

    public static DocumentNode parse(String source) {
        return parse(source, ParserOptions.defaults());
    }

    public static DocumentNode parse(String source, ParserOptions options) {
        return new LatexParser(tokenize(source), options).parse();
    }

    public static Analysis analyze(String filePath, String source) {
        return new LatexAnalyzer(TexframeConfig.load()).analyze(filePath, source);
    }
}
