package org.dxworks.texframe.analyzer;

import org.approvaltests.Approvals;
import org.dxworks.texframe.TestUtils;
import org.dxworks.texframe.TexframeConfig;
import org.dxworks.texframe.model.Analysis;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

public class LatexAnalyzeApprovalTest {
    private static final String SAMPLES_BASE_PATH = "src/test/resources/samples/latex/";

    @Test
    void analyze_Paper() throws IOException {
        verify("Paper.tex");
    }

    @Test
    void analyze_Unclosed() throws IOException {
        verify("Unclosed.tex");
    }

    private static void verify(String fileName) throws IOException {
        Path filePath = Paths.get(SAMPLES_BASE_PATH + fileName);
        LatexAnalyzer analyzer = new LatexAnalyzer(TexframeConfig.defaults());
        Analysis analysis = analyzer.analyze(filePath.toString(), Files.readString(filePath));
        Approvals.verify(TestUtils.toApprovalText(analysis));
    }
}
