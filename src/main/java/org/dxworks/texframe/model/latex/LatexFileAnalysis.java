package org.dxworks.texframe.model.latex;

import org.dxworks.texframe.model.Analysis;

import java.util.ArrayList;
import java.util.List;

public class LatexFileAnalysis implements Analysis {
    public String filePath;
    public String language = "latex";
    public String title; // nullable
    public String abstractText; // nullable
    public List<LatexSection> sections = new ArrayList<>();
    public List<LatexCitation> citations = new ArrayList<>();
    public List<String> footnotes = new ArrayList<>();
    public List<LatexMath> math = new ArrayList<>();
    public List<String> environments = new ArrayList<>();
    public String error; // set when the source could not be parsed

    @Override
    public String getFilePath() {
        return filePath;
    }

    @Override
    public String getLanguage() {
        return language;
    }
}
