package org.dxworks.texframe.model.latex;

import java.util.ArrayList;
import java.util.List;

public class LatexSection {
    public String heading;
    public String shortHeading; // optional [..] argument, nullable
    public int level; // 1 = \section ... 5 = \subparagraph
    public boolean numbered;
    public String label; // nullable
    public int paragraphs; // non-blank paragraphs directly under the heading
    public List<LatexSection> subsections = new ArrayList<>();
}
