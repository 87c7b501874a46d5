package org.calista.kinda.transform;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Output line -&gt; original line (both 1-based). Lines the engine inserts map to the line that caused them.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class SourceMap {

    public String file;
    public String generatedFile;
    public List<Integer> lines = new ArrayList<>();

    public SourceMap() {
    }

    public SourceMap(String file, String generatedFile, List<Integer> lines) {
        this.file = file;
        this.generatedFile = generatedFile;
        this.lines = new ArrayList<>(lines);
    }

    /**
     * @throws IllegalArgumentException outside [1, outputLineCount()]
     */
    public int originalLine(int outputLine) {
        if (outputLine < 1 || outputLine > lines.size()) {
            throw new IllegalArgumentException("output line out of range: " + outputLine + " (1.." + lines.size() + ")");
        }
        return lines.get(outputLine - 1);
    }

    public int outputLineCount() {
        return lines.size();
    }

    /** True when every output line maps to the original line with the same number. */
    public boolean isIdentity() {
        for (int i = 0; i < lines.size(); i++) {
            if (lines.get(i) != i + 1) return false;
        }
        return true;
    }
}
