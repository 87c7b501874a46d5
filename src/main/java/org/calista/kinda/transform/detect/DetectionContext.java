package org.calista.kinda.transform.detect;

import org.calista.kinda.transform.KindaSyntaxException;
import org.calista.kinda.transform.SourcePosition;
import org.calista.kinda.transform.scan.SourceLine;

import java.util.List;
import java.util.Objects;

/**
 * Per-file state shared by detectors: the scanned lines and error construction.
 */
public final class DetectionContext {

    private final String fileName;
    private final List<SourceLine> lines;

    public DetectionContext(String fileName, List<SourceLine> lines) {
        this.fileName = fileName == null ? "<source>" : fileName;
        this.lines = Objects.requireNonNull(lines, "lines");
    }

    public String fileName() {
        return fileName;
    }

    public List<SourceLine> lines() {
        return lines;
    }

    public KindaSyntaxException error(SourceLine line, int column, String reason) {
        return error(line, column, reason, null);
    }

    public KindaSyntaxException error(SourceLine line, int column, String reason, String suggestion) {
        int col = Math.max(0, Math.min(column, line.length()));
        return new KindaSyntaxException(new SourcePosition(fileName, line.number(), col + 1), reason, line.text(), suggestion);
    }

    /**
     * Column of the statement-level '~' on this line: the first code token, or the token right after
     * {@code else}. -1 when there is none.
     */
    public static int statementMarker(SourceLine line) {
        int first = line.firstCode();
        if (first < 0) return -1;
        if (line.isCodeChar(first, '~')) return first;

        for (int i = first; i < line.length(); i++) {
            if (!line.isCodeChar(i, '~')) continue;
            int p = i - 1;
            while (p >= 0 && line.isCode(p) && Character.isWhitespace(line.charAt(p))) p--;
            if (p >= 3 && line.startsWithCode(p - 3, "else") && p < i - 1
                    && (p - 4 < 0 || !Character.isJavaIdentifierPart(line.charAt(p - 4)))) {
                return i;
            }
        }
        return -1;
    }

    /** True when the marker at this column follows {@code else}. */
    public static boolean afterElse(SourceLine line, int tilde) {
        return tilde != line.firstCode();
    }

    /** The identifier right after the '~' at {@code tilde}; empty when none. */
    public static String word(SourceLine line, int tilde) {
        return line.slice(tilde + 1, line.identEnd(tilde + 1));
    }
}
