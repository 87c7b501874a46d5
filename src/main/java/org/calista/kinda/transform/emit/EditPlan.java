package org.calista.kinda.transform.emit;

import org.calista.kinda.transform.SourceMap;
import org.calista.kinda.transform.scan.SourceLine;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Column edits, extra indentation and inserted lines against the original lines, rendered in one pass.
 *
 * <p>Every edit refers to original columns, so detectors and the emitter never see shifted text.
 * Untouched characters are copied as they are.</p>
 */
public final class EditPlan {

    private static final Comparator<Edit> APPLY_ORDER = Comparator
            .comparingInt((Edit e) -> e.start).reversed()
            .thenComparing(Edit::isInsert)
            .thenComparing(Comparator.comparingLong((Edit e) -> e.seq).reversed());

    private final List<SourceLine> lines;
    private final List<List<Edit>> edits;
    private final StringBuilder[] prefixes;
    private final List<List<String>> before;
    private final List<List<String>> after;
    private long seq;

    public EditPlan(List<SourceLine> lines) {
        this.lines = Objects.requireNonNull(lines, "lines");
        int n = lines.size();
        this.edits = new ArrayList<>(n);
        this.before = new ArrayList<>(n);
        this.after = new ArrayList<>(n);
        this.prefixes = new StringBuilder[n];
        for (int i = 0; i < n; i++) {
            edits.add(new ArrayList<>(0));
            before.add(new ArrayList<>(0));
            after.add(new ArrayList<>(0));
        }
    }

    public void replace(int line, int start, int end, String text) {
        SourceLine l = lines.get(line);
        if (end > l.length()) throw new IllegalArgumentException("edit past end of line " + l.number());
        edits.get(line).add(new Edit(line, start, end, text, seq++));
    }

    public void insert(int line, int at, String text) {
        replace(line, at, at, text);
    }

    /** Extra leading whitespace for the whole line. */
    public void indent(int line, String unit) {
        if (prefixes[line] == null) prefixes[line] = new StringBuilder();
        prefixes[line].append(unit);
    }

    public void insertLineBefore(int line, String text) {
        before.get(line).add(text);
    }

    public void insertLineAfter(int line, String text) {
        after.get(line).add(text);
    }

    public List<Edit> edits(int line) {
        return List.copyOf(edits.get(line));
    }

    public boolean isEmpty() {
        for (int i = 0; i < lines.size(); i++) {
            if (!edits.get(i).isEmpty() || prefixes[i] != null || !before.get(i).isEmpty() || !after.get(i).isEmpty()) {
                return false;
            }
        }
        return true;
    }

    /** Rendered text and the source map of output lines back to original lines. */
    public static final class Rendered {
        public final String text;
        public final List<Integer> lineMap;

        Rendered(String text, List<Integer> lineMap) {
            this.text = text;
            this.lineMap = List.copyOf(lineMap);
        }

        public SourceMap sourceMap(String file, String generatedFile) {
            return new SourceMap(file, generatedFile, lineMap);
        }
    }

    /**
     * @throws IllegalStateException when two edits on a line overlap
     */
    public Rendered render() {
        String dominant = dominantTerminator(lines);
        StringBuilder out = new StringBuilder();
        List<Integer> map = new ArrayList<>(lines.size() + 8);

        for (int i = 0; i < lines.size(); i++) {
            SourceLine l = lines.get(i);
            String prefix = prefixes[i] == null ? "" : prefixes[i].toString();
            String term = l.terminator().isEmpty() ? dominant : l.terminator();
            boolean last = i == lines.size() - 1;

            for (String s : before.get(i)) {
                out.append(prefix).append(s).append(term);
                map.add(l.number());
            }

            out.append(prefix).append(apply(l, edits.get(i)));
            List<String> tail = after.get(i);
            if (tail.isEmpty()) {
                out.append(l.terminator());
                map.add(l.number());
                continue;
            }
            out.append(term);
            map.add(l.number());
            for (int k = 0; k < tail.size(); k++) {
                out.append(prefix).append(tail.get(k));
                // keep a missing final newline missing
                boolean lastOut = last && k == tail.size() - 1 && l.terminator().isEmpty();
                out.append(lastOut ? "" : term);
                map.add(l.number());
            }
        }
        return new Rendered(out.toString(), map);
    }

    static String apply(SourceLine line, List<Edit> lineEdits) {
        if (lineEdits.isEmpty()) return line.text();
        for (int a = 0; a < lineEdits.size(); a++) {
            for (int b = a + 1; b < lineEdits.size(); b++) {
                if (lineEdits.get(a).overlaps(lineEdits.get(b))) {
                    throw new IllegalStateException("overlapping edits on line " + line.number() + ": "
                            + lineEdits.get(a) + " and " + lineEdits.get(b));
                }
            }
        }
        List<Edit> sorted = new ArrayList<>(lineEdits);
        sorted.sort(APPLY_ORDER);
        StringBuilder sb = new StringBuilder(line.text());
        for (Edit e : sorted) {
            sb.replace(e.start, e.end, e.text);
        }
        return sb.toString();
    }

    static String dominantTerminator(List<SourceLine> lines) {
        int lf = 0, crlf = 0, cr = 0;
        for (SourceLine l : lines) {
            switch (l.terminator()) {
                case "\n" -> lf++;
                case "\r\n" -> crlf++;
                case "\r" -> cr++;
                default -> {
                }
            }
        }
        if (crlf > lf && crlf >= cr) return "\r\n";
        if (cr > lf && cr > crlf) return "\r";
        return "\n";
    }
}
