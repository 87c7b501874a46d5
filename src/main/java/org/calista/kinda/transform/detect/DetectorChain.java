package org.calista.kinda.transform.detect;

import org.calista.kinda.transform.Vocabulary;
import org.calista.kinda.transform.detect.impl.ConditionalDetector;
import org.calista.kinda.transform.detect.impl.DriftDetector;
import org.calista.kinda.transform.detect.impl.FallbackDetector;
import org.calista.kinda.transform.detect.impl.LoopDetector;
import org.calista.kinda.transform.detect.impl.StatementDetector;
import org.calista.kinda.transform.detect.impl.ToleranceDetector;
import org.calista.kinda.transform.node.FuzzyNode;
import org.calista.kinda.transform.scan.SourceLine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Runs detectors in priority order over every line with a code '~', then audits what is left.
 *
 * <p>Audit: an uncovered "~=" or vocabulary word is an error; an unknown word in statement position
 * is an error with a suggestion; any other '~' is the bitwise complement and stays.</p>
 */
public final class DetectorChain {

    private static final Logger log = LoggerFactory.getLogger(DetectorChain.class);

    private final List<Detector> detectors;

    public DetectorChain(List<Detector> detectors) {
        Objects.requireNonNull(detectors, "detectors");
        if (detectors.isEmpty()) throw new IllegalArgumentException("detectors must not be empty");
        this.detectors = List.copyOf(detectors);
    }

    /** Loop, conditional, statement, tolerance, drift, fallback. */
    public static DetectorChain standard() {
        return new DetectorChain(List.of(
                new LoopDetector(),
                new ConditionalDetector(),
                new StatementDetector(),
                new ToleranceDetector(),
                new DriftDetector(),
                new FallbackDetector()));
    }

    public List<Detector> detectors() {
        return detectors;
    }

    public List<FuzzyNode> detect(DetectionContext ctx) {
        List<FuzzyNode> all = new ArrayList<>();
        for (SourceLine line : ctx.lines()) {
            if (!line.hasCode('~')) continue;
            List<FuzzyNode> found = new ArrayList<>(4);
            for (Detector d : detectors) {
                d.detect(ctx, line, found);
            }
            audit(ctx, line, found);
            all.addAll(found);
        }
        if (log.isDebugEnabled()) log.debug("{}: {} fuzzy node(s)", ctx.fileName(), all.size());
        return all;
    }

    static void audit(DetectionContext ctx, SourceLine line, List<FuzzyNode> found) {
        int statement = DetectionContext.statementMarker(line);
        for (int i = 0; i < line.length(); i++) {
            if (!line.isCodeChar(i, '~') || covered(found, i)) continue;

            if (line.isCodeChar(i + 1, '=')) {
                throw ctx.error(line, i, "'~=' is only allowed as a standalone reassignment 'x ~= value;'");
            }
            String word = DetectionContext.word(line, i);
            if (word.isEmpty()) continue;
            if (Vocabulary.isKeyword(word)) {
                throw ctx.error(line, i, "misplaced or malformed '~" + word + "'");
            }
            if (i == statement && startsStatement(ctx, line, i)) {
                throw ctx.error(line, i, "unknown fuzzy construct '~" + word + "'", Vocabulary.suggest(word));
            }
        }
    }

    /** False for a line that continues an expression from the previous line. */
    static boolean startsStatement(DetectionContext ctx, SourceLine line, int tilde) {
        if (tilde != line.firstCode()) return true;
        for (int li = line.index() - 1; li >= 0; li--) {
            SourceLine prev = ctx.lines().get(li);
            int last = prev.contentEnd() - 1;
            if (last < 0) continue;
            if (!prev.isCode(last)) return false;
            char c = prev.charAt(last);
            return c == ';' || c == '{' || c == '}';
        }
        return true;
    }

    private static boolean covered(List<FuzzyNode> nodes, int column) {
        for (FuzzyNode n : nodes) {
            if (n.covers(column)) return true;
        }
        return false;
    }
}
