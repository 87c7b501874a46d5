package org.calista.kinda.transform.detect.impl;

import org.calista.kinda.transform.Vocabulary;
import org.calista.kinda.transform.detect.DetectionContext;
import org.calista.kinda.transform.detect.Detector;
import org.calista.kinda.transform.node.DriftAccess;
import org.calista.kinda.transform.node.FuzzyNode;
import org.calista.kinda.transform.scan.SourceLine;

import java.util.List;

/**
 * {@code x~drift}: attached directly to a plain variable name.
 */
public final class DriftDetector implements Detector {

    static final String MARKER = "~" + Vocabulary.DRIFT;

    @Override
    public String name() {
        return "drift";
    }

    @Override
    public void detect(DetectionContext ctx, SourceLine line, List<FuzzyNode> found) {
        for (int t = 0; t < line.length(); t++) {
            if (!isDriftMarker(line, t)) continue;

            int nameStart = t;
            while (nameStart > 0 && line.isCode(nameStart - 1) && Character.isJavaIdentifierPart(line.charAt(nameStart - 1))) {
                nameStart--;
            }
            if (nameStart == t || !line.isIdentStart(nameStart)) {
                throw ctx.error(line, t, "'~drift' must directly follow a variable name");
            }
            if (line.isCodeChar(nameStart - 1, '.')) {
                throw ctx.error(line, nameStart, "'~drift' applies to a plain variable name, not a member");
            }
            found.add(new DriftAccess(line.index(), t, nameStart, line.slice(nameStart, t)));
        }
    }

    static boolean isDriftMarker(SourceLine line, int t) {
        return line.startsWithCode(t, MARKER) && line.identEnd(t + 1) == t + MARKER.length();
    }
}
