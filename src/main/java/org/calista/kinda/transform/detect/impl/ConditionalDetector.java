package org.calista.kinda.transform.detect.impl;

import org.calista.kinda.transform.Vocabulary;
import org.calista.kinda.transform.detect.DetectionContext;
import org.calista.kinda.transform.detect.Detector;
import org.calista.kinda.transform.node.ConditionalGate;
import org.calista.kinda.transform.node.FuzzyNode;
import org.calista.kinda.transform.scan.SourceLine;

import java.util.List;

/**
 * {@code ~sometimes (c)}, {@code ~maybe}, {@code ~probably}, {@code ~rarely}, at statement start or after {@code else}.
 */
public final class ConditionalDetector implements Detector {

    @Override
    public String name() {
        return "conditional";
    }

    @Override
    public void detect(DetectionContext ctx, SourceLine line, List<FuzzyNode> found) {
        int tilde = DetectionContext.statementMarker(line);
        if (tilde < 0) return;
        String word = DetectionContext.word(line, tilde);
        if (!Vocabulary.GATES.contains(word)) return;

        int markerEnd = tilde + 1 + word.length();
        int next = line.skipWs(markerEnd);
        boolean afterElse = DetectionContext.afterElse(line, tilde);

        if (line.isCodeChar(next, '(')) {
            int close = line.matchForward(next);
            if (close < 0) throw ctx.error(line, next, "unbalanced parentheses in '~" + word + "' condition");
            int after = line.skipWs(close + 1);
            if (!startsBody(line, after)) {
                throw ctx.error(line, after, "unexpected '" + line.charAt(after) + "' after '~" + word + "' condition");
            }
            found.add(new ConditionalGate(line.index(), tilde, markerEnd, word, next, close, afterElse));
            return;
        }
        if (next >= line.length() || line.isComment(next) || line.isCodeChar(next, '{')) {
            found.add(new ConditionalGate(line.index(), tilde, markerEnd, word, -1, -1, afterElse));
            return;
        }
        throw ctx.error(line, next, "'~" + word + "' condition must be parenthesised");
    }

    // block, end of line, or a single statement; anything else would continue the condition
    private static boolean startsBody(SourceLine line, int i) {
        if (i >= line.length() || line.isComment(i) || line.isCodeChar(i, '{')) return true;
        if (line.isCodeChar(i, '~')) return line.isIdentStart(i + 1);
        if (!line.isIdentStart(i)) return false;
        return !"instanceof".equals(line.slice(i, line.identEnd(i)));
    }
}
