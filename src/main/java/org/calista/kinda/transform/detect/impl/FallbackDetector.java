package org.calista.kinda.transform.detect.impl;

import org.calista.kinda.transform.Vocabulary;
import org.calista.kinda.transform.detect.DetectionContext;
import org.calista.kinda.transform.detect.Detector;
import org.calista.kinda.transform.node.FuzzyNode;
import org.calista.kinda.transform.node.WelpFallback;
import org.calista.kinda.transform.scan.SourceLine;

import java.util.List;

/**
 * {@code primary ~welp fallback}, binding looser than every Java operator except assignment,
 * the conditional operator and lambda arrows.
 *
 * <p>The primary reaches left to an assignment, {@code return}, a comma, an open bracket or the
 * statement start; the fallback reaches right to a comma, a semicolon or a closing bracket.
 * Both stay on the marker's line.</p>
 */
public final class FallbackDetector implements Detector {

    static final String MARKER = "~" + Vocabulary.WELP;

    @Override
    public String name() {
        return "fallback";
    }

    @Override
    public void detect(DetectionContext ctx, SourceLine line, List<FuzzyNode> found) {
        for (int t = 0; t < line.length(); t++) {
            if (!isWelpMarker(line, t)) continue;

            int primaryStart = primaryStart(ctx, line, t);
            int primaryEnd = line.trimEnd(primaryStart, t);
            if (primaryEnd <= primaryStart) throw ctx.error(line, t, "'~welp' needs an expression before it");

            int fallbackStart = line.skipWs(t + MARKER.length());
            int fallbackEnd = fallbackEnd(ctx, line, fallbackStart);
            if (fallbackEnd <= fallbackStart) throw ctx.error(line, fallbackStart, "'~welp' needs a fallback value after it");

            found.add(new WelpFallback(line.index(), t, primaryStart, primaryEnd, fallbackStart, fallbackEnd));
        }
    }

    public static boolean isWelpMarker(SourceLine line, int t) {
        return line.startsWithCode(t, MARKER) && line.identEnd(t + 1) == t + MARKER.length();
    }

    static int primaryStart(DetectionContext ctx, SourceLine line, int tilde) {
        int depth = 0;
        int i = tilde - 1;
        for (; i >= 0; i--) {
            if (line.isLiteral(i)) continue;
            if (line.isComment(i)) break;
            char c = line.charAt(i);
            if (c == ')' || c == ']' || c == '}') {
                depth++;
            } else if (c == '(' || c == '[' || c == '{') {
                if (depth == 0) break;
                depth--;
            } else if (depth == 0) {
                if (c == ';' || c == ',' || c == '?') break;
                if (c == ':' && !line.isCodeChar(i - 1, ':') && !line.isCodeChar(i + 1, ':')) break;
                if (c == '>' && line.isCodeChar(i - 1, '-')) break;
                if (c == '=' && isAssignment(line, i)) break;
                if (c == '~' && isWelpMarker(line, i)) {
                    throw ctx.error(line, i, "chained '~welp' fallbacks are ambiguous; add parentheses");
                }
            }
        }
        int start = line.skipWs(i + 1);
        if (line.isIdentStart(start) && "return".equals(line.slice(start, line.identEnd(start)))) {
            start = line.skipWs(line.identEnd(start));
        }
        return start;
    }

    static int fallbackEnd(DetectionContext ctx, SourceLine line, int start) {
        int depth = 0;
        int i = start;
        for (; i < line.length(); i++) {
            if (line.isLiteral(i)) continue;
            if (line.isComment(i)) break;
            char c = line.charAt(i);
            if (c == '(' || c == '[' || c == '{') {
                depth++;
            } else if (c == ')' || c == ']' || c == '}') {
                if (depth == 0) break;
                depth--;
            } else if (depth == 0) {
                if (c == ';' || c == ',') break;
                if (c == '~' && isWelpMarker(line, i)) {
                    throw ctx.error(line, i, "chained '~welp' fallbacks are ambiguous; add parentheses");
                }
            }
        }
        return line.trimEnd(start, i);
    }

    // '=' of an assignment or compound assignment, not of ==, !=, <= or >=
    private static boolean isAssignment(SourceLine line, int i) {
        if (line.isCodeChar(i + 1, '=')) return false;
        if (i == 0 || !line.isCode(i - 1)) return true;
        char prev = line.charAt(i - 1);
        if (prev == '=' || prev == '!') return false;
        if (prev == '<' || prev == '>') return line.isCodeChar(i - 2, prev);
        return true;
    }
}
