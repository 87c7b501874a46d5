package org.calista.kinda.transform.detect.impl;

import org.calista.kinda.transform.Vocabulary;
import org.calista.kinda.transform.detect.DetectionContext;
import org.calista.kinda.transform.detect.Detector;
import org.calista.kinda.transform.detect.RoleClassifier;
import org.calista.kinda.transform.node.FuzzyNode;
import org.calista.kinda.transform.node.RoleCue;
import org.calista.kinda.transform.node.ToleranceAssignment;
import org.calista.kinda.transform.node.ToleranceComparison;
import org.calista.kinda.transform.node.ToleranceValue;
import org.calista.kinda.transform.scan.SourceLine;

import java.util.List;

/**
 * Inline {@code ~ish}, anywhere in code.
 *
 * <p>Attached to a primary and followed by no operand it is a value ({@code 42~ish}); with a right
 * operand it is binary and {@link RoleClassifier} picks comparison or assignment.</p>
 */
public final class ToleranceDetector implements Detector {

    private static final String MARKER = "~" + Vocabulary.ISH;

    @Override
    public String name() {
        return "tolerance";
    }

    @Override
    public void detect(DetectionContext ctx, SourceLine line, List<FuzzyNode> found) {
        for (int t = 0; t < line.length(); t++) {
            if (!isIshMarker(line, t)) continue;

            int after = t + MARKER.length();
            boolean attached = isPrimaryEnd(line, t - 1);
            int rhsStart = line.skipWs(after);
            boolean operand = isOperandStart(line, rhsStart);

            if (attached && !operand) {
                found.add(new ToleranceValue(line.index(), t, primaryStart(line, t)));
                continue;
            }
            if (!operand) throw ctx.error(line, t, "'~ish' needs a value before it or an operand after it");

            int lhsEnd = line.trimEnd(0, t);
            int lhsStart = primaryStart(line, lhsEnd);
            if (lhsStart >= lhsEnd) throw ctx.error(line, t, "'~ish' comparison is missing its left operand");

            int rhsEnd = rhsEnd(ctx, line, rhsStart);
            if (rhsEnd <= rhsStart) throw ctx.error(line, rhsStart, "'~ish' comparison is missing its right operand");

            RoleCue cue = RoleClassifier.classify(line, t, lhsStart, lhsEnd, rhsEnd, found);
            if (cue == RoleCue.BARE_ASSIGNMENT) {
                found.add(new ToleranceAssignment(line.index(), t, line.slice(lhsStart, lhsEnd),
                        lhsStart, lhsEnd, rhsStart, rhsEnd));
            } else {
                found.add(new ToleranceComparison(line.index(), t, lhsStart, lhsEnd, rhsStart, rhsEnd, cue));
            }
        }
    }

    static boolean isIshMarker(SourceLine line, int t) {
        return line.startsWithCode(t, MARKER) && line.identEnd(t + 1) == t + MARKER.length();
    }

    static boolean isPrimaryEnd(SourceLine line, int i) {
        if (i < 0) return false;
        if (line.isLiteral(i)) return true;
        if (!line.isCode(i)) return false;
        char c = line.charAt(i);
        return Character.isJavaIdentifierPart(c) || c == ')' || c == ']';
    }

    static boolean isOperandStart(SourceLine line, int i) {
        if (i >= line.length()) return false;
        if (line.isLiteral(i)) return true;
        if (!line.isCode(i)) return false;
        char c = line.charAt(i);
        if (Character.isJavaIdentifierStart(c) || Character.isDigit(c) || c == '(') return true;
        if (c == '-' && i + 1 < line.length()) {
            char n = line.charAt(i + 1);
            return line.isCode(i + 1) && (Character.isDigit(n) || Character.isJavaIdentifierStart(n) || n == '(');
        }
        return false;
    }

    /**
     * Start of the primary expression ending just before {@code end}: identifiers, member access,
     * call and index suffixes, literals, and value-form {@code ~ish} and {@code ~drift} suffixes.
     */
    static int primaryStart(SourceLine line, int end) {
        int p = end;
        while (p > 0) {
            int i = p - 1;
            if (i >= 3 && isIshMarker(line, i - 3)) {
                p = i - 3;
                continue;
            }
            if (i >= 5 && DriftDetector.isDriftMarker(line, i - 5)) {
                p = i - 5;
                continue;
            }
            if (line.isLiteral(i)) {
                while (i >= 0 && line.isLiteral(i)) i--;
                p = i + 1;
                continue;
            }
            if (!line.isCode(i)) break;
            char c = line.charAt(i);
            if (Character.isJavaIdentifierPart(c) || c == '.') {
                p = i;
                continue;
            }
            if (c == ')' || c == ']') {
                int open = line.matchBackward(i);
                if (open < 0) break;
                p = open;
                continue;
            }
            break;
        }
        // unary minus directly before a primary, when it cannot be a binary minus
        if (p < end && p > 0 && line.isCodeChar(p - 1, '-')) {
            int q = p - 2;
            while (q >= 0 && line.isCode(q) && Character.isWhitespace(line.charAt(q))) q--;
            if (q < 0 || !isPrimaryEnd(line, q)) p--;
        }
        return p;
    }

    /** End of the right operand: stops at a delimiter or operator at depth 0. */
    static int rhsEnd(DetectionContext ctx, SourceLine line, int start) {
        int depth = 0;
        int i = start;
        while (i < line.length()) {
            if (line.isComment(i)) break;
            if (line.isLiteral(i)) {
                i++;
                continue;
            }
            char c = line.charAt(i);
            if (c == '(' || c == '[' || c == '{') {
                depth++;
            } else if (c == ')' || c == ']' || c == '}') {
                if (depth == 0) break;
                depth--;
            } else if (depth == 0) {
                if (isIshMarker(line, i)) {
                    int after = line.skipWs(i + MARKER.length());
                    if (isPrimaryEnd(line, i - 1) && !isOperandStart(line, after)) {
                        i += MARKER.length();
                        continue;
                    }
                    throw ctx.error(line, i, "chained '~ish' comparisons are ambiguous; add parentheses");
                }
                if (isStop(line, i, start)) break;
            }
            i++;
        }
        return line.trimEnd(start, i);
    }

    private static boolean isStop(SourceLine line, int i, int start) {
        char c = line.charAt(i);
        return switch (c) {
            case ',', ';', '?', '&', '|', '<', '>', '=' -> true;
            case '!' -> line.isCodeChar(i + 1, '=');
            case ':' -> !line.isCodeChar(i + 1, ':') && !line.isCodeChar(i - 1, ':');
            case '-' -> i > start && line.isCodeChar(i + 1, '>');
            case '~' -> FallbackDetector.isWelpMarker(line, i);
            default -> false;
        };
    }
}
