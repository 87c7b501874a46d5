package org.calista.kinda.transform.detect;

import org.calista.kinda.transform.node.ConditionalGate;
import org.calista.kinda.transform.node.FuzzyNode;
import org.calista.kinda.transform.node.LoopConstruct;
import org.calista.kinda.transform.node.RoleCue;
import org.calista.kinda.transform.scan.SourceLine;

import java.util.List;
import java.util.Set;

/**
 * Decides whether a binary {@code a ~ish b} compares or assigns.
 *
 * <p>Cues are checked in order; the first that holds wins. Only {@link RoleCue#BARE_ASSIGNMENT} yields
 * the assignment role, so anything ambiguous compares.</p>
 */
public final class RoleClassifier {

    static final Set<String> CONDITIONAL_KEYWORDS = Set.of("if", "while", "for", "return", "assert");

    private RoleClassifier() {
    }

    /**
     * @param tilde     column of the '~' of {@code ~ish}
     * @param lhsStart  first column of the left operand
     * @param lhsEnd    column after the left operand
     * @param rhsEnd    column after the right operand
     * @param lineNodes nodes already found on this line
     */
    public static RoleCue classify(SourceLine line, int tilde, int lhsStart, int lhsEnd, int rhsEnd,
                                   List<FuzzyNode> lineNodes) {
        if (hasConditionalContext(line, lineNodes)) return RoleCue.CONDITIONAL_KEYWORD;
        if (hasOperator(line)) return RoleCue.OPERATOR;
        if (line.depthAt(tilde) > 0) return RoleCue.NESTED;
        if (isBareStatement(line, lhsStart, lhsEnd, rhsEnd)) return RoleCue.BARE_ASSIGNMENT;
        return RoleCue.DEFAULT;
    }

    static boolean hasConditionalContext(SourceLine line, List<FuzzyNode> lineNodes) {
        for (FuzzyNode n : lineNodes) {
            if (n instanceof ConditionalGate || n instanceof LoopConstruct) return true;
        }
        int i = 0;
        while (i < line.length()) {
            if (!line.isCode(i)) {
                i++;
                continue;
            }
            char c = line.charAt(i);
            if (c == '?') return true;
            if (Character.isJavaIdentifierStart(c) && (i == 0 || !Character.isJavaIdentifierPart(line.charAt(i - 1)))) {
                int end = line.identEnd(i);
                // "~if" would be a marker word, not a keyword
                boolean marker = i > 0 && line.isCodeChar(i - 1, '~');
                if (!marker && CONDITIONAL_KEYWORDS.contains(line.slice(i, end))) return true;
                i = end;
                continue;
            }
            i++;
        }
        return false;
    }

    static boolean hasOperator(SourceLine line) {
        for (int i = 0; i < line.length(); i++) {
            if (!line.isCode(i)) continue;
            char c = line.charAt(i);
            switch (c) {
                case '&' -> {
                    if (line.isCodeChar(i + 1, '&')) return true;
                }
                case '|' -> {
                    if (line.isCodeChar(i + 1, '|')) return true;
                }
                case '!', '<' -> {
                    return true;
                }
                case '>' -> {
                    if (!line.isCodeChar(i - 1, '-')) return true;
                }
                case '=' -> {
                    if (line.isCodeChar(i + 1, '=')) return true;
                }
                default -> {
                }
            }
        }
        return false;
    }

    static boolean isBareStatement(SourceLine line, int lhsStart, int lhsEnd, int rhsEnd) {
        if (lhsStart != line.firstCode()) return false;
        if (!line.isIdentStart(lhsStart) || line.identEnd(lhsStart) != lhsEnd) return false;
        int semi = line.skipWs(rhsEnd);
        if (!line.isCodeChar(semi, ';')) return false;
        int rest = line.skipWs(semi + 1);
        return rest >= line.length() || line.isComment(rest);
    }
}
