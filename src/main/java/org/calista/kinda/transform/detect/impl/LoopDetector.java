package org.calista.kinda.transform.detect.impl;

import org.calista.kinda.transform.detect.DetectionContext;
import org.calista.kinda.transform.detect.Detector;
import org.calista.kinda.transform.node.FuzzyNode;
import org.calista.kinda.transform.node.LoopConstruct;
import org.calista.kinda.transform.node.LoopKind;
import org.calista.kinda.transform.scan.BlockLocator;
import org.calista.kinda.transform.scan.SourceLine;

import java.util.List;

/**
 * Loop headers at the start of a statement. Runs first: loop keywords share prefixes with the gates
 * ({@code ~sometimes_while} vs {@code ~sometimes}).
 */
public final class LoopDetector implements Detector {

    @Override
    public String name() {
        return "loop";
    }

    @Override
    public void detect(DetectionContext ctx, SourceLine line, List<FuzzyNode> found) {
        int tilde = line.firstCode();
        if (tilde < 0 || !line.isCodeChar(tilde, '~')) return;

        String word = DetectionContext.word(line, tilde);
        LoopKind kind = LoopKind.fromKeyword(word);
        if (kind == null) return;

        int markerEnd = tilde + 1 + word.length();
        LoopConstruct node = switch (kind) {
            case SOMETIMES_WHILE, EVENTUALLY_UNTIL -> conditioned(ctx, line, tilde, markerEnd, kind);
            case KINDA_REPEAT -> repeat(ctx, line, tilde, markerEnd);
            case MAYBE_FOR -> perItem(ctx, line, tilde, markerEnd);
        };
        found.add(node);
    }

    private static LoopConstruct conditioned(DetectionContext ctx, SourceLine line, int tilde, int markerEnd, LoopKind kind) {
        int start = line.skipWs(markerEnd);
        int last = line.contentEnd() - 1;

        if (last >= start && line.isCodeChar(last, '{')) {
            int condStart = start;
            int condEnd = line.trimEnd(start, last);
            if (condEnd > condStart && line.isCodeChar(condStart, '(') && line.matchForward(condStart) == condEnd - 1) {
                condStart++;
                condEnd--;
            }
            int innerStart = line.skipWs(condStart);
            if (line.trimEnd(innerStart, condEnd) <= innerStart) {
                throw ctx.error(line, start, "'~" + kind.keyword() + "' needs a condition");
            }
            // prefix runs up to the condition, suffix from its end to the brace
            return new LoopConstruct(line.index(), tilde, markerEnd, kind,
                    condStart, condEnd, last, condStart, condEnd, null);
        }

        if (line.isCodeChar(start, '(')) {
            int close = line.matchForward(start);
            if (close < 0) throw ctx.error(line, start, "unbalanced parentheses in '~" + kind.keyword() + "'");
            if (line.trimEnd(start + 1, close) <= line.skipWs(start + 1)) {
                throw ctx.error(line, start, "'~" + kind.keyword() + "' needs a condition");
            }
            return new LoopConstruct(line.index(), tilde, markerEnd, kind,
                    start + 1, close, close + 1, start + 1, close, null);
        }
        throw ctx.error(line, Math.max(start, markerEnd), "expected '{' after '~" + kind.keyword() + "' condition");
    }

    private static LoopConstruct repeat(DetectionContext ctx, SourceLine line, int tilde, int markerEnd) {
        int open = line.skipWs(markerEnd);
        if (!line.isCodeChar(open, '(')) {
            throw ctx.error(line, open, "'~kinda_repeat' count must be parenthesised");
        }
        int close = line.matchForward(open);
        if (close < 0) throw ctx.error(line, open, "unbalanced parentheses in '~kinda_repeat'");
        if (line.trimEnd(open + 1, close) <= line.skipWs(open + 1)) {
            throw ctx.error(line, open, "'~kinda_repeat' needs a count");
        }
        return new LoopConstruct(line.index(), tilde, markerEnd, LoopKind.KINDA_REPEAT,
                open + 1, close, close + 1, open + 1, close, null);
    }

    private static LoopConstruct perItem(DetectionContext ctx, SourceLine line, int tilde, int markerEnd) {
        int start = line.skipWs(markerEnd);
        LoopConstruct.PerItem layout;
        int prefixEnd;

        if (line.isCodeChar(start, '(')) {
            int close = line.matchForward(start);
            if (close < 0) throw ctx.error(line, start, "unbalanced parentheses in '~maybe_for'");
            int colon = findForEachColon(line, start + 1, close);
            if (colon < 0) throw ctx.error(line, start, "'~maybe_for (...)' needs 'Type name : items'");
            int brace = line.skipWs(close + 1);
            if (!line.isCodeChar(brace, '{')) throw ctx.error(line, brace, "expected '{' after '~maybe_for' header");
            layout = block(ctx, line, false, start + 1, colon, line.skipWs(colon + 1), close, brace);
            prefixEnd = markerEnd;
        } else {
            int varEnd = line.identEnd(start);
            if (!line.isIdentStart(start)) {
                throw ctx.error(line, start, "'~maybe_for' expects 'name in items' or '(Type name : items)'");
            }
            int in = line.skipWs(varEnd);
            if (!line.startsWithCode(in, "in") || !Character.isWhitespace(charAt(line, in + 2))) {
                throw ctx.error(line, in, "expected 'in' after '~maybe_for " + line.slice(start, varEnd) + "'");
            }
            int iterStart = line.skipWs(in + 2);
            int brace = line.contentEnd() - 1;
            if (brace < iterStart || !line.isCodeChar(brace, '{')) {
                throw ctx.error(line, Math.max(iterStart, 0), "expected '{' after '~maybe_for' header");
            }
            int iterEnd = line.trimEnd(iterStart, brace);
            if (iterEnd <= iterStart) throw ctx.error(line, iterStart, "'~maybe_for' needs something to iterate");
            layout = block(ctx, line, true, start, varEnd, iterStart, iterEnd, brace);
            prefixEnd = start;
        }
        return new LoopConstruct(line.index(), tilde, markerEnd, LoopKind.MAYBE_FOR,
                prefixEnd, -1, -1, layout.varStart, layout.iterEnd, layout);
    }

    private static LoopConstruct.PerItem block(DetectionContext ctx, SourceLine line, boolean inForm,
                                               int varStart, int varEnd, int iterStart, int iterEnd, int brace) {
        BlockLocator.Location close = BlockLocator.findClose(ctx.lines(), line.index(), brace);
        if (close == null) throw ctx.error(line, brace, "unbalanced block: '~maybe_for' body is never closed");
        return new LoopConstruct.PerItem(inForm, varStart, varEnd, iterStart, iterEnd, brace, close.line, close.column);
    }

    /** Depth-0 ':' that is not part of '::'; -1 when absent. */
    static int findForEachColon(SourceLine line, int from, int to) {
        int depth = 0;
        for (int i = from; i < to; i++) {
            if (!line.isCode(i)) continue;
            char c = line.charAt(i);
            if (c == '(' || c == '[' || c == '{' || c == '<') depth++;
            else if (c == ')' || c == ']' || c == '}' || (c == '>' && !line.isCodeChar(i - 1, '-'))) depth--;
            else if (c == ':' && depth == 0) {
                if (line.isCodeChar(i + 1, ':')) {
                    i++;
                    continue;
                }
                if (line.isCodeChar(i - 1, ':')) continue;
                return i;
            }
        }
        return -1;
    }

    private static char charAt(SourceLine line, int i) {
        return i < line.length() ? line.charAt(i) : '\0';
    }
}
