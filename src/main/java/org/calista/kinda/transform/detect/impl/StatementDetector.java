package org.calista.kinda.transform.detect.impl;

import org.calista.kinda.transform.Vocabulary;
import org.calista.kinda.transform.detect.DetectionContext;
import org.calista.kinda.transform.detect.Detector;
import org.calista.kinda.transform.node.FuzzyDeclaration;
import org.calista.kinda.transform.node.FuzzyNode;
import org.calista.kinda.transform.node.FuzzyReassignment;
import org.calista.kinda.transform.node.SortaPrint;
import org.calista.kinda.transform.node.TimeDriftDeclaration;
import org.calista.kinda.transform.scan.SourceLine;

import java.util.List;

/**
 * Whole statements: {@code ~kinda} and {@code ~time drift} declarations, {@code ~sorta print(...)}
 * and {@code x ~= e;}.
 */
public final class StatementDetector implements Detector {

    @Override
    public String name() {
        return "statement";
    }

    @Override
    public void detect(DetectionContext ctx, SourceLine line, List<FuzzyNode> found) {
        int first = line.firstCode();
        if (first < 0) return;

        if (line.isCodeChar(first, '~')) {
            String word = DetectionContext.word(line, first);
            int markerEnd = first + 1 + word.length();
            if (Vocabulary.KINDA.equals(word)) found.add(declaration(ctx, line, first, markerEnd));
            else if (Vocabulary.SORTA.equals(word)) found.add(sortaPrint(ctx, line, first, markerEnd));
            else if (Vocabulary.TIME.equals(word)) found.add(timeDrift(ctx, line, first, markerEnd));
            return;
        }

        if (!line.isIdentStart(first)) return;
        int identEnd = line.identEnd(first);
        int op = line.skipWs(identEnd);
        if (!line.startsWithCode(op, "~=")) return;

        int exprStart = line.skipWs(op + 2);
        int semi = line.findAtDepthZero(exprStart, ';');
        if (semi < 0) throw ctx.error(line, op, "'~=' reassignment must end with ';'");
        int exprEnd = line.trimEnd(exprStart, semi);
        if (exprEnd <= exprStart) throw ctx.error(line, op, "'~=' needs a value");
        found.add(new FuzzyReassignment(line.index(), op, line.slice(first, identEnd), first, identEnd, exprStart, exprEnd));
    }

    private static FuzzyDeclaration declaration(DetectionContext ctx, SourceLine line, int tilde, int markerEnd) {
        int typeStart = line.skipWs(markerEnd);
        int typeEnd = line.identEnd(typeStart);
        String type = line.slice(typeStart, typeEnd);
        if (!Vocabulary.KINDA_TYPES.contains(type)) {
            String shown = type.isEmpty() ? "" : " '" + type + "'";
            throw ctx.error(line, typeStart, "unknown kinda type" + shown + ", expected one of " + Vocabulary.KINDA_TYPES,
                    Vocabulary.suggest(type, Vocabulary.KINDA_TYPES));
        }

        int nameStart = line.skipWs(typeEnd);
        if (!line.isIdentStart(nameStart)) throw ctx.error(line, nameStart, "'~kinda " + type + "' needs a variable name");
        int nameEnd = line.identEnd(nameStart);
        String name = line.slice(nameStart, nameEnd);
        int op = line.skipWs(nameEnd);

        if ("binary".equals(type)) {
            if (!line.isCodeChar(op, ';')) {
                throw ctx.error(line, op, "'~kinda binary " + name + "' takes no initializer and must end with ';'");
            }
            return new FuzzyDeclaration(line.index(), tilde, markerEnd, type, name, -1, -1, op, -1);
        }

        Initializer init = initializer(ctx, line, op, "~kinda " + type + " " + name);
        return new FuzzyDeclaration(line.index(), tilde, markerEnd, type, name,
                init.exprStart, init.exprEnd, init.semicolon, init.fuzzyTilde);
    }

    private static TimeDriftDeclaration timeDrift(DetectionContext ctx, SourceLine line, int tilde, int markerEnd) {
        int wordStart = line.skipWs(markerEnd);
        int wordEnd = line.identEnd(wordStart);
        String word = line.slice(wordStart, wordEnd);
        if (!Vocabulary.DRIFT.equals(word)) {
            throw ctx.error(line, wordStart, "expected 'drift' after '~time'",
                    word.isEmpty() ? null : Vocabulary.suggest(word, List.of(Vocabulary.DRIFT)));
        }

        int typeStart = line.skipWs(wordEnd);
        int typeEnd = line.identEnd(typeStart);
        String type = line.slice(typeStart, typeEnd);
        if (!Vocabulary.TIME_DRIFT_TYPES.contains(type)) {
            String shown = type.isEmpty() ? "" : " '" + type + "'";
            throw ctx.error(line, typeStart, "unknown time drift type" + shown + ", expected one of " + Vocabulary.TIME_DRIFT_TYPES,
                    Vocabulary.suggest(type, Vocabulary.TIME_DRIFT_TYPES));
        }

        int nameStart = line.skipWs(typeEnd);
        if (!line.isIdentStart(nameStart)) throw ctx.error(line, nameStart, "'~time drift " + type + "' needs a variable name");
        int nameEnd = line.identEnd(nameStart);
        String name = line.slice(nameStart, nameEnd);

        Initializer init = initializer(ctx, line, line.skipWs(nameEnd), "~time drift " + type + " " + name);
        return new TimeDriftDeclaration(line.index(), tilde, markerEnd, type, name,
                init.exprStart, init.exprEnd, init.fuzzyTilde);
    }

    /** "= e;" or "~= e;" after a declared name. */
    private static final class Initializer {
        int exprStart;
        int exprEnd;
        int semicolon;
        int fuzzyTilde = -1;
    }

    private static Initializer initializer(DetectionContext ctx, SourceLine line, int op, String declared) {
        Initializer init = new Initializer();
        if (line.startsWithCode(op, "~=")) {
            init.fuzzyTilde = op;
            init.exprStart = line.skipWs(op + 2);
        } else if (line.isCodeChar(op, '=') && !line.isCodeChar(op + 1, '=')) {
            init.exprStart = line.skipWs(op + 1);
        } else if (line.isCodeChar(op, ';')) {
            throw ctx.error(line, op, "'" + declared + "' needs an initializer");
        } else {
            throw ctx.error(line, op, "expected '=' or '~=' after '" + declared + "'");
        }

        init.semicolon = line.findAtDepthZero(init.exprStart, ';');
        if (init.semicolon < 0) throw ctx.error(line, init.exprStart, "'" + declared + "' declaration must end with ';'");
        init.exprEnd = line.trimEnd(init.exprStart, init.semicolon);
        if (init.exprEnd <= init.exprStart) throw ctx.error(line, init.exprStart, "'" + declared + "' needs an initializer");
        return init;
    }

    private static SortaPrint sortaPrint(DetectionContext ctx, SourceLine line, int tilde, int markerEnd) {
        int wordStart = line.skipWs(markerEnd);
        int wordEnd = line.identEnd(wordStart);
        String word = line.slice(wordStart, wordEnd);
        if (!"print".equals(word)) {
            throw ctx.error(line, wordStart, "'~sorta' only supports print(...)",
                    word.isEmpty() ? null : Vocabulary.suggest(word, List.of("print")));
        }
        int open = line.skipWs(wordEnd);
        if (!line.isCodeChar(open, '(')) throw ctx.error(line, open, "expected '(' after '~sorta print'");
        int close = line.matchForward(open);
        if (close < 0) throw ctx.error(line, open, "unbalanced parentheses in '~sorta print'");
        return new SortaPrint(line.index(), tilde, markerEnd, open, close);
    }
}
