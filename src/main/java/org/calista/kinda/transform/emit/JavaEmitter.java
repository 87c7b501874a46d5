package org.calista.kinda.transform.emit;

import org.calista.kinda.transform.TransformOptions;
import org.calista.kinda.transform.node.ConditionalGate;
import org.calista.kinda.transform.node.DriftAccess;
import org.calista.kinda.transform.node.FuzzyDeclaration;
import org.calista.kinda.transform.node.FuzzyNode;
import org.calista.kinda.transform.node.FuzzyReassignment;
import org.calista.kinda.transform.node.LoopConstruct;
import org.calista.kinda.transform.node.SortaPrint;
import org.calista.kinda.transform.node.TimeDriftDeclaration;
import org.calista.kinda.transform.node.ToleranceAssignment;
import org.calista.kinda.transform.node.ToleranceComparison;
import org.calista.kinda.transform.node.ToleranceValue;
import org.calista.kinda.transform.node.WelpFallback;
import org.calista.kinda.transform.scan.SourceLine;

import java.util.List;
import java.util.Objects;

/**
 * Turns detected nodes into an {@link EditPlan} of plain Java calling the runtime facade.
 *
 * <p>Loop counters carry the 1-based source line ({@code __kinda_sw_12}) so nested loops never clash.
 * Everything except {@code maybe_for} stays on its own line. A {@code ~welp} lambda encloses any
 * other construct that starts at its primary.</p>
 */
public final class JavaEmitter {

    static final String GUARD_OPEN = "if (%s.maybeFor()) {";

    private final TransformOptions options;
    private final String rt;

    public JavaEmitter(TransformOptions options) {
        this.options = Objects.requireNonNull(options, "options");
        this.rt = options.runtimeSimpleName();
    }

    public EditPlan emit(List<SourceLine> lines, List<FuzzyNode> nodes) {
        EditPlan plan = new EditPlan(lines);
        // inserts at one column render in emit order, so outer constructs go first:
        // welp, then operations, then values
        for (FuzzyNode n : nodes) {
            if (n instanceof WelpFallback) emit(plan, lines, n);
        }
        for (FuzzyNode n : nodes) {
            if (!(n instanceof WelpFallback) && !isValue(n)) emit(plan, lines, n);
        }
        for (FuzzyNode n : nodes) {
            if (isValue(n)) emit(plan, lines, n);
        }
        if (options.injectImport && !nodes.isEmpty()) injectImport(plan, lines);
        return plan;
    }

    private static boolean isValue(FuzzyNode n) {
        return n instanceof ToleranceValue || n instanceof DriftAccess;
    }

    private void emit(EditPlan plan, List<SourceLine> lines, FuzzyNode node) {
        int line = node.line;
        int n = line + 1;

        if (node instanceof ConditionalGate g) {
            if (g.parenthesised()) {
                plan.replace(line, g.markerStart, g.openParen + 1, "if (" + rt + "." + g.gate + "(");
                plan.replace(line, g.closeParen, g.closeParen + 1, "))");
            } else {
                plan.replace(line, g.markerStart, g.markerEnd, "if (" + rt + "." + g.gate + "())");
            }
        } else if (node instanceof LoopConstruct l) {
            emitLoop(plan, lines, l, n);
        } else if (node instanceof FuzzyDeclaration d) {
            if (d.isBinary()) {
                plan.replace(line, d.markerStart, d.semicolon, "int " + d.name + " = " + rt + ".kindaBinary()");
            } else {
                plan.replace(line, d.markerStart, d.exprStart, d.javaType() + " " + d.name + " = " + rt + "." + d.factoryMethod() + "(");
                plan.insert(line, d.exprEnd, ")");
            }
        } else if (node instanceof FuzzyReassignment r) {
            plan.replace(line, r.identEnd, r.exprStart, " = " + rt + ".fuzzyAssign(");
            plan.insert(line, r.exprEnd, ")");
        } else if (node instanceof SortaPrint p) {
            plan.replace(line, p.markerStart, p.openParen + 1, rt + ".sortaPrint(");
        } else if (node instanceof ToleranceValue v) {
            plan.insert(line, v.primaryStart, rt + ".ishValue(");
            plan.replace(line, v.markerStart, v.markerEnd, ")");
        } else if (node instanceof ToleranceComparison c) {
            plan.insert(line, c.lhsStart, rt + ".ishCompare(");
            plan.replace(line, c.lhsEnd, c.rhsStart, ", ");
            plan.insert(line, c.rhsEnd, ")");
        } else if (node instanceof ToleranceAssignment a) {
            plan.replace(line, a.lhsStart, a.rhsStart, a.name + " = " + rt + ".ishAssign(" + a.name + ", ");
            plan.insert(line, a.rhsEnd, ")");
        } else if (node instanceof TimeDriftDeclaration d) {
            plan.replace(line, d.markerStart, d.exprStart,
                    d.javaType() + " " + d.name + " = " + rt + "." + d.factoryMethod() + "(\"" + d.name + "\", ");
            plan.insert(line, d.exprEnd, ")");
        } else if (node instanceof DriftAccess a) {
            plan.insert(line, a.nameStart, rt + ".drift(\"" + a.name + "\", ");
            plan.replace(line, a.markerStart, a.markerEnd, ")");
        } else if (node instanceof WelpFallback w) {
            plan.insert(line, w.primaryStart, rt + ".welp(() -> ");
            plan.replace(line, w.primaryEnd, w.fallbackStart, ", ");
            plan.insert(line, w.fallbackEnd, ")");
        } else {
            throw new IllegalStateException("no emitter for " + node);
        }
    }

    private void emitLoop(EditPlan plan, List<SourceLine> lines, LoopConstruct l, int n) {
        int line = l.line;
        switch (l.loopKind) {
            case SOMETIMES_WHILE -> {
                String var = "__kinda_sw_" + n;
                plan.replace(line, l.markerStart, l.prefixEnd,
                        "for (int " + var + " = 0; " + rt + ".sometimesWhile(" + var + "++, ");
                plan.replace(line, l.suffixStart, l.suffixEnd, loopSuffix(lines.get(line), l));
            }
            case EVENTUALLY_UNTIL -> {
                String var = "__kinda_eu_" + n;
                plan.replace(line, l.markerStart, l.prefixEnd,
                        "for (Object " + var + " = " + rt + ".eventuallyUntilBegin(); " + rt + ".eventuallyUntil(" + var + ", ");
                plan.replace(line, l.suffixStart, l.suffixEnd, loopSuffix(lines.get(line), l));
            }
            case KINDA_REPEAT -> {
                String var = "__kinda_rep_" + n;
                plan.replace(line, l.markerStart, l.prefixEnd,
                        "for (int " + var + " = 0, " + var + "_n = " + rt + ".kindaRepeat(");
                plan.replace(line, l.suffixStart, l.suffixEnd,
                        "); " + var + " < " + var + "_n; " + var + "++)");
            }
            case MAYBE_FOR -> emitPerItem(plan, lines, l);
        }
    }

    /** "); ) " before a brace on the same line, "); )" after a parenthesised condition otherwise. */
    private static String loopSuffix(SourceLine line, LoopConstruct l) {
        return line.isCodeChar(l.suffixEnd, '{') ? "); ) " : "); )";
    }

    private void emitPerItem(EditPlan plan, List<SourceLine> lines, LoopConstruct l) {
        LoopConstruct.PerItem p = l.perItem;
        int h = l.line;
        SourceLine header = lines.get(h);

        if (p.inForm) {
            plan.replace(h, l.markerStart, p.varStart, "for (var ");
            plan.replace(h, p.varEnd, p.iterStart, " : ");
            plan.replace(h, p.iterEnd, p.braceCol, ") ");
        } else {
            plan.replace(h, l.markerStart, l.markerEnd, "for");
        }

        String guard = String.format(GUARD_OPEN, rt);
        if (p.closeLine == h) {
            plan.insert(h, p.braceCol + 1, " " + guard);
            plan.insert(h, p.closeCol, "} ");
            return;
        }

        String unit = indentUnit(lines, h, p.closeLine);
        String headerIndent = header.indent();

        boolean codeAfterBrace = header.contentEnd() > p.braceCol + 1;
        if (codeAfterBrace) plan.insert(h, p.braceCol + 1, " " + guard);
        else plan.insertLineAfter(h, headerIndent + unit + guard);

        for (int i = h + 1; i < p.closeLine; i++) {
            SourceLine body = lines.get(i);
            if (body.isBlank() || body.startsInLiteral()) continue;
            plan.indent(i, unit);
        }

        SourceLine close = lines.get(p.closeLine);
        boolean onlyWsBeforeClose = close.slice(0, p.closeCol).isBlank();
        if (onlyWsBeforeClose) {
            plan.insertLineBefore(p.closeLine, close.indent() + unit + "}");
        } else {
            if (!close.startsInLiteral()) plan.indent(p.closeLine, unit);
            plan.insert(p.closeLine, p.closeCol, "} ");
        }
    }

    /**
     * Body indentation minus header indentation; a tab when the header is tab-indented; otherwise the
     * configured default.
     */
    String indentUnit(List<SourceLine> lines, int header, int closeLine) {
        String headerIndent = lines.get(header).indent();
        for (int i = header + 1; i < closeLine; i++) {
            SourceLine l = lines.get(i);
            if (l.isBlank() || l.startsInLiteral()) continue;
            String bodyIndent = l.indent();
            if (bodyIndent.length() > headerIndent.length() && bodyIndent.startsWith(headerIndent)) {
                return bodyIndent.substring(headerIndent.length());
            }
            break;
        }
        return headerIndent.indexOf('\t') >= 0 ? "\t" : options.defaultIndent;
    }

    /**
     * Adds the runtime import on the package line, or at the very start of a file without one.
     * Nothing is added when the class or its package is already imported.
     */
    void injectImport(EditPlan plan, List<SourceLine> lines) {
        String cls = options.runtimeClass;
        int dot = cls.lastIndexOf('.');
        if (dot < 0) return;
        String pkg = cls.substring(0, dot);
        if (pkg.equals(packageName(lines))) return;

        for (SourceLine l : lines) {
            int first = l.firstCode();
            if (first < 0 || !l.startsWithCode(first, "import")) continue;
            String stmt = l.slice(first, l.contentEnd()).replace(" ", "").replace("\t", "");
            if (stmt.equals("import" + cls + ";") || stmt.equals("import" + pkg + ".*;")) return;
        }

        String stmt = "import " + cls + ";";
        for (SourceLine l : lines) {
            int first = l.firstCode();
            if (first < 0 || !l.startsWithCode(first, "package") || l.identEnd(first) != first + 7) continue;
            int semi = l.findAtDepthZero(first, ';');
            if (semi >= 0) {
                plan.insert(l.index(), semi + 1, " " + stmt);
                return;
            }
        }
        SourceLine top = lines.get(0);
        plan.insert(0, 0, top.length() == 0 ? stmt : stmt + " ");
    }

    static String packageName(List<SourceLine> lines) {
        for (SourceLine l : lines) {
            int first = l.firstCode();
            if (first < 0 || !l.startsWithCode(first, "package") || l.identEnd(first) != first + 7) continue;
            int semi = l.findAtDepthZero(first, ';');
            if (semi < 0) return null;
            return l.slice(first + 7, semi).trim();
        }
        return null;
    }
}
