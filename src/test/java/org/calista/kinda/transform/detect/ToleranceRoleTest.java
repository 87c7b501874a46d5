package org.calista.kinda.transform.detect;

import org.calista.kinda.transform.KindaSyntaxException;
import org.calista.kinda.transform.TransformOptions;
import org.calista.kinda.transform.TransformResult;
import org.calista.kinda.transform.impl.KindaTransformer;
import org.calista.kinda.transform.node.FuzzyNode;
import org.calista.kinda.transform.node.RoleCue;
import org.calista.kinda.transform.node.ToleranceAssignment;
import org.calista.kinda.transform.node.ToleranceComparison;
import org.calista.kinda.transform.node.ToleranceOperation;
import org.calista.kinda.transform.node.ToleranceRole;
import org.calista.kinda.transform.node.ToleranceValue;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ToleranceRoleTest {

    private static final KindaTransformer TX = new KindaTransformer(
            new TransformOptions(TransformOptions.DEFAULT_RUNTIME_CLASS, false, 10_000, "    "));

    private static TransformResult run(String src) {
        return TX.transform(src, "Roles.java.knda");
    }

    private static ToleranceOperation operation(String src) {
        for (FuzzyNode n : run(src).nodes) {
            if (n instanceof ToleranceOperation op) return op;
        }
        throw new AssertionError("no tolerance operation in: " + src);
    }

    @Nested
    @DisplayName("role cues")
    class Cues {

        @Test
        @DisplayName("conditional keyword forces comparison")
        void conditionalKeyword() {
            ToleranceOperation op = operation("if (a ~ish b) {");
            assertEquals(RoleCue.CONDITIONAL_KEYWORD, op.cue);
            assertEquals(ToleranceRole.COMPARISON, op.role());
            assertEquals("return Kinda.ishCompare(x, 3);", run("return x ~ish 3;").text);
        }

        @Test
        @DisplayName("ternary counts as conditional context")
        void ternary() {
            assertEquals(RoleCue.CONDITIONAL_KEYWORD, operation("int r = a ~ish b ? 1 : 0;").cue);
        }

        @Test
        @DisplayName("logical operator forces comparison")
        void operator() {
            ToleranceOperation op = operation("boolean both = ok && a ~ish b;");
            assertEquals(RoleCue.OPERATOR, op.cue);
            assertEquals("boolean both = ok && Kinda.ishCompare(a, b);", run("boolean both = ok && a ~ish b;").text);
        }

        @Test
        @DisplayName("argument position is nested")
        void nested() {
            ToleranceOperation op = operation("check(a ~ish b);");
            assertEquals(RoleCue.NESTED, op.cue);
            assertEquals("check(Kinda.ishCompare(a, b));", run("check(a ~ish b);").text);
        }

        @Test
        @DisplayName("bare statement assigns")
        void bareAssignment() {
            ToleranceOperation op = operation("x ~ish 10; // nudge");
            assertTrue(op instanceof ToleranceAssignment);
            assertEquals(ToleranceRole.ASSIGNMENT, op.role());
            assertEquals("x", ((ToleranceAssignment) op).name);
            assertEquals("x = Kinda.ishAssign(x, 10); // nudge", run("x ~ish 10; // nudge").text);
        }

        @Test
        @DisplayName("anything else compares")
        void fallback() {
            ToleranceOperation op = operation("boolean close = a ~ish b;");
            assertTrue(op instanceof ToleranceComparison);
            assertEquals(RoleCue.DEFAULT, op.cue);
        }

        @Test
        @DisplayName("member access on the left is not a bare assignment")
        void memberAccess() {
            assertEquals(RoleCue.DEFAULT, operation("p.x ~ish 10;").cue);
        }
    }

    @Nested
    @DisplayName("operand extents")
    class Operands {

        @Test
        @DisplayName("calls, indexes and member chains are whole operands")
        void complexOperands() {
            assertEquals("if (Kinda.ishCompare(sensor.read(0)[1], limits.get(\"max\"))) {",
                    run("if (sensor.read(0)[1] ~ish limits.get(\"max\")) {").text);
        }

        @Test
        @DisplayName("right operand stops at a comparison or separator")
        void rhsStops() {
            assertEquals("call(Kinda.ishCompare(a, b + 1), c);", run("call(a ~ish b + 1, c);").text);
            assertEquals("if (Kinda.ishCompare(a, b) == ok) {", run("if (a ~ish b == ok) {").text);
        }

        @Test
        @DisplayName("negative literal operands")
        void negative() {
            assertEquals("if (Kinda.ishCompare(-t, -5)) {", run("if (-t ~ish -5) {").text);
        }

        @Test
        @DisplayName("value form on both sides of a comparison")
        void valueInsideComparison() {
            assertEquals("if (Kinda.ishCompare(Kinda.ishValue(a), b)) {", run("if (a~ish ~ish b) {").text);
        }

        @Test
        @DisplayName("value form after a call")
        void valueAfterCall() {
            TransformResult r = run("double d = measure(x)~ish;");
            assertEquals("double d = Kinda.ishValue(measure(x));", r.text);
            assertTrue(r.nodes.get(0) instanceof ToleranceValue);
        }
    }

    @Nested
    @DisplayName("malformed")
    class Malformed {

        @Test
        @DisplayName("chained comparisons")
        void chained() {
            KindaSyntaxException e = assertThrows(KindaSyntaxException.class, () -> run("if (a ~ish b ~ish c) {"));
            assertTrue(e.reason().contains("chained"));
        }

        @Test
        @DisplayName("missing left operand")
        void missingLeft() {
            KindaSyntaxException e = assertThrows(KindaSyntaxException.class, () -> run("~ish 3;"));
            assertTrue(e.reason().contains("left operand"));
        }

        @Test
        @DisplayName("lone marker")
        void lone() {
            KindaSyntaxException e = assertThrows(KindaSyntaxException.class, () -> run("int z = ~ish;"));
            assertEquals(9, e.column());
        }

        @Test
        @DisplayName("identifiers that only start with ish are not markers")
        void longerWord() {
            assertSame("int z = ~ishy;\n", run("int z = ~ishy;\n").text);
        }
    }
}
