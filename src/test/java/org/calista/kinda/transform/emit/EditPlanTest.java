package org.calista.kinda.transform.emit;

import org.calista.kinda.transform.scan.LexicalScanner;
import org.calista.kinda.transform.scan.SourceLine;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class EditPlanTest {

    @Test
    @DisplayName("edits use original columns regardless of application order")
    void originalColumns() {
        List<SourceLine> lines = LexicalScanner.scan("abc def ghi");
        EditPlan plan = new EditPlan(lines);
        plan.replace(0, 0, 3, "ABCDE");
        plan.replace(0, 8, 11, "G");
        plan.insert(0, 4, "[");
        plan.insert(0, 7, "]");
        assertEquals("ABCDE [def] G", plan.render().text);
    }

    @Test
    @DisplayName("inserts at one column keep creation order")
    void insertOrder() {
        EditPlan plan = new EditPlan(LexicalScanner.scan("x"));
        plan.insert(0, 0, "a");
        plan.insert(0, 0, "b");
        plan.insert(0, 1, "c");
        assertEquals("abxc", plan.render().text);
    }

    @Test
    @DisplayName("replacement starting at an insert column is applied first")
    void replaceBeforeInsert() {
        EditPlan plan = new EditPlan(LexicalScanner.scan("ab"));
        plan.replace(0, 0, 1, "Z");
        plan.insert(0, 0, ">");
        assertEquals(">Zb", plan.render().text);
    }

    @Test
    @DisplayName("overlapping replacements are refused")
    void overlap() {
        EditPlan plan = new EditPlan(LexicalScanner.scan("abcdef"));
        plan.replace(0, 0, 3, "x");
        plan.replace(0, 2, 4, "y");
        assertThrows(IllegalStateException.class, plan::render);
    }

    @Test
    @DisplayName("insert strictly inside a replacement is refused")
    void insertInsideReplacement() {
        EditPlan plan = new EditPlan(LexicalScanner.scan("abcdef"));
        plan.replace(0, 1, 4, "x");
        plan.insert(0, 2, "y");
        assertThrows(IllegalStateException.class, plan::render);
    }

    @Test
    @DisplayName("inserted lines get the line's prefix, terminator and source line")
    void insertedLines() {
        EditPlan plan = new EditPlan(LexicalScanner.scan("a\r\nb\r\nc"));
        plan.indent(1, "  ");
        plan.insertLineBefore(1, "before");
        plan.insertLineAfter(2, "tail");
        EditPlan.Rendered r = plan.render();
        assertEquals("a\r\n  before\r\n  b\r\nc\r\ntail", r.text);
        assertEquals(List.of(1, 2, 2, 3, 3), r.lineMap);
        assertFalse(plan.isEmpty());
    }

    @Test
    @DisplayName("dominant terminator")
    void dominant() {
        assertEquals("\n", EditPlan.dominantTerminator(LexicalScanner.scan("x")));
        assertEquals("\r\n", EditPlan.dominantTerminator(LexicalScanner.scan("a\r\nb\r\nc\n")));
    }

    @Test
    @DisplayName("edits past the end of a line are rejected immediately")
    void pastEnd() {
        EditPlan plan = new EditPlan(LexicalScanner.scan("ab"));
        assertThrows(IllegalArgumentException.class, () -> plan.replace(0, 1, 5, "x"));
    }
}
