package org.calista.kinda.transform.scan;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class LexicalScannerTest {

    @Nested
    @DisplayName("line splitting")
    class Lines {

        @Test
        @DisplayName("empty input has no lines")
        void empty() {
            assertTrue(LexicalScanner.scan("").isEmpty());
        }

        @Test
        @DisplayName("every terminator kind is recorded per line")
        void terminators() {
            List<SourceLine> lines = LexicalScanner.scan("a\nb\r\nc\rd");
            assertEquals(4, lines.size());
            assertEquals("\n", lines.get(0).terminator());
            assertEquals("\r\n", lines.get(1).terminator());
            assertEquals("\r", lines.get(2).terminator());
            assertEquals("", lines.get(3).terminator());
            assertEquals("d", lines.get(3).text());
            assertEquals(4, lines.get(3).number());
        }

        @Test
        @DisplayName("trailing newline does not create an extra line")
        void trailingNewline() {
            assertEquals(2, LexicalScanner.scan("x;\ny;\n").size());
        }
    }

    @Nested
    @DisplayName("character classes")
    class Classes {

        @Test
        @DisplayName("string contents are literal, including escaped quotes")
        void strings() {
            SourceLine l = LexicalScanner.scan("s = \"a\\\"~b\"; ~x").get(0);
            int inside = l.text().indexOf('~');
            assertTrue(l.isLiteral(inside));
            int outside = l.text().lastIndexOf('~');
            assertTrue(l.isCode(outside));
        }

        @Test
        @DisplayName("char literals")
        void chars() {
            SourceLine l = LexicalScanner.scan("c = '~'; d = '\\'';").get(0);
            assertTrue(l.isLiteral(5));
            assertFalse(l.hasCode('~'));
            assertTrue(l.isCodeChar(l.length() - 1, ';'));
        }

        @Test
        @DisplayName("line comments end at the line break")
        void lineComment() {
            List<SourceLine> lines = LexicalScanner.scan("x; // ~maybe\n~maybe");
            assertFalse(lines.get(0).hasCode('~'));
            assertTrue(lines.get(0).isComment(3));
            assertTrue(lines.get(1).isCode(0));
        }

        @Test
        @DisplayName("block comments span lines")
        void blockComment() {
            List<SourceLine> lines = LexicalScanner.scan("a /* ~x\n ~y */ ~z");
            assertTrue(lines.get(0).isCode(0));
            assertFalse(lines.get(0).hasCode('~'));
            SourceLine second = lines.get(1);
            assertTrue(second.isComment(1));
            assertTrue(second.isCode(second.length() - 2));
            assertEquals(-1, second.firstCode());
        }

        @Test
        @DisplayName("text blocks span lines and mark continuation lines")
        void textBlock() {
            List<SourceLine> lines = LexicalScanner.scan("t = \"\"\"\n  ~kinda \"x\"\n  \"\"\"; ~y");
            assertFalse(lines.get(0).startsInLiteral());
            assertTrue(lines.get(1).startsInLiteral());
            assertFalse(lines.get(1).hasCode('~'));
            assertTrue(lines.get(2).startsInLiteral());
            assertTrue(lines.get(2).hasCode('~'));
        }

        @Test
        @DisplayName("unterminated string does not leak into the next line")
        void unterminatedString() {
            List<SourceLine> lines = LexicalScanner.scan("s = \"open\n~maybe {");
            assertTrue(lines.get(1).isCode(0));
        }
    }

    @Nested
    @DisplayName("line helpers")
    class Helpers {

        @Test
        @DisplayName("brackets match on code only")
        void brackets() {
            SourceLine l = LexicalScanner.scan("f(a, \")\", g(b)) + 1").get(0);
            assertEquals(14, l.matchForward(1));
            assertEquals(1, l.matchBackward(14));
            assertEquals(-1, LexicalScanner.scan("f(a").get(0).matchForward(1));
            assertThrows(IllegalArgumentException.class, () -> l.matchForward(0));
        }

        @Test
        @DisplayName("depth-zero search skips nested brackets")
        void depthZero() {
            SourceLine l = LexicalScanner.scan("x = f(a; b); y;").get(0);
            assertEquals(11, l.findAtDepthZero(0, ';'));
            assertEquals(-1, l.findAtDepthZero(6, ','));
            assertEquals(1, l.depthAt(7));
        }

        @Test
        @DisplayName("content end ignores trailing comments and blanks")
        void contentEnd() {
            SourceLine l = LexicalScanner.scan("  foo {  // bar  ").get(0);
            assertEquals(7, l.contentEnd());
            assertEquals("  ", l.indent());
            assertEquals(2, l.firstCode());
        }
    }

    @Nested
    @DisplayName("block locator")
    class Blocks {

        @Test
        @DisplayName("finds the closing brace across lines, skipping literals")
        void crossLine() {
            List<SourceLine> lines = LexicalScanner.scan("for (x) {\n  s = \"}\";\n  if (y) { z(); }\n}\n");
            BlockLocator.Location loc = BlockLocator.findClose(lines, 0, 8);
            assertNotNull(loc);
            assertEquals(3, loc.line);
            assertEquals(0, loc.column);
        }

        @Test
        @DisplayName("null when never closed")
        void unclosed() {
            assertNull(BlockLocator.findClose(LexicalScanner.scan("a {\n b {\n }\n"), 0, 2));
        }

        @Test
        @DisplayName("rejects a column without a brace")
        void noBrace() {
            assertThrows(IllegalArgumentException.class,
                    () -> BlockLocator.findClose(LexicalScanner.scan("a {"), 0, 0));
        }
    }
}
