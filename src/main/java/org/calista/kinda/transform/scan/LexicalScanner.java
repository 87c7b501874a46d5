package org.calista.kinda.transform.scan;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits source into lines and classifies every character as code, literal or comment.
 *
 * <p>Single pass, no regex. Block comments and text blocks carry their state over line breaks;
 * string and char literals end at the line break if unterminated.</p>
 */
public final class LexicalScanner {

    private enum State { CODE, LINE_COMMENT, BLOCK_COMMENT, STRING, CHAR, TEXT_BLOCK }

    private LexicalScanner() {
    }

    public static List<SourceLine> scan(String source) {
        if (source == null || source.isEmpty()) return List.of();

        List<SourceLine> out = new ArrayList<>();
        State state = State.CODE;
        final int n = source.length();
        int start = 0;

        while (start < n) {
            int end = start;
            while (end < n && source.charAt(end) != '\n' && source.charAt(end) != '\r') end++;
            String term;
            if (end >= n) term = "";
            else if (source.charAt(end) == '\r' && end + 1 < n && source.charAt(end + 1) == '\n') term = "\r\n";
            else term = String.valueOf(source.charAt(end));

            String text = source.substring(start, end);
            boolean startsInLiteral = state == State.TEXT_BLOCK;
            byte[] kinds = new byte[text.length()];
            state = classify(text, kinds, state);

            out.add(new SourceLine(out.size(), text, term, kinds, startsInLiteral));
            start = end + term.length();
        }
        return out;
    }

    private static State classify(String s, byte[] kinds, State state) {
        final int n = s.length();
        int i = 0;
        while (i < n) {
            char c = s.charAt(i);
            switch (state) {
                case CODE -> {
                    if (c == '/' && i + 1 < n && s.charAt(i + 1) == '/') {
                        state = State.LINE_COMMENT;
                        continue;
                    }
                    if (c == '/' && i + 1 < n && s.charAt(i + 1) == '*') {
                        kinds[i] = SourceLine.COMMENT;
                        kinds[i + 1] = SourceLine.COMMENT;
                        i += 2;
                        state = State.BLOCK_COMMENT;
                        continue;
                    }
                    if (s.startsWith("\"\"\"", i)) {
                        fill(kinds, i, i + 3, SourceLine.LITERAL);
                        i += 3;
                        state = State.TEXT_BLOCK;
                        continue;
                    }
                    if (c == '"') {
                        kinds[i++] = SourceLine.LITERAL;
                        state = State.STRING;
                        continue;
                    }
                    if (c == '\'') {
                        kinds[i++] = SourceLine.LITERAL;
                        state = State.CHAR;
                        continue;
                    }
                    kinds[i++] = SourceLine.CODE;
                }
                case LINE_COMMENT -> kinds[i++] = SourceLine.COMMENT;
                case BLOCK_COMMENT -> {
                    kinds[i] = SourceLine.COMMENT;
                    if (c == '*' && i + 1 < n && s.charAt(i + 1) == '/') {
                        kinds[i + 1] = SourceLine.COMMENT;
                        i += 2;
                        state = State.CODE;
                        continue;
                    }
                    i++;
                }
                case STRING, CHAR -> {
                    kinds[i] = SourceLine.LITERAL;
                    if (c == '\\' && i + 1 < n) {
                        kinds[i + 1] = SourceLine.LITERAL;
                        i += 2;
                        continue;
                    }
                    i++;
                    if ((state == State.STRING && c == '"') || (state == State.CHAR && c == '\'')) state = State.CODE;
                }
                case TEXT_BLOCK -> {
                    kinds[i] = SourceLine.LITERAL;
                    if (c == '\\' && i + 1 < n) {
                        kinds[i + 1] = SourceLine.LITERAL;
                        i += 2;
                        continue;
                    }
                    if (s.startsWith("\"\"\"", i)) {
                        fill(kinds, i, i + 3, SourceLine.LITERAL);
                        i += 3;
                        state = State.CODE;
                        continue;
                    }
                    i++;
                }
            }
        }
        // line comments and plain literals stop at the line break
        if (state == State.LINE_COMMENT || state == State.STRING || state == State.CHAR) return State.CODE;
        return state;
    }

    private static void fill(byte[] kinds, int from, int to, byte kind) {
        for (int k = from; k < to && k < kinds.length; k++) kinds[k] = kind;
    }
}
