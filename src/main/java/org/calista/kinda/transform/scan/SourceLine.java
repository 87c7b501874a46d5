package org.calista.kinda.transform.scan;

/**
 * One physical line with its terminator and a per-character lexical class.
 *
 * <p>Classes: {@link #CODE}, {@link #LITERAL} (string, char, text block, quotes included),
 * {@link #COMMENT}. Only code characters can start a marker or close a bracket.</p>
 */
public final class SourceLine {

    public static final byte CODE = 0;
    public static final byte LITERAL = 1;
    public static final byte COMMENT = 2;

    private final int index;
    private final String text;
    private final String terminator;
    private final byte[] kinds;
    private final boolean startsInLiteral;

    SourceLine(int index, String text, String terminator, byte[] kinds, boolean startsInLiteral) {
        this.index = index;
        this.text = text;
        this.terminator = terminator;
        this.kinds = kinds;
        this.startsInLiteral = startsInLiteral;
    }

    /** 0-based. */
    public int index() {
        return index;
    }

    /** 1-based. */
    public int number() {
        return index + 1;
    }

    public String text() {
        return text;
    }

    /** "\n", "\r\n", "\r" or "" for a last line without newline. */
    public String terminator() {
        return terminator;
    }

    /** True when the line begins inside a text block. */
    public boolean startsInLiteral() {
        return startsInLiteral;
    }

    public int length() {
        return text.length();
    }

    public char charAt(int i) {
        return text.charAt(i);
    }

    public boolean isCode(int i) {
        return i >= 0 && i < kinds.length && kinds[i] == CODE;
    }

    public boolean isLiteral(int i) {
        return i >= 0 && i < kinds.length && kinds[i] == LITERAL;
    }

    public boolean isComment(int i) {
        return i >= 0 && i < kinds.length && kinds[i] == COMMENT;
    }

    /** Code character equal to c. */
    public boolean isCodeChar(int i, char c) {
        return isCode(i) && text.charAt(i) == c;
    }

    public boolean startsWithCode(int i, String s) {
        if (i < 0 || i + s.length() > text.length()) return false;
        for (int k = 0; k < s.length(); k++) {
            if (!isCode(i + k) || text.charAt(i + k) != s.charAt(k)) return false;
        }
        return true;
    }

    /** First non-whitespace code character, or -1. */
    public int firstCode() {
        for (int i = 0; i < text.length(); i++) {
            if (isCode(i) && !Character.isWhitespace(text.charAt(i))) return i;
            if (!isCode(i)) return -1;
        }
        return -1;
    }

    /** One past the last non-whitespace code or literal character; 0 when there is none. */
    public int contentEnd() {
        for (int i = text.length() - 1; i >= 0; i--) {
            if (kinds[i] != COMMENT && !Character.isWhitespace(text.charAt(i))) return i + 1;
        }
        return 0;
    }

    public boolean hasCode(char c) {
        for (int i = 0; i < text.length(); i++) {
            if (kinds[i] == CODE && text.charAt(i) == c) return true;
        }
        return false;
    }

    /** Index of the first non-whitespace character at or after i (may be text length). */
    public int skipWs(int i) {
        while (i < text.length() && Character.isWhitespace(text.charAt(i))) i++;
        return i;
    }

    /** Index after the last non-whitespace character before end, never below from. */
    public int trimEnd(int from, int end) {
        while (end > from && Character.isWhitespace(text.charAt(end - 1))) end--;
        return end;
    }

    /** End of the identifier starting at i (i itself when there is none). */
    public int identEnd(int i) {
        int j = i;
        while (j < text.length() && isCode(j) && Character.isJavaIdentifierPart(text.charAt(j))) j++;
        return j;
    }

    public boolean isIdentStart(int i) {
        return isCode(i) && Character.isJavaIdentifierStart(text.charAt(i));
    }

    /**
     * Matching close bracket for the code bracket at open, on this line, or -1.
     */
    public int matchForward(int open) {
        char o = text.charAt(open);
        char c = closerOf(o);
        if (c == 0 || !isCode(open)) throw new IllegalArgumentException("not an opening bracket at " + open);
        int depth = 0;
        for (int i = open; i < text.length(); i++) {
            if (!isCode(i)) continue;
            char ch = text.charAt(i);
            if (ch == o) depth++;
            else if (ch == c && --depth == 0) return i;
        }
        return -1;
    }

    /**
     * Matching open bracket for the code bracket at close, on this line, or -1.
     */
    public int matchBackward(int close) {
        char c = text.charAt(close);
        char o = openerOf(c);
        if (o == 0 || !isCode(close)) throw new IllegalArgumentException("not a closing bracket at " + close);
        int depth = 0;
        for (int i = close; i >= 0; i--) {
            if (!isCode(i)) continue;
            char ch = text.charAt(i);
            if (ch == c) depth++;
            else if (ch == o && --depth == 0) return i;
        }
        return -1;
    }

    /**
     * First code {@code target} at or after {@code from} that is not nested in brackets opened after
     * {@code from}; -1 when absent or when an unmatched closer comes first.
     */
    public int findAtDepthZero(int from, char target) {
        int depth = 0;
        for (int i = from; i < text.length(); i++) {
            if (!isCode(i)) continue;
            char ch = text.charAt(i);
            if (depth == 0 && ch == target) return i;
            if (ch == '(' || ch == '[' || ch == '{') depth++;
            else if (ch == ')' || ch == ']' || ch == '}') {
                if (--depth < 0) return -1;
            }
        }
        return -1;
    }

    /** Net depth of (, [ and { before position i. */
    public int depthAt(int i) {
        int depth = 0;
        for (int k = 0; k < i && k < text.length(); k++) {
            if (!isCode(k)) continue;
            char ch = text.charAt(k);
            if (ch == '(' || ch == '[' || ch == '{') depth++;
            else if (ch == ')' || ch == ']' || ch == '}') depth--;
        }
        return depth;
    }

    /** Leading whitespace. */
    public String indent() {
        int i = 0;
        while (i < text.length() && (text.charAt(i) == ' ' || text.charAt(i) == '\t')) i++;
        return text.substring(0, i);
    }

    public boolean isBlank() {
        return text.isBlank();
    }

    public String slice(int from, int to) {
        return text.substring(from, to);
    }

    static char closerOf(char o) {
        return switch (o) {
            case '(' -> ')';
            case '[' -> ']';
            case '{' -> '}';
            default -> 0;
        };
    }

    static char openerOf(char c) {
        return switch (c) {
            case ')' -> '(';
            case ']' -> '[';
            case '}' -> '{';
            default -> 0;
        };
    }

    @Override
    public String toString() {
        return number() + ": " + text;
    }
}
