package org.calista.kinda.transform;

import org.calista.kinda.KindaException;

import java.util.Objects;

/**
 * Fatal transformation error for one file: where, what text, and an optional suggestion.
 */
public class KindaSyntaxException extends KindaException {

    private final SourcePosition position;
    private final String sourceLine;
    private final String suggestion;
    private final String reason;

    public KindaSyntaxException(SourcePosition position, String reason, String sourceLine, String suggestion) {
        super(format(position, reason, sourceLine, suggestion));
        this.position = Objects.requireNonNull(position, "position");
        this.reason = Objects.requireNonNull(reason, "reason");
        this.sourceLine = sourceLine;
        this.suggestion = suggestion;
    }

    public SourcePosition position() {
        return position;
    }

    public int line() {
        return position.line;
    }

    public int column() {
        return position.column;
    }

    /** Message without position and snippet. */
    public String reason() {
        return reason;
    }

    /** Offending source line, as written. */
    public String sourceLine() {
        return sourceLine;
    }

    /** Closest known construct, or null. */
    public String suggestion() {
        return suggestion;
    }

    private static String format(SourcePosition pos, String reason, String sourceLine, String suggestion) {
        StringBuilder sb = new StringBuilder();
        sb.append(pos).append(": ").append(reason);
        if (suggestion != null) sb.append(" (did you mean '").append(suggestion).append("'?)");
        if (sourceLine != null) {
            sb.append(System.lineSeparator()).append("    ").append(sourceLine);
            sb.append(System.lineSeparator()).append("    ");
            for (int i = 1; i < pos.column && i <= sourceLine.length(); i++) {
                sb.append(sourceLine.charAt(i - 1) == '\t' ? '\t' : ' ');
            }
            sb.append('^');
        }
        return sb.toString();
    }
}
