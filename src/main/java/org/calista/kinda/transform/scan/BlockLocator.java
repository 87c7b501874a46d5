package org.calista.kinda.transform.scan;

import java.util.List;

/**
 * Finds the brace that closes a block, across lines, ignoring literals and comments.
 */
public final class BlockLocator {

    /** Line index and column of a closing brace. */
    public static final class Location {
        public final int line;
        public final int column;

        Location(int line, int column) {
            this.line = line;
            this.column = column;
        }

        @Override
        public String toString() {
            return "Location{line=" + line + ", column=" + column + '}';
        }
    }

    private BlockLocator() {
    }

    /**
     * @param openCol column of a code '{' on {@code lines.get(line)}
     * @return the matching '}', or null when the block is never closed
     */
    public static Location findClose(List<SourceLine> lines, int line, int openCol) {
        SourceLine first = lines.get(line);
        if (!first.isCodeChar(openCol, '{')) {
            throw new IllegalArgumentException("no '{' at " + first.number() + ":" + (openCol + 1));
        }
        int depth = 0;
        for (int li = line; li < lines.size(); li++) {
            SourceLine l = lines.get(li);
            for (int i = li == line ? openCol : 0; i < l.length(); i++) {
                if (!l.isCode(i)) continue;
                char c = l.charAt(i);
                if (c == '{') depth++;
                else if (c == '}' && --depth == 0) return new Location(li, i);
            }
        }
        return null;
    }
}
