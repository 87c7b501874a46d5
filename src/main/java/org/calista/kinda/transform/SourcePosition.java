package org.calista.kinda.transform;

import java.util.Objects;

/**
 * 1-based line and column inside a named source.
 */
public final class SourcePosition {

    public final String file;
    public final int line;
    public final int column;

    public SourcePosition(String file, int line, int column) {
        if (line < 1) throw new IllegalArgumentException("line must be >= 1: " + line);
        if (column < 1) throw new IllegalArgumentException("column must be >= 1: " + column);
        this.file = file == null ? "<source>" : file;
        this.line = line;
        this.column = column;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SourcePosition p)) return false;
        return line == p.line && column == p.column && file.equals(p.file);
    }

    @Override
    public int hashCode() {
        return Objects.hash(file, line, column);
    }

    @Override
    public String toString() {
        return file + ":" + line + ":" + column;
    }
}
