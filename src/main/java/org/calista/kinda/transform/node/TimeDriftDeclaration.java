package org.calista.kinda.transform.node;

import org.calista.kinda.transform.Vocabulary;

/**
 * {@code ~time drift float|int x = e;}. The name is registered with the runtime so later
 * {@code x~drift} reads can age it.
 */
public final class TimeDriftDeclaration extends FuzzyNode {

    /** float or int. */
    public final String type;
    public final String name;
    public final int exprStart;
    public final int exprEnd;
    /** Column of the '~' in "~=", -1 for plain '='. */
    public final int fuzzyAssignTilde;

    public TimeDriftDeclaration(int line, int markerStart, int markerEnd, String type, String name,
                                int exprStart, int exprEnd, int fuzzyAssignTilde) {
        super(NodeKind.TIME_DRIFT_DECLARATION, line, markerStart, markerEnd);
        if (!Vocabulary.TIME_DRIFT_TYPES.contains(type)) throw new IllegalArgumentException("unknown time drift type: " + type);
        this.type = type;
        this.name = name;
        this.exprStart = exprStart;
        this.exprEnd = exprEnd;
        this.fuzzyAssignTilde = fuzzyAssignTilde;
    }

    @Override
    public boolean covers(int column) {
        return super.covers(column) || (fuzzyAssignTilde >= 0 && column == fuzzyAssignTilde);
    }

    public String javaType() {
        return "float".equals(type) ? "double" : "int";
    }

    public String factoryMethod() {
        return "float".equals(type) ? "timeDriftFloat" : "timeDriftInt";
    }
}
