package org.calista.kinda.transform.node;

import org.calista.kinda.transform.Vocabulary;

/**
 * {@code ~kinda int|float|bool x = e;} and {@code ~kinda binary x;}.
 */
public final class FuzzyDeclaration extends FuzzyNode {

    /** Dialect type: int, float, bool or binary. */
    public final String type;
    public final String name;
    /** -1 for binary. */
    public final int exprStart;
    public final int exprEnd;
    public final int semicolon;
    /** Column of the '~' in "~=", -1 for plain '='. */
    public final int fuzzyAssignTilde;

    public FuzzyDeclaration(int line, int markerStart, int markerEnd, String type, String name,
                            int exprStart, int exprEnd, int semicolon, int fuzzyAssignTilde) {
        super(NodeKind.FUZZY_DECLARATION, line, markerStart, markerEnd);
        if (!Vocabulary.KINDA_TYPES.contains(type)) throw new IllegalArgumentException("unknown kinda type: " + type);
        this.type = type;
        this.name = name;
        this.exprStart = exprStart;
        this.exprEnd = exprEnd;
        this.semicolon = semicolon;
        this.fuzzyAssignTilde = fuzzyAssignTilde;
    }

    @Override
    public boolean covers(int column) {
        return super.covers(column) || (fuzzyAssignTilde >= 0 && column == fuzzyAssignTilde);
    }

    public boolean isBinary() {
        return "binary".equals(type);
    }

    public String javaType() {
        return switch (type) {
            case "float" -> "double";
            case "bool" -> "boolean";
            default -> "int";
        };
    }

    /** Facade method the initializer is passed to. */
    public String factoryMethod() {
        return switch (type) {
            case "float" -> "kindaFloat";
            case "bool" -> "kindaBool";
            case "binary" -> "kindaBinary";
            default -> "kindaInt";
        };
    }
}
