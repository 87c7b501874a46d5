package org.calista.kinda.transform.node;

/**
 * Which syntactic evidence decided the role of a binary {@code ~ish}. Checked in declaration order.
 */
public enum RoleCue {
    /** if, while, for, return, assert, a fuzzy gate or loop on the line, or a ternary '?'. */
    CONDITIONAL_KEYWORD(ToleranceRole.COMPARISON),
    /** Logical or comparison operator on the line. */
    OPERATOR(ToleranceRole.COMPARISON),
    /** Inside parentheses, brackets or braces. */
    NESTED(ToleranceRole.COMPARISON),
    /** {@code x ~ish t;} as a whole statement. */
    BARE_ASSIGNMENT(ToleranceRole.ASSIGNMENT),
    /** Nothing matched; an expression value. */
    DEFAULT(ToleranceRole.COMPARISON);

    private final ToleranceRole role;

    RoleCue(ToleranceRole role) {
        this.role = role;
    }

    public ToleranceRole role() {
        return role;
    }
}
