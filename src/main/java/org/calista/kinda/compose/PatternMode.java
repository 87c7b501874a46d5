package org.calista.kinda.compose;

/**
 * What a pattern returns: a boolean verdict for two operands, a new value, or a gated boolean.
 */
public enum PatternMode {
    COMPARISON,
    ASSIGNMENT,
    GATE
}
