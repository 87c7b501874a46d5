package org.calista.kinda.compose;

public enum FailureReason {
    /** Operand could not be converted (ClassCastException, NumberFormatException, ...). */
    CONVERSION,
    /** Pattern detected a state it cannot evaluate from. */
    INTERNAL_STATE,
    /** Any other runtime exception. */
    UNEXPECTED
}
