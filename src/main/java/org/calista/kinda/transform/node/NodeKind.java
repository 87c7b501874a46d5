package org.calista.kinda.transform.node;

public enum NodeKind {
    CONDITIONAL_GATE,
    LOOP_CONSTRUCT,
    FUZZY_DECLARATION,
    FUZZY_REASSIGNMENT,
    SORTA_PRINT,
    TOLERANCE_VALUE,
    TOLERANCE_COMPARISON,
    TOLERANCE_ASSIGNMENT,
    TIME_DRIFT_DECLARATION,
    DRIFT_ACCESS,
    WELP_FALLBACK
}
