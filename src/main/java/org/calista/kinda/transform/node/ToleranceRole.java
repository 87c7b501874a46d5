package org.calista.kinda.transform.node;

public enum ToleranceRole {
    VALUE,
    COMPARISON,
    ASSIGNMENT
}
