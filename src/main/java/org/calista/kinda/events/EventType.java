package org.calista.kinda.events;

public enum EventType {
    /** A composed construct failed and the direct implementation answered instead. */
    COMPOSITION_FALLBACK,
    /** An operand could not be read as a number/boolean; a soft default was used. */
    CONVERSION_FAILURE,
    /** sometimes_while hit its cycle cap. */
    LOOP_CAP_EXCEEDED,
    /** eventually_until hit its evaluation cap before becoming confident. */
    CONFIDENCE_TIMEOUT,
    /** Wilson bound was not computable; proportion check used. */
    CONFIDENCE_FALLBACK,
    /** A welp primary threw or gave null; the fallback value was used. */
    WELP_FALLBACK
}
