package me.christianrobert.trylower.transformation.semantic.element;

/**
 * Broad categories of the nominal types the host reports.
 */
public enum TypeCategory {
    /** Ordinary success value type. */
    VALUE,
    /** Nominal error-producing type. */
    ERROR,
    /** Type of a block that produces no value. */
    UNIT,
    /** Host could not determine the type. */
    UNKNOWN
}
