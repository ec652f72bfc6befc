package me.christianrobert.trylower.transformation.desugar;

/**
 * Where a {@code throw} in a catch clause transfers control to.
 */
public enum ThrowTarget {
    /** The construct sits in the function body: a throw returns {@code Err} from the function. */
    FUNCTION_RETURN,
    /** The construct is a fallible statement of an enclosing try scope: a throw yields its {@code Err}. */
    ENCLOSING_RESULT
}
