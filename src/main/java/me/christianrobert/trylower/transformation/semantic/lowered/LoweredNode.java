package me.christianrobert.trylower.transformation.semantic.lowered;

/**
 * Base class of the lowered tree emitted for a try/catch construct.
 *
 * <p>Every node is an expression built from constructs the host type checker and code
 * generator already understand: name bindings, two-armed result dispatch, conditionals and early
 * termination. No node requires a runtime exception mechanism.
 *
 * <p>Nodes are immutable and compare structurally, so two lowerings of the same input can be
 * checked for identity with {@code equals}.
 */
public abstract class LoweredNode {

    public abstract <R> R accept(LoweredNodeVisitor<R> visitor);
}
