package me.christianrobert.trylower.transformation.type;

import me.christianrobert.trylower.transformation.semantic.element.ErrorType;
import me.christianrobert.trylower.transformation.semantic.element.HostExpression;
import me.christianrobert.trylower.transformation.semantic.element.TypeRef;

/**
 * Type queries answered by the host type system.
 * <p>
 * The engine depends only on this interface. The host supplies an implementation backed by its
 * own symbol/type table; that table is an immutable snapshot for the duration of a pass, so one
 * oracle may be shared by workers lowering different functions in parallel. Implementations must
 * not mutate state in response to queries.
 * </p>
 *
 * @see SimpleTypeOracle
 */
public interface TypeOracle {

    /**
     * Gets the value type of an expression. For a fallible call site this is the success type.
     *
     * @param expression Host expression
     * @return The type, or {@link TypeRef#UNKNOWN} if the host cannot determine it
     */
    TypeRef typeOf(HostExpression expression);

    /**
     * Gets the single static error type a fallible call site can fail with.
     *
     * @param callSite Host expression flagged fallible by the parser
     * @return The error type, or null if it cannot be resolved
     */
    ErrorType errorTypeOf(HostExpression callSite);

    /**
     * @return true if a value of type {@code from} may be used where {@code to} is expected
     */
    boolean isAssignable(TypeRef from, TypeRef to);
}
