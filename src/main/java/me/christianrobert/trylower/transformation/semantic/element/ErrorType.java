package me.christianrobert.trylower.transformation.semantic.element;

/**
 * Opaque identifier of a nominal error-producing type.
 * <p>
 * Two error types are the same handler key only if their names are identical. Handlers never
 * match through inheritance or trait relationships.
 * </p>
 */
public final class ErrorType extends TypeRef {

    private ErrorType(String name) {
        super(TypeCategory.ERROR, name);
    }

    public static ErrorType of(String name) {
        return new ErrorType(name);
    }
}
