package me.christianrobert.trylower.transformation.semantic.element;

import java.util.Objects;

/**
 * Nominal reference to a type known to the host type system.
 * <p>
 * Types are compared by exact nominal identity (category and name). There is no structural
 * comparison and no subtyping: assignability beyond equality is a question for the host,
 * answered through {@link me.christianrobert.trylower.transformation.type.TypeOracle}.
 * </p>
 */
public class TypeRef {

    public static final TypeRef UNIT = new TypeRef(TypeCategory.UNIT, "()");
    public static final TypeRef UNKNOWN = new TypeRef(TypeCategory.UNKNOWN, "?");

    private final TypeCategory category;
    private final String name;

    protected TypeRef(TypeCategory category, String name) {
        if (category == null) {
            throw new IllegalArgumentException("Type category cannot be null");
        }
        if (name == null || name.trim().isEmpty()) {
            throw new IllegalArgumentException("Type name cannot be null or empty");
        }
        this.category = category;
        this.name = name;
    }

    /**
     * Creates a value type reference.
     */
    public static TypeRef of(String name) {
        return new TypeRef(TypeCategory.VALUE, name);
    }

    public TypeCategory getCategory() {
        return category;
    }

    public String getName() {
        return name;
    }

    public boolean isUnknown() {
        return category == TypeCategory.UNKNOWN;
    }

    public boolean isUnit() {
        return category == TypeCategory.UNIT;
    }

    public boolean isError() {
        return category == TypeCategory.ERROR;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TypeRef)) return false;
        TypeRef other = (TypeRef) o;
        return category == other.category && name.equals(other.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(category, name);
    }

    @Override
    public String toString() {
        return name;
    }
}
