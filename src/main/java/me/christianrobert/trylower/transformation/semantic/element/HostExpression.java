package me.christianrobert.trylower.transformation.semantic.element;

import me.christianrobert.trylower.transformation.semantic.SemanticNode;

import java.util.Objects;

/**
 * An expression owned by the host compiler.
 *
 * <p>The engine treats expressions as opaque: it moves them into the lowered tree and asks the
 * {@link me.christianrobert.trylower.transformation.type.TypeOracle} about their types, but it
 * never looks inside. The {@code id} is the key the host uses to answer type queries; the text is
 * carried for diagnostics and debug output only.
 */
public class HostExpression implements SemanticNode {

    private final String id;
    private final String text;
    private final SourceLocation location;

    public HostExpression(String id, String text, SourceLocation location) {
        if (id == null || id.trim().isEmpty()) {
            throw new IllegalArgumentException("Expression id cannot be null or empty");
        }
        if (text == null) {
            throw new IllegalArgumentException("Expression text cannot be null");
        }
        if (location == null) {
            throw new IllegalArgumentException("Expression location cannot be null");
        }
        this.id = id;
        this.text = text;
        this.location = location;
    }

    /**
     * Convenience for hosts whose expression ids double as source text.
     */
    public static HostExpression of(String text, SourceLocation location) {
        return new HostExpression(text + "@" + location, text, location);
    }

    public String getId() {
        return id;
    }

    public String getText() {
        return text;
    }

    @Override
    public SourceLocation getLocation() {
        return location;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        HostExpression that = (HostExpression) o;
        return id.equals(that.id) && text.equals(that.text) && location.equals(that.location);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, text, location);
    }

    @Override
    public String toString() {
        return text;
    }
}
