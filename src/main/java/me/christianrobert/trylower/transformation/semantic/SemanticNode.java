package me.christianrobert.trylower.transformation.semantic;

import me.christianrobert.trylower.transformation.semantic.element.SourceLocation;

/**
 * Base interface for all input syntax tree nodes handed over by the host front end.
 *
 * <p>The engine never tokenizes or parses source text. The host parser recognizes
 * {@code try { ... } (catch(pattern) { ... })+} and {@code throw expr;} and builds these
 * nodes; every node carries the source location that diagnostics point at.
 */
public interface SemanticNode {

    /**
     * @return Location of this node in the host source, never null
     */
    SourceLocation getLocation();
}
