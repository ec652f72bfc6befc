package me.christianrobert.trylower.transformation.analysis;

import me.christianrobert.trylower.transformation.semantic.element.ErrorType;
import me.christianrobert.trylower.transformation.semantic.statement.Statement;

/**
 * A try scope statement tagged by the error-flow analysis as plain or fallible.
 */
public class AnnotatedStatement {

    /**
     * Outcome of error-flow analysis for one statement.
     */
    public enum Kind {
        /** Cannot fail; its value is bound and the chain continues. */
        PLAIN,
        /** May fail with exactly one static error type. */
        FALLIBLE,
        /** Flagged fallible, but the host could not resolve an error type. */
        UNRESOLVED
    }

    private final Statement statement;
    private final Kind kind;
    private final ErrorType errorType;  // Only for FALLIBLE

    private AnnotatedStatement(Statement statement, Kind kind, ErrorType errorType) {
        if (statement == null) {
            throw new IllegalArgumentException("Annotated statement cannot be null");
        }
        this.statement = statement;
        this.kind = kind;
        this.errorType = errorType;
    }

    public static AnnotatedStatement plain(Statement statement) {
        return new AnnotatedStatement(statement, Kind.PLAIN, null);
    }

    public static AnnotatedStatement fallible(Statement statement, ErrorType errorType) {
        if (errorType == null) {
            throw new IllegalArgumentException("Fallible statement requires an error type");
        }
        return new AnnotatedStatement(statement, Kind.FALLIBLE, errorType);
    }

    public static AnnotatedStatement unresolved(Statement statement) {
        return new AnnotatedStatement(statement, Kind.UNRESOLVED, null);
    }

    public Statement getStatement() {
        return statement;
    }

    public Kind getKind() {
        return kind;
    }

    public boolean isFallible() {
        return kind == Kind.FALLIBLE;
    }

    public ErrorType getErrorType() {
        return errorType;
    }

    @Override
    public String toString() {
        return kind == Kind.FALLIBLE ? "{fallible: " + errorType + "}" : "{" + kind.name().toLowerCase() + "}";
    }
}
