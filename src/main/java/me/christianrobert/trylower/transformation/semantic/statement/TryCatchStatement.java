package me.christianrobert.trylower.transformation.semantic.statement;

import me.christianrobert.trylower.transformation.semantic.element.ErrorType;
import me.christianrobert.trylower.transformation.semantic.element.SourceLocation;

import java.util.List;

/**
 * One try/catch construct: {@code try { ... } catch(A a) { ... } catch(B b) { ... }}.
 *
 * <p>The construct is the unit of analysis: its handler table and statement annotations are
 * built fresh for it, and a fatal diagnostic suppresses only its own lowering.
 *
 * <p>{@code declaredErrorType} is set by the host when the construct is itself an expression
 * with its own declared result type (e.g. an inner block with a type ascription). When absent,
 * throws inside the construct's handlers produce the enclosing function's error type.
 */
public class TryCatchStatement extends Statement {

    private final String binding;  // Optional, names the construct's value
    private final TryBlock tryBlock;
    private final List<CatchClause> catchClauses;
    private final ErrorType declaredErrorType;  // Optional

    public TryCatchStatement(String binding, TryBlock tryBlock, List<CatchClause> catchClauses,
                             ErrorType declaredErrorType, SourceLocation location) {
        super(location);
        if (tryBlock == null) {
            throw new IllegalArgumentException("Try block cannot be null");
        }
        if (catchClauses == null) {
            throw new IllegalArgumentException("Catch clauses cannot be null");
        }
        this.binding = binding;
        this.tryBlock = tryBlock;
        this.catchClauses = List.copyOf(catchClauses);
        this.declaredErrorType = declaredErrorType;
    }

    public TryCatchStatement(TryBlock tryBlock, List<CatchClause> catchClauses, SourceLocation location) {
        this(null, tryBlock, catchClauses, null, location);
    }

    public String getBinding() {
        return binding;
    }

    public TryBlock getTryBlock() {
        return tryBlock;
    }

    public List<CatchClause> getCatchClauses() {
        return catchClauses;
    }

    public ErrorType getDeclaredErrorType() {
        return declaredErrorType;
    }

    public boolean hasDeclaredErrorType() {
        return declaredErrorType != null;
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitTryCatch(this);
    }

    @Override
    public String toString() {
        return "TryCatchStatement{location=" + getLocation() + ", tryBlock=" + tryBlock +
                ", catchClauses=" + catchClauses + "}";
    }
}
