package me.christianrobert.trylower.transformation.analysis;

import me.christianrobert.trylower.transformation.semantic.element.ErrorType;
import me.christianrobert.trylower.transformation.semantic.statement.TryBlock;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * A try scope after error-flow analysis, in original statement order.
 */
public class AnnotatedTryBlock {

    private final TryBlock tryBlock;
    private final List<AnnotatedStatement> statements;

    public AnnotatedTryBlock(TryBlock tryBlock, List<AnnotatedStatement> statements) {
        if (tryBlock == null || statements == null) {
            throw new IllegalArgumentException("Try block and annotations cannot be null");
        }
        if (statements.size() != tryBlock.getStatements().size()) {
            throw new IllegalArgumentException("Every try scope statement needs exactly one annotation");
        }
        this.tryBlock = tryBlock;
        this.statements = List.copyOf(statements);
    }

    public TryBlock getTryBlock() {
        return tryBlock;
    }

    public List<AnnotatedStatement> getStatements() {
        return statements;
    }

    /**
     * Distinct error types produced by fallible statements, in order of first occurrence.
     */
    public Set<ErrorType> getProducedErrorTypes() {
        Set<ErrorType> produced = new LinkedHashSet<>();
        for (AnnotatedStatement statement : statements) {
            if (statement.isFallible()) {
                produced.add(statement.getErrorType());
            }
        }
        return produced;
    }

    @Override
    public String toString() {
        return "AnnotatedTryBlock{successType=" + tryBlock.getSuccessType() + ", statements=" + statements + "}";
    }
}
