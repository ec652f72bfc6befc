package me.christianrobert.trylower.transformation.analysis;

import me.christianrobert.trylower.transformation.context.TransformationContext;
import me.christianrobert.trylower.transformation.diagnostic.DiagnosticCode;
import me.christianrobert.trylower.transformation.diagnostic.DiagnosticCollector;
import me.christianrobert.trylower.transformation.semantic.element.ErrorType;
import me.christianrobert.trylower.transformation.semantic.element.HostExpression;
import me.christianrobert.trylower.transformation.semantic.element.SourceLocation;
import me.christianrobert.trylower.transformation.semantic.element.TypeRef;
import me.christianrobert.trylower.transformation.semantic.statement.Block;
import me.christianrobert.trylower.transformation.semantic.statement.BlockStatement;
import me.christianrobert.trylower.transformation.semantic.statement.CatchClause;
import me.christianrobert.trylower.transformation.semantic.statement.ConditionalStatement;
import me.christianrobert.trylower.transformation.semantic.statement.ExpressionStatement;
import me.christianrobert.trylower.transformation.semantic.statement.LoweredStatement;
import me.christianrobert.trylower.transformation.semantic.statement.Statement;
import me.christianrobert.trylower.transformation.semantic.statement.StatementVisitor;
import me.christianrobert.trylower.transformation.semantic.statement.ThrowStatement;
import me.christianrobert.trylower.transformation.semantic.statement.TryCatchStatement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Enforces where {@code throw} may appear and what handlers evaluate to.
 *
 * <p>Rules:
 * <ul>
 *   <li>{@code throw} is legal only lexically inside a catch clause body, including ordinary
 *       blocks nested in it. In a try scope or outside any construct it reports
 *       {@code E-INVALID-THROW-CONTEXT}.</li>
 *   <li>A nested construct defines its own throw scope; its statements are validated when the
 *       nested construct itself is lowered, never as part of the enclosing one.</li>
 *   <li>A thrown payload must have exactly the error type of wherever the throw leaves to: the
 *       function's outer error type, or the error type of the enclosing result block
 *       ({@code E-THROW-TYPE-MISMATCH(expected, found)}).</li>
 *   <li>A declared error-type override on a construct that can throw must name that same type
 *       ({@code E-INVALID-ERROR-TYPE-OVERRIDE(expected, declared)}); it only takes effect when the
 *       construct is an operand of an enclosing try scope.</li>
 *   <li>Each handler's terminal non-throw value must be assignable to the try block's success
 *       type ({@code E-HANDLER-RETURN-MISMATCH(expected, found)}); so must the try block's own
 *       last value ({@code E-TRY-RESULT-MISMATCH(expected, found)}).</li>
 * </ul>
 *
 * <p>Types the host reports as unknown are left to the host's own type checker.
 */
public class ScopeTypeValidator {

    private static final Logger log = LoggerFactory.getLogger(ScopeTypeValidator.class);

    private final TransformationContext context;
    private final DiagnosticCollector diagnostics;

    public ScopeTypeValidator(TransformationContext context, DiagnosticCollector diagnostics) {
        if (context == null || diagnostics == null) {
            throw new IllegalArgumentException("Context and diagnostics cannot be null");
        }
        this.context = context;
        this.diagnostics = diagnostics;
    }

    // ========== Constructs ==========

    /**
     * @param construct Construct to validate
     * @param throwType Error type every {@code throw} of the construct's handlers must carry
     */
    public void validateConstruct(TryCatchStatement construct, ErrorType throwType) {
        log.debug("Validating throw scopes and result types of construct at {} (throws {})",
                construct.getLocation(), throwType);

        TypeRef successType = construct.getTryBlock().getSuccessType();

        rejectThrows(construct.getTryBlock().getBody(), "throw is not allowed in a try scope; only catch clauses may throw");
        checkBlockValue(construct.getTryBlock().getBody(), successType, DiagnosticCode.TRY_RESULT_MISMATCH);

        if (construct.hasDeclaredErrorType() && ThrowScopes.canThrow(construct)
                && !construct.getDeclaredErrorType().equals(throwType)) {
            diagnostics.report(DiagnosticCode.INVALID_ERROR_TYPE_OVERRIDE, construct.getLocation(),
                    "declared error type " + construct.getDeclaredErrorType() + " does not apply here;"
                            + " throws of this construct leave with " + throwType,
                    throwType.getName(), construct.getDeclaredErrorType().getName());
        }

        for (CatchClause clause : construct.getCatchClauses()) {
            checkThrowPayloads(clause.getBody(), throwType);
            checkBlockValue(clause.getBody(), successType, DiagnosticCode.HANDLER_RETURN_MISMATCH);
        }
    }

    // ========== Code Outside Constructs ==========

    /**
     * Reports every {@code throw} of a function body that is not inside a catch clause.
     * Constructs in the body are skipped; they are validated on their own.
     */
    public void validateOutsideConstructs(Block functionBody) {
        rejectThrows(functionBody, "throw is only allowed inside a catch clause");
    }

    // ========== Throw Placement ==========

    private void rejectThrows(Block block, String message) {
        for (Statement statement : block.getStatements()) {
            statement.accept(new ThrowWalker() {
                @Override
                public Void visitThrow(ThrowStatement throwStatement) {
                    diagnostics.report(DiagnosticCode.INVALID_THROW_CONTEXT, throwStatement.getLocation(), message);
                    return null;
                }
            });
        }
    }

    private void checkThrowPayloads(Block handlerBody, ErrorType expected) {
        for (Statement statement : handlerBody.getStatements()) {
            statement.accept(new ThrowWalker() {
                @Override
                public Void visitThrow(ThrowStatement throwStatement) {
                    TypeRef found = typeOf(throwStatement.getPayload());
                    if (found.isUnknown()) {
                        log.debug("Unknown payload type at {}, leaving it to the host", throwStatement.getLocation());
                        return null;
                    }
                    if (!found.equals(expected)) {
                        diagnostics.report(DiagnosticCode.THROW_TYPE_MISMATCH, throwStatement.getLocation(),
                                "thrown value must be of error type " + expected + " but is " + found,
                                expected.getName(), found.getName());
                    }
                    return null;
                }
            });
        }
    }

    /**
     * Walks ordinary nested blocks and stops at nested constructs.
     * Subclasses decide what to do with each {@code throw}.
     */
    private abstract static class ThrowWalker implements StatementVisitor<Void> {

        @Override
        public Void visitExpression(ExpressionStatement statement) {
            return null;
        }

        @Override
        public Void visitBlock(BlockStatement statement) {
            walk(statement.getBlock());
            return null;
        }

        @Override
        public Void visitConditional(ConditionalStatement statement) {
            walk(statement.getThenBlock());
            if (statement.hasElseBlock()) {
                walk(statement.getElseBlock());
            }
            return null;
        }

        @Override
        public Void visitTryCatch(TryCatchStatement statement) {
            return null;
        }

        @Override
        public Void visitLowered(LoweredStatement statement) {
            return null;
        }

        private void walk(Block block) {
            for (Statement statement : block.getStatements()) {
                statement.accept(this);
            }
        }
    }

    // ========== Result Types ==========

    private void checkBlockValue(Block block, TypeRef expected, DiagnosticCode code) {
        Statement terminal = block.getTerminal();
        if (terminal == null) {
            compare(TypeRef.UNIT, expected, block.getLocation(), code);
            return;
        }
        terminal.accept(new StatementVisitor<Void>() {
            @Override
            public Void visitExpression(ExpressionStatement statement) {
                compare(typeOf(statement.getExpression()), expected, statement.getLocation(), code);
                return null;
            }

            @Override
            public Void visitThrow(ThrowStatement statement) {
                return null;
            }

            @Override
            public Void visitBlock(BlockStatement statement) {
                checkBlockValue(statement.getBlock(), expected, code);
                return null;
            }

            @Override
            public Void visitConditional(ConditionalStatement statement) {
                checkBlockValue(statement.getThenBlock(), expected, code);
                if (statement.hasElseBlock()) {
                    checkBlockValue(statement.getElseBlock(), expected, code);
                } else {
                    compare(TypeRef.UNIT, expected, statement.getLocation(), code);
                }
                return null;
            }

            @Override
            public Void visitTryCatch(TryCatchStatement statement) {
                compare(statement.getTryBlock().getSuccessType(), expected, statement.getLocation(), code);
                return null;
            }

            @Override
            public Void visitLowered(LoweredStatement statement) {
                return null;
            }
        });
    }

    private TypeRef typeOf(HostExpression expression) {
        TypeRef type = context.getTypeOracle().typeOf(expression);
        return type != null ? type : TypeRef.UNKNOWN;
    }

    private void compare(TypeRef found, TypeRef expected, SourceLocation location, DiagnosticCode code) {
        if (found.isUnknown() || expected.isUnknown()) {
            return;
        }
        if (!context.getTypeOracle().isAssignable(found, expected)) {
            String what = code == DiagnosticCode.TRY_RESULT_MISMATCH ? "try block" : "catch clause";
            diagnostics.report(code, location,
                    what + " must evaluate to " + expected + " but evaluates to " + found,
                    expected.getName(), found.getName());
        }
    }
}
