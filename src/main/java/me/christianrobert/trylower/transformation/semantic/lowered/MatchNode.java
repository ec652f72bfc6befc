package me.christianrobert.trylower.transformation.semantic.lowered;

import me.christianrobert.trylower.transformation.semantic.element.ErrorType;

import java.util.Objects;

/**
 * Two-armed dispatch on a result-producing scrutinee.
 *
 * <pre>
 * match scrutinee {
 *     Ok(okName)   =&gt; onOk,
 *     Err(errName) =&gt; onErr     -- errName has type errorType
 * }
 * </pre>
 *
 * <p>The handler selected for {@code onErr} is fixed at compile time from the handler table;
 * there is no runtime lookup.
 */
public class MatchNode extends LoweredNode {

    private final LoweredNode scrutinee;
    private final String okName;
    private final LoweredNode onOk;
    private final ErrorType errorType;
    private final String errName;
    private final LoweredNode onErr;

    public MatchNode(LoweredNode scrutinee, String okName, LoweredNode onOk,
                     ErrorType errorType, String errName, LoweredNode onErr) {
        if (scrutinee == null || onOk == null || onErr == null) {
            throw new IllegalArgumentException("Match scrutinee and arms cannot be null");
        }
        if (okName == null || errName == null) {
            throw new IllegalArgumentException("Match arm bindings cannot be null");
        }
        if (errorType == null) {
            throw new IllegalArgumentException("Match error type cannot be null");
        }
        this.scrutinee = scrutinee;
        this.okName = okName;
        this.onOk = onOk;
        this.errorType = errorType;
        this.errName = errName;
        this.onErr = onErr;
    }

    public LoweredNode getScrutinee() {
        return scrutinee;
    }

    public String getOkName() {
        return okName;
    }

    public LoweredNode getOnOk() {
        return onOk;
    }

    public ErrorType getErrorType() {
        return errorType;
    }

    public String getErrName() {
        return errName;
    }

    public LoweredNode getOnErr() {
        return onErr;
    }

    @Override
    public <R> R accept(LoweredNodeVisitor<R> visitor) {
        return visitor.visitMatch(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        MatchNode that = (MatchNode) o;
        return scrutinee.equals(that.scrutinee)
                && okName.equals(that.okName)
                && onOk.equals(that.onOk)
                && errorType.equals(that.errorType)
                && errName.equals(that.errName)
                && onErr.equals(that.onErr);
    }

    @Override
    public int hashCode() {
        return Objects.hash(scrutinee, okName, onOk, errorType, errName, onErr);
    }

    @Override
    public String toString() {
        return "Match{" + scrutinee + ", Ok(" + okName + ") => " + onOk +
                ", Err(" + errName + ": " + errorType + ") => " + onErr + "}";
    }
}
