package com.tinyc.eval;

import com.tinyc.TinyCException;

public class EvaluationException extends TinyCException {
    public enum Reason {
        UNKNOWN_OPERATOR,
        INVALID_ARITY,
        DIVISION_BY_ZERO
    }

    private final Reason reason;

    public EvaluationException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    static EvaluationException unknownOperator(String keyword) {
        return new EvaluationException(Reason.UNKNOWN_OPERATOR, "Unknown operator: " + keyword);
    }

    static EvaluationException invalidArity(String keyword) {
        return new EvaluationException(Reason.INVALID_ARITY,
                "Operator '" + keyword + "' needs at least one operand");
    }

    static EvaluationException divisionByZero(int operandIndex) {
        return new EvaluationException(Reason.DIVISION_BY_ZERO,
                "Division by zero (operand " + (operandIndex + 1) + " of div is 0)");
    }

    @Override
    public Reason reason() {
        return reason;
    }
}
