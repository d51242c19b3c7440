package com.tinyc.codegen;

import com.tinyc.TinyCException;

public class CompilationException extends TinyCException {
    public enum Reason {
        UNKNOWN_OPERATOR
    }

    private final Reason reason;

    public CompilationException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    static CompilationException unknownOperator(String keyword) {
        return new CompilationException(Reason.UNKNOWN_OPERATOR, "Unknown operator: " + keyword);
    }

    @Override
    public Reason reason() {
        return reason;
    }
}
