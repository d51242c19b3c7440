package com.tinyc;

/**
 * Raised when a program is nested deeper than the recursive tree walkers can
 * follow on the current thread's stack.
 */
public class NestingTooDeepException extends TinyCException {
    public enum Reason {
        NESTING_TOO_DEEP
    }

    public NestingTooDeepException(String stage) {
        super("Expression is nested too deeply for the " + stage + " stage");
    }

    @Override
    public Reason reason() {
        return Reason.NESTING_TOO_DEEP;
    }
}
