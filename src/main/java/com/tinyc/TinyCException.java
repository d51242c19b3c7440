package com.tinyc;

/**
 * Base type of every failure raised by a pipeline stage. Subclasses carry a
 * reason enum so callers can tell failures apart without parsing messages.
 */
public abstract class TinyCException extends RuntimeException {
    protected TinyCException(String message) {
        super(message);
    }

    public abstract Enum<?> reason();
}
