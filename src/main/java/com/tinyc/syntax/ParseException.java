package com.tinyc.syntax;

import com.tinyc.TinyCException;

public class ParseException extends TinyCException {
    public enum Reason {
        UNEXPECTED_END_OF_INPUT
    }

    private final Reason reason;
    private final int position;

    public ParseException(Reason reason, String message, int position) {
        super("Parse error at token " + position + ": " + message);
        this.reason = reason;
        this.position = position;
    }

    static ParseException unexpectedEnd(int position) {
        return new ParseException(Reason.UNEXPECTED_END_OF_INPUT,
                "expected a number or an operator but reached the end of input", position);
    }

    @Override
    public Reason reason() {
        return reason;
    }

    /** Index of the token the parser was about to read. */
    public int position() {
        return position;
    }
}
