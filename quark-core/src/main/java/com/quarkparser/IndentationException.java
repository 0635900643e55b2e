package com.quarkparser;

/**
 * A structural indentation violation. Aborts normalization immediately.
 */
public class IndentationException extends ParseException {
    public IndentationException(String detail, Token token) {
        super("IndentationError", token, null, "indentation", detail);
    }
}
