package com.quarkparser;

import java.util.List;

/**
 * Raised at the end of scanning when one or more {@link LexicalError}s were recorded.
 */
public class LexicalException extends ParseException {
    private final List<LexicalError> errors;

    public LexicalException(List<LexicalError> errors) {
        super("LexicalError", errors.get(0).line(), errors.get(0).column(), "scanner", summarize(errors));
        this.errors = List.copyOf(errors);
    }

    private static String summarize(List<LexicalError> errors) {
        String first = errors.get(0).message();
        if (errors.size() == 1) {
            return first;
        }
        return first + " (and " + (errors.size() - 1) + " more)";
    }

    public List<LexicalError> getErrors() {
        return errors;
    }
}
