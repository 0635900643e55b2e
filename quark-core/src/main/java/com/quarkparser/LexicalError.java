package com.quarkparser;

/**
 * A recoverable lexer diagnostic. The lexer records it and keeps scanning.
 */
public record LexicalError(int line, int column, String message) {
    @Override
    public String toString() {
        return message + " (line " + line + ", column " + column + ")";
    }
}
