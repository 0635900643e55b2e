package com.quarkparser;

/**
 * Base class of every error raised by the Quark front end.
 *
 * <p>The message has the form {@code "<errorType>: <detail> (line L, column C)"}.</p>
 */
public class ParseException extends RuntimeException {
    private final String errorType;
    private final Token token;
    private final int line;
    private final int column;
    private final String expected;
    private final String context;
    private final String detail;

    public ParseException(String errorType, Token token, String expected, String context, String detail) {
        this(errorType, token, token != null ? token.line() : 0, token != null ? token.column() : 0,
            expected, context, detail);
    }

    public ParseException(String errorType, int line, int column, String context, String detail) {
        this(errorType, null, line, column, null, context, detail);
    }

    private ParseException(String errorType, Token token, int line, int column,
                           String expected, String context, String detail) {
        super(format(errorType, line, column, detail));
        this.errorType = errorType;
        this.token = token;
        this.line = line;
        this.column = column;
        this.expected = expected;
        this.context = context;
        this.detail = detail;
    }

    private static String format(String errorType, int line, int column, String detail) {
        if (line <= 0) {
            return errorType + ": " + detail;
        }
        return errorType + ": " + detail + " (line " + line + ", column " + column + ")";
    }

    public String getErrorType() {
        return errorType;
    }

    /**
     * The offending token, or {@code null} when the error is not tied to one.
     */
    public Token getToken() {
        return token;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    public String getExpected() {
        return expected;
    }

    public String getContext() {
        return context;
    }

    /**
     * The message without the error type and position decoration.
     */
    public String getDetail() {
        return detail;
    }
}
