package com.quarkparser;

public class UnexpectedTokenException extends ParseException {
    public UnexpectedTokenException(Token token, String context) {
        super("SyntaxError", token, null, context,
            token.type() == TokenType.EOF
                ? "Unexpected end of input"
                : "Unexpected " + ExpectedTokenException.describe(token) + " in " + context);
    }
}
