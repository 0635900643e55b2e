package com.quarkparser;

public class ExpectedTokenException extends ParseException {
    public ExpectedTokenException(String expected, Token token) {
        super("SyntaxError", token, expected, null,
            "Expected " + expected + " but found " + describe(token));
    }

    static String describe(Token token) {
        if (token.type() == TokenType.EOF) {
            return "end of input";
        }
        if (token.lexeme().isEmpty() || token.type() == TokenType.NEWLINE || token.type() == TokenType.WS) {
            return token.type().name();
        }
        return token.type() + " '" + token.lexeme() + "'";
    }
}
