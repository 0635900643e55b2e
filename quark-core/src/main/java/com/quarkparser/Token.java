package com.quarkparser;

/**
 * A single lexical token.
 *
 * <p>{@code literal} holds the decoded value for literal tokens: a {@link Long} for {@code INT},
 * a {@link Double} for {@code FLOAT}, the text between the quotes for {@code STR} and the
 * indentation width (an {@link Integer}) for {@code WS}. It is {@code null} for every other kind.
 * Tokens synthesized by the indentation normalizer have an empty lexeme.</p>
 */
public record Token(
    TokenType type,
    String lexeme,
    Object literal,
    int line,
    int column,
    int position,
    int endPosition
) {
    public Token(TokenType type, String lexeme, int line, int column) {
        this(type, lexeme, null, line, column, 0, 0);
    }

    /**
     * Creates a structural token (INDENT, DEDENT or EOF) positioned at {@code anchor}.
     */
    public static Token synthesized(TokenType type, Token anchor) {
        if (anchor == null) {
            return new Token(type, "", null, 1, 1, 0, 0);
        }
        return new Token(type, "", null, anchor.line(), anchor.column(), anchor.position(), anchor.position());
    }

    /**
     * The rendered value of this token: the literal when there is one, otherwise the lexeme.
     */
    public Object value() {
        return literal != null ? literal : lexeme;
    }

    @Override
    public String toString() {
        if (lexeme == null || lexeme.isEmpty()) {
            return type + " @" + line + ":" + column;
        }
        return type + " '" + lexeme + "' @" + line + ":" + column;
    }
}
