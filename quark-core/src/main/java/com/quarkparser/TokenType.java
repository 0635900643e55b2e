package com.quarkparser;

public enum TokenType {
    // Identifiers and keywords
    ID,
    USE,
    MODULE,
    IN,
    AND,
    OR,
    IF,
    ELSEIF,
    ELSE,
    FOR,
    WHILE,
    WHEN,
    FN,
    CLASS,

    // Literals
    INT,
    FLOAT,
    STR,

    // Operators
    PLUS,           // +
    MINUS,          // -
    STAR,           // *
    SLASH,          // /
    PERCENT,        // %
    STAR_STAR,      // **
    AMPERSAND,      // &
    TILDE,          // ~
    BANG,           // !
    ASSIGN,         // =
    LT,             // <
    GT,             // >
    LE,             // <=
    GE,             // >=
    EQ,             // ==
    NE,             // !=
    DOT,            // .
    DOT_DOT,        // ..
    AT,             // @
    COMMA,          // ,
    COLON,          // :
    PIPE,           // |
    UNDERSCORE,     // _

    // Grouping
    LPAREN,         // (
    RPAREN,         // )
    LBRACKET,       // [
    RBRACKET,       // ]
    LBRACE,         // {
    RBRACE,         // }

    // Produced by the lexer, consumed by the indentation normalizer
    WS,
    NEWLINE,

    // Synthesized by the indentation normalizer
    INDENT,
    DEDENT,
    EOF
}
