package com.quarkparser.ast;

/**
 * An expression. Any expression may stand as a statement.
 */
public sealed interface Expression extends Statement permits
    Identifier,
    Literal,
    Operator,
    Ternary,
    Pipe,
    FunctionCall {
}
