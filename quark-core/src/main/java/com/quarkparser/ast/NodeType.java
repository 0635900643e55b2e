package com.quarkparser.ast;

/**
 * The closed set of AST node kinds.
 */
public enum NodeType {
    CompilationUnit,
    Block,
    IfStatement,
    WhenStatement,
    Pattern,
    ForLoop,
    WhileLoop,
    Function,
    FunctionCall,
    Arguments,
    Identifier,
    Literal,
    Operator,
    Ternary,
    Pipe,
    Module,
    Use
}
