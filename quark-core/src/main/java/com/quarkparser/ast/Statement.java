package com.quarkparser.ast;

public sealed interface Statement extends Node permits
    Expression,
    IfStatement,
    WhenStatement,
    ForLoop,
    WhileLoop,
    Function,
    ModuleDeclaration,
    UseDeclaration {
}
