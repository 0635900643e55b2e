package com.quarkparser.ast;

import com.quarkparser.Token;

import java.util.List;

/**
 * A statement list, written either as an indented suite or inline after a {@code ':'}.
 */
public record Block(List<Statement> statements) implements Node {

    public Block {
        statements = List.copyOf(statements);
    }

    @Override
    public NodeType type() {
        return NodeType.Block;
    }

    @Override
    public Token token() {
        return null;
    }

    @Override
    public List<Node> children() {
        return List.copyOf(statements);
    }
}
