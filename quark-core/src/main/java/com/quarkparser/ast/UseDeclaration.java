package com.quarkparser.ast;

import com.quarkparser.Token;

import java.util.List;

/**
 * {@code use name}. The name is recorded, not resolved.
 */
public record UseDeclaration(Token token, Identifier name) implements Statement {

    @Override
    public NodeType type() {
        return NodeType.Use;
    }

    @Override
    public List<Node> children() {
        return List.of(name);
    }
}
