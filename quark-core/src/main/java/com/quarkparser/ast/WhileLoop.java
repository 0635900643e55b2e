package com.quarkparser.ast;

import com.quarkparser.Token;

import java.util.List;

public record WhileLoop(Token token, Expression condition, Block body) implements Statement {

    @Override
    public NodeType type() {
        return NodeType.WhileLoop;
    }

    @Override
    public List<Node> children() {
        return List.of(condition, body);
    }
}
