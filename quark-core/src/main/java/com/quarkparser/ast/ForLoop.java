package com.quarkparser.ast;

import com.quarkparser.Token;

import java.util.List;

public record ForLoop(Token token, Identifier variable, Expression iterable, Block body) implements Statement {

    @Override
    public NodeType type() {
        return NodeType.ForLoop;
    }

    @Override
    public List<Node> children() {
        return List.of(variable, iterable, body);
    }
}
