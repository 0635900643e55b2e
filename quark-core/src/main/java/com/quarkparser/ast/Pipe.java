package com.quarkparser.ast;

import com.quarkparser.Token;

import java.util.List;

public record Pipe(Token token, Expression left, Expression right) implements Expression {

    @Override
    public NodeType type() {
        return NodeType.Pipe;
    }

    @Override
    public List<Node> children() {
        return List.of(left, right);
    }
}
