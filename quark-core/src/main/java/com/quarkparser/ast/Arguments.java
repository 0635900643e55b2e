package com.quarkparser.ast;

import com.quarkparser.Token;

import java.util.List;

public record Arguments(List<Expression> values) implements Node {

    public Arguments {
        values = List.copyOf(values);
    }

    @Override
    public NodeType type() {
        return NodeType.Arguments;
    }

    @Override
    public Token token() {
        return null;
    }

    @Override
    public List<Node> children() {
        return List.copyOf(values);
    }
}
