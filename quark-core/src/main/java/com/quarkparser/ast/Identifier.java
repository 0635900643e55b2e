package com.quarkparser.ast;

import com.quarkparser.Token;

import java.util.List;

public record Identifier(Token token) implements Expression {

    public String name() {
        return token.lexeme();
    }

    @Override
    public NodeType type() {
        return NodeType.Identifier;
    }

    @Override
    public List<Node> children() {
        return List.of();
    }
}
