package com.quarkparser.ast;

import com.quarkparser.Token;

import java.util.List;

public record CompilationUnit(List<Statement> body) implements Node {

    public CompilationUnit {
        body = List.copyOf(body);
    }

    @Override
    public NodeType type() {
        return NodeType.CompilationUnit;
    }

    @Override
    public Token token() {
        return null;
    }

    @Override
    public List<Node> children() {
        return List.copyOf(body);
    }
}
