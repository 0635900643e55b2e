package com.quarkparser.ast;

import com.quarkparser.Token;

import java.util.List;

/**
 * {@code module name: body}.
 */
public record ModuleDeclaration(Token token, Identifier name, Block body) implements Statement {

    @Override
    public NodeType type() {
        return NodeType.Module;
    }

    @Override
    public List<Node> children() {
        return List.of(name, body);
    }
}
