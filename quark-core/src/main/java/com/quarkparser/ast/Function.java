package com.quarkparser.ast;

import com.quarkparser.Token;

import java.util.List;

/**
 * Function definition, from either {@code fn name args: body} or {@code name = fn args: body}.
 * The token is the {@code fn} keyword in both forms.
 */
public record Function(Token token, Identifier name, Arguments parameters, Block body) implements Statement {

    @Override
    public NodeType type() {
        return NodeType.Function;
    }

    @Override
    public List<Node> children() {
        return List.of(name, parameters, body);
    }
}
