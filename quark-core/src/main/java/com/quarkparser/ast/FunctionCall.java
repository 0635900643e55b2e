package com.quarkparser.ast;

import com.quarkparser.Token;

import java.util.List;

/**
 * A call. Directive calls ({@code @name args}) carry the {@code @} token; calls written by
 * juxtaposition have no token.
 */
public record FunctionCall(
    Token token,  // Can be null
    Expression callee,
    Arguments arguments
) implements Expression {

    public FunctionCall(Expression callee, Arguments arguments) {
        this(null, callee, arguments);
    }

    @Override
    public NodeType type() {
        return NodeType.FunctionCall;
    }

    @Override
    public List<Node> children() {
        return List.of(callee, arguments);
    }
}
