package com.quarkparser.ast;

import com.quarkparser.Token;

import java.util.List;

/**
 * {@code whenTrue if condition else whenFalse}. Children are ordered condition, true branch,
 * false branch.
 */
public record Ternary(Token token, Expression condition, Expression whenTrue, Expression whenFalse) implements Expression {

    @Override
    public NodeType type() {
        return NodeType.Ternary;
    }

    @Override
    public List<Node> children() {
        return List.of(condition, whenTrue, whenFalse);
    }
}
