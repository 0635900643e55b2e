package com.quarkparser.ast;

import com.quarkparser.Token;

import java.util.ArrayList;
import java.util.List;

/**
 * One clause of a {@code when} statement: alternatives joined by {@code or}, then the result.
 * The wildcard alternative is an {@link Identifier} holding the {@code _} token.
 */
public record Pattern(List<Expression> alternatives, Expression result) implements Node {

    public Pattern {
        alternatives = List.copyOf(alternatives);
    }

    @Override
    public NodeType type() {
        return NodeType.Pattern;
    }

    @Override
    public Token token() {
        return null;
    }

    @Override
    public List<Node> children() {
        List<Node> children = new ArrayList<>(alternatives.size() + 1);
        children.addAll(alternatives);
        children.add(result);
        return List.copyOf(children);
    }
}
