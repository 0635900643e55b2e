package com.quarkparser.ast;

import com.quarkparser.Token;

import java.util.List;

/**
 * A scalar literal (INT, FLOAT or STR token, no elements), a list literal ({@code [} token,
 * elements in order) or a map literal ({@code {} token, one key/value {@link Operator} per entry).
 */
public record Literal(Token token, List<Expression> elements) implements Expression {

    public Literal {
        elements = elements == null ? List.of() : List.copyOf(elements);
    }

    public Literal(Token token) {
        this(token, List.of());
    }

    public Object value() {
        return token.value();
    }

    @Override
    public NodeType type() {
        return NodeType.Literal;
    }

    @Override
    public List<Node> children() {
        return List.copyOf(elements);
    }
}
