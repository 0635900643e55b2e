package com.quarkparser.ast;

import com.quarkparser.Token;

import java.util.List;

/**
 * Unary, binary, member access and map-entry nodes. The token is the operator symbol
 * ({@code .} for member access, {@code :} for a map entry).
 */
public record Operator(Token token, List<Expression> operands) implements Expression {

    public Operator {
        operands = List.copyOf(operands);
    }

    public Operator(Token token, Expression operand) {
        this(token, List.of(operand));
    }

    public Operator(Token token, Expression left, Expression right) {
        this(token, List.of(left, right));
    }

    public String symbol() {
        return token.lexeme();
    }

    @Override
    public NodeType type() {
        return NodeType.Operator;
    }

    @Override
    public List<Node> children() {
        return List.copyOf(operands);
    }
}
