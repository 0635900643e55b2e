package com.quarkparser.ast;

import com.quarkparser.Token;

import java.util.ArrayList;
import java.util.List;

/**
 * {@code if}/{@code elseif}/{@code else} chain. Each {@code elseif} clause is a nested
 * IfStatement with no clauses of its own.
 */
public record IfStatement(
    Token token,
    Expression condition,
    Block consequent,
    List<IfStatement> elseIfs,
    Block alternate  // Can be null
) implements Statement {

    public IfStatement {
        elseIfs = elseIfs == null ? List.of() : List.copyOf(elseIfs);
    }

    public IfStatement(Token token, Expression condition, Block consequent) {
        this(token, condition, consequent, List.of(), null);
    }

    @Override
    public NodeType type() {
        return NodeType.IfStatement;
    }

    @Override
    public List<Node> children() {
        List<Node> children = new ArrayList<>(elseIfs.size() + 3);
        children.add(condition);
        children.add(consequent);
        children.addAll(elseIfs);
        if (alternate != null) {
            children.add(alternate);
        }
        return List.copyOf(children);
    }
}
