package com.quarkparser.ast;

import com.quarkparser.Token;

import java.util.ArrayList;
import java.util.List;

public record WhenStatement(Token token, Expression subject, List<Pattern> patterns) implements Statement {

    public WhenStatement {
        patterns = List.copyOf(patterns);
    }

    @Override
    public NodeType type() {
        return NodeType.WhenStatement;
    }

    @Override
    public List<Node> children() {
        List<Node> children = new ArrayList<>(patterns.size() + 1);
        children.add(subject);
        children.addAll(patterns);
        return List.copyOf(children);
    }
}
