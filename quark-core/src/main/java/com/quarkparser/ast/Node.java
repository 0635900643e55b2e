package com.quarkparser.ast;

import com.quarkparser.Token;

import java.util.List;

/**
 * Base interface for all Quark AST nodes.
 *
 * <p>Besides its typed components every node exposes a uniform view: its kind, the token it
 * originates from (if any) and its children in a fixed, kind-dependent order. The tree is strict:
 * a node owns its children and no node is shared.</p>
 */
public sealed interface Node permits
    CompilationUnit,
    Block,
    Statement,
    Pattern,
    Arguments {

    NodeType type();

    /**
     * The originating token, or {@code null} for nodes that have none.
     */
    Token token();

    List<Node> children();
}
