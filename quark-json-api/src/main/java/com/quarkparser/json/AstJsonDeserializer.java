package com.quarkparser.json;

import com.quarkparser.ast.CompilationUnit;
import com.quarkparser.ast.Node;

/**
 * Rebuilds Quark trees from the JSON an {@link AstJsonSerializer} writes. The node kind is taken
 * from each object's {@code "type"} property, and properties no node declares are skipped.
 */
public interface AstJsonDeserializer {

    /**
     * @throws AstJsonException if the JSON is malformed or its root is not a CompilationUnit
     */
    CompilationUnit deserializeCompilationUnit(String json) throws AstJsonException;

    /**
     * Reads a subtree whose root must be a {@code type}, e.g. {@code Expression.class} for the
     * JSON of an operand.
     *
     * @throws AstJsonException if the JSON is malformed or its root is some other kind of node
     */
    <T extends Node> T deserialize(String json, Class<T> type) throws AstJsonException;
}
