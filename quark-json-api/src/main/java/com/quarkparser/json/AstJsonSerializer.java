package com.quarkparser.json;

import com.quarkparser.ast.Node;

/**
 * Writes a Quark tree, or any subtree of it, as one JSON object. For {@code x = 1}:
 *
 * <pre>
 * {"type":"Operator","token":{"type":"ASSIGN","lexeme":"=",...},
 *  "operands":[{"type":"Identifier",...},{"type":"Literal",...}]}
 * </pre>
 *
 * Tokens keep their source position, so a tree read back through {@link AstJsonDeserializer}
 * equals the one that was written.
 */
public interface AstJsonSerializer {

    /**
     * @throws AstJsonException if the node cannot be written
     */
    String serialize(Node node) throws AstJsonException;

    /**
     * Multi-line form of {@link #serialize(Node)}; it reads back to the same tree.
     */
    String serializePretty(Node node) throws AstJsonException;
}
