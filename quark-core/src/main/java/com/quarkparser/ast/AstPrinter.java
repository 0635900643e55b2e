package com.quarkparser.ast;

import com.quarkparser.Token;

/**
 * Renders a tree as an outline, one node per line, indented with one tab per level:
 *
 * <pre>
 * IfStatement[if]
 * 	Identifier[x]
 * 	Block
 * 		Identifier[y]
 * </pre>
 *
 * Source positions are not printed, so two trees print the same exactly when they have the same
 * shape, kinds and token values.
 */
public final class AstPrinter {

    private AstPrinter() {
        // Utility class
    }

    public static String print(Node node) {
        StringBuilder sb = new StringBuilder();
        print(node, 0, sb);
        return sb.toString();
    }

    private static void print(Node node, int depth, StringBuilder sb) {
        sb.append("\t".repeat(depth)).append(label(node)).append('\n');
        for (Node child : node.children()) {
            print(child, depth + 1, sb);
        }
    }

    /**
     * {@code Kind[value]}, or just {@code Kind} for nodes without a token.
     */
    public static String label(Node node) {
        Token token = node.token();
        if (token == null) {
            return node.type().name();
        }
        return node.type().name() + "[" + token.value() + "]";
    }
}
