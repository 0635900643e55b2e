package com.quarkparser.jackson;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.Version;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.quarkparser.Token;
import com.quarkparser.TokenType;
import com.quarkparser.ast.Block;
import com.quarkparser.ast.Expression;
import com.quarkparser.ast.FunctionCall;
import com.quarkparser.ast.IfStatement;
import com.quarkparser.ast.Node;
import com.quarkparser.ast.Pattern;
import com.quarkparser.ast.Statement;
import com.quarkparser.jackson.mixins.NodeMixin;

import java.io.IOException;

/**
 * Jackson module that configures serialization/deserialization for the Quark AST.
 *
 * This module handles:
 * - Polymorphic node types via NodeMixin
 * - Null optional children that must still appear in the output
 * - Token literals, which come back as Long, Double, String or Integer depending on the token kind
 */
public class AstModule extends SimpleModule {

    public AstModule() {
        super("AstModule", new Version(1, 0, 0, null, "com.quarkparser", "quark-jackson"));
        addDeserializer(Token.class, new TokenDeserializer());
    }

    @Override
    public void setupModule(SetupContext context) {
        super.setupModule(context);

        context.setMixInAnnotations(Node.class, NodeMixin.class);
        context.setMixInAnnotations(Statement.class, NodeMixin.class);
        context.setMixInAnnotations(Expression.class, NodeMixin.class);
        context.setMixInAnnotations(Pattern.class, NodeMixin.class);

        context.setMixInAnnotations(IfStatement.class, IfStatementMixin.class);
        context.setMixInAnnotations(FunctionCall.class, FunctionCallMixin.class);
    }

    // ==================== Serialization Mixins ====================

    // alternate is null when there is no else clause
    private abstract static class IfStatementMixin {
        @JsonInclude(JsonInclude.Include.ALWAYS)
        abstract Block alternate();
    }

    // token is null for calls written by juxtaposition
    private abstract static class FunctionCallMixin {
        @JsonInclude(JsonInclude.Include.ALWAYS)
        abstract Token token();
    }

    // ==================== Token Deserializer ====================

    /**
     * Reads a token, converting its literal back to the type the lexer gives it. JSON has a
     * single number type, so without this an INT literal would come back as an Integer.
     */
    static class TokenDeserializer extends StdDeserializer<Token> {

        TokenDeserializer() {
            super(Token.class);
        }

        @Override
        public Token deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
            JsonNode node = p.getCodec().readTree(p);

            String typeName = node.path("type").asText();
            TokenType type;
            try {
                type = TokenType.valueOf(typeName);
            } catch (IllegalArgumentException e) {
                return ctxt.reportInputMismatch(Token.class, "Unknown token type '%s'", typeName);
            }

            return new Token(
                type,
                node.path("lexeme").asText(""),
                literal(type, node.get("literal")),
                node.path("line").asInt(),
                node.path("column").asInt(),
                node.path("position").asInt(),
                node.path("endPosition").asInt()
            );
        }

        private static Object literal(TokenType type, JsonNode literal) {
            if (literal == null || literal.isNull()) {
                return null;
            }
            return switch (type) {
                case INT -> Long.valueOf(literal.asLong());
                case FLOAT -> Double.valueOf(literal.asDouble());
                case WS -> Integer.valueOf(literal.asInt());
                default -> literal.asText();
            };
        }
    }
}
