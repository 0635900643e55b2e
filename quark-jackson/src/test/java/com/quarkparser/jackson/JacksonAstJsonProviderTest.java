package com.quarkparser.jackson;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.quarkparser.Parser;
import com.quarkparser.ast.AstPrinter;
import com.quarkparser.ast.CompilationUnit;
import com.quarkparser.ast.Expression;
import com.quarkparser.ast.Identifier;
import com.quarkparser.ast.Literal;
import com.quarkparser.ast.Node;
import com.quarkparser.json.AstJsonException;
import com.quarkparser.json.AstJsonProvider;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class JacksonAstJsonProviderTest {

    private static final String PROGRAM = """
        use io

        module shapes:
            fn area kind, size:
                when kind:
                    'square' or 'box': size ** 2
                    _: 0

        for s in [1, 2.5, 3]:
            @print(area 'square', s)
            big = s if s > 2 else 0
            [s] | map double
        """;

    private final JacksonAstJsonProvider provider = new JacksonAstJsonProvider();

    @Test
    void testRoundTripRestoresEqualTree() {
        CompilationUnit unit = Parser.parse(PROGRAM);
        String json = provider.getSerializer().serialize(unit);
        CompilationUnit copy = provider.getDeserializer().deserializeCompilationUnit(json);

        assertEquals(AstPrinter.print(unit), AstPrinter.print(copy));
        assertEquals(unit, copy);
    }

    @Test
    void testPrettyOutputReadsBack() {
        CompilationUnit unit = Parser.parse("if a: b\nelse: c\n");
        String pretty = provider.getSerializer().serializePretty(unit);
        assertTrue(pretty.contains("\n"));
        assertEquals(unit, provider.getDeserializer().deserializeCompilationUnit(pretty));
    }

    @Test
    @DisplayName("Every node carries its kind in the type property")
    void testTypeDiscriminator() throws Exception {
        CompilationUnit unit = Parser.parse("use io\nmodule m: x\n");
        ObjectMapper mapper = provider.getObjectMapper();
        JsonNode tree = mapper.readTree(provider.getSerializer().serialize(unit));

        assertEquals("CompilationUnit", tree.get("type").asText());
        JsonNode body = tree.get("body");
        assertEquals("Use", body.get(0).get("type").asText());
        assertEquals("Module", body.get(1).get("type").asText());
        assertEquals("Identifier", body.get(1).get("name").get("type").asText());
        assertEquals("Block", body.get(1).get("body").get("type").asText());
    }

    @Test
    void testTokenIsWrittenAsPlainObject() throws Exception {
        Node literal = Parser.parse("  \n42").body().get(0);
        JsonNode token = provider.getObjectMapper()
            .readTree(provider.getSerializer().serialize(literal))
            .get("token");

        assertEquals("INT", token.get("type").asText());
        assertEquals("42", token.get("lexeme").asText());
        assertEquals(42, token.get("literal").asInt());
        assertEquals(2, token.get("line").asInt());
        assertEquals(1, token.get("column").asInt());
    }

    @Test
    void testOptionalChildrenAreWrittenAsNull() throws Exception {
        ObjectMapper mapper = provider.getObjectMapper();

        JsonNode ifStatement = mapper.readTree(provider.getSerializer().serialize(Parser.parse("if a: b").body().get(0)));
        assertTrue(ifStatement.has("alternate"));
        assertTrue(ifStatement.get("alternate").isNull());

        JsonNode call = mapper.readTree(provider.getSerializer().serialize(Parser.parse("f x").body().get(0)));
        assertTrue(call.has("token"));
        assertTrue(call.get("token").isNull());

        // other null values are left out
        JsonNode identifierToken = call.get("callee").get("token");
        assertFalse(identifierToken.has("literal"));
    }

    @Test
    void testLiteralValueTypesSurvive() {
        CompilationUnit unit = Parser.parse("[1, 2.0, 'three']");
        CompilationUnit copy = provider.getDeserializer()
            .deserializeCompilationUnit(provider.getSerializer().serialize(unit));

        List<Expression> elements = ((Literal) copy.body().get(0)).elements();
        assertEquals(Long.class, ((Literal) elements.get(0)).value().getClass());
        assertEquals(Double.class, ((Literal) elements.get(1)).value().getClass());
        assertEquals("three", ((Literal) elements.get(2)).value());
    }

    @Test
    void testDeserializeSingleNode() {
        Expression expression = (Expression) Parser.parse("a + b * 2").body().get(0);
        String json = provider.getSerializer().serialize(expression);

        assertEquals(expression, provider.getDeserializer().deserialize(json, Expression.class));
        assertEquals(expression, provider.getDeserializer().deserialize(json, Node.class));
    }

    @Test
    void testUnknownPropertiesAreIgnored() {
        String json = """
            {"type": "Identifier", "comment": "added later",
             "token": {"type": "ID", "lexeme": "x", "line": 1, "column": 1, "position": 0, "endPosition": 1}}
            """;
        Identifier identifier = provider.getDeserializer().deserialize(json, Identifier.class);
        assertEquals(Parser.parse("x").body().get(0), identifier);
    }

    @Test
    void testMalformedJson() {
        AstJsonException e = assertThrows(AstJsonException.class,
            () -> provider.getDeserializer().deserializeCompilationUnit("{\"type\": \"CompilationUnit\", "));
        assertEquals("Failed to deserialize CompilationUnit", e.getMessage());
        assertNotNull(e.getCause());
    }

    @Test
    void testWrongNodeClass() {
        String json = provider.getSerializer().serialize(Parser.parse("x").body().get(0));
        assertThrows(AstJsonException.class, () -> provider.getDeserializer().deserialize(json, Literal.class));
    }

    @Test
    void testUnknownTokenType() {
        String json = """
            {"type": "Identifier", "token": {"type": "NOPE", "lexeme": "x"}}
            """;
        assertThrows(AstJsonException.class, () -> provider.getDeserializer().deserialize(json, Identifier.class));
    }

    @Test
    void testProviderIsDiscovered() {
        assertTrue(AstJsonProvider.isProviderAvailable());
        assertInstanceOf(JacksonAstJsonProvider.class, AstJsonProvider.getProvider());
        assertEquals("Jackson", AstJsonProvider.getProvider("jackson").getName());
        assertEquals(List.of("Jackson"), AstJsonProvider.availableProviders());
    }
}
