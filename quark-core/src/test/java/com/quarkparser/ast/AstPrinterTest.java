package com.quarkparser.ast;

import com.quarkparser.Parser;
import com.quarkparser.Token;
import com.quarkparser.TokenType;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class AstPrinterTest {

    @Test
    void testOutlineFormat() {
        Token plus = new Token(TokenType.PLUS, "+", 1, 3);
        Operator sum = new Operator(plus,
            new Identifier(new Token(TokenType.ID, "a", 1, 1)),
            new Literal(new Token(TokenType.INT, "2", 2L, 1, 5, 4, 5)));

        assertEquals("Operator[+]\n\tIdentifier[a]\n\tLiteral[2]\n", AstPrinter.print(sum));
    }

    @Test
    void testLabelWithoutToken() {
        assertEquals("Block", AstPrinter.label(new Block(List.of())));
        assertEquals("Arguments", AstPrinter.label(new Arguments(List.of())));
        assertEquals("CompilationUnit", AstPrinter.label(new CompilationUnit(List.of())));
    }

    @Test
    void testStringLiteralPrintsContentWithoutQuotes() {
        Node literal = Parser.parse("'hi there'").body().get(0);
        assertEquals("Literal[hi there]", AstPrinter.label(literal));
    }

    @Test
    void testPositionsAreNotPrinted() {
        String compact = AstPrinter.print(Parser.parse("f(1 + 2)"));
        String spaced = AstPrinter.print(Parser.parse("\n\nf(  1 +\n    2 )\n"));
        assertEquals(compact, spaced);
    }

    @Test
    void testCompilationUnitChildrenAreTopLevelStatements() {
        CompilationUnit unit = Parser.parse("a\nb\n");
        assertEquals("CompilationUnit\n\tIdentifier[a]\n\tIdentifier[b]\n", AstPrinter.print(unit));
        assertEquals(List.copyOf(unit.body()), unit.children());
    }
}
