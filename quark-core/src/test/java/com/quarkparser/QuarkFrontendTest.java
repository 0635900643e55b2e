package com.quarkparser;

import com.quarkparser.ast.AstPrinter;
import com.quarkparser.ast.CompilationUnit;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

public class QuarkFrontendTest {

    private static final String PROGRAM = """
        use io

        fn fib n:
            when n:
                0 or 1: n
                _: fib(n - 1) + fib(n - 2)

        for i in 0..10:
            @print fib i
        """;

    @Test
    void testCompileSuccess() {
        ParseResult<CompilationUnit> result = QuarkFrontend.compile(PROGRAM);
        assertTrue(result.succeeded());
        assertTrue(result.error().isEmpty());
        assertEquals(3, result.orElseThrow().body().size());
    }

    @Test
    void testCompileMatchesParser() {
        CompilationUnit viaFrontend = QuarkFrontend.compile(PROGRAM).orElseThrow();
        CompilationUnit viaParser = Parser.parse(PROGRAM);
        assertEquals(AstPrinter.print(viaParser), AstPrinter.print(viaFrontend));
    }

    @Test
    void testLexicalFailure() {
        ParseResult<CompilationUnit> result = QuarkFrontend.compile("a = $\nb = ?\n");
        assertFalse(result.succeeded());
        ParseException error = result.error().orElseThrow();
        assertInstanceOf(LexicalException.class, error);
        assertEquals(2, ((LexicalException) error).getErrors().size());
        assertEquals("LexicalError", error.getErrorType());
    }

    @Test
    void testIndentationFailure() {
        ParseResult<CompilationUnit> result = QuarkFrontend.compile("x = 1\n    y = 2\n");
        ParseException error = result.error().orElseThrow();
        assertInstanceOf(IndentationException.class, error);
        assertEquals("IndentationError: indentation increase but not in new block (line 2, column 5)",
            error.getMessage());
    }

    @Test
    void testSyntaxFailure() {
        ParseResult<CompilationUnit> result = QuarkFrontend.compile("if x\n");
        ParseException error = result.error().orElseThrow();
        assertEquals("SyntaxError", error.getErrorType());
        assertEquals("':' after if condition", error.getExpected());
    }

    @Test
    void testOrElseThrowRethrowsStoredError() {
        ParseResult<CompilationUnit> result = QuarkFrontend.compile("* 2");
        ParseException thrown = assertThrows(ParseException.class, result::orElseThrow);
        assertSame(result.error().orElseThrow(), thrown);
    }

    @Test
    void testFailureShortCircuitsLaterStages() {
        AtomicBoolean ran = new AtomicBoolean(false);
        ParseResult<List<Token>> scanned = QuarkFrontend.scan("'open", ParserOptions.DEFAULT);
        ParseResult<Integer> mapped = scanned
            .map(List::size)
            .flatMap(size -> {
                ran.set(true);
                return ParseResult.success(size);
            });
        assertFalse(ran.get());
        assertFalse(mapped.succeeded());
        assertSame(scanned.error().orElseThrow(), mapped.error().orElseThrow());
    }

    @Test
    void testStagesCanRunSeparately() {
        ParseResult<List<Token>> scanned = QuarkFrontend.scan("if a:\n    b\n", ParserOptions.DEFAULT);
        List<Token> primitive = scanned.orElseThrow();
        assertFalse(primitive.stream().anyMatch(t -> t.type() == TokenType.INDENT));

        List<Token> normalized = QuarkFrontend.normalize(primitive).orElseThrow();
        assertEquals(TokenType.EOF, normalized.get(normalized.size() - 1).type());
        assertTrue(normalized.stream().anyMatch(t -> t.type() == TokenType.INDENT));

        ParseResult<CompilationUnit> parsed = QuarkFrontend.parse(normalized, ParserOptions.DEFAULT);
        assertEquals(1, parsed.orElseThrow().body().size());
    }

    @Test
    void testFailureCarriesItsCause() {
        ParseException cause = new ParseException("SyntaxError", 3, 7, "test", "broken");
        ParseResult<String> result = ParseResult.failure(cause);

        assertInstanceOf(ParseResult.Failure.class, result);
        assertSame(cause, ((ParseResult.Failure<String>) result).cause());
        assertSame(cause, result.error().orElseThrow());
        assertEquals(new ParseResult.Failure<String>(cause), result);
        assertTrue(ParseResult.success("ok").error().isEmpty());
    }

    @Test
    void testMapTransformsSuccess() {
        ParseResult<Integer> count = QuarkFrontend.compile("a\nb\n").map(unit -> unit.body().size());
        assertEquals(Integer.valueOf(2), count.orElseThrow());
    }

    @Test
    void testCompilationsAreIndependent() {
        assertFalse(QuarkFrontend.compile("if x\n").succeeded());
        assertTrue(QuarkFrontend.compile("x\n").succeeded());
    }

    @Test
    void testSourceNameAndTabWidthOptions() {
        ParserOptions options = ParserOptions.DEFAULT.withSourceName("main.qk").withTabWidth(4);
        assertEquals("main.qk", options.sourceName());
        assertEquals(4, options.tabWidth());

        // one tab and four spaces are the same level at tab width 4
        assertTrue(QuarkFrontend.compile("if a:\n\tb\n    c\n", options).succeeded());
        assertFalse(QuarkFrontend.compile("if a:\n\tb\n    c\n").succeeded());
    }

    @Test
    void testInvalidTabWidth() {
        assertThrows(IllegalArgumentException.class, () -> ParserOptions.DEFAULT.withTabWidth(0));
    }
}
