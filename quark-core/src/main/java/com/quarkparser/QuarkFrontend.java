package com.quarkparser;

import com.quarkparser.ast.CompilationUnit;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;

/**
 * Runs the front end as three stages, scan, normalize and parse, each returning a
 * {@link ParseResult}. The first failing stage ends the pipeline.
 *
 * <p>Every call works on fresh state, so independent sources may be compiled concurrently.</p>
 */
public final class QuarkFrontend {
    private static final Logger log = LogManager.getLogger(QuarkFrontend.class);

    private QuarkFrontend() {
        // Utility class
    }

    public static ParseResult<CompilationUnit> compile(String source) {
        return compile(source, ParserOptions.DEFAULT);
    }

    public static ParseResult<CompilationUnit> compile(String source, ParserOptions options) {
        ParseResult<CompilationUnit> result = scan(source, options)
            .flatMap(QuarkFrontend::normalize)
            .flatMap(tokens -> parse(tokens, options));
        result.error().ifPresent(e -> log.debug("{} failed: {}", options.sourceName(), e.getMessage()));
        return result;
    }

    /**
     * Primitive tokens of {@code source}, or all lexical errors found in it.
     */
    public static ParseResult<List<Token>> scan(String source, ParserOptions options) {
        try {
            return ParseResult.success(new Lexer(source, options).tokenize());
        } catch (LexicalException e) {
            return ParseResult.failure(e);
        }
    }

    public static ParseResult<List<Token>> normalize(List<Token> tokens) {
        try {
            return ParseResult.success(new IndentationNormalizer().normalize(tokens));
        } catch (IndentationException e) {
            return ParseResult.failure(e);
        }
    }

    public static ParseResult<CompilationUnit> parse(List<Token> tokens, ParserOptions options) {
        try {
            return ParseResult.success(new Parser(tokens, options).parse());
        } catch (ParseException e) {
            return ParseResult.failure(e);
        }
    }
}
