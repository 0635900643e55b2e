package com.quarkparser;

import com.quarkparser.IndentationNormalizer.TaggedToken;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.quarkparser.TokenType.*;
import static org.junit.jupiter.api.Assertions.*;

public class IndentationNormalizerTest {

    private static List<Token> normalize(String source) {
        return new IndentationNormalizer().normalize(new Lexer(source).tokenize());
    }

    private static List<TokenType> types(String source) {
        return normalize(source).stream().map(Token::type).toList();
    }

    private static long count(List<TokenType> types, TokenType type) {
        return types.stream().filter(t -> t == type).count();
    }

    @Test
    @DisplayName("Flat programs get one NEWLINE per non-blank line and no INDENT/DEDENT")
    void testFlatProgram() {
        List<TokenType> types = types("a = 1\n\nb = a + 2\n   \n@print b\n");
        assertEquals(0, count(types, INDENT));
        assertEquals(0, count(types, DEDENT));
        assertEquals(3, count(types, NEWLINE));
        assertEquals(EOF, types.get(types.size() - 1));
    }

    @Test
    void testIndentAndDedent() {
        assertEquals(
            List.of(IF, ID, COLON, NEWLINE, INDENT, ID, NEWLINE, DEDENT, ID, NEWLINE, EOF),
            types("if x:\n    y\nz\n"));
    }

    @Test
    void testRemainingLevelsAreClosedAtEndOfInput() {
        assertEquals(
            List.of(ID, COLON, NEWLINE, INDENT, ID, COLON, NEWLINE, INDENT, ID, NEWLINE, DEDENT, DEDENT, EOF),
            types("a:\n  b:\n    c\n"));
    }

    @Test
    void testDedentAcrossSeveralLevels() {
        List<TokenType> types = types("a:\n  b:\n    c\nd\n");
        assertEquals(
            List.of(ID, COLON, NEWLINE, INDENT, ID, COLON, NEWLINE, INDENT, ID, NEWLINE, DEDENT, DEDENT, ID, NEWLINE, EOF),
            types);
    }

    @Test
    void testIndentsAndDedentsBalance() {
        String source = """
            module shapes:
                fn area shape:
                    when shape.kind:
                        'square': shape.side ** 2
                        _: 0

                fn describe s:
                    if area s > 10:
                        @print 'big'
                    else:
                        @print 'small'
            @print 'done'
            """;
        List<TokenType> types = types(source);
        assertEquals(count(types, INDENT), count(types, DEDENT));
        assertEquals(6, count(types, INDENT));
    }

    @Test
    void testBlankAndCommentLinesInsideBlock() {
        assertEquals(
            List.of(ID, COLON, NEWLINE, INDENT, ID, NEWLINE, ID, NEWLINE, DEDENT, EOF),
            types("a:\n    b\n    // note\n\n  \n    c\n"));
    }

    @Test
    @DisplayName("Newlines inside parentheses do not touch the indentation stack")
    void testParenthesizedContinuationLines() {
        assertEquals(
            List.of(ID, ASSIGN, LPAREN, INT, PLUS, INT, RPAREN, NEWLINE, ID, NEWLINE, EOF),
            types("x = (1 +\n        2)\ny\n"));
    }

    @Test
    void testInlineBlockDoesNotRequireIndent() {
        List<TokenType> types = types("if x: y\nz\n");
        assertEquals(0, count(types, INDENT));
        assertEquals(2, count(types, NEWLINE));
    }

    @Test
    void testIndentWithoutColonIsRejected() {
        IndentationException e = assertThrows(IndentationException.class, () -> normalize("a\n    b\n"));
        assertEquals("indentation increase but not in new block", e.getDetail());
        assertEquals("IndentationError", e.getErrorType());
        assertEquals(2, e.getLine());
    }

    @Test
    void testMissingIndentedBlock() {
        IndentationException e = assertThrows(IndentationException.class, () -> normalize("if x:\ny\n"));
        assertEquals("expected an indented block", e.getDetail());
    }

    @Test
    void testInconsistentDedent() {
        IndentationException e = assertThrows(IndentationException.class,
            () -> normalize("a:\n    b:\n        c\n      d\n"));
        assertEquals("inconsistent indentation", e.getDetail());
        assertEquals(4, e.getLine());
        assertEquals("d", e.getToken().lexeme());
    }

    @Test
    void testEmptyInput() {
        List<Token> tokens = normalize("");
        assertEquals(1, tokens.size());
        Token eof = tokens.get(0);
        assertEquals(EOF, eof.type());
        assertEquals(1, eof.line());
        assertEquals(1, eof.column());
    }

    @Test
    void testSynthesizedTokensArePositionedAtTheRealToken() {
        List<Token> tokens = normalize("a:\n    b\nc\n");
        Token indent = tokens.get(3);
        Token dedent = tokens.get(6);
        assertEquals(INDENT, indent.type());
        assertEquals(2, indent.line());
        assertEquals(5, indent.column());
        assertEquals(DEDENT, dedent.type());
        assertEquals(3, dedent.line());
        assertEquals("", dedent.lexeme());
    }

    @Test
    void testTagLineStarts() {
        List<TaggedToken> tagged = new IndentationNormalizer().tagLineStarts(new Lexer("a:\n  b c").tokenize());
        assertEquals(List.of(ID, COLON, NEWLINE, WS, ID, ID), tagged.stream().map(TaggedToken::type).toList());

        TaggedToken a = tagged.get(0);
        TaggedToken b = tagged.get(4);
        TaggedToken c = tagged.get(5);
        assertTrue(a.atLineStart());
        assertFalse(a.mustIndent());
        assertTrue(b.atLineStart());
        assertTrue(b.mustIndent());
        assertFalse(c.atLineStart());
        assertFalse(c.mustIndent());
    }

    @Test
    void testColonFollowedByTokenOnSameLineResetsIndentState() {
        List<TaggedToken> tagged = new IndentationNormalizer().tagLineStarts(new Lexer("if a: b\nc").tokenize());
        assertTrue(tagged.stream().noneMatch(TaggedToken::mustIndent));
    }
}
