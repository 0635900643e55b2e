package com.quarkparser;

import com.quarkparser.ast.Arguments;
import com.quarkparser.ast.Block;
import com.quarkparser.ast.CompilationUnit;
import com.quarkparser.ast.Expression;
import com.quarkparser.ast.ForLoop;
import com.quarkparser.ast.Function;
import com.quarkparser.ast.FunctionCall;
import com.quarkparser.ast.Identifier;
import com.quarkparser.ast.IfStatement;
import com.quarkparser.ast.ModuleDeclaration;
import com.quarkparser.ast.Pattern;
import com.quarkparser.ast.Statement;
import com.quarkparser.ast.UseDeclaration;
import com.quarkparser.ast.WhenStatement;
import com.quarkparser.ast.WhileLoop;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;

/**
 * Recursive-descent parser for Quark statements and blocks. Expressions are delegated to
 * {@link ExpressionParser}.
 *
 * <p>The parser reads an immutable, fully normalized token list (ending in {@code EOF}) through
 * a cursor that only moves forward. A parser instance parses one compilation unit.</p>
 */
public class Parser {
    private static final Logger log = LogManager.getLogger(Parser.class);

    /** Deepest nesting of statements and sub-expressions accepted before parsing stops. */
    static final int MAX_NESTING_DEPTH = 500;

    private final List<Token> tokens;
    private final ParserOptions options;
    private final ExpressionParser expressions;
    private int current = 0;
    private int nestingDepth = 0;               // open statements and sub-expressions

    public Parser(String source) {
        this(source, ParserOptions.DEFAULT);
    }

    public Parser(String source, ParserOptions options) {
        this(new IndentationNormalizer().normalize(new Lexer(source, options).tokenize()), options);
    }

    /**
     * Creates a parser over an already normalized token stream.
     *
     * @throws IllegalArgumentException if the stream does not end with {@code EOF}
     */
    public Parser(List<Token> tokens, ParserOptions options) {
        if (tokens.isEmpty() || tokens.get(tokens.size() - 1).type() != TokenType.EOF) {
            throw new IllegalArgumentException("Token stream must end with EOF");
        }
        this.tokens = List.copyOf(tokens);
        this.options = options;
        this.expressions = new ExpressionParser(this);
    }

    public CompilationUnit parse() {
        log.debug("parse compilation unit {}", options.sourceName());
        List<Statement> body = new ArrayList<>();
        while (!isAtEnd()) {
            if (match(TokenType.NEWLINE)) {
                continue;
            }
            body.add(parseStatement());
        }
        log.debug("parsed {} top-level statements", body.size());
        return new CompilationUnit(body);
    }

    // ========================================================================
    // Statements
    // ========================================================================

    private Statement parseStatement() {
        enterNesting("statement");
        try {
            return parseStatementKind();
        } finally {
            exitNesting();
        }
    }

    private Statement parseStatementKind() {
        Token token = peek();
        return switch (token.type()) {
            case IF -> parseIfStatement();
            case WHEN -> parseWhenStatement();
            case FOR -> parseForLoop();
            case WHILE -> parseWhileLoop();
            case FN -> parseFunction();
            case MODULE -> parseModule();
            case USE -> parseUse();
            case AT -> parseDirective();
            case ID -> checkAhead(1, TokenType.ASSIGN) && checkAhead(2, TokenType.FN)
                ? parseFunction()
                : expressions.parseExpression();
            default -> expressions.parseExpression();
        };
    }

    /**
     * An indented suite after NEWLINE INDENT, an empty block after a bare NEWLINE,
     * or statements up to the end of the line.
     */
    private Block parseBlock() {
        List<Statement> statements = new ArrayList<>();

        if (check(TokenType.NEWLINE)) {
            advance();
            if (match(TokenType.INDENT)) {
                while (!check(TokenType.DEDENT)) {
                    if (match(TokenType.NEWLINE)) {
                        continue;
                    }
                    if (isAtEnd()) {
                        throw new UnexpectedTokenException(peek(), "block");
                    }
                    statements.add(parseStatement());
                }
                consume(TokenType.DEDENT, "end of block");
            }
            return new Block(statements);
        }

        // a DEDENT directly after the last line of a file closes the enclosing suite
        while (!check(TokenType.NEWLINE) && !check(TokenType.DEDENT) && !isAtEnd()) {
            statements.add(parseStatement());
        }
        match(TokenType.NEWLINE);
        return new Block(statements);
    }

    private IfStatement parseIfStatement() {
        log.debug("parse if statement");
        Token ifToken = advance();
        Expression condition = expressions.parseExpression();
        consume(TokenType.COLON, "':' after if condition");
        Block consequent = parseBlock();

        List<IfStatement> elseIfs = new ArrayList<>();
        while (check(TokenType.ELSEIF)) {
            Token elseIfToken = advance();
            Expression elseIfCondition = expressions.parseExpression();
            consume(TokenType.COLON, "':' after elseif condition");
            elseIfs.add(new IfStatement(elseIfToken, elseIfCondition, parseBlock()));
        }

        Block alternate = null;
        if (match(TokenType.ELSE)) {
            consume(TokenType.COLON, "':' after else");
            alternate = parseBlock();
        }

        return new IfStatement(ifToken, condition, consequent, elseIfs, alternate);
    }

    private WhenStatement parseWhenStatement() {
        log.debug("parse when statement");
        Token whenToken = advance();
        Expression subject = expressions.parseExpression();
        consume(TokenType.COLON, "':' after when subject");
        consume(TokenType.NEWLINE, "line break after 'when ...:'");
        consume(TokenType.INDENT, "indented pattern clauses");

        List<Pattern> patterns = new ArrayList<>();
        while (!check(TokenType.DEDENT)) {
            if (match(TokenType.NEWLINE)) {
                continue;
            }
            if (isAtEnd()) {
                throw new UnexpectedTokenException(peek(), "when statement");
            }
            patterns.add(parsePattern());
        }
        consume(TokenType.DEDENT, "end of when statement");
        return new WhenStatement(whenToken, subject, patterns);
    }

    private Pattern parsePattern() {
        List<Expression> alternatives = new ArrayList<>();
        do {
            if (check(TokenType.UNDERSCORE)) {
                alternatives.add(new Identifier(advance()));
            } else {
                // above logical-or so that 'or' separates alternatives
                alternatives.add(expressions.parsePatternAlternative());
            }
        } while (match(TokenType.OR));

        consume(TokenType.COLON, "':' after pattern");
        Expression result = expressions.parseExpression();
        return new Pattern(alternatives, result);
    }

    private ForLoop parseForLoop() {
        log.debug("parse for loop");
        Token forToken = advance();
        Identifier variable = new Identifier(consume(TokenType.ID, "loop variable after 'for'"));
        if (!check(TokenType.IN)) {
            throw new ParseException("SyntaxError", peek(), "'in'", "for loop",
                "Expected 'in' after loop variable but found " + ExpectedTokenException.describe(peek()));
        }
        advance();
        Expression iterable = expressions.parseExpression();
        consume(TokenType.COLON, "':' after for clause");
        return new ForLoop(forToken, variable, iterable, parseBlock());
    }

    private WhileLoop parseWhileLoop() {
        log.debug("parse while loop");
        Token whileToken = advance();
        Expression condition = expressions.parseExpression();
        consume(TokenType.COLON, "':' after while condition");
        return new WhileLoop(whileToken, condition, parseBlock());
    }

    private Function parseFunction() {
        log.debug("parse function");
        Identifier name;
        Token fnToken;
        if (check(TokenType.FN)) {
            fnToken = advance();
            name = new Identifier(consume(TokenType.ID, "function name after 'fn'"));
        } else {
            name = new Identifier(consume(TokenType.ID, "function name"));
            consume(TokenType.ASSIGN, "'=' after function name");
            fnToken = consume(TokenType.FN, "'fn'");
        }
        Arguments parameters = parseArguments();
        consume(TokenType.COLON, "':' after function parameters");
        return new Function(fnToken, name, parameters, parseBlock());
    }

    private FunctionCall parseDirective() {
        log.debug("parse directive call");
        Token atToken = advance();
        Identifier callee = new Identifier(consume(TokenType.ID, "directive name after '@'"));
        return new FunctionCall(atToken, callee, parseArguments());
    }

    private ModuleDeclaration parseModule() {
        log.debug("parse module");
        Token moduleToken = advance();
        Identifier name = new Identifier(consume(TokenType.ID, "module name"));
        consume(TokenType.COLON, "':' after module name");
        return new ModuleDeclaration(moduleToken, name, parseBlock());
    }

    private UseDeclaration parseUse() {
        Token useToken = advance();
        return new UseDeclaration(useToken, new Identifier(consume(TokenType.ID, "module name after 'use'")));
    }

    /**
     * Comma separated expressions ending before {@code ':'}, NEWLINE, DEDENT or EOF, optionally wrapped
     * in one pair of parentheses.
     */
    private Arguments parseArguments() {
        List<Expression> values = new ArrayList<>();

        if (check(TokenType.LPAREN) && isParenthesizedArgumentList()) {
            advance();
            if (!check(TokenType.RPAREN)) {
                do {
                    values.add(expressions.parseExpression());
                } while (match(TokenType.COMMA));
            }
            consume(TokenType.RPAREN, "')' after arguments");
            return new Arguments(values);
        }

        while (!check(TokenType.COLON) && !check(TokenType.NEWLINE) && !check(TokenType.DEDENT) && !isAtEnd()) {
            values.add(expressions.parseExpression());
            if (!match(TokenType.COMMA)) {
                break;
            }
        }
        return new Arguments(values);
    }

    // The '(' at the cursor wraps the whole list if its ')' is the last token of the list.
    private boolean isParenthesizedArgumentList() {
        int depth = 0;
        for (int i = current; i < tokens.size(); i++) {
            TokenType type = tokens.get(i).type();
            if (type == TokenType.LPAREN) {
                depth++;
            } else if (type == TokenType.RPAREN) {
                depth--;
                if (depth == 0) {
                    TokenType after = i + 1 < tokens.size() ? tokens.get(i + 1).type() : TokenType.EOF;
                    return after == TokenType.COLON || after == TokenType.NEWLINE || after == TokenType.EOF;
                }
            } else if (type == TokenType.EOF) {
                return false;
            }
        }
        return false;
    }

    // ========================================================================
    // Static entry points
    // ========================================================================

    public static CompilationUnit parse(String source) {
        return new Parser(source).parse();
    }

    public static CompilationUnit parse(String source, ParserOptions options) {
        return new Parser(source, options).parse();
    }

    // ========================================================================
    // Nesting
    // ========================================================================

    /**
     * @throws ParseException a SyntaxError at the current token once more than
     *                        {@link #MAX_NESTING_DEPTH} levels are open
     */
    void enterNesting(String context) {
        if (++nestingDepth > MAX_NESTING_DEPTH) {
            throw new ParseException("SyntaxError", peek(), null, context,
                "Nesting exceeds " + MAX_NESTING_DEPTH + " levels");
        }
    }

    void exitNesting() {
        nestingDepth--;
    }

    // ========================================================================
    // Cursor
    // ========================================================================

    boolean match(TokenType... types) {
        for (TokenType type : types) {
            if (check(type)) {
                advance();
                return true;
            }
        }
        return false;
    }

    boolean check(TokenType type) {
        return peek().type() == type;
    }

    boolean checkAhead(int offset, TokenType type) {
        int pos = current + offset;
        if (pos >= tokens.size()) return false;
        return tokens.get(pos).type() == type;
    }

    /**
     * Returns the current token and moves past it.
     *
     * @throws UnexpectedTokenException when the cursor is on EOF
     */
    Token advance() {
        if (isAtEnd()) {
            throw new UnexpectedTokenException(peek(), "input");
        }
        current++;
        return previous();
    }

    boolean isAtEnd() {
        return peek().type() == TokenType.EOF;
    }

    Token peek() {
        return tokens.get(current);
    }

    /**
     * The token {@code offset} positions after the current one; EOF past the end.
     */
    Token peek(int offset) {
        int pos = Math.min(current + offset, tokens.size() - 1);
        return tokens.get(pos);
    }

    Token previous() {
        return tokens.get(current - 1);
    }

    Token consume(TokenType type, String expected) {
        if (check(type)) {
            return advance();
        }
        throw new ExpectedTokenException(expected, peek());
    }
}
