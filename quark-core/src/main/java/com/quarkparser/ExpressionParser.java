package com.quarkparser;

import com.quarkparser.ast.Arguments;
import com.quarkparser.ast.Expression;
import com.quarkparser.ast.FunctionCall;
import com.quarkparser.ast.Identifier;
import com.quarkparser.ast.Literal;
import com.quarkparser.ast.Operator;
import com.quarkparser.ast.Pipe;
import com.quarkparser.ast.Ternary;

import java.util.ArrayList;
import java.util.List;

/**
 * Pratt parser for Quark expressions, reading tokens through the cursor of its {@link Parser}.
 */
final class ExpressionParser {
    // ========================================================================
    // Binding Power Constants
    // ========================================================================
    // Higher binding power = tighter binding
    static final int BP_ASSIGNMENT = 0;     // =, also the default for tokens without a rule
    static final int BP_PIPE = 1;           // |
    static final int BP_COMMA = 2;          // ,
    static final int BP_TERNARY = 3;        // a if c else b
    static final int BP_LOGICAL_OR = 4;     // or
    static final int BP_LOGICAL_AND = 5;    // and
    static final int BP_BITWISE_AND = 6;    // &
    static final int BP_EQUALITY = 7;       // == !=
    static final int BP_COMPARISON = 8;     // < <= > >=
    static final int BP_RANGE = 9;          // ..
    static final int BP_TERM = 10;          // + -
    static final int BP_FACTOR = 11;        // * / %
    static final int BP_EXPONENT = 12;      // ** (right-associative)
    static final int BP_UNARY = 13;         // prefix ! ~ -
    static final int BP_APPLICATION = 14;   // f x
    static final int BP_ACCESS = 15;        // literals, grouping, member access

    private final Parser p;

    ExpressionParser(Parser parser) {
        this.p = parser;
    }

    Expression parseExpression() {
        return parseExpr(BP_ASSIGNMENT);
    }

    Expression parsePatternAlternative() {
        return parseExpr(BP_LOGICAL_AND);
    }

    // ========================================================================
    // Core loop - parseExpr(int minBp)
    // ========================================================================
    // 1. Parse a prefix expression.
    // 2. Until a terminator, extend it with a ternary, a juxtaposition call or an
    //    infix operator whose binding power is at least minBp.
    // A token that can start an operand is an application argument when the
    // context allows application and the token would not bind as infix here.
    // '-' is the only such token with an infix meaning: '2 * 3 - 1' is '2 * (3 (-1))'.

    Expression parseExpr(int minBp) {
        p.enterNesting("expression");
        try {
            return parseNested(minBp);
        } finally {
            p.exitNesting();
        }
    }

    private Expression parseNested(int minBp) {
        if (p.check(TokenType.IF)) {
            // 'if' only continues an expression: 'a if c else b'
            throw new UnexpectedTokenException(p.peek(), "expression");
        }

        Token token = p.advance();
        Expression left = switch (token.type()) {
            case INT, FLOAT, STR -> prefixLiteral(this, token);
            case ID, UNDERSCORE -> prefixIdentifier(this, token);
            case LPAREN -> prefixGroup(this, token);
            case LBRACKET -> prefixList(this, token);
            case LBRACE -> prefixMap(this, token);
            case MINUS, BANG, TILDE -> prefixUnary(this, token);
            default -> throw new UnexpectedTokenException(token, "expression");
        };

        while (!isTerminator(p.peek().type())) {
            TokenType tt = p.peek().type();

            if (tt == TokenType.IF) {
                if (minBp > BP_TERNARY) {
                    break;
                }
                left = infixTernary(this, left, p.advance());
                continue;
            }

            int lbp = infixBindingPower(tt);
            if (canStartExpression(tt) && minBp <= BP_APPLICATION && (lbp < 0 || lbp < minBp)) {
                left = application(this, left);
                continue;
            }

            if (lbp < 0 || lbp < minBp) {
                break;
            }

            Token opToken = p.advance();
            left = switch (tt) {
                case PIPE -> infixPipe(this, left, opToken);
                case DOT -> infixMember(this, left, opToken);
                default -> infixBinary(this, left, opToken);
            };
        }

        return left;
    }

    /**
     * Binding power of {@code type} as an infix operator, or -1 if it has no infix handler.
     */
    static int infixBindingPower(TokenType type) {
        return switch (type) {
            case ASSIGN -> BP_ASSIGNMENT;
            case PIPE -> BP_PIPE;
            case OR -> BP_LOGICAL_OR;
            case AND -> BP_LOGICAL_AND;
            case AMPERSAND -> BP_BITWISE_AND;
            case EQ, NE -> BP_EQUALITY;
            case LT, LE, GT, GE -> BP_COMPARISON;
            case DOT_DOT -> BP_RANGE;
            case PLUS, MINUS -> BP_TERM;
            case STAR, SLASH, PERCENT -> BP_FACTOR;
            case STAR_STAR -> BP_EXPONENT;
            case DOT -> BP_ACCESS;
            default -> -1;
        };
    }

    // Comma and colon always end a single expression; lists split on them at their call sites.
    static boolean isTerminator(TokenType type) {
        return switch (type) {
            case RPAREN, NEWLINE, RBRACKET, RBRACE, EOF, COMMA, COLON -> true;
            default -> false;
        };
    }

    static boolean canStartExpression(TokenType type) {
        return switch (type) {
            case ID, INT, FLOAT, STR, LPAREN, LBRACKET, LBRACE, UNDERSCORE, BANG, TILDE, MINUS -> true;
            default -> false;
        };
    }

    // ========================================================================
    // Prefix Handlers
    // ========================================================================

    private static Expression prefixLiteral(ExpressionParser ep, Token token) {
        return new Literal(token);
    }

    private static Expression prefixIdentifier(ExpressionParser ep, Token token) {
        return new Identifier(token);
    }

    private static Expression prefixGroup(ExpressionParser ep, Token token) {
        Expression inner = ep.parseExpr(BP_ASSIGNMENT);
        ep.p.consume(TokenType.RPAREN, "')' to close '(' at line " + token.line());
        return inner;
    }

    private static Expression prefixList(ExpressionParser ep, Token token) {
        List<Expression> elements = new ArrayList<>();
        if (!ep.p.check(TokenType.RBRACKET)) {
            do {
                elements.add(ep.parseExpr(BP_ASSIGNMENT));
            } while (ep.p.match(TokenType.COMMA));
        }
        ep.p.consume(TokenType.RBRACKET, "']' to close list literal");
        return new Literal(token, elements);
    }

    private static Expression prefixMap(ExpressionParser ep, Token token) {
        List<Expression> entries = new ArrayList<>();
        if (!ep.p.check(TokenType.RBRACE)) {
            do {
                Identifier key = new Identifier(ep.p.consume(TokenType.ID, "identifier as map key"));
                Token colon = ep.p.consume(TokenType.COLON, "':' after map key");
                Expression value = ep.parseExpr(BP_ASSIGNMENT);
                entries.add(new Operator(colon, key, value));
            } while (ep.p.match(TokenType.COMMA));
        }
        ep.p.consume(TokenType.RBRACE, "'}' to close map literal");
        return new Literal(token, entries);
    }

    private static Expression prefixUnary(ExpressionParser ep, Token token) {
        Expression operand = ep.parseExpr(BP_UNARY);
        return new Operator(token, operand);
    }

    // ========================================================================
    // Infix Handlers
    // ========================================================================

    private static Expression infixBinary(ExpressionParser ep, Expression left, Token op) {
        // Left-associative: RBP = LBP + 1. Only ** is right-associative (RBP = LBP)
        int rbp = op.type() == TokenType.STAR_STAR ? BP_EXPONENT : infixBindingPower(op.type()) + 1;
        Expression right = ep.parseExpr(rbp);
        return new Operator(op, left, right);
    }

    private static Expression infixPipe(ExpressionParser ep, Expression left, Token op) {
        Expression right = ep.parseExpr(BP_PIPE + 1);
        return new Pipe(op, left, right);
    }

    private static Expression infixMember(ExpressionParser ep, Expression object, Token dot) {
        Identifier property = new Identifier(ep.p.consume(TokenType.ID, "identifier after '.'"));
        return new Operator(dot, object, property);
    }

    private static Expression infixTernary(ExpressionParser ep, Expression whenTrue, Token ifToken) {
        Expression condition = ep.parseExpr(BP_TERNARY + 1);
        ep.p.consume(TokenType.ELSE, "'else' in conditional expression");
        Expression whenFalse = ep.parseExpr(BP_TERNARY);
        return new Ternary(ifToken, condition, whenTrue, whenFalse);
    }

    /**
     * Call by juxtaposition. Arguments are parsed at term level so that {@code f n - 1} is
     * {@code f(n - 1)}; further arguments follow after commas.
     */
    private static Expression application(ExpressionParser ep, Expression callee) {
        List<Expression> args = new ArrayList<>();
        args.add(ep.parseExpr(BP_TERM));
        while (ep.p.check(TokenType.COMMA) && canStartExpression(ep.p.peek(1).type())) {
            ep.p.advance();
            args.add(ep.parseExpr(BP_TERM));
        }
        return new FunctionCall(callee, new Arguments(args));
    }
}
