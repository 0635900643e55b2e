package com.quarkparser;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Turns Quark source text into the primitive token stream consumed by {@link IndentationNormalizer}.
 *
 * <p>Whitespace is only emitted (as a {@code WS} token carrying its width) at the start of a line
 * and outside parentheses. A run of line breaks outside parentheses becomes a single
 * {@code NEWLINE}; inside parentheses line breaks are absorbed. No {@code EOF} is emitted.</p>
 *
 * <p>A lexer instance scans one source once; its state is never shared.</p>
 */
public class Lexer {
    private static final Logger log = LogManager.getLogger(Lexer.class);

    private static final Map<String, TokenType> KEYWORDS = Map.ofEntries(
        Map.entry("use", TokenType.USE),
        Map.entry("module", TokenType.MODULE),
        Map.entry("in", TokenType.IN),
        Map.entry("and", TokenType.AND),
        Map.entry("or", TokenType.OR),
        Map.entry("if", TokenType.IF),
        Map.entry("elseif", TokenType.ELSEIF),
        Map.entry("else", TokenType.ELSE),
        Map.entry("for", TokenType.FOR),
        Map.entry("while", TokenType.WHILE),
        Map.entry("when", TokenType.WHEN),
        Map.entry("fn", TokenType.FN),
        Map.entry("class", TokenType.CLASS)
    );

    private final String source;
    private final int length;
    private final ParserOptions options;
    private final List<Token> tokens = new ArrayList<>();
    private final List<LexicalError> errors = new ArrayList<>();

    private int position = 0;
    private int line = 1;
    private int lineStart = 0;
    private int parenDepth = 0;
    private boolean atLineStart = true;
    private boolean scanned = false;

    public Lexer(String source) {
        this(source, ParserOptions.DEFAULT);
    }

    public Lexer(String source, ParserOptions options) {
        this.source = source;
        this.length = source.length();
        this.options = options;
    }

    /**
     * Scans the whole source.
     *
     * @return the primitive tokens
     * @throws LexicalException if any character could not be scanned
     */
    public List<Token> tokenize() {
        if (!scanned) {
            scan();
            scanned = true;
        }
        if (!errors.isEmpty()) {
            throw new LexicalException(errors);
        }
        return List.copyOf(tokens);
    }

    /**
     * Errors recorded while scanning. Empty until {@link #tokenize()} has run.
     */
    public List<LexicalError> errors() {
        return List.copyOf(errors);
    }

    /**
     * Number of parentheses still open at the current scan position.
     */
    public int parenDepth() {
        return parenDepth;
    }

    private void scan() {
        log.trace("scanning {} ({} chars)", options.sourceName(), length);
        while (position < length) {
            char c = source.charAt(position);

            if (c == ' ' || c == '\t') {
                scanWhitespace();
                continue;
            }

            if (c == '\n' || (c == '\r' && peekChar(1) == '\n')) {
                scanNewlines();
                continue;
            }

            if (c == '\r') {
                position++;
                continue;
            }

            if (c == '/' && peekChar(1) == '/') {
                while (position < length && source.charAt(position) != '\n' && source.charAt(position) != '\r') {
                    position++;
                }
                continue;
            }

            atLineStart = false;

            if (isDigit(c) || (c == '.' && isDigit(peekChar(1)))) {
                scanNumber();
            } else if (isIdentifierStart(c)) {
                scanIdentifier();
            } else if (c == '\'' || c == '"') {
                scanString(c);
            } else {
                scanOperator(c);
            }
        }
        log.trace("scanned {} tokens, {} errors", tokens.size(), errors.size());
    }

    private void scanWhitespace() {
        int start = position;
        int startColumn = column();
        int width = 0;
        while (position < length) {
            char c = source.charAt(position);
            if (c == ' ') {
                width++;
            } else if (c == '\t') {
                width += options.tabWidth();
            } else {
                break;
            }
            position++;
        }
        if (atLineStart && parenDepth == 0) {
            tokens.add(new Token(TokenType.WS, source.substring(start, position), width,
                line, startColumn, start, position));
        }
        atLineStart = false;
    }

    private void scanNewlines() {
        int start = position;
        int startLine = line;
        int startColumn = column();
        while (position < length) {
            char c = source.charAt(position);
            if (c == '\n') {
                position++;
            } else if (c == '\r' && peekChar(1) == '\n') {
                position += 2;
            } else {
                break;
            }
            line++;
            lineStart = position;
        }
        if (parenDepth == 0) {
            tokens.add(new Token(TokenType.NEWLINE, source.substring(start, position), null,
                startLine, startColumn, start, position));
        }
        atLineStart = true;
    }

    private void scanNumber() {
        int start = position;
        int startColumn = column();
        boolean isFloat = false;

        while (isDigit(peekChar(0))) {
            position++;
        }
        // '..' is the range operator and never part of a number
        if (peekChar(0) == '.' && peekChar(1) != '.') {
            isFloat = true;
            position++;
            while (isDigit(peekChar(0))) {
                position++;
            }
        }

        String text = source.substring(start, position);
        if (isFloat) {
            tokens.add(new Token(TokenType.FLOAT, text, Double.parseDouble(text), line, startColumn, start, position));
            return;
        }
        try {
            tokens.add(new Token(TokenType.INT, text, Long.parseLong(text), line, startColumn, start, position));
        } catch (NumberFormatException e) {
            error(line, startColumn, "Integer literal out of range: " + text);
        }
    }

    private void scanIdentifier() {
        int start = position;
        int startColumn = column();
        while (isIdentifierPart(peekChar(0))) {
            position++;
        }
        String text = source.substring(start, position);
        TokenType type;
        if (text.equals("_")) {
            type = TokenType.UNDERSCORE;
        } else {
            type = KEYWORDS.getOrDefault(text, TokenType.ID);
        }
        tokens.add(new Token(type, text, null, line, startColumn, start, position));
    }

    private void scanString(char quote) {
        int start = position;
        int startColumn = column();
        int cursor = position + 1;
        while (cursor < length) {
            char c = source.charAt(cursor);
            if (c == quote) {
                String value = source.substring(start + 1, cursor);
                position = cursor + 1;
                tokens.add(new Token(TokenType.STR, value, value, line, startColumn, start, position));
                return;
            }
            if (c == '\n' || c == '\r') {
                break;
            }
            if (c == '\\' && cursor + 1 < length && source.charAt(cursor + 1) != '\n') {
                // escapes are kept verbatim
                cursor += 2;
                continue;
            }
            cursor++;
        }
        error(line, startColumn, "Unterminated string literal");
        position++;
    }

    private void scanOperator(char c) {
        int start = position;
        int startColumn = column();
        char next = peekChar(1);

        TokenType type = switch (c) {
            case '*' -> next == '*' ? TokenType.STAR_STAR : TokenType.STAR;
            case '.' -> next == '.' ? TokenType.DOT_DOT : TokenType.DOT;
            case '<' -> next == '=' ? TokenType.LE : TokenType.LT;
            case '>' -> next == '=' ? TokenType.GE : TokenType.GT;
            case '=' -> next == '=' ? TokenType.EQ : TokenType.ASSIGN;
            case '!' -> next == '=' ? TokenType.NE : TokenType.BANG;
            case '+' -> TokenType.PLUS;
            case '-' -> TokenType.MINUS;
            case '/' -> TokenType.SLASH;
            case '%' -> TokenType.PERCENT;
            case '&' -> TokenType.AMPERSAND;
            case '~' -> TokenType.TILDE;
            case '[' -> TokenType.LBRACKET;
            case ']' -> TokenType.RBRACKET;
            case '{' -> TokenType.LBRACE;
            case '}' -> TokenType.RBRACE;
            case '@' -> TokenType.AT;
            case ',' -> TokenType.COMMA;
            case '|' -> TokenType.PIPE;
            case ':' -> TokenType.COLON;
            case '(' -> TokenType.LPAREN;
            case ')' -> TokenType.RPAREN;
            default -> null;
        };

        if (type == null) {
            error(line, startColumn, "Unexpected character '" + c + "'");
            position++;
            return;
        }

        position += switch (type) {
            case STAR_STAR, DOT_DOT, LE, GE, EQ, NE -> 2;
            default -> 1;
        };

        if (type == TokenType.LPAREN) {
            parenDepth++;
        } else if (type == TokenType.RPAREN && parenDepth > 0) {
            parenDepth--;
        }

        tokens.add(new Token(type, source.substring(start, position), null, line, startColumn, start, position));
    }

    private void error(int errorLine, int errorColumn, String message) {
        LexicalError error = new LexicalError(errorLine, errorColumn, message);
        log.debug("{}: {}", options.sourceName(), error);
        errors.add(error);
    }

    private int column() {
        return position - lineStart + 1;
    }

    private char peekChar(int offset) {
        int index = position + offset;
        return index < length ? source.charAt(index) : '\0';
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isIdentifierStart(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
    }

    private static boolean isIdentifierPart(char c) {
        return isIdentifierStart(c) || isDigit(c);
    }
}
