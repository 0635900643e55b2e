package com.quarkparser;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Converts the primitive token stream of the {@link Lexer} into the stream the {@link Parser} reads.
 *
 * <p>Runs two passes. {@link #tagLineStarts(List)} marks each real token with whether it starts a
 * line and whether it must open an indented block (it is the first token after {@code ':'} and a
 * line break). {@link #trackLevels(List)} then turns the leading whitespace widths into
 * {@code INDENT}/{@code DEDENT} tokens, drops blank-line {@code NEWLINE}s and all {@code WS}
 * tokens, and terminates the stream with {@code EOF}.</p>
 */
public class IndentationNormalizer {
    private static final Logger log = LogManager.getLogger(IndentationNormalizer.class);

    static final String EXPECTED_INDENTED_BLOCK = "expected an indented block";
    static final String UNEXPECTED_INDENT = "indentation increase but not in new block";
    static final String INCONSISTENT_DEDENT = "inconsistent indentation";

    private enum IndentState { NO_INDENT, MAY_INDENT, MUST_INDENT }

    /**
     * A token annotated by the first pass.
     *
     * @param token       the primitive token
     * @param atLineStart true if only whitespace precedes the token on its line
     * @param mustIndent  true if the token has to open a new indented block
     */
    public record TaggedToken(Token token, boolean atLineStart, boolean mustIndent) {
        public TokenType type() {
            return token.type();
        }
    }

    /**
     * Runs both passes.
     *
     * @throws IndentationException on the first structural indentation error
     */
    public List<Token> normalize(List<Token> tokens) {
        return trackLevels(tagLineStarts(tokens));
    }

    /**
     * Pass A: line-start and must-indent tagging.
     */
    public List<TaggedToken> tagLineStarts(List<Token> tokens) {
        List<TaggedToken> tagged = new ArrayList<>(tokens.size());
        IndentState state = IndentState.NO_INDENT;
        boolean lineStart = true;

        for (Token token : tokens) {
            switch (token.type()) {
                case COLON -> {
                    tagged.add(new TaggedToken(token, lineStart, false));
                    state = IndentState.MAY_INDENT;
                    lineStart = false;
                }
                case NEWLINE -> {
                    tagged.add(new TaggedToken(token, lineStart, false));
                    if (state == IndentState.MAY_INDENT) {
                        state = IndentState.MUST_INDENT;
                    }
                    lineStart = true;
                }
                case WS -> tagged.add(new TaggedToken(token, lineStart, false));
                default -> {
                    tagged.add(new TaggedToken(token, lineStart, state == IndentState.MUST_INDENT));
                    state = IndentState.NO_INDENT;
                    lineStart = false;
                }
            }
        }
        return tagged;
    }

    /**
     * Pass B: indentation level tracking.
     *
     * @throws IndentationException on the first structural indentation error
     */
    public List<Token> trackLevels(List<TaggedToken> tagged) {
        List<Token> out = new ArrayList<>(tagged.size() + 8);
        Deque<Integer> levels = new ArrayDeque<>();
        levels.push(0);
        int pendingDepth = 0;
        Token last = null;

        for (TaggedToken entry : tagged) {
            Token token = entry.token();
            last = token;

            if (token.type() == TokenType.WS) {
                pendingDepth = ((Number) token.literal()).intValue();
                continue;
            }

            if (token.type() == TokenType.NEWLINE) {
                // a line break at line start ends a blank line
                if (!entry.atLineStart()) {
                    out.add(token);
                }
                pendingDepth = 0;
                continue;
            }

            if (entry.mustIndent()) {
                if (pendingDepth <= levels.peek()) {
                    throw new IndentationException(EXPECTED_INDENTED_BLOCK, token);
                }
                levels.push(pendingDepth);
                out.add(Token.synthesized(TokenType.INDENT, token));
            } else if (entry.atLineStart()) {
                int top = levels.peek();
                if (pendingDepth > top) {
                    throw new IndentationException(UNEXPECTED_INDENT, token);
                }
                if (pendingDepth < top) {
                    if (!levels.contains(pendingDepth)) {
                        throw new IndentationException(INCONSISTENT_DEDENT, token);
                    }
                    while (levels.peek() > pendingDepth) {
                        levels.pop();
                        out.add(Token.synthesized(TokenType.DEDENT, token));
                    }
                }
            }
            out.add(token);
        }

        while (levels.size() > 1) {
            levels.pop();
            out.add(Token.synthesized(TokenType.DEDENT, last));
        }
        out.add(Token.synthesized(TokenType.EOF, last));

        if (log.isTraceEnabled()) {
            log.trace("normalized {} primitive tokens into {}", tagged.size(), out.size());
        }
        return out;
    }
}
