package com.quarkparser;

/**
 * Options shared by the lexer and the parser.
 *
 * @param sourceName name of the source used in diagnostics
 * @param tabWidth   indentation width of a tab character at the start of a line
 */
public record ParserOptions(String sourceName, int tabWidth) {

    public static final ParserOptions DEFAULT = new ParserOptions("<input>", 1);

    public ParserOptions {
        if (sourceName == null) {
            sourceName = "<input>";
        }
        if (tabWidth < 1) {
            throw new IllegalArgumentException("tabWidth must be positive, was " + tabWidth);
        }
    }

    public ParserOptions withSourceName(String name) {
        return new ParserOptions(name, tabWidth);
    }

    public ParserOptions withTabWidth(int width) {
        return new ParserOptions(sourceName, width);
    }
}
