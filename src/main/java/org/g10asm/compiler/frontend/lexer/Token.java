package org.g10asm.compiler.frontend.lexer;

/**
 * Represents a single token extracted from the source code by the {@link Lexer}.
 *
 * @param type The type of the token.
 * @param text The exact text of the token from the source code (string literals keep their quotes).
 * @param value The decoded literal value: {@link Long} for integer and character literals,
 *              {@link Double} for number literals, {@link String} for string literals, otherwise null.
 * @param line The 1-based line number where the token was found.
 * @param column The 1-based column number where the token begins.
 * @param fileName The file this token originates from.
 * @param keyword The keyword table entry for keyword tokens, otherwise null.
 */
public record Token(
        TokenType type,
        String text,
        Object value,
        int line,
        int column,
        String fileName,
        Keyword keyword
) {

    /**
     * Creates a token that is not a keyword.
     */
    public Token(TokenType type, String text, Object value, int line, int column, String fileName) {
        this(type, text, value, line, column, fileName, null);
    }

    public boolean is(TokenType expected) {
        return type == expected;
    }

    /**
     * Checks whether this is a keyword token of the given category.
     * @param expected The keyword category.
     * @return {@code true} if the token's keyword belongs to the category.
     */
    public boolean isKeyword(KeywordType expected) {
        return type == TokenType.KEYWORD && keyword != null && keyword.type() == expected;
    }

    /**
     * Returns the integer value of a literal.
     * Number literals yield their integer part.
     * @return The integer value, or 0 if the token has no numeric value.
     */
    public long intValue() {
        if (value instanceof Long l) return l;
        if (value instanceof Double d) return d.longValue();
        return 0L;
    }

    /**
     * Returns the floating value of a numeric literal.
     * @return The value as a double, or 0 if the token has no numeric value.
     */
    public double numberValue() {
        if (value instanceof Double d) return d;
        if (value instanceof Long l) return l;
        return 0.0;
    }

    /**
     * Returns the decoded content of a string literal.
     * @return The string value, or the raw text for other tokens.
     */
    public String stringValue() {
        return value instanceof String s ? s : text;
    }

    /**
     * Returns the bare name of a variable or placeholder, i.e. the text without its
     * <code>$</code> or <code>@</code> sigil.
     * @return The name, or the text itself for other tokens.
     */
    public String name() {
        return switch (type) {
            case VARIABLE, PLACEHOLDER, PLACEHOLDER_KEYWORD -> text.substring(1);
            default -> text;
        };
    }

    /**
     * Returns a copy of this token that reports a different origin.
     * @param newFileName The file to report.
     * @param newLine The line to report.
     * @return The re-stamped token.
     */
    public Token withOrigin(String newFileName, int newLine) {
        return new Token(type, text, value, newLine, column, newFileName, keyword);
    }

    @Override
    public String toString() {
        String shown = type == TokenType.NEWLINE ? "\\n" : text;
        return String.format("%s '%s' (%s:%d:%d)", type, shown, fileName, line, column);
    }
}
