package org.g10asm.compiler.frontend.preprocessor;

import org.g10asm.compiler.frontend.lexer.Token;
import org.g10asm.compiler.frontend.lexer.TokenType;

import java.util.ArrayList;
import java.util.List;

/**
 * Helpers for slicing and re-stamping token lists.
 */
public final class TokenLists {

    private TokenLists() {}

    /**
     * Removes line continuations (a backslash directly followed by a NEWLINE) and the
     * END_OF_FILE marker.
     * @param tokens The lexer output.
     * @return The filtered tokens.
     */
    public static List<Token> filterContinuations(List<Token> tokens) {
        List<Token> filtered = new ArrayList<>(tokens.size());
        for (int i = 0; i < tokens.size(); i++) {
            Token token = tokens.get(i);
            if (token.type() == TokenType.END_OF_FILE) {
                continue;
            }
            if (token.type() == TokenType.BACKSLASH
                    && i + 1 < tokens.size() && tokens.get(i + 1).type() == TokenType.NEWLINE) {
                i++;
                continue;
            }
            filtered.add(token);
        }
        return filtered;
    }

    /**
     * Splits tokens on commas that are not nested inside parentheses, brackets or braces.
     * An empty input yields an empty list.
     * @param tokens The tokens to split.
     * @return The comma-separated groups.
     */
    public static List<List<Token>> splitTopLevel(List<Token> tokens) {
        List<List<Token>> groups = new ArrayList<>();
        if (tokens.isEmpty()) {
            return groups;
        }
        List<Token> group = new ArrayList<>();
        int nesting = 0;
        for (Token token : tokens) {
            switch (token.type()) {
                case LEFT_PARENTHESIS, LEFT_BRACKET, LEFT_BRACE -> nesting++;
                case RIGHT_PARENTHESIS, RIGHT_BRACKET, RIGHT_BRACE -> nesting = Math.max(0, nesting - 1);
                default -> { }
            }
            if (token.type() == TokenType.COMMA && nesting == 0) {
                groups.add(group);
                group = new ArrayList<>();
            } else {
                group.add(token);
            }
        }
        groups.add(group);
        return groups;
    }

    /**
     * Re-stamps tokens with a new origin, e.g. the call site of a macro.
     * @param tokens The tokens to copy.
     * @param fileName The file to report.
     * @param line The line to report.
     * @return The re-stamped copies.
     */
    public static List<Token> restamp(List<Token> tokens, String fileName, int line) {
        List<Token> copies = new ArrayList<>(tokens.size());
        for (Token token : tokens) {
            copies.add(token.withOrigin(fileName, line));
        }
        return copies;
    }

    public static boolean containsType(List<Token> tokens, TokenType type) {
        for (Token token : tokens) {
            if (token.type() == type) return true;
        }
        return false;
    }

    /**
     * Checks whether {@code right} starts exactly where {@code left} ends on the same line.
     */
    public static boolean adjacent(Token left, Token right) {
        return left.line() == right.line()
                && left.fileName() != null && left.fileName().equals(right.fileName())
                && left.column() + left.text().length() == right.column();
    }

    /**
     * Joins the token texts with single spaces, for messages.
     */
    public static String describe(List<Token> tokens) {
        return OutputWriter.render(tokens);
    }
}
