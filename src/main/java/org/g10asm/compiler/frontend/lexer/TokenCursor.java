package org.g10asm.compiler.frontend.lexer;

import org.g10asm.compiler.diagnostics.DiagnosticsEngine;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A stateful position over a private, mutable copy of a token list.
 * <p>
 * Besides navigation the cursor supports in-place rewriting ({@link #erase(int)} and
 * {@link #inject(List, boolean)}), which the preprocessor uses for macro expansion,
 * include splicing and conditional blocks. Failed expectations are reported to the
 * {@link DiagnosticsEngine} and raised as {@link SyntaxException}.
 */
public class TokenCursor {

    private final List<Token> tokens;
    private final DiagnosticsEngine diagnostics;
    private int position = 0;

    /**
     * Creates a cursor at the start of a copy of the given tokens.
     * @param tokens The tokens to walk; the list is copied.
     * @param diagnostics The engine for reporting errors.
     */
    public TokenCursor(List<Token> tokens, DiagnosticsEngine diagnostics) {
        this.tokens = new ArrayList<>(tokens);
        this.diagnostics = diagnostics;
    }

    /**
     * Returns the token at a signed offset from the current position without consuming it.
     * @param offset The offset, negative values look backwards.
     * @return The token.
     * @throws SyntaxException if the offset leaves the token list.
     */
    public Token peek(int offset) {
        int index = position + offset;
        if (index < 0 || index >= tokens.size()) {
            throw fail(lastKnownToken(), "Unexpected end of input.");
        }
        return tokens.get(index);
    }

    public Token peek() {
        return peek(0);
    }

    public Token previous() {
        return peek(-1);
    }

    /**
     * Consumes the current token and returns it.
     * @return The consumed token.
     */
    public Token consume() {
        Token token = peek();
        position++;
        return token;
    }

    /**
     * Moves forward by {@code count} tokens, stopping at the end of the list.
     * @param count The number of tokens to skip.
     */
    public void skip(int count) {
        position = Math.min(tokens.size(), position + Math.max(0, count));
    }

    /**
     * Skips all consecutive tokens of the given type.
     * @param type The type to skip.
     * @return The number of skipped tokens.
     */
    public int skipWhile(TokenType type) {
        int skipped = 0;
        while (check(type)) {
            position++;
            skipped++;
        }
        return skipped;
    }

    /**
     * Consumes the rest of the current line including its NEWLINE token.
     */
    public void skipLine() {
        while (position < tokens.size() && tokens.get(position).type() != TokenType.NEWLINE) {
            position++;
        }
        skip(1);
    }

    /**
     * Consumes and returns the tokens up to, but not including, the next NEWLINE.
     * @return The remaining tokens of the current line.
     */
    public List<Token> restOfLine() {
        List<Token> line = new ArrayList<>();
        while (position < tokens.size()
                && tokens.get(position).type() != TokenType.NEWLINE
                && tokens.get(position).type() != TokenType.END_OF_FILE) {
            line.add(tokens.get(position++));
        }
        return line;
    }

    public boolean check(TokenType type) {
        return position < tokens.size() && tokens.get(position).type() == type;
    }

    public boolean checkNext(TokenType type) {
        return position + 1 < tokens.size() && tokens.get(position + 1).type() == type;
    }

    /**
     * Checks whether the current token is a keyword of the given category.
     * @param type The keyword category.
     * @return {@code true} on a match; nothing is consumed.
     */
    public boolean checkKeyword(KeywordType type) {
        return position < tokens.size() && tokens.get(position).isKeyword(type);
    }

    /**
     * Consumes the current token if it has one of the given types.
     * @param types The accepted types.
     * @return {@code true} if a token was consumed.
     */
    public boolean match(TokenType... types) {
        for (TokenType type : types) {
            if (check(type)) {
                position++;
                return true;
            }
        }
        return false;
    }

    /**
     * Consumes a token of the expected type or fails.
     * @param type The expected type.
     * @param format The error message format, see {@link String#format(String, Object...)}.
     * @param args The format arguments.
     * @return The consumed token.
     * @throws SyntaxException if the current token has another type.
     */
    public Token expect(TokenType type, String format, Object... args) {
        if (check(type)) return consume();
        throw fail(currentOrLast(), String.format(format, args));
    }

    /**
     * Consumes a keyword of the expected category or fails.
     * @param type The expected keyword category.
     * @param format The error message format.
     * @param args The format arguments.
     * @return The consumed token.
     * @throws SyntaxException if the current token is not such a keyword.
     */
    public Token expectKeyword(KeywordType type, String format, Object... args) {
        if (checkKeyword(type)) return consume();
        throw fail(currentOrLast(), String.format(format, args));
    }

    /**
     * Reports an error located at the given token and returns the exception to throw.
     * @param at The token the error refers to.
     * @param message The message to report.
     * @return The exception; callers throw it.
     */
    public SyntaxException fail(Token at, String message) {
        String file = at != null ? at.fileName() : "<unknown>";
        int line = at != null ? at.line() : 0;
        diagnostics.reportError(message, file, line);
        return new SyntaxException(message, at);
    }

    /**
     * Removes {@code count} tokens starting at the current position. The position stays,
     * so the first token after the erased range becomes current.
     * @param count The number of tokens to remove.
     */
    public void erase(int count) {
        int end = Math.min(tokens.size(), position + Math.max(0, count));
        tokens.subList(position, end).clear();
    }

    /**
     * Inserts tokens at the current position.
     * @param inserted The tokens to insert.
     * @param advance {@code true} to move past the inserted tokens, {@code false} to make
     *                the first inserted token current.
     */
    public void inject(List<Token> inserted, boolean advance) {
        tokens.addAll(position, inserted);
        if (advance) {
            position += inserted.size();
        }
    }

    public boolean isAtEnd() {
        return position >= tokens.size() || tokens.get(position).type() == TokenType.END_OF_FILE;
    }

    public void reset() {
        position = 0;
    }

    public int position() {
        return position;
    }

    /**
     * Moves the cursor to an absolute index, e.g. to rewind after a failed lookahead.
     * @param index The new position, clamped to the list bounds.
     */
    public void seek(int index) {
        position = Math.max(0, Math.min(tokens.size(), index));
    }

    public int size() {
        return tokens.size();
    }

    /**
     * @return An unmodifiable view of the current token list.
     */
    public List<Token> tokens() {
        return Collections.unmodifiableList(tokens);
    }

    public DiagnosticsEngine getDiagnostics() {
        return diagnostics;
    }

    private Token currentOrLast() {
        if (position < tokens.size()) return tokens.get(position);
        return lastKnownToken();
    }

    private Token lastKnownToken() {
        if (tokens.isEmpty()) return null;
        return tokens.get(Math.max(0, Math.min(position, tokens.size()) - 1));
    }
}
