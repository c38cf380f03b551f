package org.g10asm.compiler.frontend.lexer;

import org.g10asm.compiler.diagnostics.DiagnosticsEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * The Lexer (also known as Tokenizer or Scanner) converts G10 assembly source text into a
 * sequence of tokens, decoding literals and tracking the line and column of every token.
 * <p>
 * The first lexical error is reported to the {@link DiagnosticsEngine} and stops scanning;
 * the token list still ends with an {@link TokenType#END_OF_FILE} token.
 */
public class Lexer {

    private static final Logger LOG = LoggerFactory.getLogger(Lexer.class);

    private final String source;
    private final DiagnosticsEngine diagnostics;
    private final List<Token> tokens = new ArrayList<>();
    private final String logicalFileName;
    private int start = 0;
    private int current = 0;
    private int line = 1;
    private int lineStart = 0;
    private int startLine = 1;
    private int startColumn = 1;
    private boolean good = true;
    private boolean scanned = false;

    /**
     * Creates a new Lexer.
     * @param source The source code as a single string.
     * @param diagnostics The engine for reporting errors.
     */
    public Lexer(String source, DiagnosticsEngine diagnostics) {
        this(source, diagnostics, "<memory>");
    }

    /**
     * Creates a new Lexer with an explicit logical file name.
     * @param source The source code as a single string.
     * @param diagnostics The engine for reporting errors.
     * @param logicalFileName The name of the file being lexed, for error reporting.
     */
    public Lexer(String source, DiagnosticsEngine diagnostics, String logicalFileName) {
        this.source = source;
        this.diagnostics = diagnostics;
        this.logicalFileName = logicalFileName;
    }

    /**
     * Creates a lexer for a file on disk. Tokens report the normalized absolute path.
     * @param path The file to read (UTF-8).
     * @param diagnostics The engine for reporting errors.
     * @return A lexer over the file contents.
     * @throws IOException if the file cannot be read.
     */
    public static Lexer fromFile(Path path, DiagnosticsEngine diagnostics) throws IOException {
        Path absolute = path.toAbsolutePath().normalize();
        String content = Files.readString(absolute, StandardCharsets.UTF_8);
        return new Lexer(content, diagnostics, absolute.toString().replace('\\', '/'));
    }

    /**
     * Performs the tokenization of the entire source code.
     * Calling this method again returns the same tokens.
     * @return A list of the recognized tokens, always terminated by END_OF_FILE.
     */
    public List<Token> scanTokens() {
        if (scanned) {
            return getTokens();
        }
        while (!isAtEnd() && good) {
            start = current;
            startLine = line;
            startColumn = current - lineStart + 1;
            scanToken();
        }
        tokens.add(new Token(TokenType.END_OF_FILE, "", null, line, current - lineStart + 1, logicalFileName));
        scanned = true;
        LOG.debug("Lexed {} tokens from {}", tokens.size(), logicalFileName);
        return getTokens();
    }

    /**
     * @return {@code true} if no lexical error occurred.
     */
    public boolean isGood() {
        return good;
    }

    public List<Token> getTokens() {
        return Collections.unmodifiableList(tokens);
    }

    public String getFileName() {
        return logicalFileName;
    }

    private void scanToken() {
        char c = advance();
        switch (c) {
            case ' ', '\r', '\t':
                break;
            case '\n':
                addToken(TokenType.NEWLINE);
                line++;
                lineStart = current;
                break;
            case ';':
                // A comment goes until the end of the line.
                while (peek() != '\n' && !isAtEnd()) advance();
                break;
            case '"':
                string();
                break;
            case '\'':
                character();
                break;
            case '$':
                variable();
                break;
            case '@':
                placeholder();
                break;
            default:
                if (isDigit(c)) {
                    number(c);
                } else if (isIdentifierStart(c)) {
                    identifier();
                } else {
                    symbol(c);
                }
                break;
        }
    }

    private void identifier() {
        while (isIdentifierPart(peek())) advance();
        String text = source.substring(start, current);
        Optional<Keyword> keyword = KeywordTable.lookup(text);
        if (keyword.isPresent()) {
            tokens.add(new Token(TokenType.KEYWORD, text, null, startLine, startColumn, logicalFileName, keyword.get()));
        } else {
            addToken(TokenType.IDENTIFIER);
        }
    }

    private void variable() {
        while (isNameChar(peek())) advance();
        if (current - start == 1) {
            error("Expected a variable name after '$'.");
            return;
        }
        addToken(TokenType.VARIABLE);
    }

    private void placeholder() {
        while (isNameChar(peek())) advance();
        if (current - start == 1) {
            error("Expected a placeholder name after '@'.");
            return;
        }
        String text = source.substring(start, current);
        Optional<Keyword> keyword = KeywordTable.lookup(text.substring(1));
        if (keyword.isPresent()) {
            tokens.add(new Token(TokenType.PLACEHOLDER_KEYWORD, text, null, startLine, startColumn, logicalFileName, keyword.get()));
        } else {
            addToken(TokenType.PLACEHOLDER);
        }
    }

    private void number(char first) {
        if (first == '0' && isRadixPrefix(peek())) {
            char prefix = Character.toLowerCase(advance());
            int radix = prefix == 'x' ? 16 : prefix == 'b' ? 2 : 8;
            String radixName = prefix == 'x' ? "hexadecimal" : prefix == 'b' ? "binary" : "octal";
            int digitsStart = current;
            while (isNameChar(peek())) advance();
            String digits = source.substring(digitsStart, current);
            if (digits.isEmpty()) {
                error(String.format("Expected %s digits after '0%c' prefix.", radixName, prefix));
                return;
            }
            for (char d : digits.toCharArray()) {
                if (Character.digit(d, radix) < 0) {
                    error(String.format("Invalid digit '%c' in %s literal.", d, radixName));
                    return;
                }
            }
            parseInteger(digits, radix);
            return;
        }

        while (isDigit(peek())) advance();
        if (peek() == '.' && isDigit(peekNext())) {
            advance(); // consume the '.'
            while (isDigit(peek())) advance();
            String text = source.substring(start, current);
            addToken(TokenType.NUMBER_LITERAL, Double.parseDouble(text));
            return;
        }
        parseInteger(source.substring(start, current), 10);
    }

    private void parseInteger(String digits, int radix) {
        try {
            addToken(TokenType.INTEGER_LITERAL, Long.parseUnsignedLong(digits, radix));
        } catch (NumberFormatException e) {
            error(String.format("Integer literal '%s' does not fit in 64 bits.", source.substring(start, current)));
        }
    }

    private void character() {
        StringBuilder decoded = new StringBuilder();
        while (peek() != '\'' && peek() != '\n' && !isAtEnd()) {
            char c = advance();
            if (c == '\\') {
                int escaped = escape();
                if (escaped < 0) return;
                decoded.append((char) escaped);
            } else {
                decoded.append(c);
            }
        }
        if (peek() != '\'') {
            error("Unterminated character literal.");
            return;
        }
        advance(); // closing quote
        if (decoded.length() == 0) {
            error("Empty character literal.");
            return;
        }
        if (decoded.length() > 1) {
            error("Character literal must contain exactly one character.");
            return;
        }
        addToken(TokenType.CHARACTER_LITERAL, (long) decoded.charAt(0));
    }

    private void string() {
        StringBuilder decoded = new StringBuilder();
        while (peek() != '"' && peek() != '\n' && !isAtEnd()) {
            char c = advance();
            if (c == '\\') {
                int escaped = escape();
                if (escaped < 0) return;
                decoded.append((char) escaped);
            } else {
                decoded.append(c);
            }
        }
        if (peek() != '"') {
            error("Unterminated string literal.");
            return;
        }
        advance(); // closing quote
        addToken(TokenType.STRING_LITERAL, decoded.toString());
    }

    /**
     * Decodes the escape sequence after a consumed backslash.
     * @return The decoded character, or -1 after reporting an error.
     */
    private int escape() {
        if (isAtEnd() || peek() == '\n') {
            error("Unterminated escape sequence.");
            return -1;
        }
        char e = advance();
        switch (e) {
            case 'n': return '\n';
            case 't': return '\t';
            case 'r': return '\r';
            case '0': return 0;
            case '\\': return '\\';
            case '\'': return '\'';
            case '"': return '"';
            case 'x': {
                int high = Character.digit(peek(), 16);
                int low = Character.digit(peekNext(), 16);
                if (high < 0 || low < 0) {
                    error("Invalid hexadecimal escape sequence; expected two hex digits after '\\x'.");
                    return -1;
                }
                advance();
                advance();
                return high * 16 + low;
            }
            default:
                error(String.format("Unknown escape sequence '\\%c'.", e));
                return -1;
        }
    }

    private void symbol(char c) {
        for (TokenType type : TokenType.symbolsLongestFirst()) {
            if (source.startsWith(type.symbol(), start)) {
                current = start + type.symbol().length();
                addToken(type);
                return;
            }
        }
        error(String.format("Unexpected character '%c'.", c));
    }

    private void error(String message) {
        diagnostics.reportError(message, logicalFileName, startLine);
        good = false;
    }

    private boolean isAtEnd() {
        return current >= source.length();
    }

    private char advance() {
        return source.charAt(current++);
    }

    private char peek() {
        if (isAtEnd()) return '\0';
        return source.charAt(current);
    }

    private char peekNext() {
        if (current + 1 >= source.length()) return '\0';
        return source.charAt(current + 1);
    }

    private void addToken(TokenType type) {
        addToken(type, null);
    }

    private void addToken(TokenType type, Object literal) {
        String text = source.substring(start, current);
        tokens.add(new Token(type, text, literal, startLine, startColumn, logicalFileName));
    }

    private static boolean isRadixPrefix(char c) {
        return c == 'x' || c == 'X' || c == 'b' || c == 'B' || c == 'o' || c == 'O';
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isAlpha(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
    }

    private static boolean isNameChar(char c) {
        return isAlpha(c) || isDigit(c);
    }

    private static boolean isIdentifierStart(char c) {
        return isAlpha(c) || c == '.';
    }

    private static boolean isIdentifierPart(char c) {
        return isNameChar(c) || c == '.';
    }
}
