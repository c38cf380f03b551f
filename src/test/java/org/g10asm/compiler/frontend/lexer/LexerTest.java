package org.g10asm.compiler.frontend.lexer;

import org.g10asm.compiler.diagnostics.DiagnosticsEngine;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Contains unit tests for the {@link Lexer}.
 * These tests verify that the lexer correctly converts source code strings into a stream of tokens,
 * identifying different token types and handling features like comments.
 */
public class LexerTest {

    @TempDir
    Path tempDir;

    /**
     * Verifies that a typical source line is split into label, mnemonic, register, comma and
     * literal tokens, and that comments are dropped.
     */
    @Test
    @Tag("unit")
    void testLexerTokenization() {
        // Arrange
        String source = String.join("\n",
                ".define HELLO 42",
                "start: ld d0, HELLO ; load the answer");
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        Lexer lexer = new Lexer(source, diagnostics);

        // Act
        List<Token> tokens = lexer.scanTokens();

        // Assert
        assertThat(diagnostics.hasErrors()).isFalse();
        assertThat(tokens).extracting(Token::type).containsExactly(
                TokenType.KEYWORD, TokenType.IDENTIFIER, TokenType.INTEGER_LITERAL, TokenType.NEWLINE,
                TokenType.IDENTIFIER, TokenType.COLON, TokenType.KEYWORD, TokenType.KEYWORD,
                TokenType.COMMA, TokenType.IDENTIFIER, TokenType.END_OF_FILE);
        assertThat(tokens.get(0).isKeyword(KeywordType.PREPROCESSOR_DIRECTIVE)).isTrue();
        assertThat(tokens.get(2).intValue()).isEqualTo(42L);
        assertThat(tokens.get(6).isKeyword(KeywordType.INSTRUCTION_MNEMONIC)).isTrue();
        assertThat(tokens.get(7).isKeyword(KeywordType.REGISTER_NAME)).isTrue();
    }

    /**
     * Verifies that the decimal, binary, octal and hexadecimal integer forms decode to the same value.
     */
    @Test
    @Tag("unit")
    void testIntegerLiteralRadixes() {
        // Arrange
        Lexer lexer = new Lexer("255 0b11111111 0o377 0xFF 0XfF", new DiagnosticsEngine());

        // Act
        List<Token> tokens = lexer.scanTokens();

        // Assert
        assertThat(lexer.isGood()).isTrue();
        assertThat(tokens.subList(0, 5)).allSatisfy(token -> {
            assertThat(token.type()).isEqualTo(TokenType.INTEGER_LITERAL);
            assertThat(token.intValue()).isEqualTo(255L);
        });
    }

    /**
     * Verifies that a radix prefix without digits is a lexical error naming the radix.
     */
    @Test
    @Tag("unit")
    void testRadixPrefixWithoutDigitsIsAnError() {
        // Arrange
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        Lexer lexer = new Lexer("ld d0, 0x", diagnostics, "main.asm");

        // Act
        lexer.scanTokens();

        // Assert
        assertThat(lexer.isGood()).isFalse();
        assertThat(diagnostics.summary()).contains("main.asm:1").contains("Expected hexadecimal digits after '0x' prefix.");
    }

    /**
     * Verifies number, character and string literals, including escape sequences.
     */
    @Test
    @Tag("unit")
    void testLiteralDecoding() {
        // Arrange
        Lexer lexer = new Lexer("2.5 'A' '\\n' \"a\\tb\\x41\"", new DiagnosticsEngine());

        // Act
        List<Token> tokens = lexer.scanTokens();

        // Assert
        assertThat(lexer.isGood()).isTrue();
        assertThat(tokens.get(0).type()).isEqualTo(TokenType.NUMBER_LITERAL);
        assertThat(tokens.get(0).numberValue()).isEqualTo(2.5);
        assertThat(tokens.get(1).type()).isEqualTo(TokenType.CHARACTER_LITERAL);
        assertThat(tokens.get(1).intValue()).isEqualTo('A');
        assertThat(tokens.get(2).intValue()).isEqualTo('\n');
        assertThat(tokens.get(3).type()).isEqualTo(TokenType.STRING_LITERAL);
        assertThat(tokens.get(3).stringValue()).isEqualTo("a\tbA");
    }

    /**
     * Verifies that an unterminated string stops the lexer with an error on the right line.
     */
    @Test
    @Tag("unit")
    void testUnterminatedStringIsAnError() {
        // Arrange
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        Lexer lexer = new Lexer("nop\n.info \"oops\nnop", diagnostics, "main.asm");

        // Act
        lexer.scanTokens();

        // Assert
        assertThat(lexer.isGood()).isFalse();
        assertThat(diagnostics.getDiagnostics()).hasSize(1);
        assertThat(diagnostics.getDiagnostics().get(0).lineNumber()).isEqualTo(2);
        assertThat(diagnostics.getDiagnostics().get(0).message()).isEqualTo("Unterminated string literal.");
    }

    /**
     * Verifies that variables, placeholders and keyword placeholders get their own token types
     * and that their names drop the sigil.
     */
    @Test
    @Tag("unit")
    void testVariablesAndPlaceholders() {
        // Arrange
        Lexer lexer = new Lexer("$count @value @d0 @1", new DiagnosticsEngine());

        // Act
        List<Token> tokens = lexer.scanTokens();

        // Assert
        assertThat(tokens).extracting(Token::type).containsExactly(
                TokenType.VARIABLE, TokenType.PLACEHOLDER, TokenType.PLACEHOLDER_KEYWORD,
                TokenType.PLACEHOLDER, TokenType.END_OF_FILE);
        assertThat(tokens).extracting(Token::name).startsWith("count", "value", "d0", "1");
    }

    /**
     * Verifies that the longest operator wins, e.g. <code>&lt;&lt;=</code> over <code>&lt;&lt;</code>.
     */
    @Test
    @Tag("unit")
    void testLongestOperatorMatch() {
        // Arrange
        Lexer lexer = new Lexer("$a <<= 2 ** 3 << 1", new DiagnosticsEngine());

        // Act
        List<Token> tokens = lexer.scanTokens();

        // Assert
        assertThat(tokens).extracting(Token::type).containsExactly(
                TokenType.VARIABLE, TokenType.ASSIGN_LEFT_SHIFT, TokenType.INTEGER_LITERAL, TokenType.EXPONENT,
                TokenType.INTEGER_LITERAL, TokenType.LEFT_SHIFT, TokenType.INTEGER_LITERAL, TokenType.END_OF_FILE);
    }

    /**
     * Verifies that a file lexed from disk reports its normalized absolute path.
     *
     * @throws IOException if the temporary file cannot be written.
     */
    @Test
    @Tag("integration")
    void testFromFileUsesAbsolutePath() throws IOException {
        // Arrange
        Path file = tempDir.resolve("prog.asm");
        Files.writeString(file, "nop\n");

        // Act
        Lexer lexer = Lexer.fromFile(file, new DiagnosticsEngine());
        List<Token> tokens = lexer.scanTokens();

        // Assert
        String expected = file.toAbsolutePath().normalize().toString().replace('\\', '/');
        assertThat(lexer.getFileName()).isEqualTo(expected);
        assertThat(tokens.get(0).fileName()).isEqualTo(expected);
        assertThat(tokens).extracting(Token::type)
                .containsExactly(TokenType.KEYWORD, TokenType.NEWLINE, TokenType.END_OF_FILE);
    }
}
