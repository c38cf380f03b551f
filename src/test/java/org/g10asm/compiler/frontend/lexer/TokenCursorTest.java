package org.g10asm.compiler.frontend.lexer;

import org.g10asm.compiler.diagnostics.DiagnosticsEngine;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for the {@link TokenCursor}.
 */
public class TokenCursorTest {

    private static TokenCursor cursor(String source, DiagnosticsEngine diagnostics) {
        return new TokenCursor(new Lexer(source, diagnostics, "t.asm").scanTokens(), diagnostics);
    }

    /**
     * Verifies that restOfLine stops before the NEWLINE and skipLine consumes it.
     */
    @Test
    @Tag("unit")
    void testLineNavigation() {
        // Arrange
        TokenCursor cursor = cursor("ld d0, 1\nnop", new DiagnosticsEngine());
        cursor.consume();

        // Act
        List<Token> rest = cursor.restOfLine();

        // Assert
        assertThat(rest).extracting(Token::text).containsExactly("d0", ",", "1");
        assertThat(cursor.check(TokenType.NEWLINE)).isTrue();
        cursor.skipLine();
        assertThat(cursor.peek().text()).isEqualTo("nop");
    }

    /**
     * Verifies that a failed expectation reports the error before throwing.
     */
    @Test
    @Tag("unit")
    void testExpectReportsAndThrows() {
        // Arrange
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        TokenCursor cursor = cursor("nop", diagnostics);

        // Act & Assert
        assertThatThrownBy(() -> cursor.expect(TokenType.COMMA, "Expected '%s'.", ","))
                .isInstanceOf(SyntaxException.class)
                .hasMessage("Expected ','.");
        assertThat(diagnostics.summary()).isEqualTo("[ERROR] t.asm:1: Expected ','.");
    }

    /**
     * Verifies that injected tokens become current and erased tokens disappear.
     */
    @Test
    @Tag("unit")
    void testInjectAndErase() {
        // Arrange
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        TokenCursor cursor = cursor("nop", diagnostics);
        List<Token> extra = new Lexer("halt stop", diagnostics).scanTokens().subList(0, 2);

        // Act
        cursor.inject(extra, false);
        cursor.erase(1);

        // Assert
        assertThat(cursor.tokens()).extracting(Token::text).containsExactly("stop", "nop", "");
        assertThat(cursor.peek().text()).isEqualTo("stop");
    }

    /**
     * Verifies that peeking outside of the token list fails instead of throwing an index error.
     */
    @Test
    @Tag("unit")
    void testPeekOutOfRange() {
        // Arrange
        TokenCursor cursor = cursor("nop", new DiagnosticsEngine());

        // Act & Assert
        assertThatThrownBy(cursor::previous).isInstanceOf(SyntaxException.class);
        assertThat(cursor.isAtEnd()).isFalse();
        cursor.consume();
        assertThat(cursor.isAtEnd()).isTrue();
    }
}
