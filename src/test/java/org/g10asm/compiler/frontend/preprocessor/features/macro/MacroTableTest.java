package org.g10asm.compiler.frontend.preprocessor.features.macro;

import org.g10asm.compiler.frontend.lexer.Token;
import org.g10asm.compiler.frontend.lexer.TokenType;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for the {@link MacroTable} and its naming rules.
 */
public class MacroTableTest {

    /**
     * Verifies define, lookup and undefine, and that a redefinition names the first definition.
     *
     * @throws MacroException if a valid operation fails.
     */
    @Test
    @Tag("unit")
    void testDefineLookupUndefine() throws MacroException {
        // Arrange
        MacroTable table = new MacroTable();
        table.define(MacroDefinition.text("SIZE", List.of(), "main.asm", 3));

        // Act & Assert
        assertThat(table.isDefined("SIZE")).isTrue();
        assertThat(table.lookup("SIZE").kind()).isEqualTo(MacroDefinition.Kind.TEXT);
        assertThatThrownBy(() -> table.define(MacroDefinition.text("SIZE", List.of(), "other.asm", 9)))
                .isInstanceOf(MacroException.class)
                .hasMessage("Macro 'SIZE' is already defined at 'main.asm:3'.");
        table.undefine("SIZE");
        assertThat(table.isDefined("SIZE")).isFalse();
        assertThatThrownBy(() -> table.lookup("SIZE")).hasMessage("Macro 'SIZE' is not defined.");
    }

    /**
     * Verifies that reserved and keyword names are rejected.
     */
    @Test
    @Tag("unit")
    void testNameValidation() {
        // Act & Assert
        assertThatCode(() -> MacroTable.validateName("my_macro1")).doesNotThrowAnyException();
        assertThatThrownBy(() -> MacroTable.validateName("__internal"))
                .hasMessage("Macro name '__internal' is reserved; names must not start with '__'.");
        assertThatThrownBy(() -> MacroTable.validateName("ld"))
                .hasMessage("Macro name 'ld' collides with a keyword.");
        assertThatThrownBy(() -> MacroTable.validateName("1abc")).hasMessageStartingWith("Invalid macro name '1abc'");
    }

    /**
     * Verifies positional, named and count placeholders, and that shift rotates the arguments.
     *
     * @throws MacroException if resolving a bound placeholder fails.
     */
    @Test
    @Tag("unit")
    void testFrameResolveAndShift() throws MacroException {
        // Arrange
        Token a = token("a");
        Token b = token("b");
        MacroDefinition macro = MacroDefinition.block("pair", List.of("first", "second"), List.of(), "m.asm", 1);
        MacroFrame frame = new MacroFrame(macro, a, List.of(List.of(a), List.of(b)));

        // Act & Assert
        assertThat(frame.resolve("first", a)).containsExactly(a);
        assertThat(frame.resolve("2", a)).containsExactly(b);
        assertThat(frame.resolve("0", a).get(0).intValue()).isEqualTo(2L);
        frame.shift(1);
        assertThat(frame.resolve("1", a)).containsExactly(b);
        assertThatThrownBy(() -> frame.resolve("3", a)).isInstanceOf(MacroException.class);
        assertThatThrownBy(() -> frame.resolve("third", a))
                .hasMessage("Unknown placeholder '@third' in macro 'pair'.");
    }

    private static Token token(String text) {
        return new Token(
                TokenType.IDENTIFIER, text, null, 1, 1, "m.asm");
    }
}
