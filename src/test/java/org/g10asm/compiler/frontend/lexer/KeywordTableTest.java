package org.g10asm.compiler.frontend.lexer;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for the {@link KeywordTable}.
 */
public class KeywordTableTest {

    /**
     * Verifies that lookups ignore letter case.
     */
    @Test
    @Tag("unit")
    void testLookupIsCaseInsensitive() {
        // Act & Assert
        assertThat(KeywordTable.lookup("LD")).isEqualTo(KeywordTable.lookup("ld"));
        assertThat(KeywordTable.lookup(".ORG")).get().extracting(Keyword::type).isEqualTo(KeywordType.ASSEMBLER_DIRECTIVE);
        assertThat(KeywordTable.isKeyword("notAKeyword")).isFalse();
        assertThat(KeywordTable.lookup(null)).isEmpty();
    }

    /**
     * Verifies the parameters stored for mnemonics, data directives and registers.
     */
    @Test
    @Tag("unit")
    void testKeywordParameters() {
        // Act
        Keyword ld = KeywordTable.lookup("ld").orElseThrow();
        Keyword word = KeywordTable.lookup(".dw").orElseThrow();
        Keyword h3 = KeywordTable.lookup("h3").orElseThrow();

        // Assert
        assertThat(ld.type()).isEqualTo(KeywordType.INSTRUCTION_MNEMONIC);
        assertThat(ld.param2()).isEqualTo(2);
        assertThat(ld.param3()).isEqualTo(2);
        assertThat(word.param1()).isEqualTo(2);
        assertThat(h3.type()).isEqualTo(KeywordType.REGISTER_NAME);
        assertThat(h3.param1()).isEqualTo(3);
        assertThat(h3.param2()).isEqualTo(8);
        assertThat(h3.param3()).isEqualTo(1);
    }

    /**
     * Verifies that the opcode indices of the mnemonics are distinct.
     */
    @Test
    @Tag("unit")
    void testMnemonicOpcodesAreDistinct() {
        // Act
        long mnemonics = KeywordTable.entries().values().stream()
                .filter(k -> k.is(KeywordType.INSTRUCTION_MNEMONIC))
                .count();
        long opcodes = KeywordTable.entries().values().stream()
                .filter(k -> k.is(KeywordType.INSTRUCTION_MNEMONIC))
                .mapToInt(Keyword::param1)
                .distinct()
                .count();

        // Assert
        assertThat(opcodes).isEqualTo(mnemonics);
    }
}
