package org.g10asm.compiler;

import org.g10asm.compiler.api.AssemblyException;
import org.g10asm.compiler.api.AssemblyResult;
import org.g10asm.compiler.diagnostics.Diagnostic;
import org.g10asm.compiler.frontend.lexer.Token;
import org.g10asm.compiler.frontend.lexer.TokenType;
import org.g10asm.compiler.frontend.parser.ast.InstructionNode;
import org.g10asm.compiler.frontend.parser.features.label.LabelNode;
import org.g10asm.compiler.frontend.preprocessor.PreProcessorConfig;
import org.g10asm.compiler.frontend.preprocessor.PreprocessedSource;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * End-to-end tests for the {@link Assembler} front end pipeline.
 */
public class AssemblerTest {

    @TempDir
    Path tempDir;

    /**
     * Verifies that macros and loops are expanded before parsing and the AST holds the expanded statements.
     */
    @Test
    @Tag("integration")
    void testAssembleExpandsBeforeParsing() throws AssemblyException {
        // Arrange
        String source = String.join("\n",
                ".macro CLEAR reg",
                "ld @reg, 0",
                ".endm",
                ".repeat 2, i",
                "entry_{i}:",
                "CLEAR d1",
                ".endr") + "\n";
        Assembler assembler = new Assembler();

        // Act
        AssemblyResult result = assembler.assemble(source, "main.asm");

        // Assert
        assertThat(result.preprocessed().text()).isEqualTo("entry_0:\nld d1, 0\nentry_1:\nld d1, 0\n");
        assertThat(result.module().statements()).hasSize(4);
        assertThat(((LabelNode) result.module().statements().get(2)).name()).isEqualTo("entry_1");
        InstructionNode second = (InstructionNode) result.module().statements().get(3);
        assertThat(second.mnemonic().fileName()).isEqualTo("main.asm");
        assertThat(second.mnemonic().line()).isEqualTo(6);
        assertThat(result.tokens()).last().extracting(Token::type).isEqualTo(TokenType.END_OF_FILE);
    }

    /**
     * Verifies that a parse error inside a macro expansion is reported at the invocation line.
     */
    @Test
    @Tag("integration")
    void testParseErrorIsReportedAtOriginalLine() {
        // Arrange
        String source = String.join("\n",
                ".macro BROKEN",
                "ld d0",
                ".endm",
                "nop",
                "BROKEN") + "\n";
        Assembler assembler = new Assembler();

        // Act & Assert
        assertThatThrownBy(() -> assembler.assemble(source, "main.asm"))
                .isInstanceOf(AssemblyException.class)
                .hasMessageContaining("main.asm:5")
                .hasMessageContaining("Instruction 'ld' expects 2 operands, but got 1.");
    }

    /**
     * Verifies that a lexical error stops the pipeline before preprocessing.
     */
    @Test
    @Tag("unit")
    void testLexicalErrorFails() {
        // Arrange
        Assembler assembler = new Assembler();

        // Act & Assert
        assertThatThrownBy(() -> assembler.tokenize("ld d0, \"open\n", "main.asm"))
                .isInstanceOf(AssemblyException.class)
                .hasMessageContaining("Unterminated string literal.");
        assertThat(assembler.getDiagnostics().hasErrors()).isTrue();
    }

    /**
     * Verifies that warnings of a successful run stay available and each call starts with fresh diagnostics.
     */
    @Test
    @Tag("unit")
    void testDiagnosticsAreResetPerCall() throws AssemblyException {
        // Arrange
        Assembler assembler = new Assembler();

        // Act
        PreprocessedSource first = assembler.preprocess(".warning \"check\"\nnop\n", "main.asm");
        List<Diagnostic> afterFirst = assembler.getDiagnostics().getDiagnostics();
        assembler.preprocess("nop\n", "main.asm");

        // Assert
        assertThat(first.text()).isEqualTo("nop\n");
        assertThat(afterFirst).extracting(Diagnostic::type).containsExactly(Diagnostic.Type.WARNING);
        assertThat(assembler.getDiagnostics().getDiagnostics()).isEmpty();
    }

    /**
     * Verifies that a configured recursion limit is applied.
     */
    @Test
    @Tag("unit")
    void testConfiguredRecursionLimit() {
        // Arrange
        Assembler assembler = new Assembler(new PreProcessorConfig(4, 4, List.of()));

        // Act & Assert
        assertThatThrownBy(() -> assembler.preprocess(".macro R\nR\n.endm\nR\n", "main.asm"))
                .isInstanceOf(AssemblyException.class)
                .hasMessageContaining("Maximum recursion depth of 4 exceeded.");
    }

    /**
     * Verifies that a file on disk is assembled with its includes resolved relative to it.
     */
    @Test
    @Tag("integration")
    void testAssembleFileWithInclude() throws IOException, AssemblyException {
        // Arrange
        Path sub = Files.createDirectories(tempDir.resolve("src"));
        Files.writeString(sub.resolve("consts.asm"), ".define PORT 0x40\n");
        Path main = sub.resolve("main.asm");
        Files.writeString(main, ".include \"consts.asm\"\nld d0, [PORT]\n");

        // Act
        AssemblyResult result = new Assembler().assemble(main);

        // Assert
        assertThat(result.module().statements()).hasSize(1);
        InstructionNode instruction = (InstructionNode) result.module().statements().get(0);
        assertThat(instruction.mnemonic().line()).isEqualTo(2);
        assertThat(instruction.mnemonic().fileName()).endsWith("src/main.asm");
    }
}
