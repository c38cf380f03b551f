package org.g10asm.compiler.frontend.parser;

import org.g10asm.compiler.diagnostics.DiagnosticsEngine;
import org.g10asm.compiler.frontend.environment.Environment;
import org.g10asm.compiler.frontend.lexer.Lexer;
import org.g10asm.compiler.frontend.parser.ast.ModuleNode;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Contains unit tests for the {@link AstPrinter}.
 */
public class AstPrinterTest {

    private static ModuleNode parse(String... lines) {
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        Lexer lexer = new Lexer(String.join("\n", lines) + "\n", diagnostics, "main.asm");
        Parser parser = new Parser(lexer.scanTokens(), diagnostics, new Environment(diagnostics));
        return parser.parse().orElseThrow();
    }

    /**
     * Verifies the rendering of labels, instructions and their operand kinds.
     */
    @Test
    @Tag("unit")
    void testPrintInstructions() {
        // Arrange
        ModuleNode module = parse(
                "start: ld d0, [d1]",
                "jp zs, loop + 2");

        // Act
        String printed = AstPrinter.print(module);

        // Assert
        assertThat(printed).isEqualTo(String.join("\n",
                "module",
                "    label_definition: 'start'",
                "    instruction: ld",
                "        register operand: d0",
                "        indirect operand: [d1]",
                "    instruction: jp",
                "        condition operand: zs",
                "        direct operand:",
                "            binary expression:",
                "                operator: +",
                "                left_operand:",
                "                    identifier: loop",
                "                right_operand:",
                "                    integer: 2",
                ""));
    }

    /**
     * Verifies the rendering of data, symbol and variable directives.
     */
    @Test
    @Tag("unit")
    void testPrintDirectives() {
        // Arrange
        ModuleNode module = parse(
                ".db -1, 'A'",
                ".global main",
                ".const $N = (3)");

        // Act
        String printed = AstPrinter.print(module);

        // Assert
        assertThat(printed).isEqualTo(String.join("\n",
                "module",
                "    .byte directive:",
                "        unary expression:",
                "            operator: -",
                "            operand:",
                "                integer: 1",
                "        char: 'A'",
                "    .global directive:",
                "        main",
                "    .const directive: N",
                "        grouping expression:",
                "            integer: 3",
                ""));
    }
}
