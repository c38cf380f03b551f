package org.g10asm.compiler.frontend.environment;

import org.g10asm.compiler.diagnostics.DiagnosticsEngine;
import org.g10asm.compiler.frontend.lexer.Token;
import org.g10asm.compiler.frontend.lexer.TokenType;
import org.g10asm.compiler.frontend.parser.ast.AstNode;
import org.g10asm.compiler.frontend.parser.ast.PrimaryExpressionNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Contains unit tests for the {@link Environment}.
 */
public class EnvironmentTest {

    private DiagnosticsEngine diagnostics;
    private Environment environment;

    @BeforeEach
    void setUp() {
        diagnostics = new DiagnosticsEngine();
        environment = new Environment(diagnostics);
    }

    private static Token variable(String name, int line) {
        return new Token(TokenType.VARIABLE, "$" + name, null, line, 1, "main.asm");
    }

    private static AstNode integer(long value) {
        return new PrimaryExpressionNode(new Token(TokenType.INTEGER_LITERAL, Long.toString(value), value, 1, 1, "main.asm"));
    }

    /**
     * Verifies that a variable can be declared, read and updated.
     */
    @Test
    @Tag("unit")
    void testVariableLifecycle() {
        // Arrange
        AstNode updated = integer(2);

        // Act
        boolean defined = environment.defineVariable(variable("x", 1), integer(1));
        boolean assigned = environment.setValue(variable("x", 2), updated);

        // Assert
        assertThat(defined).isTrue();
        assertThat(assigned).isTrue();
        assertThat(environment.getValue(variable("x", 3))).contains(updated);
        assertThat(environment.exists("$x")).isTrue();
        assertThat(environment.isConstant("x")).isFalse();
        assertThat(diagnostics.hasErrors()).isFalse();
    }

    /**
     * Verifies that a constant cannot be modified and the error names its declaration.
     */
    @Test
    @Tag("unit")
    void testConstantCannotBeModified() {
        // Arrange
        environment.defineConstant(variable("SIZE", 4), integer(8));

        // Act
        boolean assigned = environment.setValue(variable("SIZE", 9), integer(9));

        // Assert
        assertThat(assigned).isFalse();
        assertThat(environment.isConstant("$SIZE")).isTrue();
        assertThat(diagnostics.getDiagnostics()).singleElement().satisfies(d -> {
            assertThat(d.message()).isEqualTo("Cannot modify constant '$SIZE' (defined at 'main.asm:4').");
            assertThat(d.lineNumber()).isEqualTo(9);
        });
    }

    /**
     * Verifies that a second declaration of the same name is rejected.
     */
    @Test
    @Tag("unit")
    void testDuplicateDeclarationIsRejected() {
        // Arrange
        environment.defineConstant(variable("A", 1), integer(1));

        // Act
        boolean defined = environment.defineVariable(variable("A", 2), integer(2));

        // Assert
        assertThat(defined).isFalse();
        assertThat(diagnostics.summary()).contains("'$A' is already defined as a constant at 'main.asm:1'.");
    }

    /**
     * Verifies that names are case-sensitive and that reading an unknown name is reported.
     */
    @Test
    @Tag("unit")
    void testUndefinedNameIsReported() {
        // Arrange
        environment.defineVariable(variable("count", 1), integer(0));

        // Act
        boolean found = environment.getValue(variable("COUNT", 2)).isPresent();

        // Assert
        assertThat(found).isFalse();
        assertThat(diagnostics.errorCount()).isEqualTo(1);
        assertThat(diagnostics.getDiagnostics().get(0).message()).isEqualTo("Undefined variable or constant '$COUNT'.");
    }

    /**
     * Verifies that clearing removes all entries.
     */
    @Test
    @Tag("unit")
    void testClear() {
        // Arrange
        environment.defineVariable(variable("a", 1), integer(0));
        environment.defineConstant(variable("b", 2), integer(0));

        // Act
        environment.clear();

        // Assert
        assertThat(environment.entries()).isEmpty();
        assertThat(environment.entry("a")).isEmpty();
    }
}
