package org.g10asm.compiler.frontend.parser;

import org.g10asm.compiler.diagnostics.Diagnostic;
import org.g10asm.compiler.diagnostics.DiagnosticsEngine;
import org.g10asm.compiler.frontend.environment.Environment;
import org.g10asm.compiler.frontend.lexer.Lexer;
import org.g10asm.compiler.frontend.lexer.Token;
import org.g10asm.compiler.frontend.lexer.TokenType;
import org.g10asm.compiler.frontend.parser.ast.AstNode;
import org.g10asm.compiler.frontend.parser.ast.BinaryExpressionNode;
import org.g10asm.compiler.frontend.parser.ast.ConditionOperandNode;
import org.g10asm.compiler.frontend.parser.ast.DirectAddressOperandNode;
import org.g10asm.compiler.frontend.parser.ast.GroupingExpressionNode;
import org.g10asm.compiler.frontend.parser.ast.ImmediateOperandNode;
import org.g10asm.compiler.frontend.parser.ast.IndirectAddressOperandNode;
import org.g10asm.compiler.frontend.parser.ast.InstructionNode;
import org.g10asm.compiler.frontend.parser.ast.ModuleNode;
import org.g10asm.compiler.frontend.parser.ast.PrimaryExpressionNode;
import org.g10asm.compiler.frontend.parser.ast.RegisterOperandNode;
import org.g10asm.compiler.frontend.parser.ast.UnaryExpressionNode;
import org.g10asm.compiler.frontend.parser.features.data.DataNode;
import org.g10asm.compiler.frontend.parser.features.interrupt.InterruptNode;
import org.g10asm.compiler.frontend.parser.features.label.LabelNode;
import org.g10asm.compiler.frontend.parser.features.org.OrgNode;
import org.g10asm.compiler.frontend.parser.features.section.SectionNode;
import org.g10asm.compiler.frontend.parser.features.symbol.ExternNode;
import org.g10asm.compiler.frontend.parser.features.symbol.GlobalNode;
import org.g10asm.compiler.frontend.parser.features.var.VariableAssignmentNode;
import org.g10asm.compiler.frontend.parser.features.var.VariableDeclarationNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Contains unit tests for the {@link Parser}. Sources are lexed directly, without
 * preprocessing, and parsed into a {@link ModuleNode}.
 */
public class ParserTest {

    private DiagnosticsEngine diagnostics;
    private Environment environment;

    @BeforeEach
    void setUp() {
        diagnostics = new DiagnosticsEngine();
        environment = new Environment(diagnostics);
    }

    private Parser parser(String... lines) {
        Lexer lexer = new Lexer(String.join("\n", lines) + "\n", diagnostics, "main.asm");
        List<Token> tokens = lexer.scanTokens();
        assertThat(lexer.isGood()).isTrue();
        return new Parser(tokens, diagnostics, environment);
    }

    private List<AstNode> statements(String... lines) {
        Optional<ModuleNode> module = parser(lines).parse();
        assertThat(diagnostics.hasErrors()).as(diagnostics.summary()).isFalse();
        assertThat(module).isPresent();
        return module.get().statements();
    }

    private Diagnostic onlyError() {
        List<Diagnostic> errors = diagnostics.getDiagnostics().stream()
                .filter(d -> d.type() == Diagnostic.Type.ERROR)
                .toList();
        assertThat(errors).hasSize(1);
        return errors.get(0);
    }

    /**
     * Verifies that a register operand and an immediate operand are recognized.
     */
    @Test
    @Tag("unit")
    void testInstructionWithRegisterAndImmediate() {
        // Act
        List<AstNode> statements = statements("ld d0, 42");

        // Assert
        assertThat(statements).hasSize(1);
        InstructionNode instruction = (InstructionNode) statements.get(0);
        assertThat(instruction.mnemonic().text()).isEqualTo("ld");
        assertThat(instruction.operands()).hasSize(2);
        assertThat(instruction.operands().get(0)).isInstanceOf(RegisterOperandNode.class);
        assertThat(((RegisterOperandNode) instruction.operands().get(0)).register().text()).isEqualTo("d0");
        ImmediateOperandNode immediate = (ImmediateOperandNode) instruction.operands().get(1);
        assertThat(((PrimaryExpressionNode) immediate.value()).token().intValue()).isEqualTo(42L);
    }

    /**
     * Verifies that branch instructions take a condition and a direct address operand.
     */
    @Test
    @Tag("unit")
    void testBranchWithCondition() {
        // Act
        List<AstNode> statements = statements("jp zs, target");

        // Assert
        InstructionNode instruction = (InstructionNode) statements.get(0);
        assertThat(instruction.operands().get(0)).isInstanceOf(ConditionOperandNode.class);
        DirectAddressOperandNode address = (DirectAddressOperandNode) instruction.operands().get(1);
        assertThat(((PrimaryExpressionNode) address.address()).token().type()).isEqualTo(TokenType.IDENTIFIER);
    }

    /**
     * Verifies the register and expression forms of indirect operands.
     */
    @Test
    @Tag("unit")
    void testIndirectOperands() {
        // Act
        List<AstNode> statements = statements(
                "ld d0, [d1]",
                "ld [0x100 + 2], l3");

        // Assert
        InstructionNode first = (InstructionNode) statements.get(0);
        IndirectAddressOperandNode byRegister = (IndirectAddressOperandNode) first.operands().get(1);
        assertThat(byRegister.target()).isInstanceOf(RegisterOperandNode.class);

        InstructionNode second = (InstructionNode) statements.get(1);
        IndirectAddressOperandNode byAddress = (IndirectAddressOperandNode) second.operands().get(0);
        assertThat(byAddress.target()).isInstanceOf(BinaryExpressionNode.class);
        assertThat(second.operands().get(1)).isInstanceOf(RegisterOperandNode.class);
    }

    /**
     * Verifies that a label may stand alone or precede a statement on the same line.
     */
    @Test
    @Tag("unit")
    void testLabels() {
        // Act
        List<AstNode> statements = statements(
                "start:",
                "loop: nop");

        // Assert
        assertThat(statements).hasSize(3);
        assertThat(((LabelNode) statements.get(0)).name()).isEqualTo("start");
        assertThat(((LabelNode) statements.get(1)).name()).isEqualTo("loop");
        assertThat(statements.get(2)).isInstanceOf(InstructionNode.class);
    }

    /**
     * Verifies operator precedence: multiplication binds tighter than addition and
     * exponentiation is right-associative.
     */
    @Test
    @Tag("unit")
    void testExpressionPrecedence() {
        // Act
        List<AstNode> statements = statements(
                ".db 1 + 2 * 3",
                ".db 2 ** 3 ** 2",
                ".db -(1 | 2)");

        // Assert
        BinaryExpressionNode sum = (BinaryExpressionNode) ((DataNode) statements.get(0)).values().get(0);
        assertThat(sum.operator().type()).isEqualTo(TokenType.PLUS);
        assertThat(((BinaryExpressionNode) sum.right()).operator().type()).isEqualTo(TokenType.TIMES);

        BinaryExpressionNode power = (BinaryExpressionNode) ((DataNode) statements.get(1)).values().get(0);
        assertThat(power.left()).isInstanceOf(PrimaryExpressionNode.class);
        assertThat(((BinaryExpressionNode) power.right()).operator().type()).isEqualTo(TokenType.EXPONENT);

        UnaryExpressionNode negation = (UnaryExpressionNode) ((DataNode) statements.get(2)).values().get(0);
        assertThat(negation.operand()).isInstanceOf(GroupingExpressionNode.class);
    }

    /**
     * Verifies that data directives carry their width and all comma-separated values.
     */
    @Test
    @Tag("unit")
    void testDataDirectives() {
        // Act
        List<AstNode> statements = statements(
                ".byte 1, 2, 3",
                ".dw 0x1234",
                ".dd \"text\"");

        // Assert
        DataNode bytes = (DataNode) statements.get(0);
        assertThat(bytes.width()).isEqualTo(1);
        assertThat(bytes.values()).hasSize(3).allMatch(PrimaryExpressionNode.class::isInstance);
        assertThat(((DataNode) statements.get(1)).width()).isEqualTo(2);
        assertThat(((DataNode) statements.get(2)).width()).isEqualTo(4);
    }

    /**
     * Verifies that a data directive without values is rejected.
     */
    @Test
    @Tag("unit")
    void testDataDirectiveRequiresValue() {
        // Arrange
        Parser parser = parser(".word");

        // Act
        Optional<ModuleNode> module = parser.parse();

        // Assert
        assertThat(module).isEmpty();
        assertThat(parser.isGood()).isFalse();
        assertThat(onlyError().message()).isEqualTo("'.word' requires at least one value.");
    }

    /**
     * Verifies the layout directives <code>.org</code>, <code>.rom</code>/<code>.ram</code> and <code>.int</code>.
     */
    @Test
    @Tag("unit")
    void testLayoutDirectives() {
        // Act
        List<AstNode> statements = statements(
                ".rom",
                ".org 0x100",
                ".int 2",
                ".ram");

        // Assert
        assertThat(((SectionNode) statements.get(0)).section()).isEqualTo(SectionNode.Section.ROM);
        assertThat(((PrimaryExpressionNode) ((OrgNode) statements.get(1)).address()).token().intValue()).isEqualTo(0x100L);
        assertThat(statements.get(2)).isInstanceOf(InterruptNode.class);
        assertThat(((SectionNode) statements.get(3)).section()).isEqualTo(SectionNode.Section.RAM);
    }

    /**
     * Verifies that <code>.global</code> and <code>.extern</code> collect their symbol lists.
     */
    @Test
    @Tag("unit")
    void testSymbolDirectives() {
        // Act
        List<AstNode> statements = statements(
                ".global main, loop",
                ".extern helper");

        // Assert
        assertThat(((GlobalNode) statements.get(0)).symbols()).extracting(Token::text).containsExactly("main", "loop");
        assertThat(((ExternNode) statements.get(1)).symbols()).extracting(Token::text).containsExactly("helper");
    }

    /**
     * Verifies that <code>.let</code> declares a variable and a compound assignment stores
     * the combined expression in the environment.
     */
    @Test
    @Tag("unit")
    void testVariableDeclarationAndCompoundAssignment() {
        // Act
        List<AstNode> statements = statements(
                ".let $count = 1",
                "$count += 2");

        // Assert
        VariableDeclarationNode declaration = (VariableDeclarationNode) statements.get(0);
        assertThat(declaration.constant()).isFalse();
        VariableAssignmentNode assignment = (VariableAssignmentNode) statements.get(1);
        assertThat(assignment.operator().type()).isEqualTo(TokenType.ASSIGN_PLUS);
        AstNode stored = environment.entry("count").orElseThrow().value();
        assertThat(stored).isInstanceOf(BinaryExpressionNode.class);
        assertThat(((BinaryExpressionNode) stored).operator().type()).isEqualTo(TokenType.PLUS);
    }

    /**
     * Verifies that assigning to a constant is reported with the location of its declaration.
     */
    @Test
    @Tag("unit")
    void testAssignmentToConstantIsRejected() {
        // Arrange
        Parser parser = parser(
                ".const $SIZE = 4",
                "$SIZE = 5");

        // Act
        Optional<ModuleNode> module = parser.parse();

        // Assert
        assertThat(module).isEmpty();
        Diagnostic error = onlyError();
        assertThat(error.message()).isEqualTo("Cannot modify constant '$SIZE' (defined at 'main.asm:1').");
        assertThat(error.lineNumber()).isEqualTo(2);
    }

    /**
     * Verifies that declaring the same name twice is reported.
     */
    @Test
    @Tag("unit")
    void testDuplicateDeclarationIsRejected() {
        // Arrange
        Parser parser = parser(
                ".let $x = 1",
                ".const $x = 2");

        // Act
        parser.parse();

        // Assert
        assertThat(onlyError().message()).isEqualTo("'$x' is already defined as a variable at 'main.asm:1'.");
    }

    /**
     * Verifies that assigning to an undeclared variable is reported.
     */
    @Test
    @Tag("unit")
    void testAssignmentToUndeclaredVariableIsRejected() {
        // Arrange
        Parser parser = parser("$ghost = 1");

        // Act
        parser.parse();

        // Assert
        assertThat(onlyError().message()).isEqualTo("Undefined variable or constant '$ghost'.");
    }

    /**
     * Verifies that the operand count of an instruction is checked against its mnemonic.
     */
    @Test
    @Tag("unit")
    void testOperandCountIsChecked() {
        // Arrange
        Parser parser = parser("ld d0");

        // Act
        Optional<ModuleNode> module = parser.parse();

        // Assert
        assertThat(module).isEmpty();
        assertThat(onlyError().message()).isEqualTo("Instruction 'ld' expects 2 operands, but got 1.");
    }

    /**
     * Verifies the message for mnemonics that accept a range of operand counts.
     */
    @Test
    @Tag("unit")
    void testOperandRangeIsChecked() {
        // Arrange
        Parser parser = parser("jp zs, a, b");

        // Act
        parser.parse();

        // Assert
        assertThat(onlyError().message()).isEqualTo("Instruction 'jp' expects between 1 and 2 operands, but got 3.");
    }

    /**
     * Verifies that directives without a parser handler are reported as unsupported.
     */
    @Test
    @Tag("unit")
    void testUnsupportedDirectiveIsReported() {
        // Arrange
        Parser parser = parser(".space 4");

        // Act
        parser.parse();

        // Assert
        assertThat(onlyError().message()).isEqualTo("Unsupported assembler directive '.space'.");
    }

    /**
     * Verifies that extra tokens after a complete statement are rejected and the error names the line.
     */
    @Test
    @Tag("unit")
    void testTrailingTokensAreRejected() {
        // Arrange
        Parser parser = parser(
                "nop",
                "ret 1 2");

        // Act
        parser.parse();

        // Assert
        Diagnostic error = onlyError();
        assertThat(error.message()).isEqualTo("Expected end of line, but got '2'.");
        assertThat(error.fileName()).isEqualTo("main.asm");
        assertThat(error.lineNumber()).isEqualTo(2);
    }

    /**
     * Verifies that a missing operand expression is reported.
     */
    @Test
    @Tag("unit")
    void testMissingExpressionIsReported() {
        // Arrange
        Parser parser = parser("ld d0, (1 +");

        // Act
        parser.parse();

        // Assert
        assertThat(onlyError().message()).isEqualTo("Expected an expression, but got end of line.");
    }

    /**
     * Verifies that parsing the same stream twice starts from the beginning and yields the
     * same module, without re-declaration errors for variables.
     */
    @Test
    @Tag("unit")
    void testParseCanBeRepeated() {
        // Arrange
        Parser parser = parser(
                ".let $count = 1",
                "nop");
        Optional<ModuleNode> first = parser.parse();

        // Act
        Optional<ModuleNode> second = parser.parse();

        // Assert
        assertThat(diagnostics.hasErrors()).as(diagnostics.summary()).isFalse();
        assertThat(parser.isGood()).isTrue();
        assertThat(first).isPresent();
        assertThat(second).isPresent();
        assertThat(second.get().statements()).hasSize(2);
        assertThat(environment.entries()).hasSize(1);
    }
}
