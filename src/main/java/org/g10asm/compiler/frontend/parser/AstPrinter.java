package org.g10asm.compiler.frontend.parser;

import org.g10asm.compiler.frontend.lexer.Token;
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

import java.util.List;
import java.util.Locale;

/**
 * Renders an AST as indented text, one node per line, four spaces per nesting level.
 * Used by <code>--parse-only</code> and in tests.
 */
public final class AstPrinter {

    private static final String INDENT = "    ";

    private AstPrinter() {}

    /**
     * @param node The root of the tree, usually a {@link ModuleNode}.
     * @return The rendered tree, each line terminated by a newline.
     */
    public static String print(AstNode node) {
        StringBuilder out = new StringBuilder();
        print(node, 0, out);
        return out.toString();
    }

    private static void print(AstNode node, int indent, StringBuilder out) {
        if (node instanceof ModuleNode module) {
            line(out, indent, "module");
            children(module.statements(), indent + 1, out);
        } else if (node instanceof LabelNode label) {
            line(out, indent, "label_definition: '" + label.name() + "'");
        } else if (node instanceof InstructionNode instruction) {
            line(out, indent, "instruction: " + instruction.mnemonic().text().toLowerCase(Locale.ROOT));
            children(instruction.operands(), indent + 1, out);
        } else if (node instanceof OrgNode org) {
            line(out, indent, ".org directive:");
            print(org.address(), indent + 1, out);
        } else if (node instanceof SectionNode section) {
            line(out, indent, "." + section.section().name().toLowerCase(Locale.ROOT) + " directive");
        } else if (node instanceof InterruptNode interrupt) {
            line(out, indent, ".int directive:");
            print(interrupt.vector(), indent + 1, out);
        } else if (node instanceof DataNode data) {
            line(out, indent, dataDirective(data.width()) + " directive:");
            children(data.values(), indent + 1, out);
        } else if (node instanceof GlobalNode global) {
            line(out, indent, ".global directive:");
            symbols(global.symbols(), indent + 1, out);
        } else if (node instanceof ExternNode extern) {
            line(out, indent, ".extern directive:");
            symbols(extern.symbols(), indent + 1, out);
        } else if (node instanceof VariableDeclarationNode declaration) {
            line(out, indent, (declaration.constant() ? ".const" : ".let") + " directive: " + declaration.name().name());
            print(declaration.initializer(), indent + 1, out);
        } else if (node instanceof VariableAssignmentNode assignment) {
            line(out, indent, "assignment: " + assignment.target().name());
            line(out, indent + 1, "operator: " + assignment.operator().text());
            print(assignment.value(), indent + 1, out);
        } else if (node instanceof ImmediateOperandNode immediate) {
            line(out, indent, "immediate operand:");
            print(immediate.value(), indent + 1, out);
        } else if (node instanceof RegisterOperandNode register) {
            line(out, indent, "register operand: " + register.register().text().toLowerCase(Locale.ROOT));
        } else if (node instanceof ConditionOperandNode condition) {
            line(out, indent, "condition operand: " + condition.condition().text().toLowerCase(Locale.ROOT));
        } else if (node instanceof DirectAddressOperandNode direct) {
            line(out, indent, "direct operand:");
            print(direct.address(), indent + 1, out);
        } else if (node instanceof IndirectAddressOperandNode indirect) {
            if (indirect.target() instanceof RegisterOperandNode register) {
                line(out, indent, "indirect operand: [" + register.register().text().toLowerCase(Locale.ROOT) + "]");
            } else {
                line(out, indent, "indirect operand:");
                print(indirect.target(), indent + 1, out);
            }
        } else if (node instanceof BinaryExpressionNode binary) {
            line(out, indent, "binary expression:");
            line(out, indent + 1, "operator: " + binary.operator().text());
            line(out, indent + 1, "left_operand:");
            print(binary.left(), indent + 2, out);
            line(out, indent + 1, "right_operand:");
            print(binary.right(), indent + 2, out);
        } else if (node instanceof UnaryExpressionNode unary) {
            line(out, indent, "unary expression:");
            line(out, indent + 1, "operator: " + unary.operator().text());
            line(out, indent + 1, "operand:");
            print(unary.operand(), indent + 2, out);
        } else if (node instanceof GroupingExpressionNode grouping) {
            line(out, indent, "grouping expression:");
            print(grouping.expression(), indent + 1, out);
        } else if (node instanceof PrimaryExpressionNode primary) {
            line(out, indent, primary(primary.token()));
        } else {
            line(out, indent, "unknown node: " + node.getClass().getSimpleName());
        }
    }

    private static String primary(Token token) {
        return switch (token.type()) {
            case INTEGER_LITERAL -> "integer: " + token.intValue();
            case NUMBER_LITERAL -> "number: " + token.numberValue();
            case CHARACTER_LITERAL -> "char: '" + (char) token.intValue() + "'";
            case STRING_LITERAL -> "string: \"" + token.stringValue() + "\"";
            case VARIABLE -> "variable: " + token.name();
            case PLACEHOLDER, PLACEHOLDER_KEYWORD -> "placeholder: " + token.name();
            default -> "identifier: " + token.text();
        };
    }

    private static String dataDirective(int width) {
        return switch (width) {
            case 1 -> ".byte";
            case 2 -> ".word";
            default -> ".dword";
        };
    }

    private static void children(List<AstNode> nodes, int indent, StringBuilder out) {
        for (AstNode child : nodes) {
            print(child, indent, out);
        }
    }

    private static void symbols(List<Token> symbols, int indent, StringBuilder out) {
        for (Token symbol : symbols) {
            line(out, indent, symbol.text());
        }
    }

    private static void line(StringBuilder out, int indent, String text) {
        out.append(INDENT.repeat(indent)).append(text).append('\n');
    }
}
