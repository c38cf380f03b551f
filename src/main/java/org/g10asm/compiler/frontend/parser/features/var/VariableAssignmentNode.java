package org.g10asm.compiler.frontend.parser.features.var;

import org.g10asm.compiler.frontend.lexer.Token;
import org.g10asm.compiler.frontend.lexer.TokenType;
import org.g10asm.compiler.frontend.parser.ast.AstNode;

import java.util.List;
import java.util.Optional;

/**
 * An AST node for an assignment statement such as <code>$count += 1</code>.
 *
 * @param target The assigned variable.
 * @param operator The assignment operator token.
 * @param value The right-hand side.
 */
public record VariableAssignmentNode(
        Token target,
        Token operator,
        AstNode value
) implements AstNode {

    @Override
    public List<AstNode> getChildren() {
        return List.of(value);
    }

    /**
     * Maps a compound assignment operator to its binary operator, e.g. <code>+=</code> to <code>+</code>.
     * @param assignment An assignment operator type.
     * @return The binary operator, or empty for plain <code>=</code>.
     */
    public static Optional<TokenType> binaryOperator(TokenType assignment) {
        return Optional.ofNullable(switch (assignment) {
            case ASSIGN_PLUS -> TokenType.PLUS;
            case ASSIGN_MINUS -> TokenType.MINUS;
            case ASSIGN_TIMES -> TokenType.TIMES;
            case ASSIGN_EXPONENT -> TokenType.EXPONENT;
            case ASSIGN_DIVIDE -> TokenType.DIVIDE;
            case ASSIGN_MODULO -> TokenType.MODULO;
            case ASSIGN_AND -> TokenType.BITWISE_AND;
            case ASSIGN_OR -> TokenType.BITWISE_OR;
            case ASSIGN_XOR -> TokenType.BITWISE_XOR;
            case ASSIGN_LEFT_SHIFT -> TokenType.LEFT_SHIFT;
            case ASSIGN_RIGHT_SHIFT -> TokenType.RIGHT_SHIFT;
            default -> null;
        });
    }
}
