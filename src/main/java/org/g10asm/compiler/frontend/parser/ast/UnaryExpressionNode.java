package org.g10asm.compiler.frontend.parser.ast;

import org.g10asm.compiler.frontend.lexer.Token;

import java.util.List;

/**
 * A prefix operation: <code>-</code>, <code>+</code>, <code>~</code> or <code>!</code>.
 *
 * @param operator The operator token.
 * @param operand The operand.
 */
public record UnaryExpressionNode(
        Token operator,
        AstNode operand
) implements AstNode {

    @Override
    public List<AstNode> getChildren() {
        return List.of(operand);
    }
}
