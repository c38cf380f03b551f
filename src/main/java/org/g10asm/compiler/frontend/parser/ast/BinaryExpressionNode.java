package org.g10asm.compiler.frontend.parser.ast;

import org.g10asm.compiler.frontend.lexer.Token;

import java.util.List;

/**
 * A binary operation.
 *
 * @param left The left operand.
 * @param operator The operator token.
 * @param right The right operand.
 */
public record BinaryExpressionNode(
        AstNode left,
        Token operator,
        AstNode right
) implements AstNode {

    @Override
    public List<AstNode> getChildren() {
        return List.of(left, right);
    }
}
