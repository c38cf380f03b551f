package org.g10asm.compiler.frontend.parser.ast;

import java.util.List;

/**
 * A parenthesized expression.
 *
 * @param expression The inner expression.
 */
public record GroupingExpressionNode(AstNode expression) implements AstNode {

    @Override
    public List<AstNode> getChildren() {
        return List.of(expression);
    }
}
