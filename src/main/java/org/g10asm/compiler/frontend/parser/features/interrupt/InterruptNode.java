package org.g10asm.compiler.frontend.parser.features.interrupt;

import org.g10asm.compiler.frontend.lexer.Token;
import org.g10asm.compiler.frontend.parser.ast.AstNode;

import java.util.List;

/**
 * An AST node for <code>.int</code>/<code>.interrupt</code>, which places the following code
 * at an interrupt vector.
 *
 * @param directive The directive token.
 * @param vector The vector number expression.
 */
public record InterruptNode(
        Token directive,
        AstNode vector
) implements AstNode {

    @Override
    public List<AstNode> getChildren() {
        return List.of(vector);
    }
}
