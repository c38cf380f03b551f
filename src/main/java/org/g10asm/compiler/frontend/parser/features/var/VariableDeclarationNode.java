package org.g10asm.compiler.frontend.parser.features.var;

import org.g10asm.compiler.frontend.lexer.Token;
import org.g10asm.compiler.frontend.parser.ast.AstNode;

import java.util.List;

/**
 * An AST node for <code>.let $name = expr</code> and <code>.const $name = expr</code>.
 *
 * @param directive The directive token.
 * @param name The variable token.
 * @param initializer The initial value.
 * @param constant Whether the declaration is a <code>.const</code>.
 */
public record VariableDeclarationNode(
        Token directive,
        Token name,
        AstNode initializer,
        boolean constant
) implements AstNode {

    @Override
    public List<AstNode> getChildren() {
        return List.of(initializer);
    }
}
