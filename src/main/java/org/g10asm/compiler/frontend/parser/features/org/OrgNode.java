package org.g10asm.compiler.frontend.parser.features.org;

import org.g10asm.compiler.frontend.lexer.Token;
import org.g10asm.compiler.frontend.parser.ast.AstNode;

import java.util.List;

/**
 * An AST node that represents an <code>.org</code> directive.
 *
 * @param directive The directive token.
 * @param address The expression that specifies the origin.
 */
public record OrgNode(
        Token directive,
        AstNode address
) implements AstNode {

    @Override
    public List<AstNode> getChildren() {
        return List.of(address);
    }
}
