package org.g10asm.compiler.frontend.parser.features.data;

import org.g10asm.compiler.frontend.lexer.Token;
import org.g10asm.compiler.frontend.parser.ast.AstNode;

import java.util.List;

/**
 * An AST node for <code>.byte</code>, <code>.word</code> and <code>.dword</code> (and their
 * <code>.db</code>, <code>.dw</code>, <code>.dd</code> aliases).
 *
 * @param directive The directive token.
 * @param width The size of one value in bytes: 1, 2 or 4.
 * @param values The value expressions, in order.
 */
public record DataNode(
        Token directive,
        int width,
        List<AstNode> values
) implements AstNode {

    public DataNode {
        values = List.copyOf(values);
    }

    @Override
    public List<AstNode> getChildren() {
        return values;
    }
}
