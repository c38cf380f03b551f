package org.g10asm.compiler.frontend.parser.features.label;

import org.g10asm.compiler.frontend.lexer.Token;
import org.g10asm.compiler.frontend.parser.ast.AstNode;

/**
 * An AST node that represents a label definition (e.g., "loop:").
 * A statement on the same line follows as a separate node.
 *
 * @param labelToken The token containing the name of the label.
 */
public record LabelNode(Token labelToken) implements AstNode {

    public String name() {
        return labelToken.text();
    }
}
