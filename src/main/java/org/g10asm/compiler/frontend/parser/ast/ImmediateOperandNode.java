package org.g10asm.compiler.frontend.parser.ast;

import java.util.List;

/**
 * An operand whose value is given by an expression, e.g. the <code>5</code> in <code>ld d0, 5</code>.
 *
 * @param value The expression.
 */
public record ImmediateOperandNode(AstNode value) implements AstNode {

    @Override
    public List<AstNode> getChildren() {
        return List.of(value);
    }
}
