package org.g10asm.compiler.frontend.parser.ast;

import java.util.List;

/**
 * The target of a branch instruction (<code>jmp</code>, <code>jpb</code>, <code>call</code>,
 * <code>jp</code>, <code>jr</code>).
 *
 * @param address The address expression, usually a label.
 */
public record DirectAddressOperandNode(AstNode address) implements AstNode {

    @Override
    public List<AstNode> getChildren() {
        return List.of(address);
    }
}
