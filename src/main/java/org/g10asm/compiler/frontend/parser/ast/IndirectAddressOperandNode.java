package org.g10asm.compiler.frontend.parser.ast;

import java.util.List;

/**
 * A bracketed address operand. The target is either a {@link RegisterOperandNode}
 * (<code>[d0]</code>) or an address expression (<code>[table + 4]</code>).
 *
 * @param target The register or the expression inside the brackets.
 */
public record IndirectAddressOperandNode(AstNode target) implements AstNode {

    public boolean isRegisterIndirect() {
        return target instanceof RegisterOperandNode;
    }

    @Override
    public List<AstNode> getChildren() {
        return List.of(target);
    }
}
