package org.g10asm.compiler.frontend.parser.ast;

import org.g10asm.compiler.frontend.lexer.Token;

import java.util.List;

/**
 * An AST node that represents a single machine instruction.
 *
 * @param mnemonic The keyword token of the mnemonic (e.g., ld).
 * @param operands The operand nodes, in source order.
 */
public record InstructionNode(
        Token mnemonic,
        List<AstNode> operands
) implements AstNode {

    public InstructionNode {
        operands = List.copyOf(operands);
    }

    @Override
    public List<AstNode> getChildren() {
        return operands;
    }
}
