package org.g10asm.compiler.frontend.parser.ast;

import org.g10asm.compiler.frontend.lexer.Token;

/**
 * A register operand such as <code>d0</code> or <code>h3</code>.
 *
 * @param register The register keyword token.
 */
public record RegisterOperandNode(Token register) implements AstNode {

    public int index() {
        return register.keyword().param1();
    }

    /**
     * @return The register width in bits: 32, 16 or 8.
     */
    public int width() {
        return register.keyword().param2();
    }
}
