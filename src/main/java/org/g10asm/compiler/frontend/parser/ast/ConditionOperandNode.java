package org.g10asm.compiler.frontend.parser.ast;

import org.g10asm.compiler.frontend.lexer.Token;

/**
 * A branching condition operand such as <code>zs</code>.
 *
 * @param condition The condition keyword token.
 */
public record ConditionOperandNode(Token condition) implements AstNode {

    public int code() {
        return condition.keyword().param1();
    }
}
