package org.g10asm.compiler.frontend.parser.ast;

import org.g10asm.compiler.frontend.lexer.Token;

/**
 * A leaf of an expression: a literal, an identifier, a variable or a placeholder.
 *
 * @param token The token of the leaf.
 */
public record PrimaryExpressionNode(Token token) implements AstNode {
}
