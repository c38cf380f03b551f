package org.g10asm.compiler.frontend.parser.features.symbol;

import org.g10asm.compiler.frontend.lexer.Token;
import org.g10asm.compiler.frontend.parser.ast.AstNode;

import java.util.List;

/**
 * An AST node for <code>.global</code>, which exports symbols from this module.
 *
 * @param directive The directive token.
 * @param symbols The exported symbol names.
 */
public record GlobalNode(
        Token directive,
        List<Token> symbols
) implements AstNode {

    public GlobalNode {
        symbols = List.copyOf(symbols);
    }
}
