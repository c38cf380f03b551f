package org.g10asm.compiler.frontend.parser.features.symbol;

import org.g10asm.compiler.frontend.lexer.Token;
import org.g10asm.compiler.frontend.parser.ast.AstNode;

import java.util.List;

/**
 * An AST node for <code>.extern</code>, which declares symbols defined in another module.
 *
 * @param directive The directive token.
 * @param symbols The imported symbol names.
 */
public record ExternNode(
        Token directive,
        List<Token> symbols
) implements AstNode {

    public ExternNode {
        symbols = List.copyOf(symbols);
    }
}
