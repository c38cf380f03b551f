package org.g10asm.compiler.frontend.parser.features.symbol;

import org.g10asm.compiler.frontend.CompilerPhase;
import org.g10asm.compiler.frontend.directive.IDirectiveHandler;
import org.g10asm.compiler.frontend.lexer.Token;
import org.g10asm.compiler.frontend.lexer.TokenType;
import org.g10asm.compiler.frontend.parser.Parser;
import org.g10asm.compiler.frontend.parser.ParsingContext;
import org.g10asm.compiler.frontend.parser.ast.AstNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Handles <code>.global</code> and <code>.extern</code>, both followed by a comma-separated list
 * of symbol names.
 */
public class SymbolDirectiveHandler implements IDirectiveHandler {
    @Override public CompilerPhase getPhase() { return CompilerPhase.PARSING; }

    @Override public AstNode parse(ParsingContext context) {
        Token directive = context.advance();
        Parser parser = (Parser) context;
        if (parser.atEndOfStatement()) {
            throw parser.fail(directive, String.format("'%s' requires at least one symbol.", directive.text()));
        }
        List<Token> symbols = new ArrayList<>();
        do {
            symbols.add(context.consume(TokenType.IDENTIFIER,
                    String.format("Expected a symbol name in '%s'.", directive.text())));
        } while (context.match(TokenType.COMMA));

        if (directive.text().equalsIgnoreCase(".global")) {
            return new GlobalNode(directive, symbols);
        }
        return new ExternNode(directive, symbols);
    }
}
