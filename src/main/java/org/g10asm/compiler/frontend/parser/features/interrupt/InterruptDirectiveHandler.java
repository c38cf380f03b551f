package org.g10asm.compiler.frontend.parser.features.interrupt;

import org.g10asm.compiler.frontend.CompilerPhase;
import org.g10asm.compiler.frontend.directive.IDirectiveHandler;
import org.g10asm.compiler.frontend.lexer.Token;
import org.g10asm.compiler.frontend.parser.Parser;
import org.g10asm.compiler.frontend.parser.ParsingContext;
import org.g10asm.compiler.frontend.parser.ast.AstNode;

/**
 * Handles <code>.int &lt;vector&gt;</code> and its long form <code>.interrupt</code>.
 */
public class InterruptDirectiveHandler implements IDirectiveHandler {
    @Override public CompilerPhase getPhase() { return CompilerPhase.PARSING; }

    @Override public AstNode parse(ParsingContext context) {
        Token directive = context.advance();
        Parser parser = (Parser) context;
        if (parser.atEndOfStatement()) {
            throw parser.fail(directive, String.format("'%s' requires a vector expression.", directive.text()));
        }
        return new InterruptNode(directive, parser.expression());
    }
}
