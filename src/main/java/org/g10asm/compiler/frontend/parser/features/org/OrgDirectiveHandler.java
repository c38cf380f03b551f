package org.g10asm.compiler.frontend.parser.features.org;

import org.g10asm.compiler.frontend.CompilerPhase;
import org.g10asm.compiler.frontend.directive.IDirectiveHandler;
import org.g10asm.compiler.frontend.lexer.Token;
import org.g10asm.compiler.frontend.parser.Parser;
import org.g10asm.compiler.frontend.parser.ParsingContext;
import org.g10asm.compiler.frontend.parser.ast.AstNode;

/**
 * Handles the parsing of the <code>.org</code> directive.
 * This directive sets the origin (the starting address) for subsequent code.
 */
public class OrgDirectiveHandler implements IDirectiveHandler {
    @Override public CompilerPhase getPhase() { return CompilerPhase.PARSING; }

    /**
     * Parses an <code>.org</code> directive.
     * The syntax is <code>.org &lt;expression&gt;</code>.
     * @param context The parsing context.
     * @return An {@link OrgNode} representing the directive.
     */
    @Override public AstNode parse(ParsingContext context) {
        Token directive = context.advance(); // consume .org
        Parser parser = (Parser) context;
        if (parser.atEndOfStatement()) {
            throw parser.fail(directive, "'.org' requires an address expression.");
        }
        return new OrgNode(directive, parser.expression());
    }
}
