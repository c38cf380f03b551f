package org.g10asm.compiler.frontend.parser.features.section;

import org.g10asm.compiler.frontend.CompilerPhase;
import org.g10asm.compiler.frontend.directive.IDirectiveHandler;
import org.g10asm.compiler.frontend.lexer.Token;
import org.g10asm.compiler.frontend.parser.Parser;
import org.g10asm.compiler.frontend.parser.ParsingContext;
import org.g10asm.compiler.frontend.parser.ast.AstNode;

/**
 * Handles <code>.rom</code> and <code>.ram</code>. Neither takes operands.
 */
public class SectionDirectiveHandler implements IDirectiveHandler {
    @Override public CompilerPhase getPhase() { return CompilerPhase.PARSING; }

    @Override public AstNode parse(ParsingContext context) {
        Token directive = context.advance();
        Parser parser = (Parser) context;
        if (!parser.atEndOfStatement()) {
            throw parser.fail(context.peek(), String.format("'%s' takes no operands.", directive.text()));
        }
        SectionNode.Section section = directive.text().equalsIgnoreCase(".rom")
                ? SectionNode.Section.ROM
                : SectionNode.Section.RAM;
        return new SectionNode(directive, section);
    }
}
