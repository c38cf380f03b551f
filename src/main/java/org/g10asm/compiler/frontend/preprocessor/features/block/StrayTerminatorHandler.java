package org.g10asm.compiler.frontend.preprocessor.features.block;

import org.g10asm.compiler.frontend.CompilerPhase;
import org.g10asm.compiler.frontend.directive.IDirectiveHandler;
import org.g10asm.compiler.frontend.lexer.Token;
import org.g10asm.compiler.frontend.parser.ParsingContext;
import org.g10asm.compiler.frontend.parser.ast.AstNode;
import org.g10asm.compiler.frontend.preprocessor.PreProcessor;

/**
 * Reports branch and block terminators (<code>.else</code>, <code>.endif</code>, <code>.endm</code>,
 * <code>.endr</code>, ...) that appear without their opening directive. Matched terminators are
 * consumed by the handler of the opening directive and never reach this one.
 */
public class StrayTerminatorHandler implements IDirectiveHandler {

    @Override
    public CompilerPhase getPhase() {
        return CompilerPhase.PREPROCESSING;
    }

    @Override
    public AstNode parse(ParsingContext context) {
        PreProcessor pass = (PreProcessor) context;
        Token directive = context.advance();
        pass.restOfLine();
        throw pass.fail(directive, String.format("'%s' without matching opening directive.", directive.text()));
    }
}
