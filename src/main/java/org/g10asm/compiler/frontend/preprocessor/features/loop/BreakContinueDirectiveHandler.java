package org.g10asm.compiler.frontend.preprocessor.features.loop;

import org.g10asm.compiler.frontend.CompilerPhase;
import org.g10asm.compiler.frontend.directive.IDirectiveHandler;
import org.g10asm.compiler.frontend.lexer.Token;
import org.g10asm.compiler.frontend.parser.ParsingContext;
import org.g10asm.compiler.frontend.parser.ast.AstNode;
import org.g10asm.compiler.frontend.preprocessor.Flow;
import org.g10asm.compiler.frontend.preprocessor.PreProcessor;
import org.g10asm.compiler.frontend.preprocessor.PreProcessorContext;

import java.util.List;

/**
 * Handles <code>.break</code> and <code>.continue</code> inside loop bodies.
 */
public class BreakContinueDirectiveHandler implements IDirectiveHandler {

    private final Flow flow;

    /**
     * @param flow {@link Flow#BREAK} or {@link Flow#CONTINUE}.
     */
    public BreakContinueDirectiveHandler(Flow flow) {
        this.flow = flow;
    }

    @Override
    public CompilerPhase getPhase() {
        return CompilerPhase.PREPROCESSING;
    }

    @Override
    public AstNode parse(ParsingContext context) {
        throw new UnsupportedOperationException("loop control is processed by the enclosing loop");
    }

    @Override
    public Flow process(ParsingContext context, PreProcessorContext ppContext, int depth) {
        PreProcessor pass = (PreProcessor) context;
        Token directive = context.advance();
        List<Token> rest = pass.restOfLine();
        if (!ppContext.isInLoop()) {
            throw pass.fail(directive, String.format("'%s' used outside of a loop.", directive.text()));
        }
        if (!rest.isEmpty()) {
            throw pass.fail(rest.get(0), String.format("'%s' takes no arguments.", directive.text()));
        }
        return flow;
    }
}
