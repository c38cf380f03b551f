package org.g10asm.compiler.frontend.preprocessor.features.loop;

import org.g10asm.compiler.frontend.CompilerPhase;
import org.g10asm.compiler.frontend.directive.IDirectiveHandler;
import org.g10asm.compiler.frontend.lexer.Token;
import org.g10asm.compiler.frontend.parser.ParsingContext;
import org.g10asm.compiler.frontend.parser.ast.AstNode;
import org.g10asm.compiler.frontend.preprocessor.Flow;
import org.g10asm.compiler.frontend.preprocessor.PreProcessor;
import org.g10asm.compiler.frontend.preprocessor.PreProcessorContext;
import org.g10asm.compiler.frontend.preprocessor.TokenLists;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Set;

/**
 * Handles <code>.repeat count [, var]</code> ... <code>.endrepeat</code> (short forms
 * <code>.rept</code> and <code>.endr</code>). The optional variable holds the 0-based iteration.
 */
public class RepeatDirectiveHandler implements IDirectiveHandler {

    private static final Logger LOG = LoggerFactory.getLogger(RepeatDirectiveHandler.class);
    private static final Set<String> OPENERS = Set.of(".repeat", ".rept");
    private static final Set<String> CLOSERS = Set.of(".endrepeat", ".endr");

    @Override
    public CompilerPhase getPhase() {
        return CompilerPhase.PREPROCESSING;
    }

    @Override
    public AstNode parse(ParsingContext context) {
        throw new UnsupportedOperationException("'.repeat' is processed with its recursion depth");
    }

    @Override
    public Flow process(ParsingContext context, PreProcessorContext ppContext, int depth) {
        PreProcessor pass = (PreProcessor) context;

        Token directive = context.advance();
        List<List<Token>> header = TokenLists.splitTopLevel(pass.restOfLine());
        List<Token> body = pass.collectBlock(directive, OPENERS, CLOSERS, ".endr");

        if (header.isEmpty() || header.size() > 2) {
            throw pass.fail(directive, String.format("'%s' expects a count and an optional loop variable.", directive.text()));
        }
        long count = LoopSupport.integer(pass, header.get(0), directive, "The count");
        if (count < 0) {
            throw pass.fail(header.get(0).get(0), String.format("The count of '%s' must not be negative, got %d.", directive.text(), count));
        }
        Token variable = header.size() == 2 ? LoopSupport.variable(pass, header.get(1), directive) : null;

        LoopSupport loop = new LoopSupport(pass, variable);
        long iterations = 0;
        try {
            for (long i = 0; i < count; i++) {
                loop.bind(i);
                iterations++;
                Flow flow = loop.iterate(body, depth + 1);
                if (flow == Flow.ABORT) {
                    return Flow.ABORT;
                }
                if (flow == Flow.BREAK) {
                    break;
                }
            }
        } finally {
            loop.restore();
        }
        LOG.debug("'{}' at {}:{} ran {} iteration(s)", directive.text(), directive.fileName(), directive.line(), iterations);
        return Flow.NORMAL;
    }
}
