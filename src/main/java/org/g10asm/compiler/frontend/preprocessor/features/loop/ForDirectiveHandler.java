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
 * Handles <code>.for var, start, end [, step]</code> ... <code>.endfor</code>/<code>.endf</code>.
 * The end is exclusive; a negative step counts down while the value is greater than the end.
 */
public class ForDirectiveHandler implements IDirectiveHandler {

    private static final Logger LOG = LoggerFactory.getLogger(ForDirectiveHandler.class);
    private static final Set<String> OPENERS = Set.of(".for");
    private static final Set<String> CLOSERS = Set.of(".endfor", ".endf");

    @Override
    public CompilerPhase getPhase() {
        return CompilerPhase.PREPROCESSING;
    }

    @Override
    public AstNode parse(ParsingContext context) {
        throw new UnsupportedOperationException("'.for' is processed with its recursion depth");
    }

    @Override
    public Flow process(ParsingContext context, PreProcessorContext ppContext, int depth) {
        PreProcessor pass = (PreProcessor) context;

        Token directive = context.advance();
        List<List<Token>> header = TokenLists.splitTopLevel(pass.restOfLine());
        List<Token> body = pass.collectBlock(directive, OPENERS, CLOSERS, ".endfor");

        if (header.size() < 3 || header.size() > 4) {
            throw pass.fail(directive, "'.for' expects a variable, a start, an end and an optional step.");
        }
        Token variable = LoopSupport.variable(pass, header.get(0), directive);
        long start = LoopSupport.integer(pass, header.get(1), directive, "The start");
        long end = LoopSupport.integer(pass, header.get(2), directive, "The end");
        long step = header.size() == 4 ? LoopSupport.integer(pass, header.get(3), directive, "The step") : 1;
        if (step == 0) {
            throw pass.fail(header.get(3).get(0), "The step of '.for' must not be zero.");
        }

        LoopSupport loop = new LoopSupport(pass, variable);
        long iterations = 0;
        try {
            for (long value = start; step > 0 ? value < end : value > end; value += step) {
                loop.bind(value);
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
        LOG.debug("'.for {}' at {}:{} ran {} iteration(s)", variable.text(), directive.fileName(), directive.line(), iterations);
        return Flow.NORMAL;
    }
}
