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
 * Handles <code>.while cond [, var]</code> ... <code>.endwhile</code>/<code>.endw</code>.
 * <p>
 * The condition is evaluated before every iteration, with the optional variable bound to the
 * 0-based iteration counter. Iteration {@code k} counts as {@code k} extra recursion levels, so a
 * loop whose condition never becomes false ends with the recursion depth error.
 */
public class WhileDirectiveHandler implements IDirectiveHandler {

    private static final Logger LOG = LoggerFactory.getLogger(WhileDirectiveHandler.class);
    private static final Set<String> OPENERS = Set.of(".while");
    private static final Set<String> CLOSERS = Set.of(".endwhile", ".endw");

    @Override
    public CompilerPhase getPhase() {
        return CompilerPhase.PREPROCESSING;
    }

    @Override
    public AstNode parse(ParsingContext context) {
        throw new UnsupportedOperationException("'.while' is processed with its recursion depth");
    }

    @Override
    public Flow process(ParsingContext context, PreProcessorContext ppContext, int depth) {
        PreProcessor pass = (PreProcessor) context;

        Token directive = context.advance();
        List<List<Token>> header = TokenLists.splitTopLevel(pass.restOfLine());
        List<Token> body = pass.collectBlock(directive, OPENERS, CLOSERS, ".endwhile");

        if (header.isEmpty() || header.size() > 2) {
            throw pass.fail(directive, "'.while' expects a condition and an optional loop variable.");
        }
        List<Token> condition = header.get(0);
        Token variable = header.size() == 2 ? LoopSupport.variable(pass, header.get(1), directive) : null;

        LoopSupport loop = new LoopSupport(pass, variable);
        long iteration = 0;
        try {
            while (true) {
                int level = depth + 1 + (int) Math.min(iteration, Integer.MAX_VALUE - depth - 1L);
                if (level > ppContext.getMaxRecursionDepth()) {
                    pass.reportFatal(directive, String.format("Maximum recursion depth of %d exceeded in '%s' loop.",
                            ppContext.getMaxRecursionDepth(), directive.text()));
                    return Flow.ABORT;
                }
                loop.bind(iteration);
                if (!pass.evaluateCondition(condition, directive).isTruthy()) {
                    break;
                }
                Flow flow = loop.iterate(body, level);
                iteration++;
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
        LOG.debug("'{}' at {}:{} ran {} iteration(s)", directive.text(), directive.fileName(), directive.line(), iteration);
        return Flow.NORMAL;
    }
}
