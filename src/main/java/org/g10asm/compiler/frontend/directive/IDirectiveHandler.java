package org.g10asm.compiler.frontend.directive;

import org.g10asm.compiler.frontend.CompilerPhase;
import org.g10asm.compiler.frontend.parser.ParsingContext;
import org.g10asm.compiler.frontend.parser.ast.AstNode;
import org.g10asm.compiler.frontend.preprocessor.Flow;
import org.g10asm.compiler.frontend.preprocessor.PreProcessorContext;

/**
 * The base interface for all directive handlers.
 * Each handler is responsible for processing a specific directive (e.g., ".org" or ".repeat").
 */
public interface IDirectiveHandler {

    /**
     * Specifies the phase in which this handler is active.
     * @return The phase in which the handler is executed.
     */
    CompilerPhase getPhase();

    /**
     * Parses the directive and its arguments.
     *
     * @param context The context that provides access to the token stream.
     * @return A corresponding AST node for this directive, or {@code null}
     *         if the directive does not produce a node in the AST.
     */
    AstNode parse(ParsingContext context);

    /**
     * Processes a preprocessor directive. The current token of {@code context} is the directive keyword.
     * This method is only called for handlers that run in the PREPROCESSING phase.
     *
     * @param context The context for the token stream.
     * @param ppContext The preprocessor state (macros, include stack, limits).
     * @param depth The recursion depth of the block containing the directive.
     * @return How processing of the enclosing block continues.
     */
    default Flow process(ParsingContext context, PreProcessorContext ppContext, int depth) {
        parse(context);
        return Flow.NORMAL;
    }
}
