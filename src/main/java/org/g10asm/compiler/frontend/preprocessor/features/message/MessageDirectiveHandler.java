package org.g10asm.compiler.frontend.preprocessor.features.message;

import org.g10asm.compiler.diagnostics.DiagnosticsEngine;
import org.g10asm.compiler.frontend.CompilerPhase;
import org.g10asm.compiler.frontend.directive.IDirectiveHandler;
import org.g10asm.compiler.frontend.lexer.Token;
import org.g10asm.compiler.frontend.parser.ParsingContext;
import org.g10asm.compiler.frontend.parser.ast.AstNode;
import org.g10asm.compiler.frontend.preprocessor.Flow;
import org.g10asm.compiler.frontend.preprocessor.PreProcessor;
import org.g10asm.compiler.frontend.preprocessor.PreProcessorContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Handles the user diagnostics <code>.info</code>, <code>.warning</code>, <code>.error</code> and
 * <code>.fatal</code> (with their aliases). The argument is an expression, usually an
 * interpolated string; its text becomes the message.
 */
public class MessageDirectiveHandler implements IDirectiveHandler {

    private static final Logger LOG = LoggerFactory.getLogger(MessageDirectiveHandler.class);

    /**
     * The effect a message directive has on the run.
     */
    public enum Severity {
        INFO,
        WARNING,
        /** Marks the run as failed and continues. */
        ERROR,
        /** Marks the run as failed and stops preprocessing. */
        FATAL
    }

    private final Severity severity;

    public MessageDirectiveHandler(Severity severity) {
        this.severity = severity;
    }

    @Override
    public CompilerPhase getPhase() {
        return CompilerPhase.PREPROCESSING;
    }

    @Override
    public AstNode parse(ParsingContext context) {
        process(context, ((PreProcessor) context).getContext(), 0);
        return null;
    }

    @Override
    public Flow process(ParsingContext context, PreProcessorContext ppContext, int depth) {
        PreProcessor pass = (PreProcessor) context;
        DiagnosticsEngine diagnostics = context.getDiagnostics();

        Token directive = context.advance();
        List<Token> expression = pass.restOfLine();
        String message = expression.isEmpty()
                ? String.format("'%s' directive reached.", directive.text())
                : pass.evaluateOrFail(pass.interpolateStrings(expression), directive).toString();

        switch (severity) {
            case INFO -> {
                diagnostics.reportInfo(message, directive.fileName(), directive.line());
                LOG.info("{}:{}: {}", directive.fileName(), directive.line(), message);
            }
            case WARNING -> {
                diagnostics.reportWarning(message, directive.fileName(), directive.line());
                LOG.warn("{}:{}: {}", directive.fileName(), directive.line(), message);
            }
            case ERROR -> diagnostics.reportError(message, directive.fileName(), directive.line());
            case FATAL -> {
                pass.reportFatal(directive, message);
                return Flow.ABORT;
            }
        }
        return Flow.NORMAL;
    }
}
