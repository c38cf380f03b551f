package org.g10asm.compiler.frontend.preprocessor.eval;

import org.g10asm.compiler.frontend.lexer.Token;

/**
 * Thrown when a preprocessor expression cannot be evaluated: syntax errors, unknown names,
 * type mismatches, wrong argument counts, division by zero and runaway macro recursion.
 */
public class EvaluationException extends Exception {

    private final transient Token token;
    private final boolean fatal;

    /**
     * @param message The error message.
     * @param token The token the error refers to, or null if the expression was empty.
     */
    public EvaluationException(String message, Token token) {
        this(message, token, false);
    }

    /**
     * @param message The error message.
     * @param token The token the error refers to, or null if the expression was empty.
     * @param fatal {@code true} if the whole preprocessing run must stop, e.g. on a recursion limit.
     */
    public EvaluationException(String message, Token token, boolean fatal) {
        super(message);
        this.token = token;
        this.fatal = fatal;
    }

    /**
     * @return The offending token, may be null.
     */
    public Token getToken() {
        return token;
    }

    public boolean isFatal() {
        return fatal;
    }
}
