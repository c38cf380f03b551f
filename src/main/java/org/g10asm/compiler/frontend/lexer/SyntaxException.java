package org.g10asm.compiler.frontend.lexer;

/**
 * Aborts the stage that is walking a token stream. The matching diagnostic has already been
 * reported when this exception is thrown, so handlers only need to stop and unwind.
 */
public class SyntaxException extends RuntimeException {

    private final transient Token token;

    /**
     * @param message The error message that was reported.
     * @param token The offending token, may be null at the end of the stream.
     */
    public SyntaxException(String message, Token token) {
        super(message);
        this.token = token;
    }

    public Token getToken() {
        return token;
    }
}
