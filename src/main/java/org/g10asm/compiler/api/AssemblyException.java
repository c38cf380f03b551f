package org.g10asm.compiler.api;

/**
 * Thrown when one or more errors occur while assembling a source file.
 * <p>
 * It is part of the public API and hides the internal exception types of the front end.
 */
public class AssemblyException extends Exception {

    /**
     * Constructs a new assembly exception with the specified detail message.
     * @param message The detail message, usually the diagnostics summary.
     */
    public AssemblyException(String message) {
        super(message, null);
    }

    /**
     * Constructs a new assembly exception with the specified detail message and cause.
     * @param message The detail message.
     * @param cause The cause.
     */
    public AssemblyException(String message, Throwable cause) {
        super(message, cause);
    }
}
