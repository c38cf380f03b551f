package org.g10asm.compiler.diagnostics;

/**
 * A single message (error, warning, info) produced while assembling a source file.
 *
 * @param type The severity of the diagnostic.
 * @param message The diagnostic message.
 * @param fileName The file the message refers to.
 * @param lineNumber The 1-based line the message refers to.
 */
public record Diagnostic(
        Type type,
        String message,
        String fileName,
        int lineNumber
) {
    /**
     * The severity of a diagnostic message.
     */
    public enum Type {
        /** An error that makes the current stage fail. */
        ERROR,
        /** A warning that does not stop assembly. */
        WARNING,
        /** An informational message, e.g. from an <code>.info</code> directive. */
        INFO
    }

    @Override
    public String toString() {
        return String.format("[%s] %s:%d: %s", type, fileName, lineNumber, message);
    }
}
