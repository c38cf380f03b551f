package org.g10asm.compiler.frontend.preprocessor.features.macro;

/**
 * Thrown by the {@link MacroTable} for invalid names, redefinitions and unknown macros.
 */
public class MacroException extends Exception {

    public MacroException(String message) {
        super(message);
    }
}
