package org.g10asm.compiler.frontend.preprocessor;

/**
 * How processing of a block continues after a line has been handled.
 */
public enum Flow {
    /** Continue with the next line. */
    NORMAL,
    /** Leave the innermost loop. */
    BREAK,
    /** Skip to the next iteration of the innermost loop. */
    CONTINUE,
    /** Stop preprocessing after a fatal error. */
    ABORT
}
