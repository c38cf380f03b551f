package org.g10asm.compiler.frontend;

/**
 * Defines the phases of the front end in which directive handlers run.
 */
public enum CompilerPhase {
    /**
     * Phase 0: directives that rewrite the token stream before parsing, such as
     * <code>.include</code>, <code>.macro</code>, <code>.if</code> or <code>.repeat</code>.
     */
    PREPROCESSING,

    /**
     * Phase 1: directives that produce nodes in the AST, such as <code>.org</code> or <code>.byte</code>.
     */
    PARSING
}
