package org.g10asm.compiler.frontend.lexer;

/**
 * The categories of reserved words in the {@link KeywordTable}.
 */
public enum KeywordType {
    /** A CPU instruction mnemonic such as <code>ld</code>. */
    INSTRUCTION_MNEMONIC,
    /** A function usable in preprocessor expressions such as <code>high</code>. */
    PREPROCESSOR_FUNCTION,
    /** A directive executed by the preprocessor such as <code>.if</code>. */
    PREPROCESSOR_DIRECTIVE,
    /** An argument of <code>.pragma</code> such as <code>once</code>. */
    PRAGMA,
    /** A directive handled by the parser such as <code>.org</code>. */
    ASSEMBLER_DIRECTIVE,
    /** A CPU register name such as <code>d0</code>. */
    REGISTER_NAME,
    /** A branching condition such as <code>zs</code>. */
    BRANCHING_CONDITION
}
