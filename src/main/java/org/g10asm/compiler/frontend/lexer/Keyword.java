package org.g10asm.compiler.frontend.lexer;

/**
 * An entry of the {@link KeywordTable}. The meaning of the three parameters depends on the type:
 * <ul>
 *   <li>mnemonics: opcode index, minimum and maximum operand count</li>
 *   <li>preprocessor functions: minimum and maximum argument count</li>
 *   <li>pragmas: argument count</li>
 *   <li>assembler directives: data width in bytes for <code>.byte/.word/.dword</code></li>
 *   <li>registers: index, width in bits, 1 for high-byte registers</li>
 *   <li>branching conditions: condition code</li>
 * </ul>
 *
 * @param name The lowercase spelling of the keyword.
 * @param type The category of the keyword.
 * @param param1 The first type-specific parameter.
 * @param param2 The second type-specific parameter.
 * @param param3 The third type-specific parameter.
 */
public record Keyword(
        String name,
        KeywordType type,
        int param1,
        int param2,
        int param3
) {
    /**
     * Checks the category of this keyword.
     * @param expected The category to compare with.
     * @return {@code true} if this keyword belongs to the category.
     */
    public boolean is(KeywordType expected) {
        return type == expected;
    }
}
