package org.g10asm.compiler.frontend.lexer;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * The static table of reserved words: instruction mnemonics, preprocessor functions and
 * directives, pragmas, assembler directives, register names and branching conditions.
 * Lookups are case-insensitive.
 */
public final class KeywordTable {

    private static final Map<String, Keyword> KEYWORDS;

    static {
        Map<String, Keyword> table = new LinkedHashMap<>();
        Builder b = new Builder(table);

        // Instruction mnemonics: opcode, minimum operands, maximum operands.
        b.mnemonics(0, 0, "nop", "stop", "halt", "di", "ei", "eii", "daa", "scf", "ccf", "clv", "sev");
        b.mnemonics(2, 2, "ld", "ldq", "ldp", "st", "stq", "stp", "mv", "mwh", "mwl");
        b.mnemonics(1, 1, "lsp", "pop", "ssp", "push", "spo", "spi");
        b.mnemonics(1, 2, "jmp", "jpb", "call");
        b.mnemonics(1, 1, "int");
        b.mnemonics(0, 1, "ret", "reti");
        b.mnemonics(2, 2, "add", "adc", "sub", "sbc");
        b.mnemonics(1, 1, "inc", "dec");
        b.mnemonics(2, 2, "and", "or", "xor");
        b.mnemonics(1, 1, "not");
        b.mnemonics(2, 2, "cmp");
        b.mnemonics(1, 1, "sla", "sra", "srl", "swap");
        b.mnemonics(0, 0, "rla");
        b.mnemonics(1, 1, "rl");
        b.mnemonics(0, 0, "rlca");
        b.mnemonics(1, 1, "rlc");
        b.mnemonics(0, 0, "rra");
        b.mnemonics(1, 1, "rr");
        b.mnemonics(0, 0, "rrca");
        b.mnemonics(1, 1, "rrc");
        b.mnemonics(2, 2, "bit", "set", "res", "tog");
        b.mnemonics(0, 0, "tcf");
        b.mnemonics(1, 2, "jp", "jr");
        b.mnemonics(0, 0, "cpl");
        b.mnemonics(2, 2, "cp");

        // Preprocessor functions: minimum and maximum argument count.
        b.functions(1, 1, "high", "low", "bitwidth", "abs");
        b.functions(2, 2, "min", "max");
        b.functions(3, 3, "clamp");
        b.functions(2, 2, "fmul", "fdiv", "fmod");
        b.functions(1, 1, "fint", "ffrac", "round", "ceil", "floor", "trunc");
        b.functions(2, 2, "pow");
        b.functions(1, 1, "sqrt", "exp", "ln", "log2", "log10");
        b.functions(2, 2, "log");
        b.functions(1, 1, "sin", "cos", "tan", "asin", "acos", "atan");
        b.functions(2, 2, "atan2");
        b.functions(1, 1, "strlen");
        b.functions(2, 2, "strcmp");
        b.functions(2, 3, "substr");
        b.functions(2, 2, "indexof");
        b.functions(1, 1, "toupper", "tolower");
        b.functions(2, Integer.MAX_VALUE, "concat");
        b.functions(1, 1, "defined", "typeof");

        // Preprocessor directives.
        b.plain(KeywordType.PREPROCESSOR_DIRECTIVE,
                ".pragma", ".include", ".define", ".macro", ".shift", ".endm", ".undef", ".purge",
                ".ifdef", ".ifndef", ".if", ".elseif", ".elif", ".else", ".endif", ".endc",
                ".repeat", ".rept", ".endrepeat", ".endr", ".for", ".endfor", ".endf",
                ".while", ".endwhile", ".endw", ".continue", ".break",
                ".info", ".warning", ".warn", ".error", ".err", ".fatal", ".fail", ".critical",
                ".assert");

        // Assembler directives; data directives carry their width in bytes.
        b.plain(KeywordType.ASSEMBLER_DIRECTIVE,
                ".metadata", ".meta", ".interrupt", ".int", ".code", ".text", ".data", ".rodata",
                ".bss", ".org", ".rom", ".ram", ".space", ".ds", ".global", ".extern", ".let", ".const");
        b.data(1, ".byte", ".db");
        b.data(2, ".word", ".dw");
        b.data(4, ".dword", ".dd");

        // Pragmas: argument count.
        b.pragma("once", 0);
        b.pragma("max_recursion_depth", 1);
        b.pragma("max_include_depth", 1);
        b.pragma("push_file", 1);
        b.pragma("pop_file", 0);

        // Registers: index, width in bits, high-byte flag.
        for (int i = 0; i < 16; i++) {
            b.register("d" + i, i, 32, 0);
            b.register("w" + i, i, 16, 0);
            b.register("h" + i, i, 8, 1);
            b.register("l" + i, i, 8, 0);
        }

        // Branching conditions.
        String[] conditions = {"nc", "zs", "zc", "cs", "cc", "vs", "vc"};
        for (int code = 0; code < conditions.length; code++) {
            table.put(conditions[code], new Keyword(conditions[code], KeywordType.BRANCHING_CONDITION, code, 0, 0));
        }

        KEYWORDS = Collections.unmodifiableMap(table);
    }

    private KeywordTable() {}

    /**
     * Looks up a reserved word.
     * @param name The word to look up, in any letter case.
     * @return The keyword entry, or empty if the word is not reserved.
     */
    public static Optional<Keyword> lookup(String name) {
        if (name == null) return Optional.empty();
        return Optional.ofNullable(KEYWORDS.get(name.toLowerCase(Locale.ROOT)));
    }

    /**
     * Checks whether a word is reserved.
     * @param name The word to check, in any letter case.
     * @return {@code true} if the word is a keyword.
     */
    public static boolean isKeyword(String name) {
        return lookup(name).isPresent();
    }

    /**
     * Returns all entries in declaration order.
     * @return An unmodifiable view of the table.
     */
    public static Map<String, Keyword> entries() {
        return KEYWORDS;
    }

    private static final class Builder {
        private final Map<String, Keyword> table;
        private int nextOpcode = 0;

        Builder(Map<String, Keyword> table) {
            this.table = table;
        }

        void mnemonics(int minOperands, int maxOperands, String... names) {
            for (String name : names) {
                table.put(name, new Keyword(name, KeywordType.INSTRUCTION_MNEMONIC, nextOpcode++, minOperands, maxOperands));
            }
        }

        void functions(int minArgs, int maxArgs, String... names) {
            for (String name : names) {
                table.put(name, new Keyword(name, KeywordType.PREPROCESSOR_FUNCTION, minArgs, maxArgs, 0));
            }
        }

        void plain(KeywordType type, String... names) {
            for (String name : names) {
                table.put(name, new Keyword(name, type, 0, 0, 0));
            }
        }

        void data(int width, String... names) {
            for (String name : names) {
                table.put(name, new Keyword(name, KeywordType.ASSEMBLER_DIRECTIVE, width, 0, 0));
            }
        }

        void pragma(String name, int argumentCount) {
            table.put(name, new Keyword(name, KeywordType.PRAGMA, argumentCount, 0, 0));
        }

        void register(String name, int index, int width, int high) {
            table.put(name, new Keyword(name, KeywordType.REGISTER_NAME, index, width, high));
        }
    }
}
