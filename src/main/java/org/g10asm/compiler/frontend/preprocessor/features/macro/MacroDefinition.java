package org.g10asm.compiler.frontend.preprocessor.features.macro;

import org.g10asm.compiler.frontend.lexer.Token;

import java.util.List;

/**
 * A single macro definition stored in the {@link MacroTable}.
 *
 * @param name       The macro name (case-sensitive).
 * @param kind       Whether this is a text substitution or a multi-line block macro.
 * @param parameters The formal parameter names of a block macro, without the <code>@</code> sigil.
 * @param body       The replacement tokens; for block macros the lines between <code>.macro</code> and <code>.endm</code>.
 * @param fileName   The file the macro was defined in.
 * @param line       The line the macro was defined on.
 */
public record MacroDefinition(
        String name,
        Kind kind,
        List<String> parameters,
        List<Token> body,
        String fileName,
        int line
) {
    /**
     * The two flavours of macros sharing one name space.
     */
    public enum Kind {
        /** Defined by <code>.define</code>; the name is replaced by the body tokens. */
        TEXT,
        /** Defined by <code>.macro</code>; invoked at the start of a line with arguments. */
        BLOCK
    }

    public MacroDefinition {
        parameters = List.copyOf(parameters);
        body = List.copyOf(body);
    }

    /**
     * Creates a text substitution macro.
     */
    public static MacroDefinition text(String name, List<Token> body, String fileName, int line) {
        return new MacroDefinition(name, Kind.TEXT, List.of(), body, fileName, line);
    }

    /**
     * Creates a block macro.
     */
    public static MacroDefinition block(String name, List<String> parameters, List<Token> body, String fileName, int line) {
        return new MacroDefinition(name, Kind.BLOCK, parameters, body, fileName, line);
    }
}
