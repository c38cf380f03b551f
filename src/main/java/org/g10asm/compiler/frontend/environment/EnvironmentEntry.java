package org.g10asm.compiler.frontend.environment;

import org.g10asm.compiler.frontend.parser.ast.AstNode;

/**
 * A variable or constant known to the {@link Environment}.
 *
 * @param name The name without the <code>$</code> sigil.
 * @param value The current value expression; for constants the initializer.
 * @param constant Whether the entry was declared with <code>.const</code>.
 * @param fileName The file of the declaration.
 * @param line The line of the declaration.
 */
public record EnvironmentEntry(
        String name,
        AstNode value,
        boolean constant,
        String fileName,
        int line
) {
    /**
     * @return "constant" or "variable", for messages.
     */
    public String kind() {
        return constant ? "constant" : "variable";
    }

    EnvironmentEntry withValue(AstNode newValue) {
        return new EnvironmentEntry(name, newValue, constant, fileName, line);
    }
}
