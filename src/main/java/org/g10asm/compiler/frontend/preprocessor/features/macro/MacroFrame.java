package org.g10asm.compiler.frontend.preprocessor.features.macro;

import org.g10asm.compiler.frontend.lexer.Token;
import org.g10asm.compiler.frontend.lexer.TokenType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The argument bindings of one active block macro invocation.
 * <p>
 * Placeholders resolve as follows: <code>@0</code> is the argument count, <code>@k</code> the
 * k-th argument (1-based) and <code>@name</code> the argument at the position of the formal
 * parameter {@code name}. <code>.shift</code> rotates the argument list.
 */
public class MacroFrame {

    private final MacroDefinition macro;
    private final Token callSite;
    private final List<List<Token>> arguments;

    public MacroFrame(MacroDefinition macro, Token callSite, List<List<Token>> arguments) {
        this.macro = macro;
        this.callSite = callSite;
        this.arguments = new ArrayList<>(arguments);
    }

    public MacroDefinition macro() {
        return macro;
    }

    public Token callSite() {
        return callSite;
    }

    public int argumentCount() {
        return arguments.size();
    }

    /**
     * Resolves a placeholder name (without <code>@</code>) to its replacement tokens.
     * @param name The placeholder name.
     * @param at The placeholder token, used to stamp synthesized tokens.
     * @return The replacement tokens.
     * @throws MacroException if the placeholder is not bound in this invocation.
     */
    public List<Token> resolve(String name, Token at) throws MacroException {
        if (!name.isEmpty() && name.chars().allMatch(Character::isDigit)) {
            int index = Integer.parseInt(name);
            if (index == 0) {
                String count = Integer.toString(arguments.size());
                return List.of(new Token(TokenType.INTEGER_LITERAL, count, (long) arguments.size(),
                        at.line(), at.column(), at.fileName()));
            }
            if (index > arguments.size()) {
                throw new MacroException(String.format("Macro '%s' was invoked with %d argument(s); '@%d' is not bound.",
                        macro.name(), arguments.size(), index));
            }
            return arguments.get(index - 1);
        }
        int position = macro.parameters().indexOf(name);
        if (position < 0) {
            throw new MacroException(String.format("Unknown placeholder '@%s' in macro '%s'.", name, macro.name()));
        }
        if (position >= arguments.size()) {
            throw new MacroException(String.format("Missing argument for parameter '@%s' of macro '%s'.", name, macro.name()));
        }
        return arguments.get(position);
    }

    /**
     * Rotates the arguments left by {@code count}; negative counts rotate right.
     * @param count The rotation distance.
     */
    public void shift(long count) {
        if (arguments.isEmpty()) return;
        int distance = (int) Math.floorMod(count, (long) arguments.size());
        Collections.rotate(arguments, -distance);
    }
}
