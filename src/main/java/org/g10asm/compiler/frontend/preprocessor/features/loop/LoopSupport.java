package org.g10asm.compiler.frontend.preprocessor.features.loop;

import org.g10asm.compiler.frontend.lexer.Token;
import org.g10asm.compiler.frontend.lexer.TokenType;
import org.g10asm.compiler.frontend.preprocessor.Flow;
import org.g10asm.compiler.frontend.preprocessor.PreProcessor;
import org.g10asm.compiler.frontend.preprocessor.PreProcessorContext;
import org.g10asm.compiler.frontend.preprocessor.features.macro.MacroDefinition;
import org.g10asm.compiler.frontend.preprocessor.features.macro.MacroException;
import org.g10asm.compiler.frontend.preprocessor.features.macro.MacroTable;
import org.g10asm.compiler.frontend.preprocessor.value.PpValue;

import java.util.List;

/**
 * The state shared by the loop directives: the optional loop variable, which is a text macro
 * holding the current value, and the processing of one iteration.
 * A previous text macro of the same name is saved before the loop and restored afterwards.
 */
final class LoopSupport {

    private final PreProcessor pass;
    private final PreProcessorContext context;
    private final Token variable;
    private final MacroDefinition saved;

    /**
     * @param pass The running preprocessor.
     * @param variable The loop variable name token, or null if the loop has none.
     */
    LoopSupport(PreProcessor pass, Token variable) {
        this.pass = pass;
        this.context = pass.getContext();
        this.variable = variable;
        this.saved = variable != null ? existing(context.getMacroTable(), variable.text()) : null;
    }

    /**
     * Validates the loop variable part of a loop header.
     * @param pass The running preprocessor.
     * @param group The tokens of the header part.
     * @param directive The loop directive, for error messages.
     * @return The variable name token.
     */
    static Token variable(PreProcessor pass, List<Token> group, Token directive) {
        if (group.size() != 1 || group.get(0).type() != TokenType.IDENTIFIER) {
            Token at = group.isEmpty() ? directive : group.get(0);
            throw pass.fail(at, String.format("Expected a loop variable name in '%s'.", directive.text()));
        }
        Token name = group.get(0);
        try {
            MacroTable.validateName(name.text());
        } catch (MacroException e) {
            throw pass.fail(name, e.getMessage());
        }
        MacroTable macros = pass.getContext().getMacroTable();
        if (macros.isDefined(name.text()) && existing(macros, name.text()).kind() == MacroDefinition.Kind.BLOCK) {
            throw pass.fail(name, String.format("Loop variable '%s' conflicts with a block macro.", name.text()));
        }
        return name;
    }

    /**
     * Evaluates a loop header expression that must yield an integer.
     */
    static long integer(PreProcessor pass, List<Token> expression, Token directive, String what) {
        PpValue value = pass.evaluateCondition(expression, directive);
        if (!value.isInteger()) {
            Token at = expression.isEmpty() ? directive : expression.get(0);
            throw pass.fail(at, String.format("%s of '%s' must be an integer, got %s.", what, directive.text(), value.typeName()));
        }
        return value.asInteger();
    }

    /**
     * Sets the loop variable to the value of the current iteration.
     */
    void bind(long value) {
        if (variable == null) {
            return;
        }
        MacroTable macros = context.getMacroTable();
        Token literal = new Token(TokenType.INTEGER_LITERAL, Long.toString(value), value,
                variable.line(), variable.column(), variable.fileName());
        replace(macros, MacroDefinition.text(variable.text(), List.of(literal), variable.fileName(), variable.line()));
    }

    /**
     * Processes the body once, one recursion level deeper than the loop directive.
     * @return The flow the iteration ended with.
     */
    Flow iterate(List<Token> body, int depth) {
        context.enterLoop();
        try {
            return pass.processBlock(body, depth);
        } finally {
            context.exitLoop();
        }
    }

    /**
     * Removes the loop variable and reinstates the macro it shadowed, if any.
     */
    void restore() {
        if (variable == null) {
            return;
        }
        MacroTable macros = context.getMacroTable();
        if (saved != null) {
            replace(macros, saved);
        } else if (macros.isDefined(variable.text())) {
            try {
                macros.undefine(variable.text());
            } catch (MacroException e) {
                throw new IllegalStateException("Loop variable vanished while restoring: " + variable.text(), e);
            }
        }
    }

    private static void replace(MacroTable macros, MacroDefinition definition) {
        try {
            if (macros.isDefined(definition.name())) {
                macros.undefine(definition.name());
            }
            macros.define(definition);
        } catch (MacroException e) {
            throw new IllegalStateException("Loop variable could not be bound: " + definition.name(), e);
        }
    }

    private static MacroDefinition existing(MacroTable macros, String name) {
        if (!macros.isDefined(name)) {
            return null;
        }
        try {
            return macros.lookup(name);
        } catch (MacroException e) {
            throw new IllegalStateException("Macro table lookup failed for defined name: " + name, e);
        }
    }
}
