package org.g10asm.compiler.frontend.preprocessor.features.macro;

import org.g10asm.compiler.frontend.lexer.KeywordTable;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * The name space shared by text and block macros.
 * <p>
 * Names are case-sensitive, must match {@code [A-Za-z_][A-Za-z0-9_]*}, must not start with
 * {@code __} and must not be a keyword.
 */
public class MacroTable {

    private static final Pattern NAME_PATTERN = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private final Map<String, MacroDefinition> macros = new LinkedHashMap<>();

    /**
     * Registers a new macro.
     * @param definition The definition to add.
     * @throws MacroException if the name is invalid or already defined.
     */
    public void define(MacroDefinition definition) throws MacroException {
        validateName(definition.name());
        MacroDefinition existing = macros.get(definition.name());
        if (existing != null) {
            throw new MacroException(String.format("Macro '%s' is already defined at '%s:%d'.",
                    existing.name(), existing.fileName(), existing.line()));
        }
        macros.put(definition.name(), definition);
    }

    /**
     * @param name The macro name.
     * @return The definition.
     * @throws MacroException if no macro with that name exists.
     */
    public MacroDefinition lookup(String name) throws MacroException {
        MacroDefinition definition = macros.get(name);
        if (definition == null) {
            throw new MacroException(String.format("Macro '%s' is not defined.", name));
        }
        return definition;
    }

    /**
     * Removes a macro.
     * @param name The macro name.
     * @return The removed definition.
     * @throws MacroException if no macro with that name exists.
     */
    public MacroDefinition undefine(String name) throws MacroException {
        MacroDefinition removed = macros.remove(name);
        if (removed == null) {
            throw new MacroException(String.format("Cannot undefine '%s': macro is not defined.", name));
        }
        return removed;
    }

    public boolean isDefined(String name) {
        return macros.containsKey(name);
    }

    public int size() {
        return macros.size();
    }

    public Collection<MacroDefinition> definitions() {
        return Collections.unmodifiableCollection(macros.values());
    }

    /**
     * Checks the naming rules for macros.
     * @param name The candidate name.
     * @throws MacroException describing the first violated rule.
     */
    public static void validateName(String name) throws MacroException {
        if (name == null || name.isEmpty()) {
            throw new MacroException("Macro name must not be empty.");
        }
        if (!NAME_PATTERN.matcher(name).matches()) {
            throw new MacroException(String.format(
                    "Invalid macro name '%s'; names consist of letters, digits and underscores and must not start with a digit.", name));
        }
        if (name.startsWith("__")) {
            throw new MacroException(String.format("Macro name '%s' is reserved; names must not start with '__'.", name));
        }
        if (KeywordTable.isKeyword(name)) {
            throw new MacroException(String.format("Macro name '%s' collides with a keyword.", name));
        }
    }
}
