package org.g10asm.compiler.frontend.environment;

import org.g10asm.compiler.diagnostics.DiagnosticsEngine;
import org.g10asm.compiler.frontend.lexer.Token;
import org.g10asm.compiler.frontend.parser.ast.AstNode;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Stores the <code>$variables</code> and constants declared by <code>.let</code> and
 * <code>.const</code>. Values are kept as unevaluated expressions.
 * <p>
 * Problems are reported to the {@link DiagnosticsEngine} at the offending token; the mutating
 * methods return {@code false} in that case.
 */
public class Environment {

    private final Map<String, EnvironmentEntry> entries = new LinkedHashMap<>();
    private final DiagnosticsEngine diagnostics;

    public Environment(DiagnosticsEngine diagnostics) {
        this.diagnostics = diagnostics;
    }

    /**
     * Declares a variable.
     * @param name The variable token, e.g. <code>$count</code>.
     * @param initializer The initial value.
     * @return {@code false} if the name is already declared.
     */
    public boolean defineVariable(Token name, AstNode initializer) {
        return define(name, initializer, false);
    }

    /**
     * Declares a constant.
     * @param name The variable token, e.g. <code>$SIZE</code>.
     * @param value The value.
     * @return {@code false} if the name is already declared.
     */
    public boolean defineConstant(Token name, AstNode value) {
        return define(name, value, true);
    }

    /**
     * Looks up the current value of a variable or constant.
     * @param name The variable token.
     * @return The value, or empty (with an error reported) if the name is not declared.
     */
    public Optional<AstNode> getValue(Token name) {
        EnvironmentEntry entry = entries.get(name.name());
        if (entry == null) {
            reportUndefined(name);
            return Optional.empty();
        }
        return Optional.of(entry.value());
    }

    /**
     * Replaces the value of a variable.
     * @param name The variable token.
     * @param value The new value.
     * @return {@code false} if the name is not declared or is a constant.
     */
    public boolean setValue(Token name, AstNode value) {
        EnvironmentEntry entry = entries.get(name.name());
        if (entry == null) {
            reportUndefined(name);
            return false;
        }
        if (entry.constant()) {
            diagnostics.reportError(String.format("Cannot modify constant '$%s' (defined at '%s:%d').",
                    entry.name(), entry.fileName(), entry.line()), name.fileName(), name.line());
            return false;
        }
        entries.put(entry.name(), entry.withValue(value));
        return true;
    }

    public boolean exists(String name) {
        return entries.containsKey(stripSigil(name));
    }

    public boolean isConstant(String name) {
        EnvironmentEntry entry = entries.get(stripSigil(name));
        return entry != null && entry.constant();
    }

    public Optional<EnvironmentEntry> entry(String name) {
        return Optional.ofNullable(entries.get(stripSigil(name)));
    }

    public Collection<EnvironmentEntry> entries() {
        return Collections.unmodifiableCollection(entries.values());
    }

    public void clear() {
        entries.clear();
    }

    private boolean define(Token name, AstNode value, boolean constant) {
        EnvironmentEntry existing = entries.get(name.name());
        if (existing != null) {
            diagnostics.reportError(String.format("'$%s' is already defined as a %s at '%s:%d'.",
                    existing.name(), existing.kind(), existing.fileName(), existing.line()), name.fileName(), name.line());
            return false;
        }
        entries.put(name.name(), new EnvironmentEntry(name.name(), value, constant, name.fileName(), name.line()));
        return true;
    }

    private void reportUndefined(Token name) {
        diagnostics.reportError(String.format("Undefined variable or constant '$%s'.", name.name()), name.fileName(), name.line());
    }

    private static String stripSigil(String name) {
        return name.startsWith("$") ? name.substring(1) : name;
    }
}
