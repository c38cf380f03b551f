package org.g10asm.compiler.frontend.directive;

import org.g10asm.compiler.frontend.parser.features.data.DataDirectiveHandler;
import org.g10asm.compiler.frontend.parser.features.interrupt.InterruptDirectiveHandler;
import org.g10asm.compiler.frontend.parser.features.org.OrgDirectiveHandler;
import org.g10asm.compiler.frontend.parser.features.section.SectionDirectiveHandler;
import org.g10asm.compiler.frontend.parser.features.symbol.SymbolDirectiveHandler;
import org.g10asm.compiler.frontend.parser.features.var.VariableDeclarationHandler;
import org.g10asm.compiler.frontend.preprocessor.Flow;
import org.g10asm.compiler.frontend.preprocessor.features.block.StrayTerminatorHandler;
import org.g10asm.compiler.frontend.preprocessor.features.conditional.ConditionalDirectiveHandler;
import org.g10asm.compiler.frontend.preprocessor.features.include.IncludeDirectiveHandler;
import org.g10asm.compiler.frontend.preprocessor.features.loop.BreakContinueDirectiveHandler;
import org.g10asm.compiler.frontend.preprocessor.features.loop.ForDirectiveHandler;
import org.g10asm.compiler.frontend.preprocessor.features.loop.RepeatDirectiveHandler;
import org.g10asm.compiler.frontend.preprocessor.features.loop.WhileDirectiveHandler;
import org.g10asm.compiler.frontend.preprocessor.features.macro.DefineDirectiveHandler;
import org.g10asm.compiler.frontend.preprocessor.features.macro.MacroDirectiveHandler;
import org.g10asm.compiler.frontend.preprocessor.features.macro.ShiftDirectiveHandler;
import org.g10asm.compiler.frontend.preprocessor.features.macro.UndefDirectiveHandler;
import org.g10asm.compiler.frontend.preprocessor.features.message.AssertDirectiveHandler;
import org.g10asm.compiler.frontend.preprocessor.features.message.MessageDirectiveHandler;
import org.g10asm.compiler.frontend.preprocessor.features.pragma.PragmaDirectiveHandler;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * A registry for directive handlers. This class holds a map of directive names
 * to their corresponding handlers.
 */
public class DirectiveHandlerRegistry {
    private final Map<String, IDirectiveHandler> handlers = new HashMap<>();

    /**
     * Registers a new directive handler.
     * @param directiveName The name of the directive (e.g., ".DEFINE").
     * @param handler The handler for the directive.
     */
    public void register(String directiveName, IDirectiveHandler handler) {
        handlers.put(directiveName.toUpperCase(), handler);
    }

    /**
     * Gets the handler for a given directive name.
     * @param directiveName The name of the directive.
     * @return An {@link Optional} containing the handler if it exists, otherwise empty.
     */
    public Optional<IDirectiveHandler> get(String directiveName) {
        return Optional.ofNullable(handlers.get(directiveName.toUpperCase()));
    }

    /**
     * Initializes the directive handler registry with all the built-in handlers.
     * @return A new instance of {@link DirectiveHandlerRegistry} with all handlers registered.
     */
    public static DirectiveHandlerRegistry initialize() {
        DirectiveHandlerRegistry registry = new DirectiveHandlerRegistry();

        // Preprocessor handlers
        registry.register(".INCLUDE", new IncludeDirectiveHandler());
        registry.register(".PRAGMA", new PragmaDirectiveHandler());
        registry.register(".DEFINE", new DefineDirectiveHandler());
        UndefDirectiveHandler undef = new UndefDirectiveHandler();
        registry.register(".UNDEF", undef);
        registry.register(".PURGE", undef);
        registry.register(".MACRO", new MacroDirectiveHandler());
        registry.register(".SHIFT", new ShiftDirectiveHandler());

        ConditionalDirectiveHandler conditional = new ConditionalDirectiveHandler();
        registry.register(".IF", conditional);
        registry.register(".IFDEF", conditional);
        registry.register(".IFNDEF", conditional);

        RepeatDirectiveHandler repeat = new RepeatDirectiveHandler();
        registry.register(".REPEAT", repeat);
        registry.register(".REPT", repeat);
        registry.register(".FOR", new ForDirectiveHandler());
        registry.register(".WHILE", new WhileDirectiveHandler());
        registry.register(".BREAK", new BreakContinueDirectiveHandler(Flow.BREAK));
        registry.register(".CONTINUE", new BreakContinueDirectiveHandler(Flow.CONTINUE));

        // Terminators are consumed by their opening directive; reaching one here is an error.
        StrayTerminatorHandler stray = new StrayTerminatorHandler();
        for (String terminator : new String[] {".ELSE", ".ELIF", ".ELSEIF", ".ENDIF", ".ENDC", ".ENDM",
                ".ENDR", ".ENDREPEAT", ".ENDF", ".ENDFOR", ".ENDW", ".ENDWHILE"}) {
            registry.register(terminator, stray);
        }

        MessageDirectiveHandler info = new MessageDirectiveHandler(MessageDirectiveHandler.Severity.INFO);
        MessageDirectiveHandler warning = new MessageDirectiveHandler(MessageDirectiveHandler.Severity.WARNING);
        MessageDirectiveHandler error = new MessageDirectiveHandler(MessageDirectiveHandler.Severity.ERROR);
        MessageDirectiveHandler fatal = new MessageDirectiveHandler(MessageDirectiveHandler.Severity.FATAL);
        registry.register(".INFO", info);
        registry.register(".WARNING", warning);
        registry.register(".WARN", warning);
        registry.register(".ERROR", error);
        registry.register(".ERR", error);
        registry.register(".FATAL", fatal);
        registry.register(".FAIL", fatal);
        registry.register(".CRITICAL", fatal);
        registry.register(".ASSERT", new AssertDirectiveHandler());

        // Parser handlers
        registry.register(".ORG", new OrgDirectiveHandler());
        SectionDirectiveHandler section = new SectionDirectiveHandler();
        registry.register(".ROM", section);
        registry.register(".RAM", section);
        InterruptDirectiveHandler interrupt = new InterruptDirectiveHandler();
        registry.register(".INT", interrupt);
        registry.register(".INTERRUPT", interrupt);
        DataDirectiveHandler data = new DataDirectiveHandler();
        for (String directive : new String[] {".BYTE", ".DB", ".WORD", ".DW", ".DWORD", ".DD"}) {
            registry.register(directive, data);
        }
        SymbolDirectiveHandler symbol = new SymbolDirectiveHandler();
        registry.register(".GLOBAL", symbol);
        registry.register(".EXTERN", symbol);
        VariableDeclarationHandler variable = new VariableDeclarationHandler();
        registry.register(".LET", variable);
        registry.register(".CONST", variable);

        return registry;
    }
}
