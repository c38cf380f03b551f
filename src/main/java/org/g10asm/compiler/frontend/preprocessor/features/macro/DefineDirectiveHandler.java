package org.g10asm.compiler.frontend.preprocessor.features.macro;

import org.g10asm.compiler.frontend.CompilerPhase;
import org.g10asm.compiler.frontend.directive.IDirectiveHandler;
import org.g10asm.compiler.frontend.lexer.Token;
import org.g10asm.compiler.frontend.lexer.TokenType;
import org.g10asm.compiler.frontend.parser.ParsingContext;
import org.g10asm.compiler.frontend.parser.ast.AstNode;
import org.g10asm.compiler.frontend.preprocessor.PreProcessor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Handles <code>.define NAME tokens...</code>, which defines a text macro. Brace groups in the
 * replacement are evaluated once, at definition time. Defining an existing text macro again
 * replaces it; a block macro of the same name is an error.
 */
public class DefineDirectiveHandler implements IDirectiveHandler {

    private static final Logger LOG = LoggerFactory.getLogger(DefineDirectiveHandler.class);

    @Override
    public CompilerPhase getPhase() {
        return CompilerPhase.PREPROCESSING;
    }

    @Override
    public AstNode parse(ParsingContext context) {
        PreProcessor pass = (PreProcessor) context;
        MacroTable macros = pass.getContext().getMacroTable();

        Token directive = context.advance();
        if (!context.check(TokenType.IDENTIFIER) && !context.check(TokenType.KEYWORD)) {
            pass.restOfLine();
            throw pass.fail(directive, "Expected a macro name after '.define'.");
        }
        Token name = context.advance();
        List<Token> replacement = pass.restOfLine();

        try {
            MacroTable.validateName(name.text());
            // The replacement may refer to the definition it replaces.
            List<Token> body = pass.expandBraces(replacement);
            if (macros.isDefined(name.text()) && macros.lookup(name.text()).kind() == MacroDefinition.Kind.TEXT) {
                macros.undefine(name.text());
            }
            macros.define(MacroDefinition.text(name.text(), body, name.fileName(), name.line()));
        } catch (MacroException e) {
            throw pass.fail(name, e.getMessage());
        }
        LOG.debug("Defined text macro '{}' at {}:{}", name.text(), name.fileName(), name.line());
        return null;
    }
}
