package org.g10asm.compiler.frontend.preprocessor.features.macro;

import org.g10asm.compiler.frontend.CompilerPhase;
import org.g10asm.compiler.frontend.directive.IDirectiveHandler;
import org.g10asm.compiler.frontend.lexer.Token;
import org.g10asm.compiler.frontend.lexer.TokenType;
import org.g10asm.compiler.frontend.parser.ParsingContext;
import org.g10asm.compiler.frontend.parser.ast.AstNode;
import org.g10asm.compiler.frontend.preprocessor.PreProcessor;
import org.g10asm.compiler.frontend.preprocessor.TokenLists;

import java.util.List;

/**
 * Handles <code>.undef</code> and <code>.purge</code>, which remove one or more macros of either kind.
 */
public class UndefDirectiveHandler implements IDirectiveHandler {

    @Override
    public CompilerPhase getPhase() {
        return CompilerPhase.PREPROCESSING;
    }

    @Override
    public AstNode parse(ParsingContext context) {
        PreProcessor pass = (PreProcessor) context;
        MacroTable macros = pass.getContext().getMacroTable();

        Token directive = context.advance();
        List<List<Token>> names = TokenLists.splitTopLevel(pass.restOfLine());
        if (names.isEmpty()) {
            throw pass.fail(directive, String.format("'%s' requires at least one macro name.", directive.text()));
        }
        for (List<Token> group : names) {
            if (group.size() != 1 || group.get(0).type() != TokenType.IDENTIFIER) {
                Token at = group.isEmpty() ? directive : group.get(0);
                throw pass.fail(at, String.format("Expected a macro name in '%s'.", directive.text()));
            }
            Token name = group.get(0);
            try {
                macros.undefine(name.text());
            } catch (MacroException e) {
                throw pass.fail(name, e.getMessage());
            }
        }
        return null;
    }
}
