package org.g10asm.compiler.frontend.preprocessor.features.message;

import org.g10asm.compiler.frontend.CompilerPhase;
import org.g10asm.compiler.frontend.directive.IDirectiveHandler;
import org.g10asm.compiler.frontend.lexer.Token;
import org.g10asm.compiler.frontend.parser.ParsingContext;
import org.g10asm.compiler.frontend.parser.ast.AstNode;
import org.g10asm.compiler.frontend.preprocessor.PreProcessor;
import org.g10asm.compiler.frontend.preprocessor.TokenLists;

import java.util.List;

/**
 * Handles <code>.assert condition [, message]</code>. A falsy condition is reported as an error.
 */
public class AssertDirectiveHandler implements IDirectiveHandler {

    @Override
    public CompilerPhase getPhase() {
        return CompilerPhase.PREPROCESSING;
    }

    @Override
    public AstNode parse(ParsingContext context) {
        PreProcessor pass = (PreProcessor) context;

        Token directive = context.advance();
        List<List<Token>> arguments = TokenLists.splitTopLevel(pass.restOfLine());
        if (arguments.isEmpty() || arguments.size() > 2) {
            throw pass.fail(directive, "'.assert' expects a condition and an optional message.");
        }
        List<Token> condition = arguments.get(0);
        if (pass.evaluateOrFail(condition, directive).isTruthy()) {
            return null;
        }
        String detail = arguments.size() == 2
                ? pass.evaluateOrFail(pass.interpolateStrings(arguments.get(1)), directive).toString()
                : TokenLists.describe(condition);
        context.getDiagnostics().reportError("Assertion failed: " + detail, directive.fileName(), directive.line());
        return null;
    }
}
