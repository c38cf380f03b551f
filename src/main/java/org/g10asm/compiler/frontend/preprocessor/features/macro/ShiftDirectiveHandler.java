package org.g10asm.compiler.frontend.preprocessor.features.macro;

import org.g10asm.compiler.frontend.CompilerPhase;
import org.g10asm.compiler.frontend.directive.IDirectiveHandler;
import org.g10asm.compiler.frontend.lexer.Token;
import org.g10asm.compiler.frontend.parser.ParsingContext;
import org.g10asm.compiler.frontend.parser.ast.AstNode;
import org.g10asm.compiler.frontend.preprocessor.PreProcessor;
import org.g10asm.compiler.frontend.preprocessor.value.PpValue;

import java.util.List;
import java.util.Optional;

/**
 * Handles <code>.shift [n]</code>, which rotates the arguments of the innermost macro invocation.
 */
public class ShiftDirectiveHandler implements IDirectiveHandler {

    @Override
    public CompilerPhase getPhase() {
        return CompilerPhase.PREPROCESSING;
    }

    @Override
    public AstNode parse(ParsingContext context) {
        PreProcessor pass = (PreProcessor) context;

        Token directive = context.advance();
        List<Token> count = pass.restOfLine();
        Optional<MacroFrame> frame = pass.getContext().currentFrame();
        if (frame.isEmpty()) {
            throw pass.fail(directive, "'.shift' used outside of a macro expansion.");
        }
        long distance = 1;
        if (!count.isEmpty()) {
            PpValue value = pass.evaluateCondition(count, directive);
            if (!value.isInteger()) {
                throw pass.fail(count.get(0), String.format("'.shift' expects an integer, got %s.", value.typeName()));
            }
            distance = value.asInteger();
        }
        frame.get().shift(distance);
        return null;
    }
}
