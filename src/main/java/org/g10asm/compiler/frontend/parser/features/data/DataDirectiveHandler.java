package org.g10asm.compiler.frontend.parser.features.data;

import org.g10asm.compiler.frontend.CompilerPhase;
import org.g10asm.compiler.frontend.directive.IDirectiveHandler;
import org.g10asm.compiler.frontend.lexer.Token;
import org.g10asm.compiler.frontend.lexer.TokenType;
import org.g10asm.compiler.frontend.parser.Parser;
import org.g10asm.compiler.frontend.parser.ParsingContext;
import org.g10asm.compiler.frontend.parser.ast.AstNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Handles the data directives. The syntax is a comma-separated list of at least one expression;
 * the value width comes from the keyword table.
 */
public class DataDirectiveHandler implements IDirectiveHandler {
    @Override public CompilerPhase getPhase() { return CompilerPhase.PARSING; }

    @Override public AstNode parse(ParsingContext context) {
        Token directive = context.advance();
        Parser parser = (Parser) context;
        if (parser.atEndOfStatement()) {
            throw parser.fail(directive, String.format("'%s' requires at least one value.", directive.text()));
        }
        List<AstNode> values = new ArrayList<>();
        do {
            values.add(parser.expression());
        } while (context.match(TokenType.COMMA));
        return new DataNode(directive, directive.keyword().param1(), values);
    }
}
