package org.g10asm.compiler.frontend.parser.features.var;

import org.g10asm.compiler.frontend.CompilerPhase;
import org.g10asm.compiler.frontend.directive.IDirectiveHandler;
import org.g10asm.compiler.frontend.environment.Environment;
import org.g10asm.compiler.frontend.lexer.SyntaxException;
import org.g10asm.compiler.frontend.lexer.Token;
import org.g10asm.compiler.frontend.lexer.TokenType;
import org.g10asm.compiler.frontend.parser.Parser;
import org.g10asm.compiler.frontend.parser.ParsingContext;
import org.g10asm.compiler.frontend.parser.ast.AstNode;

/**
 * Handles <code>.let</code> and <code>.const</code>. The declaration is registered in the
 * {@link Environment}; a second declaration of the same name is an error.
 */
public class VariableDeclarationHandler implements IDirectiveHandler {
    @Override public CompilerPhase getPhase() { return CompilerPhase.PARSING; }

    @Override public AstNode parse(ParsingContext context) {
        Token directive = context.advance();
        Parser parser = (Parser) context;
        boolean constant = directive.text().equalsIgnoreCase(".const");

        Token name = context.consume(TokenType.VARIABLE,
                String.format("Expected a variable name after '%s'.", directive.text()));
        context.consume(TokenType.ASSIGN, String.format("Expected '=' after '%s'.", name.text()));
        AstNode initializer = parser.expression();

        Environment environment = parser.getEnvironment();
        boolean defined = constant
                ? environment.defineConstant(name, initializer)
                : environment.defineVariable(name, initializer);
        if (!defined) {
            throw new SyntaxException("Duplicate declaration.", name);
        }
        return new VariableDeclarationNode(directive, name, initializer, constant);
    }
}
