package org.g10asm.compiler.frontend.preprocessor.features.macro;

import org.g10asm.compiler.frontend.CompilerPhase;
import org.g10asm.compiler.frontend.directive.IDirectiveHandler;
import org.g10asm.compiler.frontend.lexer.Token;
import org.g10asm.compiler.frontend.lexer.TokenType;
import org.g10asm.compiler.frontend.parser.ParsingContext;
import org.g10asm.compiler.frontend.parser.ast.AstNode;
import org.g10asm.compiler.frontend.preprocessor.PreProcessor;
import org.g10asm.compiler.frontend.preprocessor.TokenLists;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Handles the <code>.macro</code> directive in the preprocessor phase.
 * This directive defines a block macro with optional formal parameters. The body is stored
 * unexpanded up to the matching <code>.endm</code>; nested definitions are allowed.
 */
public class MacroDirectiveHandler implements IDirectiveHandler {

    private static final Logger LOG = LoggerFactory.getLogger(MacroDirectiveHandler.class);
    private static final Set<String> OPENERS = Set.of(".macro");
    private static final Set<String> CLOSERS = Set.of(".endm");

    @Override
    public CompilerPhase getPhase() {
        return CompilerPhase.PREPROCESSING;
    }

    /**
     * Parses a <code>.macro NAME [param, ...]</code> header and its body.
     * The body is collected before the header is validated, so a bad header does not leave the body behind.
     * @param context The parsing context, which must be a {@link PreProcessor}.
     * @return null, as this directive does not produce an AST node.
     */
    @Override
    public AstNode parse(ParsingContext context) {
        PreProcessor pass = (PreProcessor) context;
        MacroTable macros = pass.getContext().getMacroTable();

        Token directive = context.advance();
        List<Token> header = pass.restOfLine();
        List<Token> body = pass.collectBlock(directive, OPENERS, CLOSERS, ".endm");

        if (header.isEmpty() || (header.get(0).type() != TokenType.IDENTIFIER && header.get(0).type() != TokenType.KEYWORD)) {
            throw pass.fail(directive, "Expected a macro name after '.macro'.");
        }
        Token name = header.get(0);
        List<Token> rest = header.subList(1, header.size());
        if (!rest.isEmpty() && rest.get(0).type() == TokenType.COMMA) {
            rest = rest.subList(1, rest.size());
        }

        List<String> parameters = new ArrayList<>();
        for (List<Token> group : TokenLists.splitTopLevel(rest)) {
            if (group.size() != 1 || !isParameter(group.get(0))) {
                Token at = group.isEmpty() ? name : group.get(0);
                throw pass.fail(at, String.format("Invalid parameter list for macro '%s'.", name.text()));
            }
            String parameter = group.get(0).name();
            if (parameters.contains(parameter)) {
                throw pass.fail(group.get(0), String.format("Duplicate parameter '%s' in macro '%s'.", parameter, name.text()));
            }
            parameters.add(parameter);
        }

        try {
            macros.define(MacroDefinition.block(name.text(), parameters, body, name.fileName(), name.line()));
        } catch (MacroException e) {
            throw pass.fail(name, e.getMessage());
        }
        LOG.debug("Defined block macro '{}' with {} parameter(s) at {}:{}", name.text(), parameters.size(), name.fileName(), name.line());
        return null;
    }

    private static boolean isParameter(Token token) {
        return token.type() == TokenType.IDENTIFIER || token.type() == TokenType.PLACEHOLDER;
    }
}
