package org.g10asm.compiler.frontend.preprocessor.features.pragma;

import org.g10asm.compiler.frontend.CompilerPhase;
import org.g10asm.compiler.frontend.directive.IDirectiveHandler;
import org.g10asm.compiler.frontend.lexer.KeywordType;
import org.g10asm.compiler.frontend.lexer.Token;
import org.g10asm.compiler.frontend.lexer.TokenType;
import org.g10asm.compiler.frontend.parser.ParsingContext;
import org.g10asm.compiler.frontend.parser.ast.AstNode;
import org.g10asm.compiler.frontend.preprocessor.PreProcessor;
import org.g10asm.compiler.frontend.preprocessor.PreProcessorContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Handles <code>.pragma</code>: <code>once</code>, <code>max_recursion_depth N</code>,
 * <code>max_include_depth N</code> and the <code>push_file</code>/<code>pop_file</code> markers
 * around included files. The markers are passed through to the output.
 */
public class PragmaDirectiveHandler implements IDirectiveHandler {

    private static final Logger LOG = LoggerFactory.getLogger(PragmaDirectiveHandler.class);

    @Override
    public CompilerPhase getPhase() {
        return CompilerPhase.PREPROCESSING;
    }

    @Override
    public AstNode parse(ParsingContext context) {
        PreProcessor pass = (PreProcessor) context;
        PreProcessorContext ppContext = pass.getContext();

        Token directive = context.advance();
        if (context.check(TokenType.NEWLINE) || context.isAtEnd()) {
            pass.restOfLine();
            throw pass.fail(directive, "Expected a pragma name after '.pragma'.");
        }
        Token name = context.advance();
        List<Token> arguments = pass.restOfLine();
        if (!name.isKeyword(KeywordType.PRAGMA)) {
            throw pass.fail(name, String.format("Unknown pragma '%s'.", name.text()));
        }
        int expected = name.keyword().param1();
        if (arguments.size() != expected) {
            throw pass.fail(name, String.format("Pragma '%s' expects %d argument(s), but got %d.",
                    name.text(), expected, arguments.size()));
        }

        switch (name.text().toLowerCase(Locale.ROOT)) {
            case "once" -> ppContext.markOnce(ppContext.currentFile());
            case "max_recursion_depth" -> {
                int limit = positiveInteger(pass, name, arguments.get(0));
                ppContext.setMaxRecursionDepth(limit);
                LOG.debug("Maximum recursion depth set to {}", limit);
            }
            case "max_include_depth" -> {
                int limit = positiveInteger(pass, name, arguments.get(0));
                ppContext.setMaxIncludeDepth(limit);
                LOG.debug("Maximum include depth set to {}", limit);
            }
            case "push_file" -> {
                Token file = arguments.get(0);
                if (file.type() != TokenType.STRING_LITERAL) {
                    throw pass.fail(file, "Pragma 'push_file' expects a quoted file name.");
                }
                if (!ppContext.pushFile(file.stringValue())) {
                    pass.reportFatal(file, String.format("Maximum include depth of %d exceeded while including '%s'.",
                            ppContext.getMaxIncludeDepth(), file.stringValue()));
                    return null;
                }
                pass.emit(marker(directive, name, arguments));
            }
            case "pop_file" -> {
                ppContext.popFile();
                pass.emit(marker(directive, name, arguments));
            }
            default -> throw pass.fail(name, String.format("Unknown pragma '%s'.", name.text()));
        }
        return null;
    }

    private static int positiveInteger(PreProcessor pass, Token pragma, Token argument) {
        if (argument.type() != TokenType.INTEGER_LITERAL || argument.intValue() < 1 || argument.intValue() > Integer.MAX_VALUE) {
            throw pass.fail(argument, String.format("Pragma '%s' requires a positive integer, got '%s'.", pragma.text(), argument.text()));
        }
        return (int) argument.intValue();
    }

    private static List<Token> marker(Token directive, Token name, List<Token> arguments) {
        List<Token> line = new ArrayList<>();
        line.add(directive);
        line.add(name);
        line.addAll(arguments);
        return line;
    }
}
