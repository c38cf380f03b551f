package org.g10asm.compiler.frontend.preprocessor.features.include;

import org.g10asm.compiler.frontend.CompilerPhase;
import org.g10asm.compiler.frontend.directive.IDirectiveHandler;
import org.g10asm.compiler.frontend.lexer.KeywordTable;
import org.g10asm.compiler.frontend.lexer.Lexer;
import org.g10asm.compiler.frontend.lexer.SyntaxException;
import org.g10asm.compiler.frontend.lexer.Token;
import org.g10asm.compiler.frontend.lexer.TokenType;
import org.g10asm.compiler.frontend.parser.ParsingContext;
import org.g10asm.compiler.frontend.parser.ast.AstNode;
import org.g10asm.compiler.frontend.preprocessor.PreProcessor;
import org.g10asm.compiler.frontend.preprocessor.PreProcessorContext;
import org.g10asm.compiler.frontend.preprocessor.TokenLists;
import org.g10asm.compiler.frontend.preprocessor.value.PpValue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Handles the <code>.include</code> directive in the preprocessor phase.
 * This directive reads another source file and injects its tokens into the current token stream,
 * wrapped in <code>.pragma push_file</code> and <code>.pragma pop_file</code> markers.
 */
public class IncludeDirectiveHandler implements IDirectiveHandler {

    private static final Logger LOG = LoggerFactory.getLogger(IncludeDirectiveHandler.class);

    @Override
    public CompilerPhase getPhase() {
        return CompilerPhase.PREPROCESSING;
    }

    /**
     * Parses an <code>.include</code> directive. It resolves and tokenizes the file and injects
     * the new tokens right after the directive line.
     * @param context The parsing context, which must be a {@link PreProcessor}.
     * @return null, as this directive does not produce an AST node.
     */
    @Override
    public AstNode parse(ParsingContext context) {
        PreProcessor pass = (PreProcessor) context;
        PreProcessorContext ppContext = pass.getContext();

        context.advance(); // consume .include
        Token pathToken = context.consume(TokenType.STRING_LITERAL, "Expected a file path in quotes after '.include'.");
        List<Token> trailing = pass.restOfLine();
        if (!trailing.isEmpty()) {
            throw pass.fail(trailing.get(0), String.format("Unexpected '%s' after the include path.", trailing.get(0).text()));
        }

        String requested = pathToken.stringValue();
        Optional<Path> resolved = resolve(requested, pathToken.fileName(), ppContext.getIncludeDirs());
        if (resolved.isEmpty()) {
            throw pass.fail(pathToken, String.format("Could not find included file '%s'.", requested));
        }
        Path path = resolved.get();
        String logicalName = path.toString().replace('\\', '/');
        if (ppContext.isOnce(logicalName)) {
            LOG.debug("Skipping '{}', it is marked with '.pragma once'", logicalName);
            return null;
        }

        Lexer lexer;
        try {
            lexer = Lexer.fromFile(path, context.getDiagnostics());
        } catch (IOException e) {
            throw pass.fail(pathToken, String.format("Could not read included file '%s': %s", requested, e.getMessage()));
        }
        List<Token> fileTokens = lexer.scanTokens();
        if (!lexer.isGood()) {
            // the lexer has reported the error at its position in the included file
            throw new SyntaxException("Included file could not be tokenized.", pathToken);
        }
        LOG.debug("Including '{}' ({} tokens) from {}:{}", logicalName, fileTokens.size(), pathToken.fileName(), pathToken.line());

        List<Token> injected = new ArrayList<>();
        injected.add(keyword(".pragma", pathToken));
        injected.add(keyword("push_file", pathToken));
        String quoted = PpValue.quote(logicalName);
        injected.add(new Token(TokenType.STRING_LITERAL, quoted, logicalName, pathToken.line(), pathToken.column(), pathToken.fileName()));
        injected.add(newline(pathToken));
        injected.addAll(TokenLists.filterContinuations(fileTokens));
        injected.add(newline(pathToken));
        injected.add(keyword(".pragma", pathToken));
        injected.add(keyword("pop_file", pathToken));
        injected.add(newline(pathToken));

        pass.getCursor().inject(injected, false);
        return null;
    }

    /**
     * Resolves an include path against the directory of the including file, the working
     * directory and the configured include directories, in that order.
     * @param requested The path as written in the directive.
     * @param includingFile The file containing the directive.
     * @param includeDirs The configured include directories.
     * @return The normalized absolute path of the first existing candidate.
     */
    static Optional<Path> resolve(String requested, String includingFile, List<Path> includeDirs) {
        Path relative = Path.of(requested);
        if (relative.isAbsolute()) {
            return Files.isRegularFile(relative) ? Optional.of(relative.normalize()) : Optional.empty();
        }
        List<Path> bases = new ArrayList<>();
        if (includingFile != null && !includingFile.startsWith("<")) {
            Path parent = Path.of(includingFile).toAbsolutePath().getParent();
            if (parent != null) {
                bases.add(parent);
            }
        }
        bases.add(Path.of("").toAbsolutePath());
        bases.addAll(includeDirs);
        for (Path base : bases) {
            Path candidate = base.resolve(relative).toAbsolutePath().normalize();
            if (Files.isRegularFile(candidate)) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }

    private static Token keyword(String text, Token at) {
        return new Token(TokenType.KEYWORD, text, null, at.line(), at.column(), at.fileName(),
                KeywordTable.lookup(text).orElseThrow());
    }

    private static Token newline(Token at) {
        return new Token(TokenType.NEWLINE, "\n", null, at.line(), at.column(), at.fileName());
    }
}
