package org.g10asm.compiler.frontend.preprocessor;

import org.g10asm.compiler.diagnostics.DiagnosticsEngine;
import org.g10asm.compiler.frontend.CompilerPhase;
import org.g10asm.compiler.frontend.directive.DirectiveHandlerRegistry;
import org.g10asm.compiler.frontend.directive.IDirectiveHandler;
import org.g10asm.compiler.frontend.lexer.KeywordType;
import org.g10asm.compiler.frontend.lexer.SyntaxException;
import org.g10asm.compiler.frontend.lexer.Token;
import org.g10asm.compiler.frontend.lexer.TokenCursor;
import org.g10asm.compiler.frontend.lexer.TokenType;
import org.g10asm.compiler.frontend.parser.ParsingContext;
import org.g10asm.compiler.frontend.preprocessor.eval.EvaluationException;
import org.g10asm.compiler.frontend.preprocessor.eval.ExpressionEvaluator;
import org.g10asm.compiler.frontend.preprocessor.features.macro.MacroDefinition;
import org.g10asm.compiler.frontend.preprocessor.features.macro.MacroException;
import org.g10asm.compiler.frontend.preprocessor.features.macro.MacroFrame;
import org.g10asm.compiler.frontend.preprocessor.value.PpValue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * The preprocessor for the assembly language. It runs between the first lexer pass and the parser.
 * <p>
 * The token stream is processed line by line. Directive lines are dispatched to the
 * {@link IDirectiveHandler} registered for the PREPROCESSING phase, lines starting with a block
 * macro name are expanded, and every other line is expanded (placeholders, brace groups, text
 * macros, string interpolation) and written to the {@link OutputWriter}. The result is flattened
 * source text that the lexer scans a second time.
 * <p>
 * Errors are recorded in the {@link DiagnosticsEngine}; processing resumes at the next line
 * unless the error was fatal.
 */
public class PreProcessor implements ParsingContext {

    private static final Logger LOG = LoggerFactory.getLogger(PreProcessor.class);

    private final List<Token> initialTokens;
    private final DiagnosticsEngine diagnostics;
    private final DirectiveHandlerRegistry directiveRegistry;
    private final PreProcessorContext ppContext;
    private final OutputWriter output = new OutputWriter();
    private final LineExpander expander = new LineExpander(this);
    private final long errorsBefore;
    private TokenCursor cursor;
    private PreprocessedSource result;

    /**
     * Constructs a new PreProcessor with the built-in directive handlers.
     * @param config The limits and include directories.
     * @param initialTokens The tokens of the main file from the first lexer pass.
     * @param diagnostics The engine for reporting errors and warnings.
     */
    public PreProcessor(PreProcessorConfig config, List<Token> initialTokens, DiagnosticsEngine diagnostics) {
        this(config, initialTokens, diagnostics, DirectiveHandlerRegistry.initialize());
    }

    /**
     * Constructs a new PreProcessor with a custom handler registry.
     * @param config The limits and include directories.
     * @param initialTokens The tokens of the main file from the first lexer pass.
     * @param diagnostics The engine for reporting errors and warnings.
     * @param directiveRegistry The handlers to dispatch directives to.
     */
    public PreProcessor(PreProcessorConfig config, List<Token> initialTokens, DiagnosticsEngine diagnostics,
                        DirectiveHandlerRegistry directiveRegistry) {
        this.initialTokens = List.copyOf(initialTokens);
        this.diagnostics = diagnostics;
        this.directiveRegistry = directiveRegistry;
        String mainFile = initialTokens.isEmpty() ? "<memory>" : initialTokens.get(0).fileName();
        this.ppContext = new PreProcessorContext(config, mainFile);
        this.errorsBefore = diagnostics.errorCount();
        this.cursor = new TokenCursor(List.of(), diagnostics);
    }

    /**
     * Runs the preprocessor. Subsequent calls return the same result.
     * @return The flattened source text together with its line origins.
     */
    public PreprocessedSource run() {
        if (result != null) {
            return result;
        }
        List<Token> filtered = TokenLists.filterContinuations(initialTokens);
        processBlock(filtered, 0);
        result = output.toSource();
        LOG.debug("Preprocessed {} tokens into {} lines", filtered.size(), result.lineCount());
        return result;
    }

    /**
     * @return The preprocessed text, running the preprocessor first if necessary.
     */
    public String getOutput() {
        return run().text();
    }

    /**
     * @return {@code true} if no error was reported while preprocessing and no fatal error aborted the run.
     */
    public boolean isGood() {
        return diagnostics.errorCount() == errorsBefore && !ppContext.isAborted();
    }

    /**
     * Processes a block of lines, e.g. a macro body or one loop iteration, on its own cursor.
     * @param tokens The lines of the block.
     * @param depth The recursion depth of the block.
     * @return How the enclosing block continues.
     */
    public Flow processBlock(List<Token> tokens, int depth) {
        if (tokens.isEmpty()) {
            return Flow.NORMAL;
        }
        if (depth > ppContext.getMaxRecursionDepth()) {
            reportFatal(tokens.get(0), String.format("Maximum recursion depth of %d exceeded.", ppContext.getMaxRecursionDepth()));
            return Flow.ABORT;
        }
        TokenCursor outer = cursor;
        cursor = new TokenCursor(tokens, diagnostics);
        try {
            while (!cursor.isAtEnd()) {
                if (cursor.match(TokenType.NEWLINE)) {
                    continue;
                }
                int lineStart = cursor.position();
                Token lineHead = cursor.peek();
                Flow flow;
                try {
                    flow = processLine(depth);
                } catch (SyntaxException e) {
                    if (ppContext.isAborted()) {
                        return Flow.ABORT;
                    }
                    recover(lineStart, lineHead);
                    continue;
                }
                if (flow != Flow.NORMAL) {
                    return flow;
                }
                if (ppContext.isAborted()) {
                    return Flow.ABORT;
                }
            }
            return Flow.NORMAL;
        } finally {
            cursor = outer;
        }
    }

    private Flow processLine(int depth) {
        if (ppContext.currentFrame().isPresent() && !isDirective(cursor.peek(), ".macro")) {
            substituteCurrentLine();
            if (cursor.check(TokenType.NEWLINE) || cursor.isAtEnd()) {
                cursor.match(TokenType.NEWLINE);
                return Flow.NORMAL;
            }
        }

        Token first = cursor.peek();
        if (first.isKeyword(KeywordType.PREPROCESSOR_DIRECTIVE)) {
            Optional<IDirectiveHandler> handler = directiveRegistry.get(first.text());
            if (handler.isPresent() && handler.get().getPhase() == CompilerPhase.PREPROCESSING) {
                return handler.get().process(this, ppContext, depth);
            }
            restOfLine();
            throw fail(first, String.format("Unsupported preprocessor directive '%s'.", first.text()));
        }

        int labelOffset = cursor.check(TokenType.IDENTIFIER) && cursor.checkNext(TokenType.COLON) ? 2 : 0;
        if (isBlockMacroAt(labelOffset)) {
            if (labelOffset > 0) {
                List<Token> label = new ArrayList<>();
                label.add(cursor.consume());
                label.add(cursor.consume());
                emit(expander.expand(label));
            }
            return invokeMacro(depth);
        }

        List<Token> line = cursor.restOfLine();
        cursor.match(TokenType.NEWLINE);
        emit(expander.expand(line));
        return Flow.NORMAL;
    }

    private Flow invokeMacro(int depth) {
        Token name = cursor.consume();
        MacroDefinition macro = lookupBlockMacro(name);
        List<Token> argumentTokens = cursor.restOfLine();
        cursor.match(TokenType.NEWLINE);
        List<List<Token>> arguments = TokenLists.splitTopLevel(argumentTokens);
        List<Token> body = TokenLists.restamp(macro.body(), name.fileName(), name.line());

        LOG.debug("Expanding macro '{}' with {} argument(s) at {}:{}", macro.name(), arguments.size(), name.fileName(), name.line());
        ppContext.pushFrame(new MacroFrame(macro, name, arguments));
        try {
            return processBlock(body, depth + 1);
        } finally {
            ppContext.popFrame();
        }
    }

    private boolean isBlockMacroAt(int offset) {
        int index = cursor.position() + offset;
        if (index >= cursor.size()) {
            return false;
        }
        Token token = cursor.tokens().get(index);
        if (token.type() != TokenType.IDENTIFIER || !ppContext.getMacroTable().isDefined(token.text())) {
            return false;
        }
        return lookupBlockMacro(token).kind() == MacroDefinition.Kind.BLOCK;
    }

    private MacroDefinition lookupBlockMacro(Token name) {
        try {
            return ppContext.getMacroTable().lookup(name.text());
        } catch (MacroException e) {
            throw fail(name, e.getMessage());
        }
    }

    private void substituteCurrentLine() {
        int start = cursor.position();
        List<Token> line = cursor.restOfLine();
        List<Token> substituted = expander.substitutePlaceholders(line);
        cursor.seek(start);
        if (substituted != line) {
            cursor.erase(line.size());
            cursor.inject(substituted, false);
        }
    }

    /**
     * Moves past a failed line. Handlers that already consumed the line, or replaced it in place
     * (conditional blocks), leave the cursor at the start of the next line to process.
     */
    private void recover(int lineStart, Token lineHead) {
        int position = cursor.position();
        boolean replaced = position == lineStart && (cursor.isAtEnd() || cursor.peek() != lineHead);
        boolean atNextLine = position > lineStart
                && cursor.tokens().get(position - 1).type() == TokenType.NEWLINE;
        if (!replaced && !atNextLine) {
            cursor.skipLine();
        }
    }

    // Services for directive handlers

    /**
     * Evaluates an expression and reports failures. A fatal evaluation error aborts the run.
     * @param tokens The expression tokens.
     * @param directive The token to report at when the failure has no location of its own.
     * @return The value, or empty if the expression could not be evaluated.
     */
    public Optional<PpValue> evaluate(List<Token> tokens, Token directive) {
        if (tokens.isEmpty()) {
            report(directive, String.format("Expected an expression after '%s'.", directive.text()));
            return Optional.empty();
        }
        try {
            return Optional.of(new ExpressionEvaluator(tokens, ppContext.getMacroTable(), ppContext.getMaxRecursionDepth()).evaluate());
        } catch (EvaluationException e) {
            report(e.getToken() != null ? e.getToken() : directive, e.getMessage());
            if (e.isFatal()) {
                ppContext.abort();
            }
            return Optional.empty();
        }
    }

    /**
     * Evaluates an expression and aborts the current line if that fails.
     * @param tokens The expression tokens.
     * @param directive The token to report at when the failure has no location of its own.
     * @return The value.
     * @throws SyntaxException after the failure has been reported.
     */
    public PpValue evaluateOrFail(List<Token> tokens, Token directive) {
        Optional<PpValue> value = evaluate(tokens, directive);
        if (value.isEmpty()) {
            throw new SyntaxException("Expression evaluation failed.", directive);
        }
        return value.get();
    }

    /**
     * Evaluates the condition of a control directive. Brace groups are rejected.
     * @param tokens The condition tokens.
     * @param directive The directive token.
     * @return The value.
     * @throws SyntaxException after the failure has been reported.
     */
    public PpValue evaluateCondition(List<Token> tokens, Token directive) {
        for (Token token : tokens) {
            if (token.type() == TokenType.LEFT_BRACE) {
                throw fail(token, String.format(
                        "'{' is not allowed in '%s' expressions; use the macro or placeholder directly.", directive.text()));
            }
        }
        return evaluateOrFail(tokens, directive);
    }

    /**
     * Collects the lines up to the closing directive of a block. The cursor must be at the start of
     * the first body line. Nested blocks of the same kind are skipped. The closing line is consumed.
     * @param opener The opening directive token, for error messages.
     * @param openers Lower-case names of directives opening a nested block.
     * @param closers Lower-case names of directives closing the block.
     * @param expected The closer named in the error message.
     * @return The body tokens, including their NEWLINE tokens.
     * @throws SyntaxException if the block is not terminated.
     */
    public List<Token> collectBlock(Token opener, Set<String> openers, Set<String> closers, String expected) {
        int start = cursor.position();
        int nesting = 0;
        boolean lineStart = true;
        while (!cursor.isAtEnd()) {
            Token token = cursor.peek();
            if (lineStart && token.type() == TokenType.KEYWORD) {
                String name = token.text().toLowerCase(Locale.ROOT);
                if (openers.contains(name)) {
                    nesting++;
                } else if (closers.contains(name)) {
                    if (nesting == 0) {
                        List<Token> body = new ArrayList<>(cursor.tokens().subList(start, cursor.position()));
                        cursor.skipLine();
                        return body;
                    }
                    nesting--;
                }
            }
            lineStart = token.type() == TokenType.NEWLINE;
            cursor.consume();
        }
        throw fail(opener, String.format("Missing '%s' for '%s'.", expected, opener.text()));
    }

    /**
     * Reports an error and returns the exception that aborts the current line.
     * @param at The token the error refers to.
     * @param message The message.
     * @return The exception; callers throw it.
     */
    public SyntaxException fail(Token at, String message) {
        return cursor.fail(at, message);
    }

    /**
     * Reports an error and aborts the whole run.
     */
    public void reportFatal(Token at, String message) {
        report(at, message);
        ppContext.abort();
    }

    private void report(Token at, String message) {
        diagnostics.reportError(message, at.fileName(), at.line());
    }

    /**
     * Writes a finished line to the output.
     */
    public void emit(List<Token> line) {
        output.emit(line);
    }

    /**
     * Evaluates brace groups, e.g. in the body of <code>.define</code>.
     */
    public List<Token> expandBraces(List<Token> tokens) {
        return expander.evaluateBraces(tokens);
    }

    /**
     * Interpolates <code>{expr}</code> in string literals.
     */
    public List<Token> interpolateStrings(List<Token> tokens) {
        return expander.interpolateStrings(tokens);
    }

    /**
     * Substitutes the placeholders of the innermost macro invocation.
     */
    public List<Token> substitutePlaceholders(List<Token> tokens) {
        return expander.substitutePlaceholders(tokens);
    }

    /**
     * Consumes and returns the rest of the current line; the NEWLINE is consumed as well.
     */
    public List<Token> restOfLine() {
        List<Token> line = cursor.restOfLine();
        cursor.match(TokenType.NEWLINE);
        return line;
    }

    public TokenCursor getCursor() {
        return cursor;
    }

    public PreProcessorContext getContext() {
        return ppContext;
    }

    private static boolean isDirective(Token token, String name) {
        return token.isKeyword(KeywordType.PREPROCESSOR_DIRECTIVE) && token.text().equalsIgnoreCase(name);
    }

    // ParsingContext

    @Override
    public boolean match(TokenType... types) {
        return cursor.match(types);
    }

    @Override
    public boolean check(TokenType type) {
        return cursor.check(type);
    }

    @Override
    public boolean checkNext(TokenType type) {
        return cursor.checkNext(type);
    }

    @Override
    public Token advance() {
        return cursor.consume();
    }

    @Override
    public Token peek() {
        return cursor.peek();
    }

    @Override
    public Token previous() {
        return cursor.previous();
    }

    @Override
    public Token consume(TokenType type, String errorMessage) {
        return cursor.expect(type, "%s", errorMessage);
    }

    @Override
    public DiagnosticsEngine getDiagnostics() {
        return diagnostics;
    }

    @Override
    public boolean isAtEnd() {
        return cursor.isAtEnd();
    }
}
