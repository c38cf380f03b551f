package org.g10asm.compiler;

import org.g10asm.compiler.api.AssemblyException;
import org.g10asm.compiler.api.AssemblyResult;
import org.g10asm.compiler.api.IAssembler;
import org.g10asm.compiler.diagnostics.DiagnosticsEngine;
import org.g10asm.compiler.frontend.environment.Environment;
import org.g10asm.compiler.frontend.lexer.Lexer;
import org.g10asm.compiler.frontend.lexer.Token;
import org.g10asm.compiler.frontend.parser.Parser;
import org.g10asm.compiler.frontend.parser.ast.ModuleNode;
import org.g10asm.compiler.frontend.preprocessor.PreProcessor;
import org.g10asm.compiler.frontend.preprocessor.PreProcessorConfig;
import org.g10asm.compiler.frontend.preprocessor.PreprocessedSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * The main assembler implementation. This class orchestrates the front end pipeline:
 * lexing, preprocessing, lexing the preprocessed text again and parsing it.
 * Each call starts with a fresh {@link DiagnosticsEngine}. It is not thread-safe.
 */
public class Assembler implements IAssembler {

    private static final Logger LOG = LoggerFactory.getLogger(Assembler.class);
    static final String PREPROCESSED_FILE_NAME = "<preprocessed>";

    private final PreProcessorConfig config;
    private DiagnosticsEngine diagnostics = new DiagnosticsEngine();

    public Assembler() {
        this(PreProcessorConfig.defaults());
    }

    public Assembler(PreProcessorConfig config) {
        this.config = config;
    }

    @Override
    public List<Token> tokenize(String source, String fileName) throws AssemblyException {
        diagnostics = new DiagnosticsEngine();
        return lex(source, fileName);
    }

    @Override
    public PreprocessedSource preprocess(String source, String fileName) throws AssemblyException {
        diagnostics = new DiagnosticsEngine();
        return preprocess(lex(source, fileName));
    }

    @Override
    public AssemblyResult assemble(String source, String fileName) throws AssemblyException {
        diagnostics = new DiagnosticsEngine();

        // Phase 1: Lexical analysis
        List<Token> tokens = lex(source, fileName);

        // Phase 2: Preprocessing (includes, macros, conditionals, loops)
        PreprocessedSource preprocessed = preprocess(tokens);

        // Phase 3: Lex the flattened text again and map positions back to the original files
        Lexer secondPass = new Lexer(preprocessed.text(), diagnostics, PREPROCESSED_FILE_NAME);
        List<Token> relocated = preprocessed.relocate(secondPass.scanTokens());
        if (!secondPass.isGood()) {
            throw new AssemblyException(diagnostics.summary());
        }

        // Phase 4: Parsing
        Parser parser = new Parser(relocated, diagnostics, new Environment(diagnostics));
        Optional<ModuleNode> module = parser.parse();
        if (module.isEmpty() || diagnostics.hasErrors()) {
            throw new AssemblyException(diagnostics.summary());
        }
        LOG.debug("Assembled {}: {} statements", fileName, module.get().statements().size());
        return new AssemblyResult(tokens, preprocessed, module.get());
    }

    @Override
    public DiagnosticsEngine getDiagnostics() {
        return diagnostics;
    }

    private List<Token> lex(String source, String fileName) throws AssemblyException {
        Lexer lexer = new Lexer(source, diagnostics, fileName);
        List<Token> tokens = lexer.scanTokens();
        if (!lexer.isGood()) {
            throw new AssemblyException(diagnostics.summary());
        }
        return tokens;
    }

    private PreprocessedSource preprocess(List<Token> tokens) throws AssemblyException {
        PreProcessor preProcessor = new PreProcessor(config, tokens, diagnostics);
        PreprocessedSource preprocessed = preProcessor.run();
        if (!preProcessor.isGood()) {
            throw new AssemblyException(diagnostics.summary());
        }
        return preprocessed;
    }
}
