package org.g10asm.compiler.api;

import org.g10asm.compiler.diagnostics.DiagnosticsEngine;
import org.g10asm.compiler.frontend.lexer.Token;
import org.g10asm.compiler.frontend.preprocessor.PreprocessedSource;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Defines the public interface of the G10 assembler front end.
 */
public interface IAssembler {

    /**
     * Runs the lexer only.
     * @param source The source code.
     * @param fileName The name reported in diagnostics.
     * @return The tokens, terminated by END_OF_FILE.
     * @throws AssemblyException if a lexical error occurs.
     */
    List<Token> tokenize(String source, String fileName) throws AssemblyException;

    /**
     * Runs the lexer and the preprocessor.
     * @param source The source code.
     * @param fileName The name reported in diagnostics and used to resolve relative includes.
     * @return The flattened source.
     * @throws AssemblyException if a lexical or preprocessing error occurs.
     */
    PreprocessedSource preprocess(String source, String fileName) throws AssemblyException;

    /**
     * Runs the complete front end: lexer, preprocessor and parser.
     * @param source The source code.
     * @param fileName The name reported in diagnostics and used to resolve relative includes.
     * @return The tokens, the preprocessed source and the AST.
     * @throws AssemblyException if any stage reports an error.
     */
    AssemblyResult assemble(String source, String fileName) throws AssemblyException;

    /**
     * The diagnostics of the last call, including warnings and infos of a successful run.
     * @return The diagnostics engine of the last call.
     */
    DiagnosticsEngine getDiagnostics();

    /**
     * Assembles a file on disk.
     * @param path The main source file.
     * @return The front end result.
     * @throws AssemblyException if any stage reports an error.
     * @throws IOException if the file cannot be read.
     */
    default AssemblyResult assemble(Path path) throws AssemblyException, IOException {
        Path absolute = path.toAbsolutePath().normalize();
        return assemble(Files.readString(absolute), absolute.toString().replace('\\', '/'));
    }
}
