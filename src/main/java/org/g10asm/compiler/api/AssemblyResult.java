package org.g10asm.compiler.api;

import org.g10asm.compiler.frontend.lexer.Token;
import org.g10asm.compiler.frontend.parser.ast.ModuleNode;
import org.g10asm.compiler.frontend.preprocessor.PreprocessedSource;

import java.util.List;

/**
 * The output of the assembler front end.
 *
 * @param tokens The tokens of the main file, as lexed before preprocessing.
 * @param preprocessed The flattened source with its line origins.
 * @param module The root of the AST.
 */
public record AssemblyResult(
        List<Token> tokens,
        PreprocessedSource preprocessed,
        ModuleNode module
) {
    public AssemblyResult {
        tokens = List.copyOf(tokens);
    }
}
