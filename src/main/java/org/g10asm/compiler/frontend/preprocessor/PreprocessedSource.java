package org.g10asm.compiler.frontend.preprocessor;

import org.g10asm.compiler.frontend.lexer.Token;

import java.util.ArrayList;
import java.util.List;

/**
 * The result of preprocessing: flattened source text and, for every line of it, the
 * location the line originates from.
 *
 * @param text The preprocessed text, one statement per line.
 * @param lineOrigins The origin of each output line; index 0 is line 1.
 */
public record PreprocessedSource(String text, List<SourceLocation> lineOrigins) {

    public PreprocessedSource {
        lineOrigins = List.copyOf(lineOrigins);
    }

    public int lineCount() {
        return lineOrigins.size();
    }

    /**
     * Looks up the origin of an output line.
     * @param outputLine The 1-based line in {@link #text()}.
     * @return The origin, or the last known origin for lines past the end.
     */
    public SourceLocation originOf(int outputLine) {
        if (lineOrigins.isEmpty()) {
            return new SourceLocation("<preprocessed>", outputLine);
        }
        int index = Math.max(0, Math.min(lineOrigins.size() - 1, outputLine - 1));
        return lineOrigins.get(index);
    }

    /**
     * Maps tokens lexed from {@link #text()} back to the files and lines they came from.
     * Columns keep referring to the preprocessed text.
     * @param tokens Tokens lexed from the preprocessed text.
     * @return The re-stamped tokens.
     */
    public List<Token> relocate(List<Token> tokens) {
        List<Token> relocated = new ArrayList<>(tokens.size());
        for (Token token : tokens) {
            SourceLocation origin = originOf(token.line());
            relocated.add(token.withOrigin(origin.fileName(), origin.line()));
        }
        return relocated;
    }
}
