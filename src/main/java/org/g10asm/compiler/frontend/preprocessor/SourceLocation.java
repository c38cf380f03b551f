package org.g10asm.compiler.frontend.preprocessor;

/**
 * The original position of a line of preprocessed output.
 *
 * @param fileName The file the line came from.
 * @param line The 1-based line in that file.
 */
public record SourceLocation(String fileName, int line) {

    @Override
    public String toString() {
        return fileName + ":" + line;
    }
}
