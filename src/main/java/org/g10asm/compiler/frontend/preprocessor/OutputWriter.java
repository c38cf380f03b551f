package org.g10asm.compiler.frontend.preprocessor;

import org.g10asm.compiler.frontend.lexer.Token;
import org.g10asm.compiler.frontend.lexer.TokenType;

import java.util.ArrayList;
import java.util.List;

/**
 * Renders preprocessed lines as text and records where each line came from.
 * <p>
 * Tokens are separated by one space, except before <code>, : ) ]</code>, after
 * <code>( [</code> and after a unary operator.
 */
public class OutputWriter {

    private final StringBuilder text = new StringBuilder();
    private final List<SourceLocation> origins = new ArrayList<>();

    /**
     * Appends one line. Empty lines are dropped.
     * @param line The tokens of the line, without NEWLINE.
     */
    public void emit(List<Token> line) {
        if (line.isEmpty()) return;
        Token first = line.get(0);
        text.append(render(line)).append('\n');
        origins.add(new SourceLocation(first.fileName(), first.line()));
    }

    /**
     * Renders a line of tokens with the output spacing rules.
     * @param line The tokens to render.
     * @return The rendered text without a line break.
     */
    public static String render(List<Token> line) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < line.size(); i++) {
            Token token = line.get(i);
            if (i > 0 && needsSpace(line, i)) {
                sb.append(' ');
            }
            sb.append(token.text());
        }
        return sb.toString();
    }

    private static boolean needsSpace(List<Token> line, int index) {
        TokenType type = line.get(index).type();
        if (type == TokenType.COMMA || type == TokenType.COLON
                || type == TokenType.RIGHT_PARENTHESIS || type == TokenType.RIGHT_BRACKET) {
            return false;
        }
        TokenType previous = line.get(index - 1).type();
        if (previous == TokenType.LEFT_PARENTHESIS || previous == TokenType.LEFT_BRACKET) {
            return false;
        }
        return !isUnaryOperator(line, index - 1);
    }

    private static boolean isUnaryOperator(List<Token> line, int index) {
        TokenType type = line.get(index).type();
        if (type == TokenType.LOGICAL_NOT || type == TokenType.BITWISE_NOT) {
            return true;
        }
        if (type != TokenType.MINUS && type != TokenType.PLUS) {
            return false;
        }
        if (index == 0) {
            return true;
        }
        TokenType before = line.get(index - 1).type();
        return before.isOperator()
                || before == TokenType.LEFT_PARENTHESIS
                || before == TokenType.LEFT_BRACKET
                || before == TokenType.COMMA
                || before == TokenType.KEYWORD;
    }

    public String getText() {
        return text.toString();
    }

    public List<SourceLocation> getOrigins() {
        return List.copyOf(origins);
    }

    public PreprocessedSource toSource() {
        return new PreprocessedSource(getText(), origins);
    }
}
