package org.g10asm.compiler.frontend.preprocessor;

import org.g10asm.compiler.diagnostics.Diagnostic;
import org.g10asm.compiler.diagnostics.DiagnosticsEngine;
import org.g10asm.compiler.frontend.lexer.Keyword;
import org.g10asm.compiler.frontend.lexer.KeywordTable;
import org.g10asm.compiler.frontend.lexer.Lexer;
import org.g10asm.compiler.frontend.lexer.SyntaxException;
import org.g10asm.compiler.frontend.lexer.Token;
import org.g10asm.compiler.frontend.lexer.TokenType;
import org.g10asm.compiler.frontend.preprocessor.features.macro.MacroDefinition;
import org.g10asm.compiler.frontend.preprocessor.features.macro.MacroException;
import org.g10asm.compiler.frontend.preprocessor.features.macro.MacroFrame;
import org.g10asm.compiler.frontend.preprocessor.features.macro.MacroTable;
import org.g10asm.compiler.frontend.preprocessor.value.PpValue;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Rewrites the tokens of a single line: placeholder substitution, evaluation of
 * <code>{expr}</code> groups with token pasting, text macro expansion and string interpolation.
 * Errors are reported through the owning {@link PreProcessor} and raised as {@link SyntaxException}.
 */
class LineExpander {

    private final PreProcessor preProcessor;

    LineExpander(PreProcessor preProcessor) {
        this.preProcessor = preProcessor;
    }

    /**
     * Applies all rewrites an emitted line goes through.
     */
    List<Token> expand(List<Token> line) {
        List<Token> evaluated = evaluateBraces(line);
        List<Token> expanded = expandTextMacros(evaluated, 0);
        return interpolateStrings(expanded);
    }

    /**
     * Replaces placeholders with the arguments of the innermost macro invocation.
     * Outside of any invocation the line is returned unchanged.
     */
    List<Token> substitutePlaceholders(List<Token> line) {
        Optional<MacroFrame> frame = preProcessor.getContext().currentFrame();
        if (frame.isEmpty() || !hasPlaceholder(line)) {
            return line;
        }
        List<Token> out = new ArrayList<>(line.size());
        for (Token token : line) {
            if (token.type() == TokenType.PLACEHOLDER || token.type() == TokenType.PLACEHOLDER_KEYWORD) {
                try {
                    out.addAll(frame.get().resolve(token.name(), token));
                } catch (MacroException e) {
                    throw preProcessor.fail(token, e.getMessage());
                }
            } else {
                out.add(token);
            }
        }
        return out;
    }

    /**
     * Evaluates every <code>{expr}</code> group. A group touching an identifier or integer
     * without whitespace is pasted into a single identifier, e.g. <code>label_{i}</code>.
     */
    List<Token> evaluateBraces(List<Token> line) {
        if (!TokenLists.containsType(line, TokenType.LEFT_BRACE) && !TokenLists.containsType(line, TokenType.RIGHT_BRACE)) {
            return line;
        }
        List<Token> out = new ArrayList<>();
        List<Token> rawEnds = new ArrayList<>();
        int i = 0;
        while (i < line.size()) {
            Token token = line.get(i);
            if (token.type() == TokenType.RIGHT_BRACE) {
                throw preProcessor.fail(token, "Unmatched '}'.");
            }
            if (token.type() != TokenType.LEFT_BRACE) {
                out.add(token);
                rawEnds.add(token);
                i++;
                continue;
            }

            int close = findClosingBrace(line, i);
            if (close < 0) {
                throw preProcessor.fail(token, "Unterminated '{' expression.");
            }
            List<Token> inner = line.subList(i + 1, close);
            if (inner.isEmpty()) {
                throw preProcessor.fail(token, "Empty '{}' expression.");
            }
            PpValue value = preProcessor.evaluateOrFail(inner, token);
            Token closing = line.get(close);
            i = close + 1;

            boolean pasteLeft = !out.isEmpty()
                    && isPasteable(out.get(out.size() - 1))
                    && TokenLists.adjacent(rawEnds.get(rawEnds.size() - 1), token);
            boolean pasteRight = i < line.size()
                    && isPasteable(line.get(i))
                    && TokenLists.adjacent(closing, line.get(i));

            if (!pasteLeft && !pasteRight) {
                Token rendered = render(value, token);
                if (rendered != null) {
                    out.add(rendered);
                    rawEnds.add(closing);
                }
                continue;
            }

            StringBuilder text = new StringBuilder();
            Token first = token;
            if (pasteLeft) {
                first = out.remove(out.size() - 1);
                rawEnds.remove(rawEnds.size() - 1);
                text.append(first.text());
            }
            text.append(value.isString() ? value.asString() : value.toSourceText());
            Token rawEnd = closing;
            if (pasteRight) {
                Token right = line.get(i++);
                text.append(right.text());
                rawEnd = right;
            }
            out.add(pasted(text.toString(), first));
            rawEnds.add(rawEnd);
        }
        return out;
    }

    /**
     * Replaces identifiers naming text macros by their replacement tokens, recursively.
     */
    List<Token> expandTextMacros(List<Token> tokens, int level) {
        MacroTable macros = preProcessor.getContext().getMacroTable();
        List<Token> out = new ArrayList<>(tokens.size());
        for (Token token : tokens) {
            if (token.type() == TokenType.IDENTIFIER && macros.isDefined(token.text())) {
                MacroDefinition macro = lookup(macros, token);
                if (macro.kind() == MacroDefinition.Kind.TEXT) {
                    int limit = preProcessor.getContext().getMaxRecursionDepth();
                    if (level + 1 > limit) {
                        preProcessor.getContext().abort();
                        throw preProcessor.fail(token, String.format(
                                "Maximum macro recursion depth of %d exceeded while expanding '%s'.", limit, token.text()));
                    }
                    List<Token> body = TokenLists.restamp(macro.body(), token.fileName(), token.line());
                    out.addAll(expandTextMacros(body, level + 1));
                    continue;
                }
            }
            out.add(token);
        }
        return out;
    }

    /**
     * Evaluates <code>{expr}</code> inside string literals and inserts the unquoted value.
     * <code>{{</code> and <code>}}</code> stand for literal braces.
     */
    List<Token> interpolateStrings(List<Token> tokens) {
        List<Token> out = new ArrayList<>(tokens.size());
        for (Token token : tokens) {
            if (token.type() == TokenType.STRING_LITERAL && token.stringValue().indexOf('{') >= 0) {
                out.add(interpolate(token));
            } else {
                out.add(token);
            }
        }
        return out;
    }

    private Token interpolate(Token literal) {
        String source = literal.stringValue();
        StringBuilder result = new StringBuilder();
        int i = 0;
        while (i < source.length()) {
            char c = source.charAt(i);
            if (c == '{' && i + 1 < source.length() && source.charAt(i + 1) == '{') {
                result.append('{');
                i += 2;
            } else if (c == '}' && i + 1 < source.length() && source.charAt(i + 1) == '}') {
                result.append('}');
                i += 2;
            } else if (c == '{') {
                int close = findClosingBrace(source, i);
                if (close < 0) {
                    throw preProcessor.fail(literal, "Unterminated '{' in string interpolation.");
                }
                List<Token> expression = lexFragment(source.substring(i + 1, close), literal);
                if (expression.isEmpty()) {
                    throw preProcessor.fail(literal, "Empty '{}' in string interpolation.");
                }
                result.append(preProcessor.evaluateOrFail(expression, literal));
                i = close + 1;
            } else {
                result.append(c);
                i++;
            }
        }
        String text = result.toString();
        return new Token(TokenType.STRING_LITERAL, PpValue.quote(text), text,
                literal.line(), literal.column(), literal.fileName());
    }

    private List<Token> lexFragment(String fragment, Token at) {
        DiagnosticsEngine scratch = new DiagnosticsEngine();
        Lexer lexer = new Lexer(fragment, scratch, at.fileName());
        List<Token> lexed = lexer.scanTokens();
        if (!lexer.isGood()) {
            String message = scratch.getDiagnostics().stream()
                    .filter(d -> d.type() == Diagnostic.Type.ERROR)
                    .map(Diagnostic::message)
                    .findFirst()
                    .orElse("Invalid expression in string interpolation.");
            throw preProcessor.fail(at, message);
        }
        List<Token> expression = new ArrayList<>();
        for (Token token : lexed) {
            if (token.type() != TokenType.END_OF_FILE && token.type() != TokenType.NEWLINE) {
                expression.add(token.withOrigin(at.fileName(), at.line()));
            }
        }
        return expression;
    }

    private MacroDefinition lookup(MacroTable macros, Token token) {
        try {
            return macros.lookup(token.text());
        } catch (MacroException e) {
            throw preProcessor.fail(token, e.getMessage());
        }
    }

    private static boolean hasPlaceholder(List<Token> line) {
        return TokenLists.containsType(line, TokenType.PLACEHOLDER)
                || TokenLists.containsType(line, TokenType.PLACEHOLDER_KEYWORD);
    }

    private static boolean isPasteable(Token token) {
        return token.type() == TokenType.IDENTIFIER
                || token.type() == TokenType.INTEGER_LITERAL
                || token.type() == TokenType.KEYWORD;
    }

    private static Token pasted(String text, Token first) {
        Optional<Keyword> keyword = KeywordTable.lookup(text);
        if (keyword.isPresent()) {
            return new Token(TokenType.KEYWORD, text, null, first.line(), first.column(), first.fileName(), keyword.get());
        }
        return new Token(TokenType.IDENTIFIER, text, null, first.line(), first.column(), first.fileName());
    }

    private static Token render(PpValue value, Token at) {
        return switch (value.type()) {
            case VOID -> null;
            case INTEGER -> new Token(TokenType.INTEGER_LITERAL, Long.toString(value.asInteger()), value.asInteger(),
                    at.line(), at.column(), at.fileName());
            case BOOLEAN -> new Token(TokenType.INTEGER_LITERAL, value.toSourceText(), value.asBoolean() ? 1L : 0L,
                    at.line(), at.column(), at.fileName());
            case NUMBER -> new Token(TokenType.NUMBER_LITERAL, value.toSourceText(), value.asDouble(),
                    at.line(), at.column(), at.fileName());
            case STRING -> new Token(TokenType.STRING_LITERAL, value.toSourceText(), value.asString(),
                    at.line(), at.column(), at.fileName());
        };
    }

    private static int findClosingBrace(List<Token> line, int open) {
        int nesting = 0;
        for (int i = open; i < line.size(); i++) {
            TokenType type = line.get(i).type();
            if (type == TokenType.LEFT_BRACE) {
                nesting++;
            } else if (type == TokenType.RIGHT_BRACE && --nesting == 0) {
                return i;
            }
        }
        return -1;
    }

    private static int findClosingBrace(String text, int open) {
        int nesting = 0;
        for (int i = open; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '{') {
                nesting++;
            } else if (c == '}' && --nesting == 0) {
                return i;
            }
        }
        return -1;
    }
}
