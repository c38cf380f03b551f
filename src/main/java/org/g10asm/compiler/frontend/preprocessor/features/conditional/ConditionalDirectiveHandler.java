package org.g10asm.compiler.frontend.preprocessor.features.conditional;

import org.g10asm.compiler.frontend.CompilerPhase;
import org.g10asm.compiler.frontend.directive.IDirectiveHandler;
import org.g10asm.compiler.frontend.lexer.SyntaxException;
import org.g10asm.compiler.frontend.lexer.Token;
import org.g10asm.compiler.frontend.lexer.TokenCursor;
import org.g10asm.compiler.frontend.lexer.TokenType;
import org.g10asm.compiler.frontend.parser.ParsingContext;
import org.g10asm.compiler.frontend.parser.ast.AstNode;
import org.g10asm.compiler.frontend.preprocessor.PreProcessor;
import org.g10asm.compiler.frontend.preprocessor.features.macro.MacroTable;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Handles conditional assembly: <code>.if</code>, <code>.ifdef</code> and <code>.ifndef</code>
 * with their <code>.elseif</code>/<code>.elif</code>, <code>.else</code> and
 * <code>.endif</code>/<code>.endc</code> branches.
 * <p>
 * The whole block is scanned first. Conditions are then evaluated in order until one holds, and
 * the block is replaced in the token stream by the body of that branch. Bodies of other
 * branches are never processed, so they may contain anything.
 */
public class ConditionalDirectiveHandler implements IDirectiveHandler {

    private static final Set<String> OPENERS = Set.of(".if", ".ifdef", ".ifndef");
    private static final Set<String> ENDERS = Set.of(".endif", ".endc");
    private static final Set<String> ELSE_IFS = Set.of(".elseif", ".elif");
    private static final String ELSE = ".else";

    private record Branch(Token directive, List<Token> condition, int bodyStart, int bodyEnd) {}

    @Override
    public CompilerPhase getPhase() {
        return CompilerPhase.PREPROCESSING;
    }

    @Override
    public AstNode parse(ParsingContext context) {
        PreProcessor pass = (PreProcessor) context;
        TokenCursor cursor = pass.getCursor();

        int start = cursor.position();
        Token opener = context.advance();
        List<Token> header = pass.restOfLine();
        List<Token> tokens = cursor.tokens();

        List<Branch> branches = new ArrayList<>();
        Token branchDirective = opener;
        List<Token> branchCondition = header;
        int bodyStart = cursor.position();
        boolean seenElse = false;
        SyntaxException structureError = null;
        int nesting = 0;
        boolean lineStart = true;

        int i = bodyStart;
        while (i < tokens.size()) {
            Token token = tokens.get(i);
            String name = lineStart && token.type() == TokenType.KEYWORD ? token.text().toLowerCase(Locale.ROOT) : "";
            if (OPENERS.contains(name)) {
                nesting++;
            } else if (ENDERS.contains(name)) {
                if (nesting == 0) {
                    branches.add(new Branch(branchDirective, branchCondition, bodyStart, i));
                    int end = endOfLine(tokens, i);
                    if (structureError != null) {
                        discard(cursor, start, end);
                        throw structureError;
                    }
                    List<Token> chosen;
                    try {
                        chosen = choose(pass, branches, tokens);
                    } finally {
                        discard(cursor, start, end);
                    }
                    cursor.inject(chosen, false);
                    return null;
                }
                nesting--;
            } else if (nesting == 0 && (ELSE_IFS.contains(name) || ELSE.equals(name))) {
                if (seenElse && structureError == null) {
                    structureError = pass.fail(token, ELSE.equals(name)
                            ? "Duplicate '.else' in conditional block."
                            : String.format("'%s' after '.else' in conditional block.", token.text()));
                }
                branches.add(new Branch(branchDirective, branchCondition, bodyStart, i));
                int next = endOfLine(tokens, i);
                branchDirective = token;
                branchCondition = withoutNewline(tokens, i + 1, next);
                seenElse |= ELSE.equals(name);
                bodyStart = next;
                i = next;
                lineStart = true;
                continue;
            }
            lineStart = token.type() == TokenType.NEWLINE;
            i++;
        }
        cursor.seek(tokens.size());
        throw pass.fail(opener, String.format("Missing '.endif' for '%s'.", opener.text()));
    }

    private static List<Token> choose(PreProcessor pass, List<Branch> branches, List<Token> tokens) {
        for (Branch branch : branches) {
            if (holds(pass, branch)) {
                return new ArrayList<>(tokens.subList(branch.bodyStart(), branch.bodyEnd()));
            }
        }
        return List.of();
    }

    private static boolean holds(PreProcessor pass, Branch branch) {
        Token directive = branch.directive();
        List<Token> condition = branch.condition();
        String name = directive.text().toLowerCase(Locale.ROOT);
        switch (name) {
            case ELSE -> {
                if (!condition.isEmpty()) {
                    throw pass.fail(condition.get(0), "'.else' takes no condition.");
                }
                return true;
            }
            case ".ifdef", ".ifndef" -> {
                if (condition.size() != 1 || condition.get(0).type() != TokenType.IDENTIFIER) {
                    throw pass.fail(directive, String.format("'%s' expects a single macro name.", directive.text()));
                }
                MacroTable macros = pass.getContext().getMacroTable();
                boolean defined = macros.isDefined(condition.get(0).text());
                return name.equals(".ifdef") == defined;
            }
            default -> {
                List<Token> substituted = pass.substitutePlaceholders(condition);
                return pass.evaluateCondition(substituted, directive).isTruthy();
            }
        }
    }

    /**
     * Removes the tokens of the whole block, leaving the cursor where the block started.
     */
    private static void discard(TokenCursor cursor, int start, int end) {
        cursor.seek(start);
        cursor.erase(end - start);
    }

    private static int endOfLine(List<Token> tokens, int index) {
        int i = index;
        while (i < tokens.size() && tokens.get(i).type() != TokenType.NEWLINE) {
            i++;
        }
        return Math.min(tokens.size(), i + 1);
    }

    private static List<Token> withoutNewline(List<Token> tokens, int from, int to) {
        int end = to;
        if (end > from && tokens.get(end - 1).type() == TokenType.NEWLINE) {
            end--;
        }
        return new ArrayList<>(tokens.subList(from, end));
    }
}
