package org.g10asm.compiler.frontend.parser;

import org.g10asm.compiler.diagnostics.DiagnosticsEngine;
import org.g10asm.compiler.frontend.CompilerPhase;
import org.g10asm.compiler.frontend.directive.DirectiveHandlerRegistry;
import org.g10asm.compiler.frontend.directive.IDirectiveHandler;
import org.g10asm.compiler.frontend.environment.Environment;
import org.g10asm.compiler.frontend.lexer.Keyword;
import org.g10asm.compiler.frontend.lexer.KeywordType;
import org.g10asm.compiler.frontend.lexer.SyntaxException;
import org.g10asm.compiler.frontend.lexer.Token;
import org.g10asm.compiler.frontend.lexer.TokenCursor;
import org.g10asm.compiler.frontend.lexer.TokenType;
import org.g10asm.compiler.frontend.parser.ast.AstNode;
import org.g10asm.compiler.frontend.parser.ast.BinaryExpressionNode;
import org.g10asm.compiler.frontend.parser.ast.ConditionOperandNode;
import org.g10asm.compiler.frontend.parser.ast.DirectAddressOperandNode;
import org.g10asm.compiler.frontend.parser.ast.GroupingExpressionNode;
import org.g10asm.compiler.frontend.parser.ast.ImmediateOperandNode;
import org.g10asm.compiler.frontend.parser.ast.IndirectAddressOperandNode;
import org.g10asm.compiler.frontend.parser.ast.InstructionNode;
import org.g10asm.compiler.frontend.parser.ast.ModuleNode;
import org.g10asm.compiler.frontend.parser.ast.PrimaryExpressionNode;
import org.g10asm.compiler.frontend.parser.ast.RegisterOperandNode;
import org.g10asm.compiler.frontend.parser.ast.UnaryExpressionNode;
import org.g10asm.compiler.frontend.parser.features.label.LabelNode;
import org.g10asm.compiler.frontend.parser.features.var.VariableAssignmentNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;

/**
 * The main parser for the assembly language. It consumes the tokens of the preprocessed source
 * and produces an Abstract Syntax Tree (AST).
 * <p>
 * Statements are newline-terminated. Assembler directives are dispatched to the handlers
 * registered for the PARSING phase. The first error is reported and aborts the parse; no
 * partial tree is returned.
 */
public class Parser implements ParsingContext {

    private static final Logger LOG = LoggerFactory.getLogger(Parser.class);
    private static final Set<String> BRANCH_MNEMONICS = Set.of("jmp", "jpb", "call", "jp", "jr");

    private final TokenCursor cursor;
    private final DiagnosticsEngine diagnostics;
    private final DirectiveHandlerRegistry directiveRegistry;
    private final Environment environment;
    private boolean good = true;

    /**
     * Constructs a new Parser with the built-in directive handlers.
     * @param tokens The list of tokens to parse.
     * @param diagnostics The engine for reporting errors and warnings.
     * @param environment The store for <code>$variables</code> and constants.
     */
    public Parser(List<Token> tokens, DiagnosticsEngine diagnostics, Environment environment) {
        this(tokens, diagnostics, environment, DirectiveHandlerRegistry.initialize());
    }

    /**
     * Constructs a new Parser with a custom handler registry.
     * @param tokens The list of tokens to parse.
     * @param diagnostics The engine for reporting errors and warnings.
     * @param environment The store for <code>$variables</code> and constants.
     * @param directiveRegistry The handlers to dispatch directives to.
     */
    public Parser(List<Token> tokens, DiagnosticsEngine diagnostics, Environment environment,
                  DirectiveHandlerRegistry directiveRegistry) {
        this.cursor = new TokenCursor(tokens, diagnostics);
        this.diagnostics = diagnostics;
        this.environment = environment;
        this.directiveRegistry = directiveRegistry;
    }

    /**
     * Parses the entire token stream. Each call starts over from the first token with an
     * empty environment.
     * @return The module, or empty if an error was reported.
     */
    public Optional<ModuleNode> parse() {
        cursor.reset();
        environment.clear();
        good = true;
        List<AstNode> statements = new ArrayList<>();
        try {
            while (!isAtEnd()) {
                if (match(TokenType.NEWLINE)) {
                    continue;
                }
                if (isFileMarker()) {
                    cursor.skipLine();
                    continue;
                }
                line(statements);
            }
        } catch (SyntaxException e) {
            good = false;
            LOG.debug("Parsing stopped at {}: {}", e.getToken(), e.getMessage());
            return Optional.empty();
        }
        LOG.debug("Parsed {} statements", statements.size());
        return Optional.of(new ModuleNode(statements));
    }

    /**
     * @return {@code true} if the last {@link #parse()} succeeded.
     */
    public boolean isGood() {
        return good;
    }

    private void line(List<AstNode> statements) {
        if (isLabelDefinition()) {
            Token name = advance();
            advance(); // consume ':'
            statements.add(new LabelNode(name));
            if (atEndOfStatement()) {
                match(TokenType.NEWLINE);
                return;
            }
        }
        AstNode statement = statement();
        if (statement != null) {
            statements.add(statement);
        }
        if (!isAtEnd() && !match(TokenType.NEWLINE)) {
            throw fail(peek(), String.format("Expected end of line, but got '%s'.", peek().text()));
        }
    }

    private AstNode statement() {
        Token first = peek();
        if (first.isKeyword(KeywordType.ASSEMBLER_DIRECTIVE)) {
            return directiveStatement(first);
        }
        if (first.isKeyword(KeywordType.INSTRUCTION_MNEMONIC)) {
            return instruction();
        }
        if (first.type() == TokenType.VARIABLE && cursor.size() > cursor.position() + 1
                && cursor.peek(1).type().isAssignmentOperator()) {
            return assignment();
        }
        throw fail(first, String.format("Unsupported statement type '%s'.", first.text()));
    }

    private AstNode directiveStatement(Token directive) {
        Optional<IDirectiveHandler> handler = directiveRegistry.get(directive.text());
        if (handler.isPresent() && handler.get().getPhase() == CompilerPhase.PARSING) {
            return handler.get().parse(this);
        }
        throw fail(directive, String.format("Unsupported assembler directive '%s'.", directive.text()));
    }

    private InstructionNode instruction() {
        Token mnemonic = advance();
        List<AstNode> operands = new ArrayList<>();
        if (!atEndOfStatement()) {
            do {
                operands.add(operand(mnemonic));
            } while (match(TokenType.COMMA));
        }

        Keyword keyword = mnemonic.keyword();
        int min = keyword.param2();
        int max = keyword.param3();
        if (operands.size() < min || operands.size() > max) {
            String expected = min == max
                    ? String.format("%d operand%s", min, min == 1 ? "" : "s")
                    : String.format("between %d and %d operands", min, max);
            throw fail(mnemonic, String.format("Instruction '%s' expects %s, but got %d.",
                    mnemonic.text(), expected, operands.size()));
        }
        return new InstructionNode(mnemonic, operands);
    }

    private AstNode operand(Token mnemonic) {
        Token token = peek();
        if (token.isKeyword(KeywordType.REGISTER_NAME)) {
            return new RegisterOperandNode(advance());
        }
        if (token.isKeyword(KeywordType.BRANCHING_CONDITION)) {
            return new ConditionOperandNode(advance());
        }
        if (token.type() == TokenType.KEYWORD && !token.isKeyword(KeywordType.PREPROCESSOR_FUNCTION)) {
            throw fail(token, String.format("Unexpected keyword '%s' in operand of '%s'.", token.text(), mnemonic.text()));
        }
        if (match(TokenType.LEFT_BRACKET)) {
            AstNode target = peek().isKeyword(KeywordType.REGISTER_NAME)
                    ? new RegisterOperandNode(advance())
                    : expression();
            consume(TokenType.RIGHT_BRACKET, "Expected ']' after indirect address.");
            return new IndirectAddressOperandNode(target);
        }
        AstNode value = expression();
        if (BRANCH_MNEMONICS.contains(mnemonic.text().toLowerCase(Locale.ROOT))) {
            return new DirectAddressOperandNode(value);
        }
        return new ImmediateOperandNode(value);
    }

    private AstNode assignment() {
        Token target = advance();
        Token operator = advance();
        AstNode value = expression();
        AstNode stored = VariableAssignmentNode.binaryOperator(operator.type())
                .<AstNode>map(type -> new BinaryExpressionNode(new PrimaryExpressionNode(target),
                        new Token(type, type.symbol(), null, operator.line(), operator.column(), operator.fileName()),
                        value))
                .orElse(value);
        if (!environment.setValue(target, stored)) {
            throw new SyntaxException("Invalid assignment.", target);
        }
        return new VariableAssignmentNode(target, operator, value);
    }

    // Expressions

    /**
     * Parses an expression. Precedence, lowest first: <code>|</code>, <code>^</code>, <code>&amp;</code>,
     * shifts, additive, multiplicative, <code>**</code> (right-associative), unary, primary.
     * @return The expression node.
     * @throws SyntaxException if no valid expression starts at the current token.
     */
    public AstNode expression() {
        return bitwiseOr();
    }

    private AstNode bitwiseOr() {
        return leftAssociative(this::bitwiseXor, TokenType.BITWISE_OR);
    }

    private AstNode bitwiseXor() {
        return leftAssociative(this::bitwiseAnd, TokenType.BITWISE_XOR);
    }

    private AstNode bitwiseAnd() {
        return leftAssociative(this::shift, TokenType.BITWISE_AND);
    }

    private AstNode shift() {
        return leftAssociative(this::additive, TokenType.LEFT_SHIFT, TokenType.RIGHT_SHIFT);
    }

    private AstNode additive() {
        return leftAssociative(this::multiplicative, TokenType.PLUS, TokenType.MINUS);
    }

    private AstNode multiplicative() {
        return leftAssociative(this::exponent, TokenType.TIMES, TokenType.DIVIDE, TokenType.MODULO);
    }

    private AstNode exponent() {
        AstNode base = unary();
        if (match(TokenType.EXPONENT)) {
            Token operator = previous();
            return new BinaryExpressionNode(base, operator, exponent());
        }
        return base;
    }

    private AstNode unary() {
        if (match(TokenType.MINUS, TokenType.PLUS, TokenType.BITWISE_NOT, TokenType.LOGICAL_NOT)) {
            Token operator = previous();
            return new UnaryExpressionNode(operator, unary());
        }
        return primary();
    }

    private AstNode primary() {
        Token token = peek();
        switch (token.type()) {
            case INTEGER_LITERAL, NUMBER_LITERAL, CHARACTER_LITERAL, STRING_LITERAL,
                 IDENTIFIER, VARIABLE, PLACEHOLDER, PLACEHOLDER_KEYWORD -> {
                return new PrimaryExpressionNode(advance());
            }
            case LEFT_PARENTHESIS -> {
                advance();
                AstNode inner = expression();
                consume(TokenType.RIGHT_PARENTHESIS, "Expected ')' after expression.");
                return new GroupingExpressionNode(inner);
            }
            default -> {
                if (token.isKeyword(KeywordType.PREPROCESSOR_FUNCTION)) {
                    return new PrimaryExpressionNode(advance());
                }
                String shown = token.type() == TokenType.NEWLINE || token.type() == TokenType.END_OF_FILE
                        ? "end of line" : "'" + token.text() + "'";
                throw fail(token, String.format("Expected an expression, but got %s.", shown));
            }
        }
    }

    private AstNode leftAssociative(Supplier<AstNode> operand, TokenType... operators) {
        AstNode left = operand.get();
        while (match(operators)) {
            Token operator = previous();
            left = new BinaryExpressionNode(left, operator, operand.get());
        }
        return left;
    }

    // Helpers for directive handlers

    /**
     * @return {@code true} at a NEWLINE or the end of input.
     */
    public boolean atEndOfStatement() {
        return isAtEnd() || check(TokenType.NEWLINE);
    }

    /**
     * Reports an error and returns the exception that aborts the parse.
     * @param at The token the error refers to.
     * @param message The message.
     * @return The exception; callers throw it.
     */
    public SyntaxException fail(Token at, String message) {
        return cursor.fail(at, message);
    }

    public Environment getEnvironment() {
        return environment;
    }

    private boolean isLabelDefinition() {
        Token token = peek();
        boolean name = token.type() == TokenType.IDENTIFIER || token.isKeyword(KeywordType.PREPROCESSOR_FUNCTION);
        return name && checkNext(TokenType.COLON);
    }

    private boolean isFileMarker() {
        Token token = peek();
        return token.isKeyword(KeywordType.PREPROCESSOR_DIRECTIVE) && token.text().equalsIgnoreCase(".pragma");
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
