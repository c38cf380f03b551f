package org.g10asm.compiler.frontend.preprocessor.eval;

import org.g10asm.compiler.frontend.lexer.Keyword;
import org.g10asm.compiler.frontend.lexer.KeywordType;
import org.g10asm.compiler.frontend.lexer.Token;
import org.g10asm.compiler.frontend.lexer.TokenType;
import org.g10asm.compiler.frontend.preprocessor.features.macro.MacroDefinition;
import org.g10asm.compiler.frontend.preprocessor.features.macro.MacroException;
import org.g10asm.compiler.frontend.preprocessor.features.macro.MacroTable;
import org.g10asm.compiler.frontend.preprocessor.value.FixedPoint;
import org.g10asm.compiler.frontend.preprocessor.value.PpValue;

import java.util.ArrayList;
import java.util.List;

/**
 * Evaluates a preprocessor expression given as a span of tokens.
 * <p>
 * Precedence, lowest first: {@code ||}, {@code &&}, {@code |}, {@code ^}, {@code &},
 * equality, relational, shifts, additive, multiplicative, {@code **} (right-associative),
 * unary and primary. Identifiers naming text macros are evaluated recursively; the
 * evaluator never modifies the macro table.
 */
public class ExpressionEvaluator {

    @FunctionalInterface
    private interface Level {
        PpValue parse() throws EvaluationException;
    }

    private final List<Token> tokens;
    private final MacroTable macros;
    private final int maxRecursionDepth;
    private final int depth;
    private int current = 0;
    private int skipping = 0;

    /**
     * Creates an evaluator for one expression.
     * @param tokens The tokens of the expression, without the terminating NEWLINE.
     * @param macros The macro table used to resolve identifiers and {@code defined()}.
     * @param maxRecursionDepth The maximum nesting of macro references.
     */
    public ExpressionEvaluator(List<Token> tokens, MacroTable macros, int maxRecursionDepth) {
        this(tokens, macros, maxRecursionDepth, 0);
    }

    private ExpressionEvaluator(List<Token> tokens, MacroTable macros, int maxRecursionDepth, int depth) {
        this.tokens = tokens;
        this.macros = macros;
        this.maxRecursionDepth = maxRecursionDepth;
        this.depth = depth;
    }

    /**
     * Evaluates the whole token span.
     * @return The value of the expression.
     * @throws EvaluationException if the span is empty, malformed or cannot be evaluated.
     */
    public PpValue evaluate() throws EvaluationException {
        if (tokens.isEmpty()) {
            throw new EvaluationException("Expected an expression.", null);
        }
        current = 0;
        PpValue value = logicalOr();
        if (current < tokens.size()) {
            Token extra = tokens.get(current);
            throw new EvaluationException(String.format("Unexpected token '%s' after expression.", extra.text()), extra);
        }
        return value;
    }

    private PpValue logicalOr() throws EvaluationException {
        PpValue left = logicalAnd();
        while (match(TokenType.LOGICAL_OR)) {
            boolean shortCircuit = skipping == 0 && left.isTruthy();
            if (shortCircuit) skipping++;
            PpValue right;
            try {
                right = logicalAnd();
            } finally {
                if (shortCircuit) skipping--;
            }
            left = PpValue.ofBoolean(shortCircuit || right.isTruthy());
        }
        return left;
    }

    private PpValue logicalAnd() throws EvaluationException {
        PpValue left = bitwiseOr();
        while (match(TokenType.LOGICAL_AND)) {
            boolean shortCircuit = skipping == 0 && !left.isTruthy();
            if (shortCircuit) skipping++;
            PpValue right;
            try {
                right = bitwiseOr();
            } finally {
                if (shortCircuit) skipping--;
            }
            left = PpValue.ofBoolean(!shortCircuit && right.isTruthy());
        }
        return left;
    }

    private PpValue bitwiseOr() throws EvaluationException {
        return leftAssociative(this::bitwiseXor, TokenType.BITWISE_OR);
    }

    private PpValue bitwiseXor() throws EvaluationException {
        return leftAssociative(this::bitwiseAnd, TokenType.BITWISE_XOR);
    }

    private PpValue bitwiseAnd() throws EvaluationException {
        return leftAssociative(this::equality, TokenType.BITWISE_AND);
    }

    private PpValue equality() throws EvaluationException {
        return leftAssociative(this::relational, TokenType.EQUAL, TokenType.NOT_EQUAL);
    }

    private PpValue relational() throws EvaluationException {
        return leftAssociative(this::shift, TokenType.LESS, TokenType.LESS_EQUAL, TokenType.GREATER, TokenType.GREATER_EQUAL);
    }

    private PpValue shift() throws EvaluationException {
        return leftAssociative(this::additive, TokenType.LEFT_SHIFT, TokenType.RIGHT_SHIFT);
    }

    private PpValue additive() throws EvaluationException {
        return leftAssociative(this::multiplicative, TokenType.PLUS, TokenType.MINUS);
    }

    private PpValue multiplicative() throws EvaluationException {
        return leftAssociative(this::power, TokenType.TIMES, TokenType.DIVIDE, TokenType.MODULO);
    }

    private PpValue power() throws EvaluationException {
        PpValue base = unary();
        if (check(TokenType.EXPONENT)) {
            Token operator = advance();
            PpValue exponent = power();
            return binary(operator, base, exponent);
        }
        return base;
    }

    private PpValue unary() throws EvaluationException {
        if (check(TokenType.LOGICAL_NOT) || check(TokenType.BITWISE_NOT)
                || check(TokenType.PLUS) || check(TokenType.MINUS)) {
            Token operator = advance();
            PpValue operand = unary();
            if (skipping > 0) return PpValue.ofVoid();
            return switch (operator.type()) {
                case LOGICAL_NOT -> PpValue.ofBoolean(!operand.isTruthy());
                case BITWISE_NOT -> {
                    requireInteger(operator, operand);
                    yield PpValue.ofInteger(~operand.asInteger());
                }
                case MINUS -> {
                    requireNumeric(operator, operand);
                    if (operand.isInteger()) yield PpValue.ofInteger(-operand.asInteger());
                    try {
                        yield PpValue.ofNumber(operand.asNumber().negate());
                    } catch (ArithmeticException e) {
                        throw outOfRange(operator.text(), operator);
                    }
                }
                default -> {
                    requireNumeric(operator, operand);
                    yield operand;
                }
            };
        }
        return primary();
    }

    private PpValue primary() throws EvaluationException {
        if (current >= tokens.size()) {
            Token last = tokens.get(tokens.size() - 1);
            throw new EvaluationException("Unexpected end of expression.", last);
        }
        Token token = advance();
        switch (token.type()) {
            case INTEGER_LITERAL, CHARACTER_LITERAL:
                return PpValue.ofInteger(token.intValue());
            case NUMBER_LITERAL:
                return BuiltinFunctions.number(token.numberValue(), token.text(), token);
            case STRING_LITERAL:
                return PpValue.ofString(token.stringValue());
            case LEFT_PARENTHESIS: {
                PpValue inner = logicalOr();
                expect(TokenType.RIGHT_PARENTHESIS, "Expected ')' to close grouping.");
                return inner;
            }
            case IDENTIFIER:
                return identifier(token);
            case KEYWORD:
                return functionCall(token);
            case VARIABLE:
                throw new EvaluationException(String.format(
                        "Variable '%s' cannot be used in a preprocessor expression.", token.text()), token);
            case LEFT_BRACE:
                throw new EvaluationException("Braced expressions are not allowed inside preprocessor expressions.", token);
            default:
                throw new EvaluationException(String.format("Unexpected token '%s' in expression.", token.text()), token);
        }
    }

    private PpValue identifier(Token token) throws EvaluationException {
        String name = token.text();
        if (name.equals("true")) return PpValue.ofBoolean(true);
        if (name.equals("false")) return PpValue.ofBoolean(false);
        if (skipping > 0) return PpValue.ofVoid();

        MacroDefinition macro;
        try {
            macro = macros.lookup(name);
        } catch (MacroException e) {
            throw new EvaluationException(String.format("Unknown identifier '%s' in expression.", name), token);
        }
        if (macro.kind() == MacroDefinition.Kind.BLOCK) {
            throw new EvaluationException(String.format(
                    "Block macro '%s' cannot be used in an expression.", name), token);
        }
        if (depth + 1 > maxRecursionDepth) {
            throw new EvaluationException(String.format(
                    "Maximum macro recursion depth of %d exceeded while expanding '%s'.", maxRecursionDepth, name), token, true);
        }
        if (macro.body().isEmpty()) {
            return PpValue.ofVoid();
        }
        return new ExpressionEvaluator(macro.body(), macros, maxRecursionDepth, depth + 1).evaluate();
    }

    private PpValue functionCall(Token token) throws EvaluationException {
        Keyword keyword = token.keyword();
        if (keyword == null || keyword.type() != KeywordType.PREPROCESSOR_FUNCTION) {
            throw new EvaluationException(String.format("Unexpected keyword '%s' in expression.", token.text()), token);
        }
        String name = keyword.name();
        expect(TokenType.LEFT_PARENTHESIS, String.format("Expected '(' after function name '%s'.", token.text()));

        if (name.equals("defined")) {
            Token target = expectName(String.format("Expected a macro name in '%s()'.", token.text()));
            expect(TokenType.RIGHT_PARENTHESIS, "Expected ')' after macro name.");
            return PpValue.ofBoolean(macros.isDefined(target.text()));
        }

        List<PpValue> args = new ArrayList<>();
        if (!check(TokenType.RIGHT_PARENTHESIS)) {
            do {
                args.add(logicalOr());
            } while (match(TokenType.COMMA));
        }
        expect(TokenType.RIGHT_PARENTHESIS, String.format("Expected ')' to close call to '%s'.", token.text()));
        checkArity(token, keyword, args.size());

        if (skipping > 0) return PpValue.ofVoid();
        try {
            return BuiltinFunctions.call(name, args, token);
        } catch (ArithmeticException e) {
            throw outOfRange(name, token);
        }
    }

    private void checkArity(Token token, Keyword keyword, int count) throws EvaluationException {
        int min = keyword.param1();
        int max = keyword.param2();
        if (count >= min && count <= max) return;
        String expected;
        if (min == max) {
            expected = min + (min == 1 ? " argument" : " arguments");
        } else if (max == Integer.MAX_VALUE) {
            expected = "at least " + min + " arguments";
        } else {
            expected = "between " + min + " and " + max + " arguments";
        }
        throw new EvaluationException(String.format("Function '%s' expects %s, but got %d.",
                keyword.name(), expected, count), token);
    }

    private PpValue binary(Token operator, PpValue left, PpValue right) throws EvaluationException {
        if (skipping > 0) return PpValue.ofVoid();
        try {
            return applyBinary(operator, left, right);
        } catch (ArithmeticException e) {
            throw outOfRange(operator.text(), operator);
        }
    }

    private PpValue applyBinary(Token operator, PpValue left, PpValue right) throws EvaluationException {
        TokenType type = operator.type();
        switch (type) {
            case PLUS:
                if (left.isString() && right.isString()) {
                    return PpValue.ofString(left.asString() + right.asString());
                }
                requireNumeric(operator, left, right);
                if (left.isInteger() && right.isInteger()) return PpValue.ofInteger(left.asInteger() + right.asInteger());
                return PpValue.ofNumber(left.asNumber().add(right.asNumber()));
            case MINUS:
                requireNumeric(operator, left, right);
                if (left.isInteger() && right.isInteger()) return PpValue.ofInteger(left.asInteger() - right.asInteger());
                return PpValue.ofNumber(left.asNumber().subtract(right.asNumber()));
            case TIMES:
                requireNumeric(operator, left, right);
                if (left.isInteger() && right.isInteger()) return PpValue.ofInteger(left.asInteger() * right.asInteger());
                return PpValue.ofNumber(left.asNumber().multiply(right.asNumber()));
            case DIVIDE:
            case MODULO:
                return divide(operator, left, right);
            case EXPONENT:
                return BuiltinFunctions.power(left, right, operator.text(), operator);
            case BITWISE_AND:
                requireInteger(operator, left, right);
                return PpValue.ofInteger(left.asInteger() & right.asInteger());
            case BITWISE_OR:
                requireInteger(operator, left, right);
                return PpValue.ofInteger(left.asInteger() | right.asInteger());
            case BITWISE_XOR:
                requireInteger(operator, left, right);
                return PpValue.ofInteger(left.asInteger() ^ right.asInteger());
            case LEFT_SHIFT:
                requireInteger(operator, left, right);
                return PpValue.ofInteger(left.asInteger() << shiftCount(operator, right));
            case RIGHT_SHIFT:
                requireInteger(operator, left, right);
                return PpValue.ofInteger(left.asInteger() >> shiftCount(operator, right));
            case EQUAL:
                return PpValue.ofBoolean(areEqual(left, right));
            case NOT_EQUAL:
                return PpValue.ofBoolean(!areEqual(left, right));
            case LESS:
                return PpValue.ofBoolean(order(operator, left, right) < 0);
            case LESS_EQUAL:
                return PpValue.ofBoolean(order(operator, left, right) <= 0);
            case GREATER:
                return PpValue.ofBoolean(order(operator, left, right) > 0);
            case GREATER_EQUAL:
                return PpValue.ofBoolean(order(operator, left, right) >= 0);
            default:
                throw new EvaluationException(String.format("Unsupported operator '%s'.", operator.text()), operator);
        }
    }

    private PpValue divide(Token operator, PpValue left, PpValue right) throws EvaluationException {
        requireNumeric(operator, left, right);
        boolean modulo = operator.type() == TokenType.MODULO;
        if (left.isInteger() && right.isInteger()) {
            if (right.asInteger() == 0L) {
                throw new EvaluationException(modulo ? "Modulo by zero." : "Division by zero.", operator);
            }
            return PpValue.ofInteger(modulo
                    ? left.asInteger() % right.asInteger()
                    : left.asInteger() / right.asInteger());
        }
        FixedPoint divisor = right.asNumber();
        if (divisor.isZero()) {
            throw new EvaluationException(modulo ? "Modulo by zero." : "Division by zero.", operator);
        }
        return PpValue.ofNumber(modulo ? left.asNumber().remainder(divisor) : left.asNumber().divide(divisor));
    }

    private static int shiftCount(Token operator, PpValue count) throws EvaluationException {
        long value = count.asInteger();
        if (value < 0 || value > 63) {
            throw new EvaluationException(String.format("Shift count %d is out of range 0..63.", value), operator);
        }
        return (int) value;
    }

    private static EvaluationException outOfRange(String operation, Token at) {
        return new EvaluationException(String.format("Result of '%s' is out of the fixed-point range.", operation), at);
    }

    private static boolean areEqual(PpValue left, PpValue right) {
        if (left.isNumeric() && right.isNumeric()) {
            if (left.isInteger() && right.isInteger()) return left.asInteger() == right.asInteger();
            return left.asNumber().equals(right.asNumber());
        }
        if (left.type() != right.type()) return false;
        return left.equals(right);
    }

    private static int order(Token operator, PpValue left, PpValue right) throws EvaluationException {
        if (left.isNumeric() && right.isNumeric()) {
            if (left.isInteger() && right.isInteger()) return Long.compare(left.asInteger(), right.asInteger());
            return left.asNumber().compareTo(right.asNumber());
        }
        if (left.isString() && right.isString()) {
            return left.asString().compareTo(right.asString());
        }
        throw new EvaluationException(String.format("Operator '%s' cannot compare %s and %s.",
                operator.text(), left.typeName(), right.typeName()), operator);
    }

    private static void requireNumeric(Token operator, PpValue... operands) throws EvaluationException {
        for (PpValue operand : operands) {
            if (!operand.isNumeric()) {
                throw new EvaluationException(String.format("Operator '%s' requires numeric operands, but got %s.",
                        operator.text(), describe(operands)), operator);
            }
        }
    }

    private static void requireInteger(Token operator, PpValue... operands) throws EvaluationException {
        for (PpValue operand : operands) {
            if (!operand.isInteger()) {
                throw new EvaluationException(String.format("Operator '%s' requires integer operands, but got %s.",
                        operator.text(), describe(operands)), operator);
            }
        }
    }

    private static String describe(PpValue... operands) {
        if (operands.length == 1) return operands[0].typeName();
        return operands[0].typeName() + " and " + operands[1].typeName();
    }

    private PpValue leftAssociative(Level next, TokenType... operators) throws EvaluationException {
        PpValue left = next.parse();
        while (checkAny(operators)) {
            Token operator = advance();
            PpValue right = next.parse();
            left = binary(operator, left, right);
        }
        return left;
    }

    private boolean checkAny(TokenType... types) {
        for (TokenType type : types) {
            if (check(type)) return true;
        }
        return false;
    }

    private boolean check(TokenType type) {
        return current < tokens.size() && tokens.get(current).type() == type;
    }

    private boolean match(TokenType type) {
        if (check(type)) {
            current++;
            return true;
        }
        return false;
    }

    private Token advance() {
        return tokens.get(current++);
    }

    private Token expect(TokenType type, String message) throws EvaluationException {
        if (check(type)) return advance();
        Token at = current < tokens.size() ? tokens.get(current) : tokens.get(tokens.size() - 1);
        throw new EvaluationException(message, at);
    }

    private Token expectName(String message) throws EvaluationException {
        if (check(TokenType.IDENTIFIER) || check(TokenType.KEYWORD)) return advance();
        Token at = current < tokens.size() ? tokens.get(current) : tokens.get(tokens.size() - 1);
        throw new EvaluationException(message, at);
    }
}
