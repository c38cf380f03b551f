package org.g10asm.compiler.frontend.lexer;

import java.util.Arrays;
import java.util.Comparator;
import java.util.List;

/**
 * Defines the different types of tokens that the {@link Lexer} can recognize.
 * Symbol types carry the exact lexeme they are scanned from.
 */
public enum TokenType {
    // Structure.
    /** Represents the end of the source file. */
    END_OF_FILE,
    /** A newline character; statements are newline-terminated. */
    NEWLINE,

    // Names.
    /** A word found in the {@link KeywordTable}. */
    KEYWORD,
    /** Any other name, e.g. a label or a macro name. */
    IDENTIFIER,
    /** A <code>$name</code> variable reference. */
    VARIABLE,
    /** An <code>@name</code> macro parameter placeholder. */
    PLACEHOLDER,
    /** An <code>@name</code> placeholder whose name is a keyword. */
    PLACEHOLDER_KEYWORD,

    // Literals.
    /** An integer literal in decimal, binary, octal or hexadecimal notation. */
    INTEGER_LITERAL,
    /** A fractional literal such as <code>2.5</code>. */
    NUMBER_LITERAL,
    /** A single quoted character, valued as its integer code. */
    CHARACTER_LITERAL,
    /** A double quoted string. */
    STRING_LITERAL,

    // Arithmetic and bitwise operators.
    PLUS("+"),
    MINUS("-"),
    TIMES("*"),
    EXPONENT("**"),
    DIVIDE("/"),
    MODULO("%"),
    BITWISE_AND("&"),
    BITWISE_OR("|"),
    BITWISE_XOR("^"),
    BITWISE_NOT("~"),
    LEFT_SHIFT("<<"),
    RIGHT_SHIFT(">>"),

    // Assignment operators.
    ASSIGN("="),
    ASSIGN_PLUS("+="),
    ASSIGN_MINUS("-="),
    ASSIGN_TIMES("*="),
    ASSIGN_EXPONENT("**="),
    ASSIGN_DIVIDE("/="),
    ASSIGN_MODULO("%="),
    ASSIGN_AND("&="),
    ASSIGN_OR("|="),
    ASSIGN_XOR("^="),
    ASSIGN_LEFT_SHIFT("<<="),
    ASSIGN_RIGHT_SHIFT(">>="),

    // Comparison and logical operators.
    EQUAL("=="),
    NOT_EQUAL("!="),
    LESS("<"),
    LESS_EQUAL("<="),
    GREATER(">"),
    GREATER_EQUAL(">="),
    LOGICAL_AND("&&"),
    LOGICAL_OR("||"),
    LOGICAL_NOT("!"),

    // Punctuation.
    LEFT_PARENTHESIS("("),
    RIGHT_PARENTHESIS(")"),
    LEFT_BRACKET("["),
    RIGHT_BRACKET("]"),
    LEFT_BRACE("{"),
    RIGHT_BRACE("}"),
    COMMA(","),
    COLON(":"),
    QUESTION_MARK("?"),
    BACKTICK("`"),
    BACKSLASH("\\"),
    HASH("#"),
    DOUBLE_HASH("##");

    private static final List<TokenType> SYMBOLS_LONGEST_FIRST = Arrays.stream(values())
            .filter(TokenType::isSymbol)
            .sorted(Comparator.comparingInt((TokenType t) -> t.symbol.length()).reversed())
            .toList();

    private final String symbol;

    TokenType() {
        this(null);
    }

    TokenType(String symbol) {
        this.symbol = symbol;
    }

    /**
     * Returns the fixed lexeme of a symbol type.
     * @return The lexeme, or {@code null} for types without a fixed spelling.
     */
    public String symbol() {
        return symbol;
    }

    public boolean isSymbol() {
        return symbol != null;
    }

    /**
     * Checks whether this is one of the twelve assignment operators.
     * @return {@code true} for <code>=</code> and the compound assignments.
     */
    public boolean isAssignmentOperator() {
        return switch (this) {
            case ASSIGN, ASSIGN_PLUS, ASSIGN_MINUS, ASSIGN_TIMES, ASSIGN_EXPONENT, ASSIGN_DIVIDE,
                 ASSIGN_MODULO, ASSIGN_AND, ASSIGN_OR, ASSIGN_XOR, ASSIGN_LEFT_SHIFT,
                 ASSIGN_RIGHT_SHIFT -> true;
            default -> false;
        };
    }

    /**
     * Checks whether this type is an operator (arithmetic, bitwise, comparison, logical or assignment).
     * @return {@code true} if the token is an operator.
     */
    public boolean isOperator() {
        return switch (this) {
            case PLUS, MINUS, TIMES, EXPONENT, DIVIDE, MODULO, BITWISE_AND, BITWISE_OR, BITWISE_XOR,
                 BITWISE_NOT, LEFT_SHIFT, RIGHT_SHIFT, EQUAL, NOT_EQUAL, LESS, LESS_EQUAL, GREATER,
                 GREATER_EQUAL, LOGICAL_AND, LOGICAL_OR, LOGICAL_NOT -> true;
            default -> isAssignmentOperator();
        };
    }

    /**
     * Returns the symbol types ordered so that longer lexemes are tried before their prefixes.
     * @return The symbol types, longest lexeme first.
     */
    public static List<TokenType> symbolsLongestFirst() {
        return SYMBOLS_LONGEST_FIRST;
    }
}
