package org.g10asm.compiler.frontend.preprocessor.value;

import java.util.Objects;

/**
 * A value of the preprocessor expression language. Exactly one variant is live;
 * the default is {@link Type#VOID}.
 */
public final class PpValue {

    /**
     * The variants of a preprocessor value with their user-facing type names.
     */
    public enum Type {
        VOID("void"),
        INTEGER("integer"),
        NUMBER("fixed-point"),
        BOOLEAN("boolean"),
        STRING("string");

        private final String displayName;

        Type(String displayName) {
            this.displayName = displayName;
        }

        public String displayName() {
            return displayName;
        }
    }

    private static final PpValue VOID = new PpValue(Type.VOID, 0L, null, false, null);
    private static final PpValue TRUE = new PpValue(Type.BOOLEAN, 0L, null, true, null);
    private static final PpValue FALSE = new PpValue(Type.BOOLEAN, 0L, null, false, null);

    private final Type type;
    private final long integer;
    private final FixedPoint number;
    private final boolean bool;
    private final String string;

    private PpValue(Type type, long integer, FixedPoint number, boolean bool, String string) {
        this.type = type;
        this.integer = integer;
        this.number = number;
        this.bool = bool;
        this.string = string;
    }

    public static PpValue ofVoid() {
        return VOID;
    }

    public static PpValue ofInteger(long value) {
        return new PpValue(Type.INTEGER, value, null, false, null);
    }

    public static PpValue ofNumber(FixedPoint value) {
        return new PpValue(Type.NUMBER, 0L, Objects.requireNonNull(value), false, null);
    }

    public static PpValue ofBoolean(boolean value) {
        return value ? TRUE : FALSE;
    }

    public static PpValue ofString(String value) {
        return new PpValue(Type.STRING, 0L, null, false, Objects.requireNonNull(value));
    }

    public Type type() {
        return type;
    }

    public String typeName() {
        return type.displayName();
    }

    public boolean isInteger() {
        return type == Type.INTEGER;
    }

    public boolean isNumber() {
        return type == Type.NUMBER;
    }

    public boolean isNumeric() {
        return type == Type.INTEGER || type == Type.NUMBER;
    }

    public boolean isBoolean() {
        return type == Type.BOOLEAN;
    }

    public boolean isString() {
        return type == Type.STRING;
    }

    public boolean isVoid() {
        return type == Type.VOID;
    }

    /**
     * @return The integer payload.
     * @throws IllegalStateException if this is not an integer.
     */
    public long asInteger() {
        if (type != Type.INTEGER) throw new IllegalStateException("Not an integer: " + typeName());
        return integer;
    }

    /**
     * Returns the value as fixed point, promoting integers.
     * @return The fixed-point payload.
     * @throws IllegalStateException if this is not numeric.
     * @throws ArithmeticException if an integer does not fit the fixed-point range.
     */
    public FixedPoint asNumber() {
        if (type == Type.NUMBER) return number;
        if (type == Type.INTEGER) return FixedPoint.fromLong(integer);
        throw new IllegalStateException("Not a number: " + typeName());
    }

    /**
     * @return The numeric value as a double.
     * @throws IllegalStateException if this is not numeric.
     */
    public double asDouble() {
        if (type == Type.INTEGER) return integer;
        return asNumber().toDouble();
    }

    public boolean asBoolean() {
        if (type != Type.BOOLEAN) throw new IllegalStateException("Not a boolean: " + typeName());
        return bool;
    }

    public String asString() {
        if (type != Type.STRING) throw new IllegalStateException("Not a string: " + typeName());
        return string;
    }

    /**
     * Applies the truthiness rules used by conditional directives.
     * @return {@code false} for void, zero, an all-zero fixed-point value, false and the empty string.
     */
    public boolean isTruthy() {
        return switch (type) {
            case VOID -> false;
            case INTEGER -> integer != 0L;
            case NUMBER -> !number.isZero();
            case BOOLEAN -> bool;
            case STRING -> !string.isEmpty();
        };
    }

    /**
     * Renders the value as assembly source text: integers in decimal, booleans as 1 or 0,
     * numbers as plain decimals and strings as quoted, escaped literals.
     * @return The source rendering.
     */
    public String toSourceText() {
        return switch (type) {
            case VOID -> "";
            case INTEGER -> Long.toString(integer);
            case NUMBER -> number.toString();
            case BOOLEAN -> bool ? "1" : "0";
            case STRING -> quote(string);
        };
    }

    /**
     * Renders the value for messages and string interpolation. Strings are not quoted.
     * @return The display text.
     */
    @Override
    public String toString() {
        return switch (type) {
            case VOID -> "void";
            case INTEGER -> Long.toString(integer);
            case NUMBER -> number.toString();
            case BOOLEAN -> Boolean.toString(bool);
            case STRING -> string;
        };
    }

    /**
     * Quotes and escapes a string so that the lexer decodes it back to the same content.
     * @param text The raw text.
     * @return The quoted literal.
     */
    public static String quote(String text) {
        StringBuilder sb = new StringBuilder("\"");
        for (char c : text.toCharArray()) {
            switch (c) {
                case '\n' -> sb.append("\\n");
                case '\t' -> sb.append("\\t");
                case '\r' -> sb.append("\\r");
                case '\0' -> sb.append("\\0");
                case '\\' -> sb.append("\\\\");
                case '"' -> sb.append("\\\"");
                default -> {
                    if (c < 0x20) {
                        sb.append(String.format("\\x%02X", (int) c));
                    } else {
                        sb.append(c);
                    }
                }
            }
        }
        return sb.append('"').toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PpValue other)) return false;
        return type == other.type
                && integer == other.integer
                && bool == other.bool
                && Objects.equals(number, other.number)
                && Objects.equals(string, other.string);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, integer, number, bool, string);
    }
}
