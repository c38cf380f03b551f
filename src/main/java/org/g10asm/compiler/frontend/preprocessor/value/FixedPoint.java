package org.g10asm.compiler.frontend.preprocessor.value;

import java.math.BigDecimal;
import java.math.BigInteger;

/**
 * A signed Q32.32 fixed-point number: 32 integer bits in the upper half of {@code raw},
 * 32 fraction bits in the lower half.
 * <p>
 * Record equality compares raw bits; {@link #compareTo(FixedPoint)} orders by numeric value.
 *
 * @param raw The raw 64-bit representation.
 */
public record FixedPoint(long raw) implements Comparable<FixedPoint> {

    /** 2^32, the weight of the lowest integer bit. */
    public static final double SCALE = 4294967296.0;

    /** Smallest value strictly above the representable range. */
    public static final double UPPER_BOUND = 2147483648.0;

    public static final FixedPoint ZERO = new FixedPoint(0L);

    private static final String OUT_OF_RANGE = "Value is out of the fixed-point range.";

    /**
     * Packs a double. The integer part is {@code floor(v)} so negative fractions keep a
     * positive fraction field, e.g. -2.25 is stored as -3 + 0.75.
     * @param value The value, expected within [-2^31, 2^31).
     * @return The fixed-point value.
     */
    public static FixedPoint fromDouble(double value) {
        double floor = Math.floor(value);
        long integer = (long) floor;
        long fraction = (long) ((value - floor) * SCALE);
        if (fraction > 0xFFFFFFFFL) {
            fraction = 0xFFFFFFFFL;
        }
        return new FixedPoint((integer << 32) | (fraction & 0xFFFFFFFFL));
    }

    /**
     * Promotes an integer.
     * @param value The integer, within [-2^31, 2^31).
     * @return The fixed-point value.
     * @throws ArithmeticException if the integer does not fit the 32 integer bits.
     */
    public static FixedPoint fromLong(long value) {
        if (value < Integer.MIN_VALUE || value > Integer.MAX_VALUE) {
            throw new ArithmeticException(OUT_OF_RANGE);
        }
        return new FixedPoint(value << 32);
    }

    /**
     * Checks whether a double fits the Q32.32 integer range.
     * @param value The value to check.
     * @return {@code true} if the value is finite and within [-2^31, 2^31).
     */
    public static boolean isRepresentable(double value) {
        return Double.isFinite(value) && value >= -UPPER_BOUND && value < UPPER_BOUND;
    }

    public double toDouble() {
        return (raw >> 32) + (raw & 0xFFFFFFFFL) / SCALE;
    }

    /**
     * Returns the integer part rounded toward zero.
     * @return The truncated integer part.
     */
    public long truncate() {
        long floor = raw >> 32;
        if (floor < 0 && (raw & 0xFFFFFFFFL) != 0) {
            return floor + 1;
        }
        return floor;
    }

    /**
     * Returns the signed fractional part, i.e. {@code this - truncate()}.
     * @return The fraction, carrying the sign of this value.
     */
    public FixedPoint fraction() {
        return new FixedPoint(raw - (truncate() << 32));
    }

    public boolean isZero() {
        return raw == 0L;
    }

    public boolean isNegative() {
        return raw < 0L;
    }

    /**
     * @throws ArithmeticException if the sum leaves the fixed-point range.
     */
    public FixedPoint add(FixedPoint other) {
        return new FixedPoint(Math.addExact(raw, other.raw));
    }

    /**
     * @throws ArithmeticException if the difference leaves the fixed-point range.
     */
    public FixedPoint subtract(FixedPoint other) {
        return new FixedPoint(Math.subtractExact(raw, other.raw));
    }

    /**
     * @throws ArithmeticException for -2^31, whose negation is not representable.
     */
    public FixedPoint negate() {
        return new FixedPoint(Math.negateExact(raw));
    }

    /**
     * Multiplies on the raw representation: the 128-bit product shifted right by 32 bits.
     * @throws ArithmeticException if the product leaves the fixed-point range.
     */
    public FixedPoint multiply(FixedPoint other) {
        BigInteger product = BigInteger.valueOf(raw).multiply(BigInteger.valueOf(other.raw)).shiftRight(32);
        return new FixedPoint(toRaw(product));
    }

    /**
     * Divides on the raw representation: {@code (this << 32) / other}.
     * @throws ArithmeticException if {@code other} is zero or the quotient leaves the fixed-point range.
     */
    public FixedPoint divide(FixedPoint other) {
        BigInteger dividend = BigInteger.valueOf(raw).shiftLeft(32);
        return new FixedPoint(toRaw(dividend.divide(BigInteger.valueOf(other.raw))));
    }

    /**
     * Remainder of the raw representations; the result carries the sign of the dividend.
     * @throws ArithmeticException if {@code other} is zero.
     */
    public FixedPoint remainder(FixedPoint other) {
        return new FixedPoint(raw % other.raw);
    }

    private static long toRaw(BigInteger value) {
        if (value.bitLength() > 63) {
            throw new ArithmeticException(OUT_OF_RANGE);
        }
        return value.longValue();
    }

    @Override
    public int compareTo(FixedPoint other) {
        return Double.compare(toDouble(), other.toDouble());
    }

    /**
     * Renders the value as a plain decimal that always contains a fractional digit.
     */
    @Override
    public String toString() {
        String text = BigDecimal.valueOf(toDouble()).toPlainString();
        return text.indexOf('.') < 0 ? text + ".0" : text;
    }
}
