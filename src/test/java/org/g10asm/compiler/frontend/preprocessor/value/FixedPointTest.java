package org.g10asm.compiler.frontend.preprocessor.value;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for the Q32.32 {@link FixedPoint} arithmetic.
 */
public class FixedPointTest {

    private static final double EPSILON = 1.0 / FixedPoint.SCALE;

    /**
     * Verifies that packing and unpacking a double stays within one fraction step.
     */
    @ParameterizedTest
    @ValueSource(doubles = {0.0, 1.5, -2.25, 3.14159265, -0.001, 2147483647.5, -2147483648.0})
    @Tag("unit")
    void testDoubleRoundTripIsWithinOneStep(double value) {
        // Act
        double unpacked = FixedPoint.fromDouble(value).toDouble();

        // Assert
        assertThat(unpacked).isCloseTo(value, within(EPSILON));
    }

    /**
     * Verifies that negative values keep a positive fraction field and truncate toward zero.
     */
    @Test
    @Tag("unit")
    void testNegativeValueLayout() {
        // Act
        FixedPoint value = FixedPoint.fromDouble(-2.25);

        // Assert
        assertThat(value.raw() >> 32).isEqualTo(-3L);
        assertThat(value.raw() & 0xFFFFFFFFL).isEqualTo(0xC0000000L);
        assertThat(value.truncate()).isEqualTo(-2L);
        assertThat(value.fraction().toDouble()).isEqualTo(-0.25);
    }

    /**
     * Verifies multiplication and division on the raw representation.
     */
    @Test
    @Tag("unit")
    void testMultiplyAndDivide() {
        // Arrange
        FixedPoint a = FixedPoint.fromDouble(1.5);
        FixedPoint b = FixedPoint.fromDouble(-4.0);

        // Act & Assert
        assertThat(a.multiply(b).toDouble()).isEqualTo(-6.0);
        assertThat(b.divide(a).toDouble()).isCloseTo(-8.0 / 3.0, within(EPSILON));
        assertThat(a.add(b).toString()).isEqualTo("-2.5");
        assertThat(FixedPoint.fromLong(3).toString()).isEqualTo("3.0");
    }

    /**
     * Verifies the representable range check.
     */
    @Test
    @Tag("unit")
    void testRepresentableRange() {
        // Act & Assert
        assertThat(FixedPoint.isRepresentable(-2147483648.0)).isTrue();
        assertThat(FixedPoint.isRepresentable(2147483648.0)).isFalse();
        assertThat(FixedPoint.isRepresentable(Double.NaN)).isFalse();
    }

    /**
     * Verifies that results outside [-2^31, 2^31) raise an error instead of wrapping around.
     */
    @Test
    @Tag("unit")
    void testOverflowIsRejected() {
        // Arrange
        FixedPoint max = FixedPoint.fromLong(Integer.MAX_VALUE);
        FixedPoint min = FixedPoint.fromLong(Integer.MIN_VALUE);
        FixedPoint big = FixedPoint.fromDouble(40000.0);
        FixedPoint tiny = FixedPoint.fromDouble(0.25);

        // Act & Assert
        assertThatThrownBy(() -> FixedPoint.fromLong(3000000000L)).isInstanceOf(ArithmeticException.class);
        assertThatThrownBy(() -> max.add(FixedPoint.fromLong(1))).isInstanceOf(ArithmeticException.class);
        assertThatThrownBy(() -> min.subtract(FixedPoint.fromLong(1))).isInstanceOf(ArithmeticException.class);
        assertThatThrownBy(min::negate).isInstanceOf(ArithmeticException.class);
        assertThatThrownBy(() -> big.multiply(FixedPoint.fromDouble(70000.0))).isInstanceOf(ArithmeticException.class);
        assertThatThrownBy(() -> big.divide(FixedPoint.fromDouble(1.0 / 65536.0))).isInstanceOf(ArithmeticException.class);
        assertThat(big.divide(tiny).toDouble()).isEqualTo(160000.0);
        assertThat(min.multiply(FixedPoint.fromLong(1))).isEqualTo(min);
    }
}
