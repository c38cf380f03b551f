package org.g10asm.compiler.frontend.preprocessor.value;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link PpValue}.
 */
public class PpValueTest {

    /**
     * Verifies the truthiness rules used by conditional directives.
     */
    @Test
    @Tag("unit")
    void testTruthiness() {
        // Act & Assert
        assertThat(PpValue.ofVoid().isTruthy()).isFalse();
        assertThat(PpValue.ofInteger(0).isTruthy()).isFalse();
        assertThat(PpValue.ofInteger(-1).isTruthy()).isTrue();
        assertThat(PpValue.ofNumber(FixedPoint.ZERO).isTruthy()).isFalse();
        assertThat(PpValue.ofNumber(FixedPoint.fromDouble(0.5)).isTruthy()).isTrue();
        assertThat(PpValue.ofString("").isTruthy()).isFalse();
        assertThat(PpValue.ofString("x").isTruthy()).isTrue();
        assertThat(PpValue.ofBoolean(false).isTruthy()).isFalse();
    }

    /**
     * Verifies how values are written back into assembly source.
     */
    @Test
    @Tag("unit")
    void testSourceRendering() {
        // Act & Assert
        assertThat(PpValue.ofInteger(-7).toSourceText()).isEqualTo("-7");
        assertThat(PpValue.ofBoolean(true).toSourceText()).isEqualTo("1");
        assertThat(PpValue.ofNumber(FixedPoint.fromDouble(2.5)).toSourceText()).isEqualTo("2.5");
        assertThat(PpValue.ofString("say \"hi\"\n").toSourceText()).isEqualTo("\"say \\\"hi\\\"\\n\"");
        assertThat(PpValue.ofString("plain").toString()).isEqualTo("plain");
        assertThat(PpValue.ofVoid().toSourceText()).isEmpty();
    }

    /**
     * Verifies that integers promote to fixed point but strings do not.
     */
    @Test
    @Tag("unit")
    void testAccessors() {
        // Act & Assert
        assertThat(PpValue.ofInteger(3).asNumber()).isEqualTo(FixedPoint.fromLong(3));
        assertThat(PpValue.ofInteger(3).asDouble()).isEqualTo(3.0);
        assertThatThrownBy(() -> PpValue.ofString("3").asInteger()).isInstanceOf(IllegalStateException.class);
        assertThat(PpValue.ofInteger(3)).isEqualTo(PpValue.ofInteger(3)).isNotEqualTo(PpValue.ofBoolean(true));
    }
}
