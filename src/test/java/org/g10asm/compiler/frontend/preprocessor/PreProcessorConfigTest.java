package org.g10asm.compiler.frontend.preprocessor;

import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Contains unit tests for {@link PreProcessorConfig}.
 */
public class PreProcessorConfigTest {

    /**
     * Verifies that the preprocessor block is read and missing keys keep their defaults.
     */
    @Test
    @Tag("unit")
    void testFromConfig() {
        // Arrange
        var config = ConfigFactory.parseString(
                "g10asm.preprocessor { max-recursion-depth = 64, include-dirs = [\"lib\", \"vendor/inc\"] }");

        // Act
        PreProcessorConfig ppConfig = PreProcessorConfig.fromConfig(config);

        // Assert
        assertThat(ppConfig.maxRecursionDepth()).isEqualTo(64);
        assertThat(ppConfig.maxIncludeDepth()).isEqualTo(PreProcessorConfig.DEFAULT_MAX_INCLUDE_DEPTH);
        assertThat(ppConfig.includeDirs()).containsExactly(Path.of("lib"), Path.of("vendor/inc"));
    }

    /**
     * Verifies that an absent block yields the defaults and extra include directories are appended.
     */
    @Test
    @Tag("unit")
    void testDefaultsAndAdditionalIncludeDirs() {
        // Act
        PreProcessorConfig ppConfig = PreProcessorConfig.fromConfig(ConfigFactory.empty())
                .withAdditionalIncludeDirs(List.of(Path.of("extra")));

        // Assert
        assertThat(ppConfig.maxRecursionDepth()).isEqualTo(PreProcessorConfig.DEFAULT_MAX_RECURSION_DEPTH);
        assertThat(ppConfig.includeDirs()).containsExactly(Path.of("extra"));
    }

    /**
     * Verifies that non-positive limits are rejected.
     */
    @Test
    @Tag("unit")
    void testRejectsNonPositiveLimits() {
        // Act & Assert
        assertThatThrownBy(() -> new PreProcessorConfig(0, 4, List.of()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("max-recursion-depth");
    }
}
