package org.g10asm.cli.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Contains unit tests for the {@link AssemblerConfigLoader}.
 */
public class AssemblerConfigLoaderTest {

    private static final String RECURSION_PATH = "g10asm.preprocessor.max-recursion-depth";

    @TempDir
    Path tempDir;

    @AfterEach
    void tearDown() {
        System.clearProperty(RECURSION_PATH);
        ConfigFactory.invalidateCaches();
    }

    /**
     * Verifies that the classpath defaults apply when no file exists.
     */
    @Test
    @Tag("unit")
    void testDefaultsFromClasspath() throws FileNotFoundException {
        // Act
        Config config = AssemblerConfigLoader.load(null, tempDir.resolve("g10asm.conf").toFile());

        // Assert
        assertThat(config.getInt(RECURSION_PATH)).isEqualTo(256);
        assertThat(config.getInt("g10asm.preprocessor.max-include-depth")).isEqualTo(16);
        assertThat(config.getString("logging.default-level")).isEqualTo("WARN");
    }

    /**
     * Verifies that an explicit file overrides the defaults and keeps the remaining keys.
     */
    @Test
    @Tag("unit")
    void testExplicitFileOverridesDefaults() throws IOException {
        // Arrange
        Path file = tempDir.resolve("custom.conf");
        Files.writeString(file, "g10asm.preprocessor.max-recursion-depth = 32\n");

        // Act
        Config config = AssemblerConfigLoader.load(file.toFile());

        // Assert
        assertThat(config.getInt(RECURSION_PATH)).isEqualTo(32);
        assertThat(config.getInt("g10asm.preprocessor.max-include-depth")).isEqualTo(16);
    }

    /**
     * Verifies that the default file is used when present.
     */
    @Test
    @Tag("unit")
    void testDefaultFileIsUsedWhenPresent() throws IOException {
        // Arrange
        Path file = tempDir.resolve("g10asm.conf");
        Files.writeString(file, "g10asm.preprocessor.include-dirs = [\"lib\"]\n");

        // Act
        Config config = AssemblerConfigLoader.load(null, file.toFile());

        // Assert
        assertThat(config.getStringList("g10asm.preprocessor.include-dirs")).containsExactly("lib");
    }

    /**
     * Verifies that system properties take precedence over the file.
     */
    @Test
    @Tag("unit")
    void testSystemPropertyOverridesFile() throws IOException {
        // Arrange
        Path file = tempDir.resolve("custom.conf");
        Files.writeString(file, "g10asm.preprocessor.max-recursion-depth = 32\n");
        System.setProperty(RECURSION_PATH, "12");
        ConfigFactory.invalidateCaches();

        // Act
        Config config = AssemblerConfigLoader.load(file.toFile());

        // Assert
        assertThat(config.getInt(RECURSION_PATH)).isEqualTo(12);
    }

    /**
     * Verifies that a missing explicit file is an error.
     */
    @Test
    @Tag("unit")
    void testMissingExplicitFileFails() {
        // Arrange
        File missing = tempDir.resolve("missing.conf").toFile();

        // Act & Assert
        assertThatThrownBy(() -> AssemblerConfigLoader.load(missing))
                .isInstanceOf(FileNotFoundException.class)
                .hasMessageContaining("missing.conf");
    }
}
