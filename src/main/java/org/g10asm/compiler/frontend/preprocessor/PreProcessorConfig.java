package org.g10asm.compiler.frontend.preprocessor;

import com.typesafe.config.Config;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Limits and search paths of the preprocessor.
 *
 * @param maxRecursionDepth The maximum nesting of macro expansions and loop iterations.
 * @param maxIncludeDepth The maximum nesting of included files.
 * @param includeDirs Additional directories searched by <code>.include</code>, in order.
 */
public record PreProcessorConfig(
        int maxRecursionDepth,
        int maxIncludeDepth,
        List<Path> includeDirs
) {
    public static final int DEFAULT_MAX_RECURSION_DEPTH = 256;
    public static final int DEFAULT_MAX_INCLUDE_DEPTH = 16;

    private static final String CONFIG_PATH = "g10asm.preprocessor";

    public PreProcessorConfig {
        if (maxRecursionDepth < 1) {
            throw new IllegalArgumentException("max-recursion-depth must be positive, got " + maxRecursionDepth);
        }
        if (maxIncludeDepth < 1) {
            throw new IllegalArgumentException("max-include-depth must be positive, got " + maxIncludeDepth);
        }
        includeDirs = List.copyOf(includeDirs);
    }

    public static PreProcessorConfig defaults() {
        return new PreProcessorConfig(DEFAULT_MAX_RECURSION_DEPTH, DEFAULT_MAX_INCLUDE_DEPTH, List.of());
    }

    /**
     * Reads the <code>g10asm.preprocessor</code> block. Missing keys fall back to the defaults.
     * @param config The application configuration.
     * @return The preprocessor configuration.
     */
    public static PreProcessorConfig fromConfig(Config config) {
        if (!config.hasPath(CONFIG_PATH)) {
            return defaults();
        }
        Config pp = config.getConfig(CONFIG_PATH);
        int recursion = pp.hasPath("max-recursion-depth") ? pp.getInt("max-recursion-depth") : DEFAULT_MAX_RECURSION_DEPTH;
        int include = pp.hasPath("max-include-depth") ? pp.getInt("max-include-depth") : DEFAULT_MAX_INCLUDE_DEPTH;
        List<Path> dirs = new ArrayList<>();
        if (pp.hasPath("include-dirs")) {
            for (String dir : pp.getStringList("include-dirs")) {
                dirs.add(Path.of(dir));
            }
        }
        return new PreProcessorConfig(recursion, include, dirs);
    }

    /**
     * Returns a copy with additional include directories appended.
     * @param extra The directories to append.
     * @return The extended configuration.
     */
    public PreProcessorConfig withAdditionalIncludeDirs(List<Path> extra) {
        List<Path> dirs = new ArrayList<>(includeDirs);
        dirs.addAll(extra);
        return new PreProcessorConfig(maxRecursionDepth, maxIncludeDepth, dirs);
    }
}
