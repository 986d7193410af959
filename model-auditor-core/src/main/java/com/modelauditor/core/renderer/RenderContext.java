package com.modelauditor.core.renderer;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Objects;

/**
 * Where rendered reports go and how the console shows them.
 *
 * @param outputDirectory directory the file system renderer writes into
 * @param colors whether console output uses ANSI colors
 * @param separator line pattern printed between reports on the console
 */
public record RenderContext(
    Path outputDirectory,
    boolean colors,
    String separator
) {
    public static final String DEFAULT_SEPARATOR = "---";

    public RenderContext {
        Objects.requireNonNull(outputDirectory, "outputDirectory must not be null");
        if (separator == null || separator.isEmpty()) {
            separator = DEFAULT_SEPARATOR;
        }
    }

    /**
     * Creates a context with colors on and the default separator.
     *
     * @param outputDirectory target directory
     * @return context
     */
    public static RenderContext of(Path outputDirectory) {
        return new RenderContext(outputDirectory, true, DEFAULT_SEPARATOR);
    }

    public static RenderContext of(String outputDirectory) {
        return of(Paths.get(outputDirectory));
    }

    public RenderContext withColors(boolean enabled) {
        return new RenderContext(outputDirectory, enabled, separator);
    }

    public RenderContext withSeparator(String pattern) {
        return new RenderContext(outputDirectory, colors, pattern);
    }
}
