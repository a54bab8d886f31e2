package com.archebuild.core.renderer;

import java.util.Map;

/**
 * Settings handed to an {@link OutputRenderer}.
 *
 * @param outputDirectory target directory, null for renderers that do not write files
 * @param settings renderer specific settings, e.g. {@code console.headers}
 */
public record RenderContext(
    String outputDirectory,
    Map<String, String> settings
) {
    public RenderContext {
        settings = settings != null ? Map.copyOf(settings) : Map.of();
    }

    /**
     * Creates a context without output directory or settings.
     *
     * @return console context
     */
    public static RenderContext console() {
        return new RenderContext(null, Map.of());
    }

    /**
     * Creates a context writing to the given directory.
     *
     * @param outputDirectory target directory
     * @return file system context
     */
    public static RenderContext directory(String outputDirectory) {
        return new RenderContext(outputDirectory, Map.of());
    }

    /**
     * @param key setting key
     * @param defaultValue value if the key is absent
     * @return setting value or default
     */
    public String getSettingOrDefault(String key, String defaultValue) {
        return settings.getOrDefault(key, defaultValue);
    }
}
