package com.archebuild.core.archetype;

/**
 * Settings of archetype generation.
 *
 * @param strictResolution if true, an element without a matching type element fails
 *                         generation; otherwise it is kept unresolved and a warning is logged
 */
public record GenerationSettings(
    boolean strictResolution
) {
    /**
     * @return lenient settings
     */
    public static GenerationSettings defaults() {
        return new GenerationSettings(false);
    }

    /**
     * @return settings that fail on unresolved elements
     */
    public static GenerationSettings strict() {
        return new GenerationSettings(true);
    }
}
