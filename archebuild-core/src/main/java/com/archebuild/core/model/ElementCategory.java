package com.archebuild.core.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * Building element categories known to the type-element database.
 *
 * <p>The {@link #keyPrefix()} is the prefix of every database key that holds a record
 * of this category (e.g. {@code OuterWall_1919_1948_heavy}).
 */
public enum ElementCategory {
    OUTER_WALL("OuterWall", CoefficientProfile.OPAQUE_ENVELOPE),
    ROOFTOP("Rooftop", CoefficientProfile.OPAQUE_ENVELOPE),
    DOOR("Door", CoefficientProfile.OPAQUE_ENVELOPE),
    WINDOW("Window", CoefficientProfile.WINDOW),
    GROUND_FLOOR("GroundFloor", CoefficientProfile.GENERIC),
    INNER_WALL("InnerWall", CoefficientProfile.GENERIC),
    CEILING("Ceiling", CoefficientProfile.GENERIC),
    FLOOR("Floor", CoefficientProfile.GENERIC);

    private final String keyPrefix;
    private final CoefficientProfile profile;

    ElementCategory(String keyPrefix, CoefficientProfile profile) {
        this.keyPrefix = keyPrefix;
        this.profile = profile;
    }

    public String keyPrefix() {
        return keyPrefix;
    }

    public CoefficientProfile profile() {
        return profile;
    }

    /**
     * Checks whether a database key belongs to this category.
     *
     * <p>Keys are matched by prefix. {@code "Floor"} therefore also matches keys of a
     * hypothetical {@code FloorXyz} category, the same way the source data is keyed.
     *
     * @param key database key
     * @return true if the key starts with this category's prefix
     */
    public boolean matchesKey(String key) {
        return key != null && key.startsWith(keyPrefix);
    }

    /**
     * Finds the category a database key belongs to.
     *
     * <p>The longest matching prefix wins, so {@code GroundFloor_...} is never
     * reported as {@code Floor}.
     *
     * @param key database key
     * @return category, or empty if no prefix matches
     */
    public static Optional<ElementCategory> fromKey(String key) {
        return Arrays.stream(values())
            .filter(category -> category.matchesKey(key))
            .max((a, b) -> Integer.compare(a.keyPrefix.length(), b.keyPrefix.length()));
    }

    /**
     * Looks up a category by its key prefix, ignoring case.
     *
     * @param prefix key prefix such as {@code "OuterWall"}
     * @return category, or empty if unknown
     */
    public static Optional<ElementCategory> fromPrefix(String prefix) {
        return Arrays.stream(values())
            .filter(category -> category.keyPrefix.equalsIgnoreCase(prefix))
            .findFirst();
    }
}
