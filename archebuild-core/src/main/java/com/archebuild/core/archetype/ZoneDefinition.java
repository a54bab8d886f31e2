package com.archebuild.core.archetype;

import java.util.Objects;

/**
 * Share of the net leased area assigned to one thermal zone.
 *
 * @param name zone name
 * @param areaFactor share of the net leased area, 0 to 1
 * @param usage usage type used to look up use conditions
 * @param numberOfFloors optional floor count overriding the building's
 * @param heightOfFloors optional floor height overriding the building's [m]
 */
public record ZoneDefinition(
    String name,
    double areaFactor,
    String usage,
    Integer numberOfFloors,
    Double heightOfFloors
) {
    /**
     * Compact constructor with validation.
     */
    public ZoneDefinition {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(usage, "usage must not be null");
        if (areaFactor < 0) {
            throw new IllegalArgumentException("areaFactor must not be negative");
        }
    }

    /**
     * Creates a zone definition without floor overrides.
     */
    public static ZoneDefinition of(String name, double areaFactor, String usage) {
        return new ZoneDefinition(name, areaFactor, usage, null, null);
    }
}
