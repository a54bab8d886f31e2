package com.archebuild.core.building;

import java.util.Objects;

/**
 * Usage data attached to a thermal zone.
 *
 * <p>Only the room geometry needed to approximate inner wall areas is modelled here;
 * occupancy and internal gain profiles belong to the simulation export.
 *
 * @param usage usage type, e.g. {@code "Living"}
 * @param typicalLength typical room length [m]
 * @param typicalWidth typical room width [m]
 */
public record UseConditions(
    String usage,
    double typicalLength,
    double typicalWidth
) {
    /**
     * Compact constructor with validation.
     */
    public UseConditions {
        Objects.requireNonNull(usage, "usage must not be null");
        if (typicalLength <= 0 || typicalWidth <= 0) {
            throw new IllegalArgumentException("typical room dimensions must be positive");
        }
    }

    /**
     * @return typical room floor area [m2]
     */
    public double typicalArea() {
        return typicalLength * typicalWidth;
    }
}
