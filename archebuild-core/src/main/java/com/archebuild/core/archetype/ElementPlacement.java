package com.archebuild.core.archetype;

import java.util.Objects;

/**
 * Name, tilt and orientation given to generated elements of one kind.
 *
 * <p>Orientation is in degrees (0 north, 90 east, 180 south, 270 west) for vertical
 * elements; roofs use {@link #ROOF} and ground floors {@link #GROUND}.
 *
 * @param name element name
 * @param tilt tilt in degrees, 90 for vertical
 * @param orientation orientation in degrees or one of the markers
 */
public record ElementPlacement(
    String name,
    double tilt,
    double orientation
) {
    /** Orientation marker of roofs */
    public static final double ROOF = -1.0;

    /** Orientation marker of ground floors */
    public static final double GROUND = -2.0;

    /**
     * Compact constructor with validation.
     */
    public ElementPlacement {
        Objects.requireNonNull(name, "name must not be null");
    }
}
