package com.archebuild.core.model;

import java.util.Objects;

/**
 * One physical slab of material within a construction assembly.
 *
 * @param id layer id from the type-element record (position in the source stack)
 * @param thickness layer thickness [m], strictly positive
 * @param material material of this layer
 */
public record Layer(
    String id,
    double thickness,
    Material material
) {
    /**
     * Compact constructor with validation.
     */
    public Layer {
        Objects.requireNonNull(material, "material must not be null");
        if (!(thickness > 0.0)) {
            throw new IllegalArgumentException("thickness must be positive, was " + thickness);
        }
    }
}
