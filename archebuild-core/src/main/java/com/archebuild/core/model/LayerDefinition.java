package com.archebuild.core.model;

import java.util.Objects;

/**
 * Layer entry of a type-element record; the material is referenced by id only.
 *
 * @param id layer id within the record
 * @param thickness layer thickness [m]
 * @param materialId id of the referenced material
 * @param materialName material name as written in the record (informational)
 */
public record LayerDefinition(
    String id,
    double thickness,
    String materialId,
    String materialName
) {
    /**
     * Compact constructor with validation.
     */
    public LayerDefinition {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(materialId, "materialId must not be null");
    }
}
