package com.archebuild.core.resolver;

import com.archebuild.core.database.TypeElementDatabase;
import com.archebuild.core.exception.MaterialNotFoundException;
import com.archebuild.core.model.Material;

import java.util.Objects;

/**
 * Resolves material ids referenced by layer definitions.
 */
public class MaterialResolver {

    private final TypeElementDatabase database;

    public MaterialResolver(TypeElementDatabase database) {
        this.database = Objects.requireNonNull(database, "database must not be null");
    }

    /**
     * Returns the material with the given id.
     *
     * @param materialId material id
     * @return material
     * @throws MaterialNotFoundException if the database holds no such material
     */
    public Material resolve(String materialId) {
        return database.findMaterial(materialId)
            .orElseThrow(() -> new MaterialNotFoundException(materialId));
    }
}
