package com.archebuild.core.database;

import com.archebuild.core.model.Material;
import com.archebuild.core.model.TypeElementRecord;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Read-only handle on normative type-element and material data.
 *
 * <p>Implementations must not change after construction. A single instance may be
 * shared by any number of concurrent archetype generations.
 *
 * @see JsonTypeElementDatabaseLoader
 * @see InMemoryTypeElementDatabase
 */
public interface TypeElementDatabase {

    /**
     * Returns the data version declared by the source files.
     *
     * @return version string, or {@code "unknown"}
     */
    String version();

    /**
     * Returns all type-element records in storage order. The version entry of the
     * source file is never part of this list.
     *
     * @return unmodifiable list of records
     */
    List<TypeElementRecord> records();

    /**
     * Looks up a record by its exact key.
     *
     * @param key database key, e.g. {@code OuterWall_1919_1948_iwu_heavy}
     * @return record, or empty if absent
     */
    Optional<TypeElementRecord> findRecord(String key);

    /**
     * Looks up a material by id.
     *
     * @param materialId material id
     * @return material, or empty if absent
     */
    Optional<Material> findMaterial(String materialId);

    /**
     * Returns all materials known to this database.
     *
     * @return unmodifiable collection of materials
     */
    Collection<Material> materials();
}
