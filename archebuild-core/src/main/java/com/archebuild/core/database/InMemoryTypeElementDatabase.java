package com.archebuild.core.database;

import com.archebuild.core.model.Material;
import com.archebuild.core.model.TypeElementRecord;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * {@link TypeElementDatabase} backed by insertion-ordered maps.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * TypeElementDatabase database = InMemoryTypeElementDatabase.builder()
 *     .version("0.7")
 *     .material(Material.of("1", "Concrete", 2300, 1.6, 1.0))
 *     .record(outerWallRecord)
 *     .build();
 * }</pre>
 */
public final class InMemoryTypeElementDatabase implements TypeElementDatabase {

    private final String version;
    private final Map<String, TypeElementRecord> records;
    private final Map<String, Material> materials;

    private InMemoryTypeElementDatabase(String version,
                                        Map<String, TypeElementRecord> records,
                                        Map<String, Material> materials) {
        this.version = version == null ? "unknown" : version;
        this.records = Collections.unmodifiableMap(new LinkedHashMap<>(records));
        this.materials = Collections.unmodifiableMap(new LinkedHashMap<>(materials));
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String version() {
        return version;
    }

    @Override
    public List<TypeElementRecord> records() {
        return List.copyOf(records.values());
    }

    @Override
    public Optional<TypeElementRecord> findRecord(String key) {
        return Optional.ofNullable(records.get(key));
    }

    @Override
    public Optional<Material> findMaterial(String materialId) {
        return Optional.ofNullable(materials.get(materialId));
    }

    @Override
    public Collection<Material> materials() {
        return materials.values();
    }

    /**
     * Builder collecting records and materials in insertion order. Adding an entry
     * with a key that is already present replaces the earlier entry.
     */
    public static final class Builder {

        private String version;
        private final Map<String, TypeElementRecord> records = new LinkedHashMap<>();
        private final Map<String, Material> materials = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder version(String version) {
            this.version = version;
            return this;
        }

        public Builder record(TypeElementRecord record) {
            Objects.requireNonNull(record, "record must not be null");
            records.put(record.key(), record);
            return this;
        }

        public Builder records(Collection<TypeElementRecord> toAdd) {
            toAdd.forEach(this::record);
            return this;
        }

        public Builder material(Material material) {
            Objects.requireNonNull(material, "material must not be null");
            materials.put(material.materialId(), material);
            return this;
        }

        public Builder materials(Collection<Material> toAdd) {
            toAdd.forEach(this::material);
            return this;
        }

        public InMemoryTypeElementDatabase build() {
            return new InMemoryTypeElementDatabase(version, records, materials);
        }
    }
}
