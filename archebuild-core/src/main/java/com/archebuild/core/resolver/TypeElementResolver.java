package com.archebuild.core.resolver;

import com.archebuild.core.building.BuildingElement;
import com.archebuild.core.database.TypeElementDatabase;
import com.archebuild.core.exception.ArcheBuildException;
import com.archebuild.core.exception.TypeElementNotFoundException;
import com.archebuild.core.model.ElementCategory;
import com.archebuild.core.model.Layer;
import com.archebuild.core.model.LayerDefinition;
import com.archebuild.core.model.TypeElementRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Populates building elements with construction data from a {@link TypeElementDatabase}.
 *
 * <p>Two lookups are supported:</p>
 * <ul>
 *   <li><b>By characteristics</b> - construction year, technique and category, see
 *       {@link #resolve(BuildingElement, int, String, ElementCategory, boolean)}</li>
 *   <li><b>By key</b> - exact database key, see {@link #resolveByKey(BuildingElement, String, boolean)}</li>
 * </ul>
 *
 * <p>Resolving copies the record's provenance and coefficients onto the element and
 * replaces its layers with freshly built {@link Layer}s. Layer materials are looked up
 * through {@link MaterialResolver}.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * TypeElementResolver resolver = new TypeElementResolver(database);
 *
 * OuterWall wall = new OuterWall();
 * ResolutionResult result = resolver.resolve(wall, 1965, "iwu_heavy");
 * if (!result.isResolved()) {
 *     // wall is untouched
 * }
 * }</pre>
 *
 * <p>The resolver holds no mutable state and never modifies the database.
 */
public class TypeElementResolver {

    private static final Logger log = LoggerFactory.getLogger(TypeElementResolver.class);

    private final TypeElementDatabase database;
    private final MaterialResolver materialResolver;

    public TypeElementResolver(TypeElementDatabase database) {
        this.database = Objects.requireNonNull(database, "database must not be null");
        this.materialResolver = new MaterialResolver(database);
    }

    /**
     * Resolves an element of its own category with layers in stored order.
     *
     * @see #resolve(BuildingElement, int, String, ElementCategory, boolean)
     */
    public ResolutionResult resolve(BuildingElement element, int year, String technique) {
        return resolve(element, year, technique, null, false);
    }

    /**
     * Resolves an element by construction year and technique.
     *
     * <p>When no record matches, the element is left untouched and a
     * {@link ResolutionStatus#NO_MATCH} result is returned.
     *
     * @param element element to populate
     * @param year construction year
     * @param technique construction technique, compared exactly
     * @param category category to search, or null for the element's own category
     * @param reverseLayers true to assign layers in reverse stored order
     * @return resolution result
     * @throws com.archebuild.core.exception.MaterialNotFoundException if a layer of the
     *         selected record references an unknown material
     * @throws ArcheBuildException if a layer of the selected record has no positive thickness
     */
    public ResolutionResult resolve(BuildingElement element, int year, String technique,
                                    ElementCategory category, boolean reverseLayers) {
        Objects.requireNonNull(element, "element must not be null");
        Objects.requireNonNull(technique, "technique must not be null");
        ElementCategory searched = category != null ? category : element.category();

        List<TypeElementRecord> candidates = findCandidates(searched, year, technique);
        Optional<TypeElementRecord> selected = TypeElementSelector.select(candidates);
        if (selected.isEmpty()) {
            log.debug("No type element found for {} in year {} with construction '{}'",
                searched.keyPrefix(), year, technique);
            return ResolutionResult.noMatch(searched, year, technique);
        }

        TypeElementRecord record = selected.get();
        List<String> candidateKeys = candidates.stream()
            .map(TypeElementRecord::key)
            .toList();
        if (candidateKeys.size() > 1) {
            log.debug("{} records match {} in year {} with construction '{}', using {}",
                candidateKeys.size(), searched.keyPrefix(), year, technique, record.key());
        }

        apply(element, record, reverseLayers);
        return ResolutionResult.resolved(searched, year, technique, record.key(), candidateKeys);
    }

    /**
     * Resolves an element and fails if no record matches.
     *
     * @return the applied record
     * @throws TypeElementNotFoundException if no record matches
     * @see #resolve(BuildingElement, int, String, ElementCategory, boolean)
     */
    public TypeElementRecord resolveOrThrow(BuildingElement element, int year, String technique,
                                            ElementCategory category, boolean reverseLayers) {
        ResolutionResult result = resolve(element, year, technique, category, reverseLayers);
        if (!result.isResolved()) {
            throw new TypeElementNotFoundException("No type element found for " + result.describe());
        }
        return database.findRecord(result.matchedKey()).orElseThrow();
    }

    /**
     * Resolves an element from the record with the given key, layers in stored order.
     *
     * @see #resolveByKey(BuildingElement, String, boolean)
     */
    public TypeElementRecord resolveByKey(BuildingElement element, String key) {
        return resolveByKey(element, key, false);
    }

    /**
     * Resolves an element from the record with the given key.
     *
     * @param element element to populate
     * @param key exact database key
     * @param reverseLayers true to assign layers in reverse stored order
     * @return the applied record
     * @throws TypeElementNotFoundException if the key is absent
     */
    public TypeElementRecord resolveByKey(BuildingElement element, String key, boolean reverseLayers) {
        Objects.requireNonNull(element, "element must not be null");
        TypeElementRecord record = database.findRecord(key)
            .orElseThrow(() -> new TypeElementNotFoundException("Type element not found in database: " + key));
        apply(element, record, reverseLayers);
        return record;
    }

    /**
     * Lists all records matching category, year and technique in storage order.
     *
     * @param category element category
     * @param year construction year
     * @param technique construction technique
     * @return matching records, possibly empty
     */
    public List<TypeElementRecord> findCandidates(ElementCategory category, int year, String technique) {
        return TypeElementSelector.candidates(database.records(), category, year, technique);
    }

    private void apply(BuildingElement element, TypeElementRecord record, boolean reverseLayers) {
        List<LayerDefinition> definitions = new ArrayList<>(record.layers());
        if (reverseLayers) {
            Collections.reverse(definitions);
        }

        List<Layer> layers = new ArrayList<>(definitions.size());
        for (LayerDefinition definition : definitions) {
            if (!(definition.thickness() > 0.0)) {
                throw new ArcheBuildException("Layer " + definition.id() + " of type element " + record.key()
                    + " has non-positive thickness " + definition.thickness());
            }
            layers.add(new Layer(definition.id(), definition.thickness(),
                materialResolver.resolve(definition.materialId())));
        }

        element.assignTypeElement(record, layers);
        log.trace("Applied {} to {} ({} layers, reversed={})",
            record.key(), element.getClass().getSimpleName(), layers.size(), reverseLayers);
    }
}
