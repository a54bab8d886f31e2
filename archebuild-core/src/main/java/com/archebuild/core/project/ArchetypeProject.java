package com.archebuild.core.project;

import com.archebuild.core.archetype.ArchetypeParameters;
import com.archebuild.core.archetype.GenerationSettings;
import com.archebuild.core.archetype.SingleFamilyDwelling;
import com.archebuild.core.building.Building;
import com.archebuild.core.building.StaticUseConditionsProvider;
import com.archebuild.core.building.UseConditionsProvider;
import com.archebuild.core.database.JsonTypeElementDatabaseLoader;
import com.archebuild.core.database.TypeElementDatabase;
import com.archebuild.core.resolver.TypeElementResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Entry point for generating archetype buildings against one type-element database.
 *
 * <p>The project keeps every successfully generated building. A building whose
 * generation fails is not registered.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * ArchetypeProject project = ArchetypeProject.withBundledDatabase("Demo");
 * SingleFamilyDwelling house = project.addResidential("House 1", ArchetypeParameters.builder()
 *     .yearOfConstruction(1962)
 *     .numberOfFloors(2)
 *     .heightOfFloors(2.7)
 *     .netLeasedArea(140)
 *     .build());
 * }</pre>
 */
public class ArchetypeProject {

    private static final Logger log = LoggerFactory.getLogger(ArchetypeProject.class);

    private final String name;
    private final TypeElementDatabase database;
    private final TypeElementResolver resolver;
    private final UseConditionsProvider useConditionsProvider;
    private final GenerationSettings settings;
    private final List<Building> buildings = new ArrayList<>();

    public ArchetypeProject(String name,
                            TypeElementDatabase database,
                            UseConditionsProvider useConditionsProvider,
                            GenerationSettings settings) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.database = Objects.requireNonNull(database, "database must not be null");
        this.useConditionsProvider = Objects.requireNonNull(useConditionsProvider, "useConditionsProvider must not be null");
        this.settings = settings != null ? settings : GenerationSettings.defaults();
        this.resolver = new TypeElementResolver(database);
    }

    /**
     * Creates a project using the sample database bundled with this library, default use
     * conditions and lenient resolution.
     *
     * @param name project name
     * @return new project
     */
    public static ArchetypeProject withBundledDatabase(String name) {
        return new ArchetypeProject(name,
            new JsonTypeElementDatabaseLoader().loadBundled(),
            new StaticUseConditionsProvider(),
            GenerationSettings.defaults());
    }

    /**
     * Generates a single family dwelling and adds it to this project.
     *
     * @param buildingName name of the new building
     * @param parameters archetype inputs
     * @return generated building
     * @throws com.archebuild.core.exception.ArcheBuildException if generation fails; the
     *         building is then not added
     */
    public SingleFamilyDwelling addResidential(String buildingName, ArchetypeParameters parameters) {
        SingleFamilyDwelling dwelling = new SingleFamilyDwelling(
            buildingName, parameters, resolver, useConditionsProvider, settings);
        dwelling.generateArchetype();
        buildings.add(dwelling);
        log.debug("Added building '{}' to project '{}' ({} buildings)", buildingName, name, buildings.size());
        return dwelling;
    }

    public String getName() {
        return name;
    }

    public TypeElementDatabase getDatabase() {
        return database;
    }

    public TypeElementResolver getResolver() {
        return resolver;
    }

    public GenerationSettings getSettings() {
        return settings;
    }

    public List<Building> getBuildings() {
        return Collections.unmodifiableList(buildings);
    }
}
