package com.archebuild.core.config;

import com.archebuild.core.archetype.ArchetypeParameters;
import com.archebuild.core.archetype.GenerationSettings;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Root configuration of an ArcheBuild run.
 *
 * <p>Loaded from {@code archebuild.yaml}. Lists the buildings to generate and where the
 * type-element data and the reports live.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * project:
 *   name: "Street survey"
 *   version: "1.0.0"
 *
 * database:
 *   typeElements: "data/TypeElements.json"
 *   materials: "data/MaterialTemplates.json"
 *
 * buildings:
 *   - name: "House 12"
 *     yearOfConstruction: 1975
 *     constructionData: iwu_heavy
 *     numberOfFloors: 2
 *     heightOfFloors: 2.8
 *     netLeasedArea: 150
 *     attic: 2
 *
 * settings:
 *   strictResolution: false
 *
 * output:
 *   directory: "./build/archebuild"
 *   formats: [markdown, json]
 * }</pre>
 *
 * @param project project metadata
 * @param database type-element data locations; null selects the bundled data
 * @param buildings buildings to generate
 * @param settings generation settings
 * @param output output configuration
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ProjectConfig(
    @JsonProperty("project") ProjectInfo project,
    @JsonProperty("database") DatabaseConfig database,
    @JsonProperty("buildings") List<BuildingConfig> buildings,
    @JsonProperty("settings") SettingsConfig settings,
    @JsonProperty("output") OutputConfig output
) {
    /**
     * Creates a default configuration: bundled data, no buildings, markdown to console.
     *
     * @return default configuration
     */
    public static ProjectConfig defaults() {
        return new ProjectConfig(
            new ProjectInfo("project", "1.0.0", null),
            null,
            List.of(),
            new SettingsConfig(false),
            new OutputConfig(null, List.of("markdown"))
        );
    }

    /**
     * @return generation settings, lenient if not configured
     */
    public GenerationSettings generationSettings() {
        if (settings == null || settings.strictResolution() == null) {
            return GenerationSettings.defaults();
        }
        return new GenerationSettings(settings.strictResolution());
    }

    /**
     * Project metadata.
     *
     * @param name project name
     * @param version project version
     * @param description optional project description
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ProjectInfo(
        @JsonProperty("name") String name,
        @JsonProperty("version") String version,
        @JsonProperty("description") String description
    ) {}

    /**
     * Locations of the type-element and material JSON files.
     *
     * @param typeElements path to the type-element JSON
     * @param materials path to the material template JSON
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record DatabaseConfig(
        @JsonProperty("typeElements") String typeElements,
        @JsonProperty("materials") String materials
    ) {}

    /**
     * One residential archetype to generate. Categorical values default to 0.
     *
     * @param name building name
     * @param yearOfConstruction year of first construction
     * @param constructionData construction data tag, e.g. {@code iwu_heavy}
     * @param numberOfFloors storeys above ground
     * @param heightOfFloors average storey height [m]
     * @param netLeasedArea net leased area [m2]
     * @param residentialLayout 0 compact, 1 elongated
     * @param neighbourBuildings 0, 1 or 2
     * @param attic 0 flat roof, 1 non heated, 2 partly heated, 3 heated
     * @param cellar 0 none, 1 non heated, 2 partly heated, 3 heated
     * @param dormer 0 none, 1 dormer
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record BuildingConfig(
        @JsonProperty("name") String name,
        @JsonProperty("yearOfConstruction") Integer yearOfConstruction,
        @JsonProperty("constructionData") String constructionData,
        @JsonProperty("numberOfFloors") Integer numberOfFloors,
        @JsonProperty("heightOfFloors") Double heightOfFloors,
        @JsonProperty("netLeasedArea") Double netLeasedArea,
        @JsonProperty("residentialLayout") Integer residentialLayout,
        @JsonProperty("neighbourBuildings") Integer neighbourBuildings,
        @JsonProperty("attic") Integer attic,
        @JsonProperty("cellar") Integer cellar,
        @JsonProperty("dormer") Integer dormer
    ) {
        /**
         * Converts this entry into validated archetype parameters.
         *
         * @return archetype parameters
         * @throws com.archebuild.core.exception.InvalidArchetypeConfigurationException if a
         *         mandatory value is missing or a code is invalid
         */
        public ArchetypeParameters toParameters() {
            ArchetypeParameters.Builder builder = ArchetypeParameters.builder()
                .residentialLayout(residentialLayout)
                .neighbourBuildings(neighbourBuildings)
                .attic(attic)
                .cellar(cellar)
                .dormer(dormer);
            if (constructionData != null) {
                builder.constructionData(constructionData);
            }
            if (yearOfConstruction != null) {
                builder.yearOfConstruction(yearOfConstruction);
            }
            if (numberOfFloors != null) {
                builder.numberOfFloors(numberOfFloors);
            }
            if (heightOfFloors != null) {
                builder.heightOfFloors(heightOfFloors);
            }
            if (netLeasedArea != null) {
                builder.netLeasedArea(netLeasedArea);
            }
            return builder.build();
        }
    }

    /**
     * Generation settings.
     *
     * @param strictResolution fail on elements without a matching type element
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record SettingsConfig(
        @JsonProperty("strictResolution") Boolean strictResolution
    ) {}

    /**
     * Output configuration.
     *
     * @param directory report directory; null writes to the console
     * @param formats report formats ({@code markdown}, {@code json})
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record OutputConfig(
        @JsonProperty("directory") String directory,
        @JsonProperty("formats") List<String> formats
    ) {}
}
