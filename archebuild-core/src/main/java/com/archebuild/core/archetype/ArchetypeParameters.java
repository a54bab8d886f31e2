package com.archebuild.core.archetype;

import com.archebuild.core.exception.InvalidArchetypeConfigurationException;
import com.archebuild.core.model.ConstructionData;

/**
 * Inputs of a residential archetype.
 *
 * <p>Categorical values left unset default to code 0 (compact layout, no neighbours,
 * flat roof, no cellar, no dormer).
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * ArchetypeParameters params = ArchetypeParameters.builder()
 *     .yearOfConstruction(1975)
 *     .constructionData(ConstructionData.IWU_HEAVY)
 *     .numberOfFloors(2)
 *     .heightOfFloors(2.8)
 *     .netLeasedArea(150)
 *     .attic(2)
 *     .build();
 * }</pre>
 *
 * @param yearOfConstruction year of first construction
 * @param constructionData construction data set
 * @param numberOfFloors storeys above ground; 1 or more for a valid archetype
 * @param heightOfFloors average storey height [m]
 * @param netLeasedArea total net leased area [m2], not the footprint
 * @param residentialLayout floor plan structure
 * @param neighbourBuildings number of adjacent buildings
 * @param attic attic design
 * @param cellar cellar design
 * @param dormer dormer design
 */
public record ArchetypeParameters(
    int yearOfConstruction,
    ConstructionData constructionData,
    int numberOfFloors,
    double heightOfFloors,
    double netLeasedArea,
    ResidentialLayout residentialLayout,
    NeighbourBuildings neighbourBuildings,
    AtticDesign attic,
    CellarDesign cellar,
    DormerDesign dormer
) {
    /**
     * Compact constructor with validation.
     */
    public ArchetypeParameters {
        if (constructionData == null) {
            throw new InvalidArchetypeConfigurationException("constructionData must be set");
        }
        if (numberOfFloors < 0) {
            throw new InvalidArchetypeConfigurationException("numberOfFloors must not be negative, was " + numberOfFloors);
        }
        if (!(heightOfFloors > 0)) {
            throw new InvalidArchetypeConfigurationException("heightOfFloors must be positive, was " + heightOfFloors);
        }
        if (!(netLeasedArea > 0)) {
            throw new InvalidArchetypeConfigurationException("netLeasedArea must be positive, was " + netLeasedArea);
        }
        if (residentialLayout == null) {
            residentialLayout = ResidentialLayout.COMPACT;
        }
        if (neighbourBuildings == null) {
            neighbourBuildings = NeighbourBuildings.NONE;
        }
        if (attic == null) {
            attic = AtticDesign.FLAT_ROOF;
        }
        if (cellar == null) {
            cellar = CellarDesign.NONE;
        }
        if (dormer == null) {
            dormer = DormerDesign.NONE;
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder accepting the integer codes used in configuration files.
     */
    public static final class Builder {

        private Integer yearOfConstruction;
        private ConstructionData constructionData = ConstructionData.IWU_HEAVY;
        private Integer numberOfFloors;
        private Double heightOfFloors;
        private Double netLeasedArea;
        private Integer residentialLayout;
        private Integer neighbourBuildings;
        private Integer attic;
        private Integer cellar;
        private Integer dormer;

        private Builder() {
        }

        public Builder yearOfConstruction(int yearOfConstruction) {
            this.yearOfConstruction = yearOfConstruction;
            return this;
        }

        public Builder constructionData(ConstructionData constructionData) {
            this.constructionData = constructionData;
            return this;
        }

        public Builder constructionData(String constructionData) {
            this.constructionData = ConstructionData.fromValue(constructionData);
            return this;
        }

        public Builder numberOfFloors(int numberOfFloors) {
            this.numberOfFloors = numberOfFloors;
            return this;
        }

        public Builder heightOfFloors(double heightOfFloors) {
            this.heightOfFloors = heightOfFloors;
            return this;
        }

        public Builder netLeasedArea(double netLeasedArea) {
            this.netLeasedArea = netLeasedArea;
            return this;
        }

        public Builder residentialLayout(Integer residentialLayout) {
            this.residentialLayout = residentialLayout;
            return this;
        }

        public Builder neighbourBuildings(Integer neighbourBuildings) {
            this.neighbourBuildings = neighbourBuildings;
            return this;
        }

        public Builder attic(Integer attic) {
            this.attic = attic;
            return this;
        }

        public Builder cellar(Integer cellar) {
            this.cellar = cellar;
            return this;
        }

        public Builder dormer(Integer dormer) {
            this.dormer = dormer;
            return this;
        }

        /**
         * Validates the collected values and builds the parameters.
         *
         * @return parameters
         * @throws InvalidArchetypeConfigurationException if a mandatory value is missing
         *         or a code has no table entry
         */
        public ArchetypeParameters build() {
            require(yearOfConstruction, "yearOfConstruction");
            require(numberOfFloors, "numberOfFloors");
            require(heightOfFloors, "heightOfFloors");
            require(netLeasedArea, "netLeasedArea");
            return new ArchetypeParameters(
                yearOfConstruction,
                constructionData,
                numberOfFloors,
                heightOfFloors,
                netLeasedArea,
                ResidentialLayout.fromCode(residentialLayout),
                NeighbourBuildings.fromCode(neighbourBuildings),
                AtticDesign.fromCode(attic),
                CellarDesign.fromCode(cellar),
                DormerDesign.fromCode(dormer)
            );
        }

        private static void require(Object value, String name) {
            if (value == null) {
                throw new InvalidArchetypeConfigurationException(name + " is mandatory for residential archetypes");
            }
        }
    }
}
