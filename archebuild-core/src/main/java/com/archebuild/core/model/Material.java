package com.archebuild.core.model;

import java.util.Objects;

/**
 * Material of a construction layer.
 *
 * <p>Materials are immutable values, so two layers holding the same material id never
 * share mutable state.
 *
 * @param materialId stable id used to deduplicate materials across a project
 * @param name material name
 * @param density density [kg/m3]
 * @param thermalConductivity thermal conductivity [W/(m*K)]
 * @param heatCapacity specific heat capacity [kJ/(kg*K)]
 * @param solarAbsorption optional solar absorption coefficient
 * @param irEmissivity optional infrared emissivity
 * @param transmittance optional transmittance (glazing)
 */
public record Material(
    String materialId,
    String name,
    double density,
    double thermalConductivity,
    double heatCapacity,
    Double solarAbsorption,
    Double irEmissivity,
    Double transmittance
) {
    /**
     * Compact constructor with validation.
     */
    public Material {
        Objects.requireNonNull(materialId, "materialId must not be null");
        if (name == null) {
            name = materialId;
        }
    }

    /**
     * Creates a material with only the thermal core properties set.
     */
    public static Material of(String materialId, String name, double density,
                              double thermalConductivity, double heatCapacity) {
        return new Material(materialId, name, density, thermalConductivity, heatCapacity, null, null, null);
    }
}
