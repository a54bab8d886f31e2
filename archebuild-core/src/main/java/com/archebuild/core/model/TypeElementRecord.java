package com.archebuild.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Normative construction assembly valid for a range of construction years and one
 * construction technique.
 *
 * @param key database key, category prefix plus disambiguating suffix
 * @param ageRange construction years this record applies to
 * @param constructionType construction technique tag (e.g. {@code iwu_heavy})
 * @param coefficients heat exchange coefficients
 * @param layers layer definitions in stacking order, inner face first
 */
public record TypeElementRecord(
    String key,
    AgeRange ageRange,
    String constructionType,
    ExchangeCoefficients coefficients,
    List<LayerDefinition> layers
) {
    /**
     * Compact constructor with validation.
     */
    public TypeElementRecord {
        Objects.requireNonNull(key, "key must not be null");
        Objects.requireNonNull(ageRange, "ageRange must not be null");
        Objects.requireNonNull(constructionType, "constructionType must not be null");
        Objects.requireNonNull(coefficients, "coefficients must not be null");
        layers = layers == null ? List.of() : List.copyOf(layers);
    }

    /**
     * Checks whether this record applies to the given category, year and technique.
     *
     * @param category element category (matched as key prefix)
     * @param year construction year
     * @param technique construction technique, compared exactly
     * @return true if all three criteria match
     */
    public boolean matches(ElementCategory category, int year, String technique) {
        return category.matchesKey(key)
            && ageRange.contains(year)
            && constructionType.equals(technique);
    }

    /**
     * @return sum of all layer thicknesses [m]
     */
    public double totalThickness() {
        return layers.stream().mapToDouble(LayerDefinition::thickness).sum();
    }
}
