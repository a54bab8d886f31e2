package com.archebuild.core.model;

import com.archebuild.core.exception.InvalidArchetypeConfigurationException;

import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * Construction data sets an archetype can be built from.
 *
 * <p>{@link #value()} is the construction technique tag stored in the type-element
 * database.
 */
public enum ConstructionData {
    IWU_HEAVY("iwu_heavy"),
    IWU_LIGHT("iwu_light"),
    KFW_40("kfw_40"),
    KFW_55("kfw_55"),
    KFW_70("kfw_70"),
    KFW_85("kfw_85"),
    KFW_100("kfw_100");

    private final String value;

    ConstructionData(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    /**
     * @return true for the KfW efficiency-house standards
     */
    public boolean isKfw() {
        return value.startsWith("kfw");
    }

    /**
     * Parses a construction data tag.
     *
     * @param value tag such as {@code "iwu_heavy"}, case insensitive
     * @return matching constant
     * @throws InvalidArchetypeConfigurationException if the tag is unknown
     */
    public static ConstructionData fromValue(String value) {
        if (value == null) {
            throw new InvalidArchetypeConfigurationException("constructionData must not be null");
        }
        return Arrays.stream(values())
            .filter(data -> data.value.equalsIgnoreCase(value.trim()))
            .findFirst()
            .orElseThrow(() -> new InvalidArchetypeConfigurationException(
                "Unknown construction data '" + value + "', expected one of "
                    + Arrays.stream(values()).map(ConstructionData::value).collect(Collectors.joining(", "))));
    }

    @Override
    public String toString() {
        return value;
    }
}
