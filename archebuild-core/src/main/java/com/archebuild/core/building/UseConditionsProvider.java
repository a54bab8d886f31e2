package com.archebuild.core.building;

/**
 * Source of {@link UseConditions} for a usage type.
 */
@FunctionalInterface
public interface UseConditionsProvider {

    /**
     * Returns the use conditions for a usage type.
     *
     * @param usage usage type, e.g. {@code "Living"}
     * @return use conditions, never null
     */
    UseConditions forUsage(String usage);
}
