package com.archebuild.core.archetype;

import com.archebuild.core.exception.InvalidArchetypeConfigurationException;

import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * Lookup of archetype configuration codes in their coefficient tables.
 *
 * <p>Each table is an enum implementing {@link ConfigurationCode}; every code has
 * exactly one constant, so a table is total over its declared codes. Codes outside a
 * table are rejected rather than mapped to a default.
 */
public final class EstimationTables {

    private EstimationTables() {
        // Utility class
    }

    /**
     * Looks up a configuration code.
     *
     * @param table enum type of the table
     * @param code code to look up; null selects code 0
     * @param axis parameter name for error messages, e.g. {@code "attic"}
     * @param <E> table type
     * @return table entry
     * @throws InvalidArchetypeConfigurationException if the code has no entry
     */
    public static <E extends Enum<E> & ConfigurationCode> E lookup(Class<E> table, Integer code, String axis) {
        int effective = code == null ? 0 : code;
        for (E entry : table.getEnumConstants()) {
            if (entry.code() == effective) {
                return entry;
            }
        }
        throw new InvalidArchetypeConfigurationException(
            "Invalid value " + effective + " for " + axis + ", expected one of "
                + Arrays.stream(table.getEnumConstants())
                    .map(entry -> String.valueOf(entry.code()))
                    .collect(Collectors.joining(", ")));
    }
}
