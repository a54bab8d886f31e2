package com.archebuild.core.resolver;

import com.archebuild.core.model.ElementCategory;

import java.util.List;
import java.util.Objects;

/**
 * Result of {@link TypeElementResolver#resolve}.
 *
 * <p>A {@link ResolutionStatus#NO_MATCH} result is not an error by itself; callers
 * decide whether an unresolved element is acceptable.
 *
 * @param status whether a record was applied
 * @param category category that was searched
 * @param year construction year that was searched
 * @param technique construction technique that was searched
 * @param matchedKey key of the applied record, null for {@code NO_MATCH}
 * @param candidateKeys keys of all records that matched, in storage order
 */
public record ResolutionResult(
    ResolutionStatus status,
    ElementCategory category,
    int year,
    String technique,
    String matchedKey,
    List<String> candidateKeys
) {
    /**
     * Compact constructor with validation.
     */
    public ResolutionResult {
        Objects.requireNonNull(status, "status must not be null");
        Objects.requireNonNull(category, "category must not be null");
        candidateKeys = candidateKeys == null ? List.of() : List.copyOf(candidateKeys);
        if (status == ResolutionStatus.RESOLVED) {
            Objects.requireNonNull(matchedKey, "matchedKey must not be null for a resolved result");
        }
    }

    /**
     * Creates a result for an applied record.
     */
    public static ResolutionResult resolved(ElementCategory category, int year, String technique,
                                            String matchedKey, List<String> candidateKeys) {
        return new ResolutionResult(ResolutionStatus.RESOLVED, category, year, technique, matchedKey, candidateKeys);
    }

    /**
     * Creates a result for a search without matches.
     */
    public static ResolutionResult noMatch(ElementCategory category, int year, String technique) {
        return new ResolutionResult(ResolutionStatus.NO_MATCH, category, year, technique, null, List.of());
    }

    public boolean isResolved() {
        return status == ResolutionStatus.RESOLVED;
    }

    /**
     * @return true if more than one record matched and the tie-break had to decide
     */
    public boolean isAmbiguous() {
        return candidateKeys.size() > 1;
    }

    /**
     * @return a one-line description for log and error messages
     */
    public String describe() {
        return category.keyPrefix() + " for year " + year + " and construction '" + technique + "'";
    }
}
