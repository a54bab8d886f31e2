package com.archebuild.core.model;

import java.util.Objects;

/**
 * Issue detected in type-element or material data.
 *
 * <p><b>Example:</b></p>
 * <pre>{@code
 * DatabaseIssue issue = DatabaseIssue.error(
 *     "OuterWall_1919_1948_iwu_heavy",
 *     "Layer 2 references unknown material 'x-17'"
 * );
 * }</pre>
 *
 * @param key key of the affected record
 * @param message human-readable description
 * @param severity severity level
 */
public record DatabaseIssue(
    String key,
    String message,
    IssueSeverity severity
) {
    /**
     * Compact constructor with validation.
     */
    public DatabaseIssue {
        Objects.requireNonNull(key, "key must not be null");
        Objects.requireNonNull(message, "message must not be null");
        Objects.requireNonNull(severity, "severity must not be null");
    }

    public static DatabaseIssue warning(String key, String message) {
        return new DatabaseIssue(key, message, IssueSeverity.WARNING);
    }

    public static DatabaseIssue error(String key, String message) {
        return new DatabaseIssue(key, message, IssueSeverity.ERROR);
    }
}
