package com.archebuild.core.exception;

/**
 * Thrown when an archetype parameter has no entry in its coefficient table
 * (e.g. {@code attic = 7}) or a mandatory parameter is missing.
 */
public class InvalidArchetypeConfigurationException extends ArcheBuildException {

    public InvalidArchetypeConfigurationException(String message) {
        super(message);
    }
}
