package com.archebuild.core.exception;

/**
 * Base class for all domain errors raised while resolving type elements or
 * generating archetype buildings.
 *
 * <p>All subclasses are unchecked. A building whose generation failed with one of
 * these exceptions is left partially assembled and must be discarded by the caller.
 */
public class ArcheBuildException extends RuntimeException {

    public ArcheBuildException(String message) {
        super(message);
    }

    public ArcheBuildException(String message, Throwable cause) {
        super(message, cause);
    }
}
