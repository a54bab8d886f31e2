package com.archebuild.core.exception;

/**
 * Thrown when type-element or material data cannot be read or parsed.
 */
public class DatabaseLoadException extends ArcheBuildException {

    public DatabaseLoadException(String message) {
        super(message);
    }

    public DatabaseLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
