package com.archebuild.core.exception;

/**
 * Thrown when a type element cannot be found, either by key or, in strict mode,
 * by construction year and technique.
 */
public class TypeElementNotFoundException extends ArcheBuildException {

    public TypeElementNotFoundException(String message) {
        super(message);
    }
}
