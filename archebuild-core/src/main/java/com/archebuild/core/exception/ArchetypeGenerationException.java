package com.archebuild.core.exception;

/**
 * Thrown when the estimation pipeline hits an arithmetic fault, such as a zero
 * effective heated floor count.
 */
public class ArchetypeGenerationException extends ArcheBuildException {

    public ArchetypeGenerationException(String message) {
        super(message);
    }
}
