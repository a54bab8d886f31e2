package com.archebuild.core.model;

/**
 * Severity of an issue found while validating type-element data.
 */
public enum IssueSeverity {
    /** Data is usable, but resolution may behave unexpectedly. */
    WARNING,

    /** Data is broken; resolving the affected record will fail. */
    ERROR
}
