package com.archebuild.core.resolver;

/**
 * Outcome of resolving an element by construction year and technique.
 */
public enum ResolutionStatus {
    /** A record matched and was applied to the element */
    RESOLVED,

    /** No record matched; the element was left untouched */
    NO_MATCH
}
