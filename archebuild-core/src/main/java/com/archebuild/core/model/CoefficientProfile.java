package com.archebuild.core.model;

/**
 * Which heat exchange coefficients an element category takes from a type-element record.
 */
public enum CoefficientProfile {
    /** Inner and outer radiative and convective coefficients (outer walls, roofs, doors) */
    OPAQUE_ENVELOPE,

    /** Window coefficients: outer exchange, g-value, convective fraction and shading */
    WINDOW,

    /** Inner radiative and convective coefficients only */
    GENERIC
}
