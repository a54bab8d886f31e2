package com.archebuild.core.archetype;

/**
 * Design of the cellar; only its heated share enters the estimation.
 */
public enum CellarDesign implements ConfigurationCode {
    NONE(0, 0.0),
    NON_HEATED(1, 0.0),
    PARTLY_HEATED(2, 0.5),
    HEATED(3, 1.0);

    private final int code;
    private final double heatedFactor;

    CellarDesign(int code, double heatedFactor) {
        this.code = code;
        this.heatedFactor = heatedFactor;
    }

    @Override
    public int code() {
        return code;
    }

    public double heatedFactor() {
        return heatedFactor;
    }

    public static CellarDesign fromCode(Integer code) {
        return EstimationTables.lookup(CellarDesign.class, code, "cellar");
    }
}
