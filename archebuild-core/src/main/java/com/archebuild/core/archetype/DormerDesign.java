package com.archebuild.core.archetype;

/**
 * Whether the roof carries a dormer.
 */
public enum DormerDesign implements ConfigurationCode {
    NONE(0, 1.0),
    DORMER(1, 1.3);

    private final int code;
    private final double roofFactor;

    DormerDesign(int code, double roofFactor) {
        this.code = code;
        this.roofFactor = roofFactor;
    }

    @Override
    public int code() {
        return code;
    }

    public double roofFactor() {
        return roofFactor;
    }

    public static DormerDesign fromCode(Integer code) {
        return EstimationTables.lookup(DormerDesign.class, code, "dormer");
    }
}
