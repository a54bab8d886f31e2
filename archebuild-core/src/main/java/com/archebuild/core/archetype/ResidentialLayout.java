package com.archebuild.core.archetype;

/**
 * Floor plan structure; selects the facade-to-floor area ratio.
 */
public enum ResidentialLayout implements ConfigurationCode {
    COMPACT(0, 0.66),
    ELONGATED(1, 0.8);

    private final int code;
    private final double facadeToFloorArea;

    ResidentialLayout(int code, double facadeToFloorArea) {
        this.code = code;
        this.facadeToFloorArea = facadeToFloorArea;
    }

    @Override
    public int code() {
        return code;
    }

    public double facadeToFloorArea() {
        return facadeToFloorArea;
    }

    public static ResidentialLayout fromCode(Integer code) {
        return EstimationTables.lookup(ResidentialLayout.class, code, "residentialLayout");
    }
}
