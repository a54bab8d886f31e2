package com.archebuild.core.archetype;

/**
 * Number of directly adjacent buildings; reduces the exposed facade.
 *
 * <p>Only the facade area budget changes. Wall orientations stay as configured.
 */
public enum NeighbourBuildings implements ConfigurationCode {
    NONE(0, 0.0, 50.0),
    ONE(1, 1.0, 30.0),
    TWO(2, 2.0, 10.0);

    private final int code;
    private final double neighbourFactor;
    private final double extraFloorArea;

    NeighbourBuildings(int code, double neighbourFactor, double extraFloorArea) {
        this.code = code;
        this.neighbourFactor = neighbourFactor;
        this.extraFloorArea = extraFloorArea;
    }

    @Override
    public int code() {
        return code;
    }

    public double neighbourFactor() {
        return neighbourFactor;
    }

    /**
     * @return area added to the living area per floor before applying the facade ratio [m2]
     */
    public double extraFloorArea() {
        return extraFloorArea;
    }

    public static NeighbourBuildings fromCode(Integer code) {
        return EstimationTables.lookup(NeighbourBuildings.class, code, "neighbourBuildings");
    }
}
