package com.archebuild.core.archetype;

/**
 * Design of the attic.
 *
 * <p>{@code areaPerFloor} scales the roof area from the living area per floor;
 * {@code areaPerRoof} gives the top floor area used when the roof term is zero.
 */
public enum AtticDesign implements ConfigurationCode {
    FLAT_ROOF(0, 0.0, 1.33, 0.0),
    NON_HEATED(1, 0.0, 0.0, 1.33),
    PARTLY_HEATED(2, 0.5, 0.75, 0.67),
    HEATED(3, 1.0, 1.5, 0.0);

    private final int code;
    private final double heatedFactor;
    private final double areaPerFloor;
    private final double areaPerRoof;

    AtticDesign(int code, double heatedFactor, double areaPerFloor, double areaPerRoof) {
        this.code = code;
        this.heatedFactor = heatedFactor;
        this.areaPerFloor = areaPerFloor;
        this.areaPerRoof = areaPerRoof;
    }

    @Override
    public int code() {
        return code;
    }

    public double heatedFactor() {
        return heatedFactor;
    }

    public double areaPerFloor() {
        return areaPerFloor;
    }

    public double areaPerRoof() {
        return areaPerRoof;
    }

    public static AtticDesign fromCode(Integer code) {
        return EstimationTables.lookup(AtticDesign.class, code, "attic");
    }
}
