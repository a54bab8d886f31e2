package com.archebuild.core.archetype;

/**
 * Intermediate and final areas of the archetype envelope estimation.
 *
 * @param netLeasedArea input net leased area [m2]
 * @param heatedFloors effective number of heated floors, including fractional cellar/attic shares
 * @param livingAreaPerFloor living area per heated floor [m2]
 * @param groundFloorArea ground floor area [m2]
 * @param roofArea roof area, after top floor fallback [m2]
 * @param topFloorArea top floor area used as roof fallback [m2]
 * @param facadeArea facade area per heated floor [m2]
 * @param windowArea total window area [m2]
 * @param cellarWallArea heated cellar wall area [m2]
 * @param outerWallArea total opaque outer wall area [m2]; may be negative for extreme inputs
 * @param roofFromTopFloor true if the roof term was zero and the top floor area was used
 */
public record EnvelopeEstimate(
    double netLeasedArea,
    double heatedFloors,
    double livingAreaPerFloor,
    double groundFloorArea,
    double roofArea,
    double topFloorArea,
    double facadeArea,
    double windowArea,
    double cellarWallArea,
    double outerWallArea,
    boolean roofFromTopFloor
) {
}
