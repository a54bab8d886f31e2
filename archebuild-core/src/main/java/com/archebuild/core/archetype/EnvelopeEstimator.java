package com.archebuild.core.archetype;

import com.archebuild.core.exception.ArchetypeGenerationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Statistical estimation of envelope areas for single family dwellings, following the
 * IWU short procedure ("Kurzverfahren").
 *
 * <p>Stages, each depending on the ones before:</p>
 * <ol>
 *   <li>heated floors = cellar factor + floors + 0.75 * attic factor</li>
 *   <li>living area per floor = net leased area / heated floors</li>
 *   <li>ground floor area = 1.33 * living area per floor</li>
 *   <li>roof area = 1.0 * dormer factor * attic area-per-floor * living area per floor,
 *       falling back to attic area-per-roof * living area per floor when zero</li>
 *   <li>facade area = layout ratio * (living area per floor + neighbour extra area)</li>
 *   <li>window area = 0.2 * net leased area</li>
 *   <li>cellar wall area = 0.5 * cellar factor * facade area</li>
 *   <li>outer wall area = heated floors * facade area - cellar wall area - window area</li>
 * </ol>
 */
public final class EnvelopeEstimator {

    private static final Logger log = LoggerFactory.getLogger(EnvelopeEstimator.class);

    /** fW: share of an attic storey counted as living area */
    public static final double LIVING_AREA_FACTOR = 0.75;

    /** p_FB: ground floor area per living area per floor */
    public static final double BOTTOM_BUILDING_CLOSURE = 1.33;

    /** Roof area per attic area */
    public static final double UPPER_BUILDING_CLOSURE = 1.0;

    /** Window area per net leased area */
    public static final double WINDOW_AREA_FACTOR = 0.2;

    /** Share of the facade area below ground for a fully heated cellar */
    public static final double CELLAR_AREA_FACTOR = 0.5;

    private EnvelopeEstimator() {
        // Utility class
    }

    /**
     * Runs the estimation.
     *
     * @param parameters archetype inputs
     * @return estimated areas
     * @throws ArchetypeGenerationException if the effective heated floor count is zero
     */
    public static EnvelopeEstimate estimate(ArchetypeParameters parameters) {
        double netLeasedArea = parameters.netLeasedArea();
        double cellarFactor = parameters.cellar().heatedFactor();

        double heatedFloors = cellarFactor
            + parameters.numberOfFloors()
            + LIVING_AREA_FACTOR * parameters.attic().heatedFactor();
        if (heatedFloors == 0.0) {
            throw new ArchetypeGenerationException(
                "Effective number of heated floors is zero (numberOfFloors=" + parameters.numberOfFloors()
                    + ", cellar=" + parameters.cellar() + ", attic=" + parameters.attic()
                    + "); cannot derive living area per floor");
        }

        double livingAreaPerFloor = netLeasedArea / heatedFloors;
        double groundFloorArea = BOTTOM_BUILDING_CLOSURE * livingAreaPerFloor;

        double roofArea = UPPER_BUILDING_CLOSURE
            * parameters.dormer().roofFactor()
            * parameters.attic().areaPerFloor()
            * livingAreaPerFloor;
        double topFloorArea = parameters.attic().areaPerRoof() * livingAreaPerFloor;
        boolean roofFromTopFloor = false;
        if (roofArea == 0.0) {
            roofArea = topFloorArea;
            roofFromTopFloor = true;
        }

        double facadeArea = parameters.residentialLayout().facadeToFloorArea()
            * (livingAreaPerFloor + parameters.neighbourBuildings().extraFloorArea());
        double windowArea = WINDOW_AREA_FACTOR * netLeasedArea;
        double cellarWallArea = CELLAR_AREA_FACTOR * cellarFactor * facadeArea;
        double outerWallArea = heatedFloors * facadeArea - cellarWallArea - windowArea;

        if (outerWallArea < 0) {
            log.warn("Estimated outer wall area is negative ({} m2) for net leased area {} m2",
                outerWallArea, netLeasedArea);
        }

        EnvelopeEstimate estimate = new EnvelopeEstimate(
            netLeasedArea,
            heatedFloors,
            livingAreaPerFloor,
            groundFloorArea,
            roofArea,
            topFloorArea,
            facadeArea,
            windowArea,
            cellarWallArea,
            outerWallArea,
            roofFromTopFloor
        );
        log.debug("Envelope estimate: {}", estimate);
        return estimate;
    }
}
