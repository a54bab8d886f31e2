package com.archebuild.core.archetype;

import com.archebuild.core.exception.ArchetypeGenerationException;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Tests for {@link EnvelopeEstimator}.
 */
class EnvelopeEstimatorTest {

    private static final double EPS = 1e-9;

    @Test
    void estimate_referenceDwelling_matchesShortProcedure() {
        EnvelopeEstimate estimate = EnvelopeEstimator.estimate(params(1, 120.0).build());

        assertThat(estimate.heatedFloors()).isCloseTo(1.0, within(EPS));
        assertThat(estimate.livingAreaPerFloor()).isCloseTo(120.0, within(EPS));
        assertThat(estimate.groundFloorArea()).isCloseTo(159.6, within(EPS));
        assertThat(estimate.roofArea()).isCloseTo(159.6, within(EPS));
        assertThat(estimate.windowArea()).isCloseTo(24.0, within(EPS));
        assertThat(estimate.facadeArea()).isCloseTo(112.2, within(EPS));
        assertThat(estimate.cellarWallArea()).isCloseTo(0.0, within(EPS));
        assertThat(estimate.outerWallArea()).isCloseTo(88.2, within(EPS));
        assertThat(estimate.roofFromTopFloor()).isFalse();
    }

    @Test
    void estimate_heatedCellarAndPartlyHeatedAttic_usesAllFactors() {
        ArchetypeParameters parameters = params(2, 270.0)
            .residentialLayout(1)
            .neighbourBuildings(1)
            .attic(2)
            .cellar(3)
            .build();

        EnvelopeEstimate estimate = EnvelopeEstimator.estimate(parameters);

        assertThat(estimate.heatedFloors()).isCloseTo(3.375, within(EPS));
        assertThat(estimate.livingAreaPerFloor()).isCloseTo(80.0, within(EPS));
        assertThat(estimate.groundFloorArea()).isCloseTo(106.4, within(EPS));
        assertThat(estimate.roofArea()).isCloseTo(60.0, within(EPS));
        assertThat(estimate.topFloorArea()).isCloseTo(53.6, within(EPS));
        assertThat(estimate.facadeArea()).isCloseTo(88.0, within(EPS));
        assertThat(estimate.windowArea()).isCloseTo(54.0, within(EPS));
        assertThat(estimate.cellarWallArea()).isCloseTo(44.0, within(EPS));
        assertThat(estimate.outerWallArea()).isCloseTo(199.0, within(EPS));
    }

    @Test
    void estimate_nonHeatedAttic_fallsBackToTopFloorArea() {
        EnvelopeEstimate estimate = EnvelopeEstimator.estimate(params(1, 100.0).attic(1).build());

        assertThat(estimate.roofFromTopFloor()).isTrue();
        assertThat(estimate.roofArea()).isCloseTo(133.0, within(EPS));
        assertThat(estimate.roofArea()).isEqualTo(estimate.topFloorArea());
    }

    @Test
    void estimate_dormer_enlargesRoof() {
        EnvelopeEstimate estimate = EnvelopeEstimator.estimate(params(1, 120.0).dormer(1).build());

        assertThat(estimate.roofArea()).isCloseTo(1.3 * 159.6, within(EPS));
    }

    @Test
    void estimate_heatedAttic_addsThreeQuarterFloor() {
        EnvelopeEstimate estimate = EnvelopeEstimator.estimate(params(1, 175.0).attic(3).build());

        assertThat(estimate.heatedFloors()).isCloseTo(1.75, within(EPS));
        assertThat(estimate.livingAreaPerFloor()).isCloseTo(100.0, within(EPS));
    }

    @ParameterizedTest
    @CsvSource({
        "1, 120, 0, 0, 0",
        "2, 150, 1, 2, 1",
        "3, 310, 3, 3, 2",
        "0, 80, 3, 3, 0",
        "4, 455.5, 2, 1, 1"
    })
    void estimate_livingAreaTimesHeatedFloors_equalsNetLeasedArea(int floors, double area, int attic,
                                                                   int cellar, int neighbours) {
        EnvelopeEstimate estimate = EnvelopeEstimator.estimate(params(floors, area)
            .attic(attic)
            .cellar(cellar)
            .neighbourBuildings(neighbours)
            .build());

        assertThat(estimate.livingAreaPerFloor() * estimate.heatedFloors()).isCloseTo(area, within(1e-6));
    }

    @Test
    void estimate_zeroHeatedFloors_throws() {
        ArchetypeParameters parameters = params(0, 100.0).attic(1).cellar(1).build();

        assertThatThrownBy(() -> EnvelopeEstimator.estimate(parameters))
            .isInstanceOf(ArchetypeGenerationException.class)
            .hasMessageContaining("heated floors");
    }

    private static ArchetypeParameters.Builder params(int floors, double area) {
        return ArchetypeParameters.builder()
            .yearOfConstruction(1970)
            .numberOfFloors(floors)
            .heightOfFloors(2.5)
            .netLeasedArea(area);
    }
}
