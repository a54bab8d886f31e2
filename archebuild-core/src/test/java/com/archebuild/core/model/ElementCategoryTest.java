package com.archebuild.core.model;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link ElementCategory} and {@link AgeRange}.
 */
class ElementCategoryTest {

    @ParameterizedTest
    @CsvSource({
        "OuterWall_iwu_heavy_0_1976, OUTER_WALL",
        "GroundFloor_kfw_40, GROUND_FLOOR",
        "Floor_iwu_light, FLOOR",
        "Window_dreifach, WINDOW",
        "InnerWall_x, INNER_WALL"
    })
    void fromKey_longestPrefixWins(String key, ElementCategory expected) {
        assertThat(ElementCategory.fromKey(key)).contains(expected);
    }

    @Test
    void fromKey_unknownPrefix_isEmpty() {
        assertThat(ElementCategory.fromKey("Chimney_1")).isEmpty();
        assertThat(ElementCategory.fromKey(null)).isEmpty();
    }

    @Test
    void fromPrefix_ignoresCase() {
        assertThat(ElementCategory.fromPrefix("rooftop")).contains(ElementCategory.ROOFTOP);
    }

    @Test
    void profile_groupsCategoriesByCoefficients() {
        assertThat(ElementCategory.DOOR.profile()).isEqualTo(CoefficientProfile.OPAQUE_ENVELOPE);
        assertThat(ElementCategory.WINDOW.profile()).isEqualTo(CoefficientProfile.WINDOW);
        assertThat(ElementCategory.CEILING.profile()).isEqualTo(CoefficientProfile.GENERIC);
    }

    @Test
    void ageRange_boundsAreInclusive() {
        AgeRange range = new AgeRange(1949, 1957);

        assertThat(range.contains(1949)).isTrue();
        assertThat(range.contains(1957)).isTrue();
        assertThat(range.contains(1958)).isFalse();
        assertThat(range.overlaps(new AgeRange(1957, 1968))).isTrue();
        assertThat(range.overlaps(new AgeRange(1958, 1968))).isFalse();
        assertThat(range).hasToString("[1949, 1957]");
    }
}
