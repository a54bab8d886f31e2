package com.archebuild.core.archetype;

import com.archebuild.core.TestDatabases;
import com.archebuild.core.building.BuildingElement;
import com.archebuild.core.building.InnerWall;
import com.archebuild.core.building.OuterWall;
import com.archebuild.core.building.StaticUseConditionsProvider;
import com.archebuild.core.building.ThermalZone;
import com.archebuild.core.building.UseConditions;
import com.archebuild.core.building.Window;
import com.archebuild.core.exception.ArchetypeGenerationException;
import com.archebuild.core.exception.TypeElementNotFoundException;
import com.archebuild.core.model.ElementCategory;
import com.archebuild.core.resolver.TypeElementResolver;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Tests for {@link SingleFamilyDwelling}.
 */
class SingleFamilyDwellingTest {

    private static final double EPS = 1e-9;

    private TypeElementResolver resolver;
    private StaticUseConditionsProvider useConditions;

    @BeforeEach
    void setUp() {
        resolver = new TypeElementResolver(TestDatabases.residential());
        useConditions = new StaticUseConditionsProvider();
    }

    @Test
    void generateArchetype_referenceDwelling_createsDefaultLayout() {
        SingleFamilyDwelling dwelling = dwelling(params(1990, 1, 120.0).build(), GenerationSettings.defaults());

        dwelling.generateArchetype();

        assertThat(dwelling.getThermalZones()).hasSize(1);
        ThermalZone zone = dwelling.getThermalZones().get(0);
        assertThat(zone.getName()).isEqualTo("SingleDwelling");
        assertThat(zone.getArea()).isCloseTo(120.0, within(EPS));
        assertThat(dwelling.getNetLeasedArea()).isCloseTo(120.0, within(EPS));
        assertThat(zone.getOuterWalls()).extracting(BuildingElement::getOrientation)
            .containsExactly(0.0, 90.0, 180.0, 270.0);
        assertThat(zone.getWindows()).hasSize(4);
        assertThat(zone.getRooftops()).singleElement()
            .satisfies(roof -> assertThat(roof.getOrientation()).isEqualTo(-1.0));
        assertThat(zone.getGroundFloors()).singleElement()
            .satisfies(ground -> assertThat(ground.getOrientation()).isEqualTo(-2.0));
        assertThat(zone.getInnerWalls()).hasSize(1);
    }

    @Test
    void generateArchetype_singleFloor_hasNoCeilingsOrFloors() {
        SingleFamilyDwelling dwelling = dwelling(params(1990, 1, 120.0).build(), GenerationSettings.defaults());

        dwelling.generateArchetype();

        ThermalZone zone = dwelling.getThermalZones().get(0);
        assertThat(zone.getCeilings()).isEmpty();
        assertThat(zone.getFloors()).isEmpty();
    }

    @Test
    void generateArchetype_twoFloors_addsCeilingAndFloorWithStoreyShare() {
        SingleFamilyDwelling dwelling = dwelling(params(1990, 2, 240.0).build(), GenerationSettings.defaults());

        dwelling.generateArchetype();

        ThermalZone zone = dwelling.getThermalZones().get(0);
        assertThat(zone.getCeilings()).singleElement()
            .satisfies(ceiling -> assertThat(ceiling.getArea()).isCloseTo(120.0, within(EPS)));
        assertThat(zone.getFloors()).singleElement()
            .satisfies(floor -> assertThat(floor.getArea()).isCloseTo(120.0, within(EPS)));
        assertThat(zone.getCeilings().get(0).getTypeElementKey()).isEqualTo("Ceiling_iwu_heavy");
    }

    @Test
    void generateArchetype_outerWallsAndWindows_shareTotalsPerOrientation() {
        SingleFamilyDwelling dwelling = dwelling(params(1990, 1, 120.0).build(), GenerationSettings.defaults());

        dwelling.generateArchetype();

        EnvelopeEstimate estimate = dwelling.getEstimate();
        ThermalZone zone = dwelling.getThermalZones().get(0);
        assertThat(zone.getOuterWalls())
            .allSatisfy(wall -> assertThat(wall.getArea()).isCloseTo(estimate.outerWallArea() / 4, within(EPS)));
        assertThat(zone.getWindows())
            .allSatisfy(window -> assertThat(window.getArea()).isCloseTo(6.0, within(EPS)));
        assertThat(zone.getOuterWalls().stream().mapToDouble(OuterWall::getArea).sum())
            .isCloseTo(estimate.outerWallArea(), within(1e-6));
        assertThat(zone.getWindows().stream().mapToDouble(Window::getArea).sum())
            .isCloseTo(estimate.windowArea(), within(1e-6));
        assertThat(zone.getRooftops().get(0).getArea()).isCloseTo(159.6, within(EPS));
        assertThat(zone.getGroundFloors().get(0).getArea()).isCloseTo(159.6, within(EPS));
        assertThat(dwelling.getOuterArea()).containsEntry(-1.0, estimate.roofArea());
        assertThat(dwelling.getWindowArea()).hasSize(4);
    }

    @Test
    void generateArchetype_innerWallAndVolume_followZoneAggregation() {
        SingleFamilyDwelling dwelling = dwelling(params(1990, 1, 120.0).build(), GenerationSettings.defaults());

        dwelling.generateArchetype();

        ThermalZone zone = dwelling.getThermalZones().get(0);
        // 120 / 36 rooms * (6 * 2.5 + 2 * 6 * 2.5)
        assertThat(zone.getInnerWalls().get(0).getArea()).isCloseTo(150.0, within(EPS));
        assertThat(zone.getVolume()).isCloseTo(300.0, within(EPS));
        assertThat(zone.getUseConditions().usage()).isEqualTo("Living");
    }

    @Test
    void generateArchetype_customUseConditions_changeInnerWallArea() {
        useConditions.with(new UseConditions("Living", 5.0, 4.0));
        SingleFamilyDwelling dwelling = dwelling(params(1990, 1, 120.0).build(), GenerationSettings.defaults());

        dwelling.generateArchetype();

        InnerWall wall = dwelling.getThermalZones().get(0).getInnerWalls().get(0);
        // 120 / 20 rooms * (5 * 2.5 + 2 * 4 * 2.5)
        assertThat(wall.getArea()).isCloseTo(195.0, within(EPS));
    }

    @Test
    void generateArchetype_resolvesByYear() {
        SingleFamilyDwelling old = dwelling(params(1900, 1, 120.0).build(), GenerationSettings.defaults());
        SingleFamilyDwelling recent = dwelling(params(1990, 1, 120.0).build(), GenerationSettings.defaults());

        old.generateArchetype();
        recent.generateArchetype();

        assertThat(old.getThermalZones().get(0).getOuterWalls())
            .allSatisfy(wall -> assertThat(wall.getTypeElementKey()).isEqualTo(TestDatabases.OLD_OUTER_WALL));
        assertThat(recent.getThermalZones().get(0).getOuterWalls())
            .allSatisfy(wall -> assertThat(wall.getTypeElementKey()).isEqualTo(TestDatabases.NEW_OUTER_WALL));
        assertThat(recent.getThermalZones().get(0).getWindows())
            .allSatisfy(window -> assertThat(window.getTypeElementKey()).isEqualTo(TestDatabases.DEFAULT_WINDOW));
    }

    @Test
    void generateArchetype_kfwLenient_usesTripleGlazingAndKeepsUnresolvedWalls() {
        SingleFamilyDwelling dwelling = dwelling(
            params(2015, 1, 120.0).constructionData("kfw_40").build(), GenerationSettings.defaults());

        dwelling.generateArchetype();

        ThermalZone zone = dwelling.getThermalZones().get(0);
        assertThat(zone.getWindows())
            .allSatisfy(window -> {
                assertThat(window.getTypeElementKey()).isEqualTo(TestDatabases.KFW_WINDOW);
                assertThat(window.getGValue()).isEqualTo(0.5);
            });
        assertThat(zone.getOuterWalls()).allSatisfy(wall -> {
            assertThat(wall.isResolved()).isFalse();
            assertThat(wall.getInnerConvection()).isNull();
            assertThat(wall.getArea()).isGreaterThan(0.0);
        });
    }

    @Test
    void generateArchetype_kfwStrict_throwsForUnresolvedElement() {
        SingleFamilyDwelling dwelling = dwelling(
            params(2015, 1, 120.0).constructionData("kfw_40").build(), GenerationSettings.strict());

        assertThatThrownBy(dwelling::generateArchetype)
            .isInstanceOf(TypeElementNotFoundException.class)
            .hasMessageContaining("OuterWall")
            .hasMessageContaining("kfw_40");
    }

    @Test
    void generateArchetype_zeroHeatedFloors_throws() {
        SingleFamilyDwelling dwelling = dwelling(params(1990, 0, 120.0).build(), GenerationSettings.defaults());

        assertThatThrownBy(dwelling::generateArchetype).isInstanceOf(ArchetypeGenerationException.class);
    }

    @Test
    void generateArchetype_twoZones_distributeByAreaShare() {
        SingleFamilyDwelling dwelling = dwelling(params(1990, 1, 120.0).build(), GenerationSettings.defaults());
        dwelling.setZoneDefinitions(List.of(
            ZoneDefinition.of("Living", 0.75, "Living"),
            new ZoneDefinition("Bed", 0.25, "Bed room", null, 3.0)));

        dwelling.generateArchetype();

        assertThat(dwelling.getNetLeasedArea()).isCloseTo(120.0, within(EPS));
        ThermalZone living = dwelling.getThermalZones().get(0);
        ThermalZone bed = dwelling.getThermalZones().get(1);
        double perOrientation = dwelling.getEstimate().outerWallArea() / 4;
        assertThat(living.getOuterWalls().get(0).getArea()).isCloseTo(0.75 * perOrientation, within(EPS));
        assertThat(bed.getOuterWalls().get(0).getArea()).isCloseTo(0.25 * perOrientation, within(EPS));
        assertThat(bed.getVolume()).isCloseTo(30.0 * 3.0, within(EPS));
        assertThat(living.getVolume()).isCloseTo(90.0 * 2.5, within(EPS));
    }

    @Test
    void generateArchetype_customWallPlacements_splitByPlacementCount() {
        SingleFamilyDwelling dwelling = dwelling(params(1990, 1, 120.0).build(), GenerationSettings.defaults());
        dwelling.setOuterWallPlacements(List.of(
            new ElementPlacement("Facade South", 90.0, 180.0),
            new ElementPlacement("Facade North", 90.0, 0.0)));

        dwelling.generateArchetype();

        ThermalZone zone = dwelling.getThermalZones().get(0);
        assertThat(zone.getOuterWalls()).hasSize(2)
            .allSatisfy(wall -> assertThat(wall.getArea())
                .isCloseTo(dwelling.getEstimate().outerWallArea() / 2, within(EPS)));
        assertThat(zone.getWindows()).hasSize(4);
    }

    @Test
    void generateArchetype_calledTwice_rebuildsInsteadOfAccumulating() {
        SingleFamilyDwelling dwelling = dwelling(params(1990, 2, 240.0).build(), GenerationSettings.defaults());

        dwelling.generateArchetype();
        dwelling.generateArchetype();

        assertThat(dwelling.getThermalZones()).hasSize(1);
        assertThat(dwelling.getNetLeasedArea()).isCloseTo(240.0, within(EPS));
        assertThat(dwelling.getThermalZones().get(0).getElements(ElementCategory.OUTER_WALL)).hasSize(4);
    }

    private SingleFamilyDwelling dwelling(ArchetypeParameters parameters, GenerationSettings settings) {
        return new SingleFamilyDwelling("House", parameters, resolver, useConditions, settings);
    }

    private static ArchetypeParameters.Builder params(int year, int floors, double area) {
        return ArchetypeParameters.builder()
            .yearOfConstruction(year)
            .numberOfFloors(floors)
            .heightOfFloors(2.5)
            .netLeasedArea(area);
    }
}
