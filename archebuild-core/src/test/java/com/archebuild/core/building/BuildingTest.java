package com.archebuild.core.building;

import com.archebuild.core.exception.ArchetypeGenerationException;
import com.archebuild.core.model.ConstructionData;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Tests for {@link Building} and {@link ThermalZone}.
 */
class BuildingTest {

    private Building building;

    @BeforeEach
    void setUp() {
        building = new Building("Test", 1970, 2, 3.0, ConstructionData.IWU_HEAVY);
    }

    @Test
    void setArea_zones_accumulateIntoNetLeasedArea() {
        ThermalZone first = building.addThermalZone("A");
        ThermalZone second = building.addThermalZone("B");

        first.setArea(60.0);
        second.setArea(40.0);
        first.setArea(50.0);

        assertThat(building.getNetLeasedArea()).isCloseTo(90.0, within(1e-9));
    }

    @Test
    void setOuterWallArea_matchesOrientationOnly() {
        ThermalZone zone = building.addThermalZone("A");
        zone.setArea(100.0);
        OuterWall south = facing(new OuterWall(), 180.0);
        OuterWall north = facing(new OuterWall(), 0.0);
        Rooftop roof = facing(new Rooftop(), -1.0);
        Ceiling ceiling = facing(new Ceiling(), -1.0);
        zone.addElement(south);
        zone.addElement(north);
        zone.addElement(roof);
        zone.addElement(ceiling);

        building.setOuterWallArea(25.0, 180.0);
        building.setOuterWallArea(80.0, -1.0);

        assertThat(south.getArea()).isEqualTo(25.0);
        assertThat(north.getArea()).isEqualTo(0.0);
        assertThat(roof.getArea()).isEqualTo(80.0);
        assertThat(ceiling.getArea()).isEqualTo(0.0);
    }

    @Test
    void setWindowArea_splitsByZoneShare() {
        ThermalZone large = building.addThermalZone("Large");
        ThermalZone small = building.addThermalZone("Small");
        large.setArea(80.0);
        small.setArea(20.0);
        Window largeWindow = large.addElement(facing(new Window(), 90.0));
        Window smallWindow = small.addElement(facing(new Window(), 90.0));

        building.setWindowArea(10.0, 90.0);

        assertThat(largeWindow.getArea()).isCloseTo(8.0, within(1e-9));
        assertThat(smallWindow.getArea()).isCloseTo(2.0, within(1e-9));
    }

    @Test
    void setOuterWallArea_withoutNetLeasedArea_throws() {
        building.addThermalZone("Empty").addElement(facing(new OuterWall(), 0.0));

        assertThatThrownBy(() -> building.setOuterWallArea(10.0, 0.0))
            .isInstanceOf(ArchetypeGenerationException.class)
            .hasMessageContaining("net leased area");
    }

    @Test
    void setInnerWallArea_zoneFloorOverride_changesStoreyShare() {
        ThermalZone zone = building.addThermalZone("A");
        zone.setArea(90.0);
        zone.setNumberOfFloors(3);
        zone.setUseConditions(new UseConditions("Office", 6.0, 6.0));
        Floor floor = zone.addElement(new Floor());

        zone.setInnerWallArea();

        assertThat(floor.getArea()).isCloseTo(60.0, within(1e-9));
    }

    @Test
    void setInnerWallArea_withoutUseConditions_throws() {
        ThermalZone zone = building.addThermalZone("A");
        zone.setArea(90.0);
        zone.addElement(new InnerWall());

        assertThatThrownBy(zone::setInnerWallArea)
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("use conditions");
    }

    @Test
    void setVolumeZone_usesBuildingHeightUnlessOverridden() {
        ThermalZone zone = building.addThermalZone("A");
        zone.setArea(50.0);

        zone.setVolumeZone();
        assertThat(zone.getVolume()).isCloseTo(150.0, within(1e-9));

        zone.setHeightOfFloors(2.0);
        zone.setVolumeZone();
        assertThat(zone.getVolume()).isCloseTo(100.0, within(1e-9));
    }

    @Test
    void getOuterWalls_returnsOnlyThatCategory() {
        ThermalZone zone = building.addThermalZone("A");
        zone.addElement(new OuterWall());
        zone.addElement(new Window());
        zone.addElement(new GroundFloor());

        assertThat(zone.getOuterWalls()).hasSize(1);
        assertThat(zone.getAllElements()).hasSize(3);
        assertThat(zone.getDoors()).isEmpty();
    }

    @Test
    void getAllElements_returnsReadOnlyView() {
        ThermalZone zone = building.addThermalZone("A");
        zone.addElement(new OuterWall());

        assertThatThrownBy(() -> zone.getAllElements().add(new Window()))
            .isInstanceOf(UnsupportedOperationException.class);
        assertThatThrownBy(() -> zone.getOuterWalls().clear())
            .isInstanceOf(UnsupportedOperationException.class);
    }

    private static <T extends BuildingElement> T facing(T element, double orientation) {
        element.setOrientation(orientation);
        return element;
    }
}
