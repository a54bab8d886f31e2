package com.archebuild.core.building;

import com.archebuild.core.exception.ArchetypeGenerationException;
import com.archebuild.core.model.ConstructionData;
import com.archebuild.core.model.ElementCategory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Building made of thermal zones and their envelope elements.
 *
 * <p>The net leased area is not set directly: it accumulates the areas of all zones
 * (see {@link ThermalZone#setArea(double)}). Archetype generators snapshot the
 * requested area, reset the accumulator and rebuild it from their zones.
 */
public class Building {

    private static final Set<ElementCategory> OUTER_AREA_CATEGORIES = EnumSet.of(
        ElementCategory.OUTER_WALL,
        ElementCategory.ROOFTOP,
        ElementCategory.GROUND_FLOOR,
        ElementCategory.DOOR
    );

    private final String name;
    private final int yearOfConstruction;
    private final int numberOfFloors;
    private final double heightOfFloors;
    private final ConstructionData constructionData;
    private final List<ThermalZone> thermalZones = new ArrayList<>();

    private double netLeasedArea;

    /**
     * Creates a building without zones.
     *
     * @param name building name
     * @param yearOfConstruction year of first construction
     * @param numberOfFloors storeys above ground
     * @param heightOfFloors average storey height [m]
     * @param constructionData construction data set the envelope is built from
     */
    public Building(String name, int yearOfConstruction, int numberOfFloors, double heightOfFloors,
                    ConstructionData constructionData) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.constructionData = Objects.requireNonNull(constructionData, "constructionData must not be null");
        this.yearOfConstruction = yearOfConstruction;
        this.numberOfFloors = numberOfFloors;
        this.heightOfFloors = heightOfFloors;
    }

    /**
     * Creates and registers a new thermal zone.
     *
     * @param zoneName zone name
     * @return the new zone, without area
     */
    public ThermalZone addThermalZone(String zoneName) {
        ThermalZone zone = new ThermalZone(this, zoneName);
        thermalZones.add(zone);
        return zone;
    }

    /**
     * Removes all zones and resets the net leased area to zero.
     */
    protected void clearThermalZones() {
        thermalZones.clear();
        netLeasedArea = 0.0;
    }

    void adjustNetLeasedArea(double delta) {
        netLeasedArea += delta;
    }

    /**
     * Distributes an envelope area over all outer walls, rooftops, ground floors and
     * doors facing the given orientation.
     *
     * <p>Each zone gets the share of its area in the building's net leased area.
     *
     * @param area total area for this orientation [m2]
     * @param orientation orientation in degrees, {@code -1} for roofs, {@code -2} for ground
     * @throws ArchetypeGenerationException if the net leased area is zero
     */
    public void setOuterWallArea(double area, double orientation) {
        distributeArea(area, orientation, OUTER_AREA_CATEGORIES);
    }

    /**
     * Distributes a window area over all windows facing the given orientation.
     *
     * @param area total window area for this orientation [m2]
     * @param orientation orientation in degrees
     * @throws ArchetypeGenerationException if the net leased area is zero
     */
    public void setWindowArea(double area, double orientation) {
        distributeArea(area, orientation, EnumSet.of(ElementCategory.WINDOW));
    }

    private void distributeArea(double area, double orientation, Set<ElementCategory> categories) {
        if (netLeasedArea == 0.0) {
            throw new ArchetypeGenerationException(
                "Cannot distribute envelope area of building '" + name + "': net leased area is zero");
        }
        for (ThermalZone zone : thermalZones) {
            double share = zone.getArea() / netLeasedArea;
            for (ElementCategory category : categories) {
                for (BuildingElement element : zone.getElements(category)) {
                    if (element.hasOrientation(orientation)) {
                        element.setArea(area * share);
                    }
                }
            }
        }
    }

    public String getName() {
        return name;
    }

    public int getYearOfConstruction() {
        return yearOfConstruction;
    }

    public int getNumberOfFloors() {
        return numberOfFloors;
    }

    public double getHeightOfFloors() {
        return heightOfFloors;
    }

    public ConstructionData getConstructionData() {
        return constructionData;
    }

    /**
     * @return sum of all zone areas [m2]
     */
    public double getNetLeasedArea() {
        return netLeasedArea;
    }

    public List<ThermalZone> getThermalZones() {
        return Collections.unmodifiableList(thermalZones);
    }
}
