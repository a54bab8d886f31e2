package com.archebuild.core.building;

import com.archebuild.core.model.ElementCategory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Thermally conditioned zone of a building.
 *
 * <p>Setting the zone area updates the net leased area of the parent building, so the
 * building's net leased area always equals the sum of its zone areas.
 *
 * <p>Floor count and height default to the parent building's values unless overridden
 * on the zone.
 */
public class ThermalZone {

    private final Building parent;
    private final String name;
    private final Map<ElementCategory, List<BuildingElement>> elements = new EnumMap<>(ElementCategory.class);

    private Double area;
    private Integer numberOfFloors;
    private Double heightOfFloors;
    private double volume;
    private UseConditions useConditions;

    ThermalZone(Building parent, String name) {
        this.parent = Objects.requireNonNull(parent, "parent must not be null");
        this.name = Objects.requireNonNull(name, "name must not be null");
    }

    /**
     * Adds a building element to this zone.
     *
     * @param element element to add
     * @param <T> element type
     * @return the added element
     */
    public <T extends BuildingElement> T addElement(T element) {
        Objects.requireNonNull(element, "element must not be null");
        elements.computeIfAbsent(element.category(), c -> new ArrayList<>()).add(element);
        return element;
    }

    /**
     * Returns the elements of one category in insertion order.
     *
     * @param category element category
     * @return unmodifiable list, empty if none
     */
    public List<BuildingElement> getElements(ElementCategory category) {
        return Collections.unmodifiableList(elements.getOrDefault(category, List.of()));
    }

    /**
     * @return all elements of this zone, grouped by category order
     */
    public List<BuildingElement> getAllElements() {
        return elements.values().stream()
            .flatMap(List::stream)
            .toList();
    }

    public List<OuterWall> getOuterWalls() {
        return typed(ElementCategory.OUTER_WALL, OuterWall.class);
    }

    public List<Window> getWindows() {
        return typed(ElementCategory.WINDOW, Window.class);
    }

    public List<Rooftop> getRooftops() {
        return typed(ElementCategory.ROOFTOP, Rooftop.class);
    }

    public List<GroundFloor> getGroundFloors() {
        return typed(ElementCategory.GROUND_FLOOR, GroundFloor.class);
    }

    public List<Door> getDoors() {
        return typed(ElementCategory.DOOR, Door.class);
    }

    public List<InnerWall> getInnerWalls() {
        return typed(ElementCategory.INNER_WALL, InnerWall.class);
    }

    public List<Ceiling> getCeilings() {
        return typed(ElementCategory.CEILING, Ceiling.class);
    }

    public List<Floor> getFloors() {
        return typed(ElementCategory.FLOOR, Floor.class);
    }

    private <T extends BuildingElement> List<T> typed(ElementCategory category, Class<T> type) {
        return elements.getOrDefault(category, List.of()).stream()
            .map(type::cast)
            .toList();
    }

    /**
     * Derives the areas of floors, ceilings and inner walls from the zone area.
     *
     * <p>Floors and ceilings get {@code (n - 1) / n} of the zone area for {@code n}
     * storeys. Inner walls are approximated from the number of typical rooms that fit
     * into the zone: {@code rooms * (L * h + 2 * W * h)} with typical room length
     * {@code L}, width {@code W} and floor height {@code h}.
     *
     * @throws IllegalStateException if area or use conditions are not set
     */
    public void setInnerWallArea() {
        if (area == null) {
            throw new IllegalStateException("Zone '" + name + "' has no area");
        }
        int floors = getEffectiveNumberOfFloors();
        double height = getEffectiveHeightOfFloors();

        double storeyShare = ((double) floors - 1) / floors;
        for (BuildingElement floor : getElements(ElementCategory.FLOOR)) {
            floor.setArea(storeyShare * area);
        }
        for (BuildingElement ceiling : getElements(ElementCategory.CEILING)) {
            ceiling.setArea(storeyShare * area);
        }

        List<BuildingElement> innerWalls = getElements(ElementCategory.INNER_WALL);
        if (innerWalls.isEmpty()) {
            return;
        }
        if (useConditions == null) {
            throw new IllegalStateException("Zone '" + name + "' has no use conditions");
        }
        double rooms = area / useConditions.typicalArea();
        double wallArea = rooms * (useConditions.typicalLength() * height
            + 2 * useConditions.typicalWidth() * height);
        for (BuildingElement wall : innerWalls) {
            wall.setArea(wallArea);
        }
    }

    /**
     * Derives the zone volume as zone area times floor height.
     */
    public void setVolumeZone() {
        if (area == null) {
            throw new IllegalStateException("Zone '" + name + "' has no area");
        }
        this.volume = area * getEffectiveHeightOfFloors();
    }

    public Building getParent() {
        return parent;
    }

    public String getName() {
        return name;
    }

    /**
     * @return zone area [m2], or 0 if not yet set
     */
    public double getArea() {
        return area == null ? 0.0 : area;
    }

    /**
     * Sets the zone area and moves the difference into the parent's net leased area.
     *
     * @param area zone area [m2]
     */
    public void setArea(double area) {
        double previous = this.area == null ? 0.0 : this.area;
        this.area = area;
        parent.adjustNetLeasedArea(area - previous);
    }

    public Integer getNumberOfFloors() {
        return numberOfFloors;
    }

    public void setNumberOfFloors(Integer numberOfFloors) {
        this.numberOfFloors = numberOfFloors;
    }

    public Double getHeightOfFloors() {
        return heightOfFloors;
    }

    public void setHeightOfFloors(Double heightOfFloors) {
        this.heightOfFloors = heightOfFloors;
    }

    /**
     * @return zone floor count, or the building's if not overridden
     */
    public int getEffectiveNumberOfFloors() {
        return numberOfFloors != null ? numberOfFloors : parent.getNumberOfFloors();
    }

    /**
     * @return zone floor height, or the building's if not overridden
     */
    public double getEffectiveHeightOfFloors() {
        return heightOfFloors != null ? heightOfFloors : parent.getHeightOfFloors();
    }

    public double getVolume() {
        return volume;
    }

    public UseConditions getUseConditions() {
        return useConditions;
    }

    public void setUseConditions(UseConditions useConditions) {
        this.useConditions = useConditions;
    }
}
