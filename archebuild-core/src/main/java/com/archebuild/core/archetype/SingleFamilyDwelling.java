package com.archebuild.core.archetype;

import com.archebuild.core.building.Building;
import com.archebuild.core.building.BuildingElement;
import com.archebuild.core.building.Ceiling;
import com.archebuild.core.building.Floor;
import com.archebuild.core.building.GroundFloor;
import com.archebuild.core.building.InnerWall;
import com.archebuild.core.building.OuterWall;
import com.archebuild.core.building.Rooftop;
import com.archebuild.core.building.ThermalZone;
import com.archebuild.core.building.UseConditionsProvider;
import com.archebuild.core.building.Window;
import com.archebuild.core.exception.TypeElementNotFoundException;
import com.archebuild.core.resolver.ResolutionResult;
import com.archebuild.core.resolver.TypeElementResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Single family dwelling archetype according to the IWU short procedure.
 *
 * <p>The default layout is one zone ({@code SingleDwelling}, 100 % of the net leased
 * area, usage {@code Living}) with four outer walls and four windows facing north, east,
 * south and west, one flat roof, one ground floor and one cumulated inner wall. Ceilings
 * and floors are added for buildings with more than one storey.
 *
 * <p>Attic, cellar, dormer, neighbour and layout settings only change areas. They do not
 * change the number, tilt or orientation of the generated elements.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * SingleFamilyDwelling dwelling = new SingleFamilyDwelling("House", params, resolver,
 *     new StaticUseConditionsProvider(), GenerationSettings.defaults());
 * dwelling.generateArchetype();
 * }</pre>
 *
 * <p>If generation throws, the instance is left partially assembled and must be discarded.
 */
public class SingleFamilyDwelling extends Building {

    private static final Logger log = LoggerFactory.getLogger(SingleFamilyDwelling.class);

    /** Window construction used for KfW efficiency standards */
    static final String KFW_WINDOW_CONSTRUCTION = "Waermeschutzverglasung, dreifach";

    /** Window construction used for all other construction data */
    static final String DEFAULT_WINDOW_CONSTRUCTION = "Kunststofffenster, Isolierverglasung";

    private final ArchetypeParameters parameters;
    private final TypeElementResolver resolver;
    private final UseConditionsProvider useConditionsProvider;
    private final GenerationSettings settings;

    private List<ZoneDefinition> zoneDefinitions = List.of(ZoneDefinition.of("SingleDwelling", 1.0, "Living"));

    private List<ElementPlacement> outerWallPlacements = List.of(
        new ElementPlacement("Exterior Facade North", 90.0, 0.0),
        new ElementPlacement("Exterior Facade East", 90.0, 90.0),
        new ElementPlacement("Exterior Facade South", 90.0, 180.0),
        new ElementPlacement("Exterior Facade West", 90.0, 270.0)
    );

    private List<ElementPlacement> windowPlacements = List.of(
        new ElementPlacement("Window Facade North", 90.0, 0.0),
        new ElementPlacement("Window Facade East", 90.0, 90.0),
        new ElementPlacement("Window Facade South", 90.0, 180.0),
        new ElementPlacement("Window Facade West", 90.0, 270.0)
    );

    private final List<ElementPlacement> roofPlacements =
        List.of(new ElementPlacement("Rooftop", 0.0, ElementPlacement.ROOF));
    private final List<ElementPlacement> groundFloorPlacements =
        List.of(new ElementPlacement("Ground Floor", 0.0, ElementPlacement.GROUND));
    private final List<ElementPlacement> innerWallPlacements =
        List.of(new ElementPlacement("InnerWall", 90.0, 0.0));
    private final List<ElementPlacement> ceilingPlacements =
        List.of(new ElementPlacement("Ceiling", 0.0, ElementPlacement.ROOF));
    private final List<ElementPlacement> floorPlacements =
        List.of(new ElementPlacement("Floor", 0.0, ElementPlacement.GROUND));

    private final Map<Double, Double> outerArea = new LinkedHashMap<>();
    private final Map<Double, Double> windowArea = new LinkedHashMap<>();
    private EnvelopeEstimate estimate;

    public SingleFamilyDwelling(String name,
                                ArchetypeParameters parameters,
                                TypeElementResolver resolver,
                                UseConditionsProvider useConditionsProvider,
                                GenerationSettings settings) {
        super(name,
            Objects.requireNonNull(parameters, "parameters must not be null").yearOfConstruction(),
            parameters.numberOfFloors(),
            parameters.heightOfFloors(),
            parameters.constructionData());
        this.parameters = parameters;
        this.resolver = Objects.requireNonNull(resolver, "resolver must not be null");
        this.useConditionsProvider = Objects.requireNonNull(useConditionsProvider, "useConditionsProvider must not be null");
        this.settings = settings != null ? settings : GenerationSettings.defaults();
    }

    /**
     * Generates zones and envelope elements from the archetype parameters.
     *
     * <p>Any zones from a previous run are discarded; the net leased area is rebuilt
     * from the new zone areas.
     *
     * @throws com.archebuild.core.exception.ArchetypeGenerationException if the effective
     *         heated floor count is zero
     * @throws TypeElementNotFoundException in strict mode, if an element cannot be resolved
     */
    public void generateArchetype() {
        double typeBuildingArea = parameters.netLeasedArea();
        clearThermalZones();
        outerArea.clear();
        windowArea.clear();

        log.info("Generating single family dwelling '{}' ({} m2, {} floors, {}, {})",
            getName(), typeBuildingArea, getNumberOfFloors(), getYearOfConstruction(), getConstructionData());

        estimate = EnvelopeEstimator.estimate(parameters);

        for (ZoneDefinition definition : zoneDefinitions) {
            ThermalZone zone = addThermalZone(definition.name());
            zone.setArea(typeBuildingArea * definition.areaFactor());
            if (definition.numberOfFloors() != null) {
                zone.setNumberOfFloors(definition.numberOfFloors());
            }
            if (definition.heightOfFloors() != null) {
                zone.setHeightOfFloors(definition.heightOfFloors());
            }
            zone.setUseConditions(useConditionsProvider.forUsage(definition.usage()));
        }

        String construction = getConstructionData().value();

        for (ElementPlacement placement : outerWallPlacements) {
            outerArea.put(placement.orientation(), estimate.outerWallArea() / outerWallPlacements.size());
            createInEveryZone(placement, OuterWall::new, construction);
        }

        String windowConstruction = getConstructionData().isKfw()
            ? KFW_WINDOW_CONSTRUCTION
            : DEFAULT_WINDOW_CONSTRUCTION;
        for (ElementPlacement placement : windowPlacements) {
            windowArea.put(placement.orientation(), estimate.windowArea() / windowPlacements.size());
            createInEveryZone(placement, Window::new, windowConstruction);
        }

        for (ElementPlacement placement : roofPlacements) {
            outerArea.put(placement.orientation(), estimate.roofArea());
            createInEveryZone(placement, Rooftop::new, construction);
        }

        for (ElementPlacement placement : groundFloorPlacements) {
            outerArea.put(placement.orientation(), estimate.groundFloorArea());
            createInEveryZone(placement, GroundFloor::new, construction);
        }

        for (ElementPlacement placement : innerWallPlacements) {
            createInEveryZone(placement, InnerWall::new, construction);
        }

        if (getNumberOfFloors() > 1) {
            for (ElementPlacement placement : ceilingPlacements) {
                createInEveryZone(placement, Ceiling::new, construction);
            }
            for (ElementPlacement placement : floorPlacements) {
                createInEveryZone(placement, Floor::new, construction);
            }
        }

        outerArea.forEach((orientation, area) -> setOuterWallArea(area, orientation));
        windowArea.forEach((orientation, area) -> setWindowArea(area, orientation));

        for (ThermalZone zone : getThermalZones()) {
            zone.setInnerWallArea();
            zone.setVolumeZone();
        }

        log.info("Generated '{}': {} zone(s), outer wall {} m2, windows {} m2, roof {} m2, ground floor {} m2",
            getName(), getThermalZones().size(), estimate.outerWallArea(), estimate.windowArea(),
            estimate.roofArea(), estimate.groundFloorArea());
    }

    private <T extends BuildingElement> void createInEveryZone(ElementPlacement placement, Supplier<T> factory,
                                                               String construction) {
        for (ThermalZone zone : getThermalZones()) {
            T element = factory.get();
            resolve(element, construction);
            element.setName(placement.name());
            element.setTilt(placement.tilt());
            element.setOrientation(placement.orientation());
            zone.addElement(element);
        }
    }

    private void resolve(BuildingElement element, String construction) {
        ResolutionResult result = resolver.resolve(element, getYearOfConstruction(), construction);
        if (result.isResolved()) {
            return;
        }
        if (settings.strictResolution()) {
            throw new TypeElementNotFoundException(
                "No type element found for " + result.describe() + " in building '" + getName() + "'");
        }
        log.warn("No type element found for {}; element of building '{}' keeps unset construction data",
            result.describe(), getName());
    }

    public ArchetypeParameters getParameters() {
        return parameters;
    }

    /**
     * @return estimate of the last generation, or null before {@link #generateArchetype()}
     */
    public EnvelopeEstimate getEstimate() {
        return estimate;
    }

    /**
     * @return envelope area per orientation of the last generation (walls, roof, ground)
     */
    public Map<Double, Double> getOuterArea() {
        return Collections.unmodifiableMap(outerArea);
    }

    /**
     * @return window area per orientation of the last generation
     */
    public Map<Double, Double> getWindowArea() {
        return Collections.unmodifiableMap(windowArea);
    }

    public List<ZoneDefinition> getZoneDefinitions() {
        return zoneDefinitions;
    }

    public void setZoneDefinitions(List<ZoneDefinition> zoneDefinitions) {
        this.zoneDefinitions = List.copyOf(zoneDefinitions);
    }

    public List<ElementPlacement> getOuterWallPlacements() {
        return outerWallPlacements;
    }

    public void setOuterWallPlacements(List<ElementPlacement> outerWallPlacements) {
        this.outerWallPlacements = List.copyOf(outerWallPlacements);
    }

    public List<ElementPlacement> getWindowPlacements() {
        return windowPlacements;
    }

    public void setWindowPlacements(List<ElementPlacement> windowPlacements) {
        this.windowPlacements = List.copyOf(windowPlacements);
    }
}
