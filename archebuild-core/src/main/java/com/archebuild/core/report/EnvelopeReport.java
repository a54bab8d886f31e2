package com.archebuild.core.report;

import com.archebuild.core.archetype.EnvelopeEstimate;
import com.archebuild.core.archetype.SingleFamilyDwelling;
import com.archebuild.core.building.Building;
import com.archebuild.core.building.BuildingElement;
import com.archebuild.core.building.OpaqueEnvelopeElement;
import com.archebuild.core.building.ThermalZone;
import com.archebuild.core.building.Window;
import com.archebuild.core.model.ElementCategory;
import com.archebuild.core.model.Layer;

import java.util.List;
import java.util.Objects;

/**
 * Immutable snapshot of a generated building, used as input for report generators.
 *
 * <p>Taking the snapshot copies every value, so later changes to the building do not
 * affect the report.
 *
 * @param buildingName building name
 * @param yearOfConstruction year of first construction
 * @param constructionData construction data tag
 * @param numberOfFloors storeys above ground
 * @param heightOfFloors average storey height [m]
 * @param netLeasedArea sum of the zone areas [m2]
 * @param estimate envelope estimate, or null for buildings not generated from an archetype
 * @param zones zone snapshots
 */
public record EnvelopeReport(
    String buildingName,
    int yearOfConstruction,
    String constructionData,
    int numberOfFloors,
    double heightOfFloors,
    double netLeasedArea,
    EnvelopeEstimate estimate,
    List<ZoneReport> zones
) {
    public EnvelopeReport {
        Objects.requireNonNull(buildingName, "buildingName must not be null");
        Objects.requireNonNull(constructionData, "constructionData must not be null");
        zones = zones != null ? List.copyOf(zones) : List.of();
    }

    /**
     * Takes a snapshot of a building.
     *
     * @param building building to report
     * @return report snapshot
     */
    public static EnvelopeReport from(Building building) {
        Objects.requireNonNull(building, "building must not be null");
        EnvelopeEstimate estimate = building instanceof SingleFamilyDwelling dwelling
            ? dwelling.getEstimate()
            : null;
        List<ZoneReport> zones = building.getThermalZones().stream()
            .map(ZoneReport::from)
            .toList();
        return new EnvelopeReport(
            building.getName(),
            building.getYearOfConstruction(),
            building.getConstructionData().value(),
            building.getNumberOfFloors(),
            building.getHeightOfFloors(),
            building.getNetLeasedArea(),
            estimate,
            zones
        );
    }

    /**
     * @return number of elements over all zones
     */
    public int elementCount() {
        return zones.stream().mapToInt(zone -> zone.elements().size()).sum();
    }

    /**
     * @return number of elements without type-element data
     */
    public long unresolvedCount() {
        return zones.stream()
            .flatMap(zone -> zone.elements().stream())
            .filter(element -> element.typeElementKey() == null)
            .count();
    }

    /**
     * Zone snapshot.
     *
     * @param name zone name
     * @param area zone area [m2]
     * @param volume zone volume [m3]
     * @param numberOfFloors effective floor count
     * @param heightOfFloors effective floor height [m]
     * @param usage usage name, or null without use conditions
     * @param elements element snapshots in category order
     */
    public record ZoneReport(
        String name,
        double area,
        double volume,
        int numberOfFloors,
        double heightOfFloors,
        String usage,
        List<ElementReport> elements
    ) {
        public ZoneReport {
            Objects.requireNonNull(name, "name must not be null");
            elements = elements != null ? List.copyOf(elements) : List.of();
        }

        static ZoneReport from(ThermalZone zone) {
            return new ZoneReport(
                zone.getName(),
                zone.getArea(),
                zone.getVolume(),
                zone.getEffectiveNumberOfFloors(),
                zone.getEffectiveHeightOfFloors(),
                zone.getUseConditions() != null ? zone.getUseConditions().usage() : null,
                zone.getAllElements().stream().map(ElementReport::from).toList()
            );
        }
    }

    /**
     * Element snapshot. Coefficients that do not apply to the element's category are null.
     *
     * @param category element category
     * @param name element name
     * @param area element area [m2]
     * @param tilt tilt [deg]
     * @param orientation orientation [deg], -1 roof, -2 ground
     * @param typeElementKey key of the applied record, null if unresolved
     * @param constructionType construction type of the applied record
     * @param innerRadiation inner radiative coefficient [W/(m2K)]
     * @param innerConvection inner convective coefficient [W/(m2K)]
     * @param outerRadiation outer radiative coefficient [W/(m2K)]
     * @param outerConvection outer convective coefficient [W/(m2K)]
     * @param gValue total solar energy transmittance of windows
     * @param totalThickness sum of layer thicknesses [m]
     * @param layers layer snapshots, inside to outside
     */
    public record ElementReport(
        ElementCategory category,
        String name,
        double area,
        Double tilt,
        Double orientation,
        String typeElementKey,
        String constructionType,
        Double innerRadiation,
        Double innerConvection,
        Double outerRadiation,
        Double outerConvection,
        Double gValue,
        double totalThickness,
        List<LayerReport> layers
    ) {
        public ElementReport {
            Objects.requireNonNull(category, "category must not be null");
            layers = layers != null ? List.copyOf(layers) : List.of();
        }

        static ElementReport from(BuildingElement element) {
            Double outerRadiation = null;
            Double outerConvection = null;
            Double gValue = null;
            if (element instanceof OpaqueEnvelopeElement opaque) {
                outerRadiation = opaque.getOuterRadiation();
                outerConvection = opaque.getOuterConvection();
            } else if (element instanceof Window window) {
                outerRadiation = window.getOuterRadiation();
                outerConvection = window.getOuterConvection();
                gValue = window.getGValue();
            }
            return new ElementReport(
                element.category(),
                element.getName(),
                element.getArea(),
                element.getTilt(),
                element.getOrientation(),
                element.getTypeElementKey(),
                element.getConstructionType(),
                element.getInnerRadiation(),
                element.getInnerConvection(),
                outerRadiation,
                outerConvection,
                gValue,
                element.totalThickness(),
                element.getLayers().stream().map(LayerReport::from).toList()
            );
        }
    }

    /**
     * Layer snapshot.
     *
     * @param id layer id
     * @param thickness thickness [m]
     * @param materialId material id
     * @param materialName material name
     * @param density density [kg/m3]
     * @param thermalConductivity thermal conductivity [W/(mK)]
     * @param heatCapacity specific heat capacity [kJ/(kgK)]
     */
    public record LayerReport(
        String id,
        double thickness,
        String materialId,
        String materialName,
        double density,
        double thermalConductivity,
        double heatCapacity
    ) {
        static LayerReport from(Layer layer) {
            return new LayerReport(
                layer.id(),
                layer.thickness(),
                layer.material().materialId(),
                layer.material().name(),
                layer.material().density(),
                layer.material().thermalConductivity(),
                layer.material().heatCapacity()
            );
        }
    }
}
