package com.archebuild.core.building;

import com.archebuild.core.model.AgeRange;
import com.archebuild.core.model.ElementCategory;
import com.archebuild.core.model.ExchangeCoefficients;
import com.archebuild.core.model.Layer;
import com.archebuild.core.model.TypeElementRecord;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Base class of all building elements (walls, windows, roofs, floors, ...).
 *
 * <p>An element carries three groups of data:</p>
 * <ul>
 *   <li><b>Construction</b> - ordered layers and heat exchange coefficients, populated
 *       from a type-element record by the resolver</li>
 *   <li><b>Geometry</b> - name, area, tilt and orientation, assigned by the archetype
 *       generator</li>
 *   <li><b>Provenance</b> - key, age range and construction type of the record the
 *       construction came from</li>
 * </ul>
 *
 * <p>Layer order is significant: the first layer is the inner face.
 *
 * <p>Each subclass declares its {@link ElementCategory} statically and decides which
 * coefficients it takes by overriding {@link #applyCoefficients(ExchangeCoefficients)}.
 */
public abstract class BuildingElement {

    private String name;
    private double area;
    private Double tilt;
    private Double orientation;

    private Double innerRadiation;
    private Double innerConvection;

    private String typeElementKey;
    private AgeRange ageRange;
    private String constructionType;

    private final List<Layer> layers = new ArrayList<>();

    /**
     * @return the database category this element type is resolved from by default
     */
    public abstract ElementCategory category();

    /**
     * Populates this element from a type-element record.
     *
     * <p>Replaces any previously assigned layers, copies the record's provenance and
     * applies its coefficients according to this element's coefficient profile.
     *
     * @param record resolved record
     * @param resolvedLayers layers built from the record, already in the requested order
     */
    public void assignTypeElement(TypeElementRecord record, List<Layer> resolvedLayers) {
        Objects.requireNonNull(record, "record must not be null");
        Objects.requireNonNull(resolvedLayers, "resolvedLayers must not be null");
        this.typeElementKey = record.key();
        this.ageRange = record.ageRange();
        this.constructionType = record.constructionType();
        applyCoefficients(record.coefficients());
        this.layers.clear();
        this.layers.addAll(resolvedLayers);
    }

    /**
     * Copies the coefficients this element type carries. The base implementation takes
     * the inner radiative and convective coefficients, which every element has.
     *
     * @param coefficients coefficients of the resolved record
     */
    protected void applyCoefficients(ExchangeCoefficients coefficients) {
        this.innerRadiation = coefficients.innerRadiation();
        this.innerConvection = coefficients.innerConvection();
    }

    /**
     * @return true once a type-element record has been assigned
     */
    public boolean isResolved() {
        return typeElementKey != null;
    }

    /**
     * @return sum of all layer thicknesses [m]
     */
    public double totalThickness() {
        return layers.stream().mapToDouble(Layer::thickness).sum();
    }

    /**
     * Checks whether this element faces the given orientation.
     *
     * @param value orientation in degrees, or one of the negative roof/ground markers
     * @return true if the element's orientation equals {@code value}
     */
    public boolean hasOrientation(double value) {
        return orientation != null && Double.compare(orientation, value) == 0;
    }

    public List<Layer> getLayers() {
        return Collections.unmodifiableList(layers);
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public double getArea() {
        return area;
    }

    public void setArea(double area) {
        this.area = area;
    }

    public Double getTilt() {
        return tilt;
    }

    public void setTilt(Double tilt) {
        this.tilt = tilt;
    }

    public Double getOrientation() {
        return orientation;
    }

    public void setOrientation(Double orientation) {
        this.orientation = orientation;
    }

    public Double getInnerRadiation() {
        return innerRadiation;
    }

    public Double getInnerConvection() {
        return innerConvection;
    }

    public String getTypeElementKey() {
        return typeElementKey;
    }

    public AgeRange getAgeRange() {
        return ageRange;
    }

    public String getConstructionType() {
        return constructionType;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[name=" + name + ", area=" + area
            + ", orientation=" + orientation + ", key=" + typeElementKey + "]";
    }
}
