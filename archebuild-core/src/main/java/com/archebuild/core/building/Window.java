package com.archebuild.core.building;

import com.archebuild.core.model.ElementCategory;
import com.archebuild.core.model.ExchangeCoefficients;

/**
 * Window in an exterior facade.
 *
 * <p>Besides inner and outer exchange coefficients a window carries its solar heat
 * gain factor, the convective fraction of its heat transfer and two shading parameters.
 */
public class Window extends BuildingElement {

    private Double outerRadiation;
    private Double outerConvection;
    private Double gValue;
    private Double aConv;
    private Double shadingGTotal;
    private Double shadingMaxIrr;

    @Override
    public ElementCategory category() {
        return ElementCategory.WINDOW;
    }

    @Override
    protected void applyCoefficients(ExchangeCoefficients coefficients) {
        super.applyCoefficients(coefficients);
        this.outerRadiation = coefficients.outerRadiation();
        this.outerConvection = coefficients.outerConvection();
        this.gValue = coefficients.gValue();
        this.aConv = coefficients.aConv();
        this.shadingGTotal = coefficients.shadingGTotal();
        this.shadingMaxIrr = coefficients.shadingMaxIrr();
    }

    public Double getOuterRadiation() {
        return outerRadiation;
    }

    public Double getOuterConvection() {
        return outerConvection;
    }

    public Double getGValue() {
        return gValue;
    }

    public Double getAConv() {
        return aConv;
    }

    public Double getShadingGTotal() {
        return shadingGTotal;
    }

    public Double getShadingMaxIrr() {
        return shadingMaxIrr;
    }
}
