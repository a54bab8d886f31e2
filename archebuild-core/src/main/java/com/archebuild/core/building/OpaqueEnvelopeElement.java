package com.archebuild.core.building;

import com.archebuild.core.model.ExchangeCoefficients;

/**
 * Opaque element separating a zone from ambient air; carries outer exchange
 * coefficients in addition to the inner ones.
 */
public abstract class OpaqueEnvelopeElement extends BuildingElement {

    private Double outerRadiation;
    private Double outerConvection;

    @Override
    protected void applyCoefficients(ExchangeCoefficients coefficients) {
        super.applyCoefficients(coefficients);
        this.outerRadiation = coefficients.outerRadiation();
        this.outerConvection = coefficients.outerConvection();
    }

    public Double getOuterRadiation() {
        return outerRadiation;
    }

    public Double getOuterConvection() {
        return outerConvection;
    }
}
