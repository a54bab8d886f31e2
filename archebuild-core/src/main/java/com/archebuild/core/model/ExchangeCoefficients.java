package com.archebuild.core.model;

/**
 * Heat exchange coefficients stored with a type-element record.
 *
 * <p>Which values are present depends on the record's category; absent values are
 * {@code null}.
 *
 * @param innerRadiation inner radiative coefficient [W/(m2*K)]
 * @param innerConvection inner convective coefficient [W/(m2*K)]
 * @param outerRadiation outer radiative coefficient [W/(m2*K)]
 * @param outerConvection outer convective coefficient [W/(m2*K)]
 * @param gValue solar heat gain factor of a window
 * @param aConv convective fraction of heat transfer through a window
 * @param shadingGTotal total g-value of the shading device
 * @param shadingMaxIrr irradiation threshold at which shading closes [W/m2]
 */
public record ExchangeCoefficients(
    Double innerRadiation,
    Double innerConvection,
    Double outerRadiation,
    Double outerConvection,
    Double gValue,
    Double aConv,
    Double shadingGTotal,
    Double shadingMaxIrr
) {
    /**
     * Creates coefficients for categories that only carry inner exchange values.
     *
     * @param innerRadiation inner radiative coefficient
     * @param innerConvection inner convective coefficient
     * @return coefficients with all outer and window values unset
     */
    public static ExchangeCoefficients inner(double innerRadiation, double innerConvection) {
        return new ExchangeCoefficients(innerRadiation, innerConvection, null, null, null, null, null, null);
    }

    /**
     * Creates coefficients for opaque envelope elements.
     */
    public static ExchangeCoefficients opaque(double innerRadiation, double innerConvection,
                                              double outerRadiation, double outerConvection) {
        return new ExchangeCoefficients(innerRadiation, innerConvection, outerRadiation, outerConvection,
            null, null, null, null);
    }
}
