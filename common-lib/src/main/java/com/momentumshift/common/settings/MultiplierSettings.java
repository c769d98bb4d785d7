package com.momentumshift.common.settings;

/**
 * Parameters of the staged context multiplier.
 *
 * <ul>
 *   <li>{@code rookie} ≥ {@code prime} ≥ {@code veteran} &gt; 0 – stage factors</li>
 *   <li>{@code formSlope} – amplification per unit of relative deficit below career average</li>
 *   <li>{@code formCap} – maximum form amplification</li>
 * </ul>
 */
public record MultiplierSettings(double rookie, double prime, double veteran, double formSlope, double formCap) {

    public MultiplierSettings {
        if (!(veteran > 0.0) || prime < veteran || rookie < prime) {
            throw new IllegalArgumentException("stage factors must satisfy rookie >= prime >= veteran > 0");
        }
        if (formSlope < 0.0 || formCap < 0.0) {
            throw new IllegalArgumentException("formSlope and formCap must be non-negative");
        }
    }
}
