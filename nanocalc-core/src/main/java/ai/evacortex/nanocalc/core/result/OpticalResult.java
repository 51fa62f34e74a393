/*
 * NanoCalc — Nanoparticle Optics Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.nanocalc.core.result;

import java.util.Objects;

/**
 * Optical response of one particle at one wavelength.
 *
 * <p>Efficiencies are dimensionless, cross-sections are in nm² and relate to them through the
 * geometric area: {@code C = Q · πr²}. Energy conservation requires {@code Q_ext = Q_sca + Q_abs};
 * the record does not enforce it, {@link #checkConservation()} reports the deviation.</p>
 *
 * @param wavelength wavelength in nm
 * @param qSca       scattering efficiency
 * @param qAbs       absorption efficiency
 * @param qExt       extinction efficiency
 * @param cSca       scattering cross-section, nm²
 * @param cAbs       absorption cross-section, nm²
 * @param cExt       extinction cross-section, nm²
 * @param metadata   model diagnostics
 */
public record OpticalResult(double wavelength,
                            double qSca,
                            double qAbs,
                            double qExt,
                            double cSca,
                            double cAbs,
                            double cExt,
                            OpticalMetadata metadata) {

    public OpticalResult {
        Objects.requireNonNull(metadata, "metadata");
    }

    /**
     * @return |Q_ext − (Q_sca + Q_abs)|
     */
    public double checkConservation() {
        return Math.abs(qExt - (qSca + qAbs));
    }
}
