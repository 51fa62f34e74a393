/*
 * NanoCalc — Nanoparticle Optics Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.nanocalc.core.units;

import ai.evacortex.nanocalc.core.constants.PhysicalConstants;
import ai.evacortex.nanocalc.core.constants.PhysicalConstants.Conversions;

/**
 * Vacuum wavelength in nanometers.
 *
 * <p>Photon conversions:</p>
 * <pre>
 *     E = h·c / λ      (eV, with h·c in eV·nm)
 *     f = c / λ        (Hz, with c in nm/s)
 * </pre>
 */
public record Wavelength(double nanometers) implements Comparable<Wavelength> {

    public Wavelength {
        Units.requireFinite(nanometers, "wavelength nm");
    }

    /**
     * @return photon energy
     * @throws ArithmeticException if the wavelength is not positive
     */
    public ElectronVolt toEnergy() {
        Units.requirePositive(nanometers, "Wavelength");
        return new ElectronVolt(Conversions.HC_EV_NM / nanometers);
    }

    /**
     * @return optical frequency in Hz
     * @throws ArithmeticException if the wavelength is not positive
     */
    public double toFrequencyHz() {
        Units.requirePositive(nanometers, "Wavelength");
        return PhysicalConstants.C_NM_S / nanometers;
    }

    @Override
    public int compareTo(Wavelength other) {
        return Double.compare(nanometers, other.nanometers);
    }
}
