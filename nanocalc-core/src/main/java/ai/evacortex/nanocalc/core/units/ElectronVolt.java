/*
 * NanoCalc — Nanoparticle Optics Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.nanocalc.core.units;

import ai.evacortex.nanocalc.core.constants.PhysicalConstants.Conversions;

/**
 * Energy in electron volts.
 */
public record ElectronVolt(double value) implements Comparable<ElectronVolt> {

    public ElectronVolt {
        Units.requireFinite(value, "eV");
    }

    public double toJoules() {
        return value * Conversions.EV_TO_J;
    }

    /**
     * Inverse of {@link Wavelength#toEnergy()}.
     *
     * @throws ArithmeticException if the energy is not positive
     */
    public Wavelength toWavelength() {
        Units.requirePositive(value, "Photon energy");
        return new Wavelength(Conversions.HC_EV_NM / value);
    }

    @Override
    public int compareTo(ElectronVolt other) {
        return Double.compare(value, other.value);
    }
}
