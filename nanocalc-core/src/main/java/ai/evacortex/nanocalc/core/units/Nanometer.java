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
 * Length in nanometers.
 */
public record Nanometer(double value) implements Comparable<Nanometer> {

    public Nanometer {
        Units.requireFinite(value, "nm");
    }

    public double toMeters() {
        return value * Conversions.NM_TO_M;
    }

    public Micrometer toMicrometers() {
        return new Micrometer(value / Conversions.NM_PER_UM);
    }

    @Override
    public int compareTo(Nanometer other) {
        return Double.compare(value, other.value);
    }
}
