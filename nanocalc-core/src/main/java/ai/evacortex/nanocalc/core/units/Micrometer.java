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
 * Length in micrometers.
 */
public record Micrometer(double value) implements Comparable<Micrometer> {

    public Micrometer {
        Units.requireFinite(value, "µm");
    }

    public Nanometer toNanometers() {
        return new Nanometer(value * Conversions.NM_PER_UM);
    }

    @Override
    public int compareTo(Micrometer other) {
        return Double.compare(value, other.value);
    }
}
