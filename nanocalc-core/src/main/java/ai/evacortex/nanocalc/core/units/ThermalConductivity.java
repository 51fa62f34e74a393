/*
 * NanoCalc — Nanoparticle Optics Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.nanocalc.core.units;

/**
 * Thermal conductivity in W/(m·K).
 */
public record ThermalConductivity(double value) implements Comparable<ThermalConductivity> {

    public ThermalConductivity {
        Units.requireFinite(value, "W/(m·K)");
    }

    @Override
    public int compareTo(ThermalConductivity other) {
        return Double.compare(value, other.value);
    }
}
