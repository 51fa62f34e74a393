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
 * Absolute temperature.
 */
public record Kelvin(double value) implements Comparable<Kelvin> {

    public Kelvin {
        Units.requireFinite(value, "K");
    }

    public double toCelsius() {
        return value - Conversions.KELVIN_CELSIUS_OFFSET;
    }

    public static Kelvin fromCelsius(double celsius) {
        return new Kelvin(celsius + Conversions.KELVIN_CELSIUS_OFFSET);
    }

    @Override
    public int compareTo(Kelvin other) {
        return Double.compare(value, other.value);
    }
}
