/*
 * NanoCalc — Nanoparticle Optics Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.nanocalc.core.units;

final class Units {

    private Units() {}

    static double requireFinite(double value, String unit) {
        if (!Double.isFinite(value)) {
            throw new IllegalArgumentException("Non-finite " + unit + " value: " + value);
        }
        return value;
    }

    static double requirePositive(double value, String what) {
        if (!(value > 0.0)) {
            throw new ArithmeticException(what + " must be positive for this conversion: " + value);
        }
        return value;
    }
}
