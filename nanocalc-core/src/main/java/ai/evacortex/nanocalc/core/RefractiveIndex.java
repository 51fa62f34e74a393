/*
 * NanoCalc — Nanoparticle Optics Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.nanocalc.core;

import ai.evacortex.nanocalc.core.math.Complex;

import java.util.Locale;

/**
 * Complex refractive index ñ = n + ik.
 *
 * <p>{@code n} is the phase-velocity factor, {@code k} the extinction coefficient.
 * Physical materials have {@code k ≥ 0}; the type does not enforce it, model validation does.</p>
 */
public record RefractiveIndex(double real, double imaginary) {

    public RefractiveIndex {
        if (!Double.isFinite(real) || !Double.isFinite(imaginary)) {
            throw new IllegalArgumentException("Refractive index parts must be finite: " + real + ", " + imaginary);
        }
    }

    public Complex toComplex() {
        return new Complex(real, imaginary);
    }

    /**
     * Relative permittivity ε = ñ².
     */
    public Complex toPermittivity() {
        return toComplex().square();
    }

    /**
     * Relative index m = ñ / n_medium for a non-absorbing host.
     *
     * @throws ArithmeticException if {@code mediumIndex} is zero
     */
    public Complex relativeTo(double mediumIndex) {
        return toComplex().divide(mediumIndex);
    }

    @Override
    public String toString() {
        return String.format(Locale.ROOT, "%.4f + %.4fi", real, imaginary);
    }
}
