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
 * Thermal transport estimate at one temperature.
 *
 * @param temperature      temperature in K
 * @param kappaEff         effective thermal conductivity, W/(m·K)
 * @param kappaBulk        bulk conductivity for comparison, W/(m·K)
 * @param reductionFactor  kappaEff / kappaBulk
 * @param mfp              phonon mean free path in nm, {@code null} if not computed
 * @param metadata         model diagnostics
 */
public record ThermalResult(double temperature,
                            double kappaEff,
                            double kappaBulk,
                            double reductionFactor,
                            Double mfp,
                            ThermalMetadata metadata) {

    public ThermalResult {
        Objects.requireNonNull(metadata, "metadata");
    }
}
