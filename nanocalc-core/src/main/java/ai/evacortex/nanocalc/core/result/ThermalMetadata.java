/*
 * NanoCalc — Nanoparticle Optics Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.nanocalc.core.result;

import java.util.List;

/**
 * @param sizeToMfpRatio     d / λ_mfp, {@code null} if not computed
 * @param dominantMechanism  dominant phonon scattering mechanism, {@code null} if unknown
 * @param notes              model-specific remarks
 */
public record ThermalMetadata(Double sizeToMfpRatio, String dominantMechanism, List<String> notes) {

    public ThermalMetadata {
        notes = notes == null ? List.of() : List.copyOf(notes);
    }

    public static ThermalMetadata empty() {
        return new ThermalMetadata(null, null, List.of());
    }
}
