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
 * Diagnostics attached to an {@link OpticalResult}.
 *
 * @param numTerms       number of multipole terms summed, {@code null} when the model has no series
 * @param converged      whether the series (if any) converged
 * @param sizeParameter  x = 2πr/λ
 * @param notes          model-specific remarks
 */
public record OpticalMetadata(Integer numTerms, boolean converged, double sizeParameter, List<String> notes) {

    public OpticalMetadata {
        notes = notes == null ? List.of() : List.copyOf(notes);
    }

    public static OpticalMetadata empty() {
        return new OpticalMetadata(null, false, 0.0, List.of());
    }
}
