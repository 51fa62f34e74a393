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
import java.util.Objects;

/**
 * @param effectiveMass       effective mass in units of mₑ, {@code null} if not used
 * @param dielectricConstant  relative dielectric constant, {@code null} if not used
 * @param modelType           model family, e.g. "Brus" or "EMA"
 * @param notes               model-specific remarks
 */
public record ElectronicMetadata(Double effectiveMass, Double dielectricConstant, String modelType, List<String> notes) {

    public ElectronicMetadata {
        Objects.requireNonNull(modelType, "modelType");
        notes = notes == null ? List.of() : List.copyOf(notes);
    }
}
