/*
 * NanoCalc — Nanoparticle Optics Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.nanocalc.core.materials;

import ai.evacortex.nanocalc.core.RefractiveIndex;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Named refractive index of a common nanoparticle material at a representative wavelength.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record MaterialPreset(@JsonProperty("name") String name,
                             @JsonProperty("nReal") double nReal,
                             @JsonProperty("nImag") double nImag,
                             @JsonProperty("description") String description) {

    public MaterialPreset {
        Objects.requireNonNull(name, "name");
        description = description == null ? "" : description;
    }

    public RefractiveIndex toRefractiveIndex() {
        return new RefractiveIndex(nReal, nImag);
    }
}
