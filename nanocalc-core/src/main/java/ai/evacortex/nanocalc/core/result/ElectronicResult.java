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
 * Size-dependent electronic structure of one particle.
 *
 * @param diameter           particle diameter in nm
 * @param bandgap            bandgap in eV
 * @param bulkBandgap        bulk bandgap in eV
 * @param confinementEnergy  confinement contribution in eV
 * @param coulombCorrection  Coulomb correction in eV
 * @param bohrRadius         exciton Bohr radius in nm, {@code null} if not computed
 * @param regime             confinement regime
 * @param metadata           model diagnostics
 */
public record ElectronicResult(double diameter,
                               double bandgap,
                               double bulkBandgap,
                               double confinementEnergy,
                               double coulombCorrection,
                               Double bohrRadius,
                               ConfinementRegime regime,
                               ElectronicMetadata metadata) {

    public ElectronicResult {
        Objects.requireNonNull(regime, "regime");
        Objects.requireNonNull(metadata, "metadata");
    }
}
