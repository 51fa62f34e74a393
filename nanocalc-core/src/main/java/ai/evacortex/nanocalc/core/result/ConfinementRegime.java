/*
 * NanoCalc — Nanoparticle Optics Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.nanocalc.core.result;

/**
 * Quantum confinement regime, comparing particle radius r with the exciton Bohr radius a_B.
 * - WEAK: r ≫ a_B
 * - INTERMEDIATE: r ≈ a_B
 * - STRONG: r ≪ a_B
 */
public enum ConfinementRegime {
    WEAK,
    INTERMEDIATE,
    STRONG
}
