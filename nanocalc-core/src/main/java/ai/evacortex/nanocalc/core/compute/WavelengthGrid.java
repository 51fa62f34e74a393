/*
 * NanoCalc — Nanoparticle Optics Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.nanocalc.core.compute;

import ai.evacortex.nanocalc.core.config.NanoCalcConfig;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Evenly spaced wavelength grids for spectral sweeps.
 */
public final class WavelengthGrid {

    private static final double STEP_TOLERANCE = 1e-9;

    private WavelengthGrid() {}

    /**
     * Inclusive ascending grid {@code start, start + step, ...} up to {@code end}.
     * Values are computed as {@code start + i·step}, so no rounding error accumulates, and never exceed {@code end}.
     *
     * @throws IllegalArgumentException if a bound is not finite, {@code step ≤ 0} or {@code end < start}
     */
    public static List<Double> range(double startNm, double endNm, double stepNm) {
        if (!Double.isFinite(startNm) || !Double.isFinite(endNm) || !Double.isFinite(stepNm)) {
            throw new IllegalArgumentException("Grid bounds must be finite");
        }
        if (stepNm <= 0.0) {
            throw new IllegalArgumentException("Step must be positive: " + stepNm);
        }
        if (endNm < startNm) {
            throw new IllegalArgumentException("End " + endNm + " is below start " + startNm);
        }
        long count = (long) Math.floor((endNm - startNm) / stepNm + STEP_TOLERANCE) + 1;
        if (count > Integer.MAX_VALUE - 8) {
            throw new IllegalArgumentException("Grid too large: " + count + " points");
        }
        List<Double> grid = new ArrayList<>((int) count);
        for (long i = 0; i < count; i++) {
            grid.add(Math.min(endNm, startNm + i * stepNm));
        }
        return Collections.unmodifiableList(grid);
    }

    public static List<Double> defaultGrid(NanoCalcConfig config) {
        return range(config.spectrumStartNm(), config.spectrumEndNm(), config.spectrumStepNm());
    }
}
