/*
 * NanoCalc — Nanoparticle Optics Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.nanocalc.core.model;

import ai.evacortex.nanocalc.core.exceptions.CalculationException;
import ai.evacortex.nanocalc.core.result.OpticalResult;

import java.util.List;

/**
 * {@code OpticalModel} computes scattering, absorption and extinction of a single particle.
 *
 * <p>Implementations must be deterministic and free of side effects: identical parameters
 * produce bit-identical {@link OpticalResult}s. Every point of a spectrum is independent of
 * every other point, so a sweep may be sharded across workers by the caller (see
 * {@link Parallelizable}) as long as the output order is restored.</p>
 */
public interface OpticalModel extends PhysicsModel {

    /**
     * Calculates the optical response at the model's own wavelength.
     *
     * @return the result for this parameter set
     * @throws CalculationException if validation or the math stage fails; validation failures
     *                              are wrapped as {@code CalculationError.Validation}
     */
    OpticalResult calculate() throws CalculationException;

    /**
     * Calculates the response at each wavelength, keeping every other parameter fixed.
     *
     * <p>The returned list has the same length and order as {@code wavelengths}. The sweep is
     * all-or-nothing: the first failing point aborts the call.</p>
     *
     * @param wavelengths wavelengths in nm
     * @return one result per input wavelength
     * @throws CalculationException from the first failing point
     * @throws NullPointerException if the list or one of its elements is {@code null}
     */
    List<OpticalResult> calculateSpectrum(List<Double> wavelengths) throws CalculationException;

    /**
     * @param wavelength wavelength in nm
     * @return an independent copy of this model evaluated at {@code wavelength}
     */
    OpticalModel withWavelength(double wavelength);
}
