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
import ai.evacortex.nanocalc.core.result.ThermalResult;

import java.util.List;

/**
 * Thermal transport in nanostructures, e.g. size-limited phonon conductivity.
 */
public interface ThermalModel extends PhysicsModel {

    ThermalResult calculate() throws CalculationException;

    /**
     * @param temperatures temperatures in K
     * @return one result per input temperature, in input order
     */
    List<ThermalResult> calculateTemperatureSweep(List<Double> temperatures) throws CalculationException;
}
