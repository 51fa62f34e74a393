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
import ai.evacortex.nanocalc.core.result.ElectronicResult;

import java.util.List;

/**
 * Size-dependent electronic structure, e.g. Brus-equation bandgaps of quantum dots.
 */
public interface ElectronicModel extends PhysicsModel {

    ElectronicResult calculate() throws CalculationException;

    /**
     * @param diameters particle diameters in nm
     * @return one result per input diameter, in input order
     */
    List<ElectronicResult> calculateSizeSweep(List<Double> diameters) throws CalculationException;
}
