/*
 * NanoCalc — Nanoparticle Optics Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.nanocalc.core.engine;

import ai.evacortex.nanocalc.core.exceptions.ValidationError;
import ai.evacortex.nanocalc.core.exceptions.ValidationException;

import java.util.ArrayList;
import java.util.List;

/**
 * Input ranges accepted by interactive front ends.
 *
 * <p>These are UI guardrails, not model invariants: {@link RayleighScatteringModel#validate()}
 * only rejects non-positive radius, wavelength and medium index.</p>
 */
public final class ParameterRanges {

    public static final double RADIUS_MIN_NM = 1.0;
    public static final double RADIUS_MAX_NM = 1000.0;
    public static final double WAVELENGTH_MIN_NM = 200.0;
    public static final double WAVELENGTH_MAX_NM = 2000.0;
    public static final double INDEX_REAL_MIN = -10.0;
    public static final double INDEX_REAL_MAX = 10.0;
    public static final double INDEX_IMAG_MIN = 0.0;
    public static final double INDEX_IMAG_MAX = 10.0;
    public static final double MEDIUM_MIN = 1.0;
    public static final double MEDIUM_MAX = 3.0;

    private ParameterRanges() {}

    /**
     * @return one {@link ValidationError.OutOfRange} per violated range, in parameter order
     *         (radius, wavelength, n, k, medium); empty if everything is in range
     */
    public static List<ValidationError.OutOfRange> check(RayleighScatteringModel model) {
        List<ValidationError.OutOfRange> violations = new ArrayList<>();
        collect(violations, model.radius(), RADIUS_MIN_NM, RADIUS_MAX_NM);
        collect(violations, model.wavelength(), WAVELENGTH_MIN_NM, WAVELENGTH_MAX_NM);
        collect(violations, model.particleIndex().real(), INDEX_REAL_MIN, INDEX_REAL_MAX);
        collect(violations, model.particleIndex().imaginary(), INDEX_IMAG_MIN, INDEX_IMAG_MAX);
        collect(violations, model.mediumIndex(), MEDIUM_MIN, MEDIUM_MAX);
        return violations;
    }

    /**
     * @throws ValidationException for the first violated range
     */
    public static void requireWithin(RayleighScatteringModel model) throws ValidationException {
        List<ValidationError.OutOfRange> violations = check(model);
        if (!violations.isEmpty()) {
            throw new ValidationException(violations.get(0));
        }
    }

    private static void collect(List<ValidationError.OutOfRange> sink, double value, double min, double max) {
        if (!(value >= min && value <= max)) {
            sink.add(new ValidationError.OutOfRange(value, min, max));
        }
    }
}
