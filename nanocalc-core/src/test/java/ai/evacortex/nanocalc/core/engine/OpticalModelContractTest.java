/*
 * NanoCalc — Nanoparticle Optics Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.nanocalc.core.engine;

import ai.evacortex.nanocalc.core.RefractiveIndex;
import ai.evacortex.nanocalc.core.exceptions.CalculationError;
import ai.evacortex.nanocalc.core.exceptions.CalculationException;
import ai.evacortex.nanocalc.core.exceptions.ValidationError;
import ai.evacortex.nanocalc.core.exceptions.ValidationException;
import ai.evacortex.nanocalc.core.model.OpticalModel;
import ai.evacortex.nanocalc.core.result.OpticalResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

abstract class OpticalModelContractTest {

    protected abstract OpticalModel model(double radius, double wavelength, RefractiveIndex particle, double medium);

    protected OpticalModel gold(double radius, double wavelength) {
        return model(radius, wavelength, new RefractiveIndex(0.5, 2.5), 1.33);
    }

    private static ValidationError validationErrorOf(CalculationException e) {
        CalculationError error = e.error();
        assertInstanceOf(CalculationError.Validation.class, error, "validation failures must be wrapped");
        return ((CalculationError.Validation) error).cause();
    }

    @Test
    void conservation_holdsExactly() {
        OpticalResult r = gold(10.0, 500.0).calculate();
        assertEquals(r.qSca() + r.qAbs(), r.qExt(), 0.0);
        assertTrue(r.checkConservation() < 1e-10);
    }

    @Test
    void fuzz_conservationAndCrossSections() {
        Random r = new Random(42);
        for (int t = 0; t < 200; t++) {
            double radius = 1.0 + r.nextDouble() * 100.0;
            double wavelength = 200.0 + r.nextDouble() * 1800.0;
            RefractiveIndex n = new RefractiveIndex(-10.0 + r.nextDouble() * 20.0, r.nextDouble() * 10.0);
            double medium = 1.0 + r.nextDouble() * 2.0;

            OpticalResult res = model(radius, wavelength, n, medium).calculate();
            double area = Math.PI * radius * radius;

            assertTrue(res.checkConservation() < 1e-10, "Conservation failed at iter " + t);
            assertEquals(res.qSca() * area, res.cSca(), Math.abs(res.cSca()) * 1e-12, "C_sca at iter " + t);
            assertEquals(res.qAbs() * area, res.cAbs(), Math.abs(res.cAbs()) * 1e-12, "C_abs at iter " + t);
            assertEquals(res.qExt() * area, res.cExt(), Math.abs(res.cExt()) * 1e-12, "C_ext at iter " + t);
        }
    }

    @Test
    void nonPositiveRadius_isRejected() {
        for (double radius : new double[]{0.0, -5.0}) {
            OpticalModel m = gold(radius, 500.0);
            ValidationException v = assertThrows(ValidationException.class, m::validate);
            assertInstanceOf(ValidationError.InvalidParameter.class, v.error());
            CalculationException c = assertThrows(CalculationException.class, m::calculate);
            assertInstanceOf(ValidationError.InvalidParameter.class, validationErrorOf(c));
            assertFalse(m.isApplicable());
        }
    }

    @Test
    void nonPositiveWavelength_isRejected() {
        OpticalModel m = gold(10.0, 0.0);
        assertInstanceOf(ValidationError.InvalidParameter.class,
                assertThrows(ValidationException.class, m::validate).error());
        assertInstanceOf(ValidationError.InvalidParameter.class,
                validationErrorOf(assertThrows(CalculationException.class, m::calculate)));
    }

    @Test
    void nonPositiveMediumIndex_isRejected() {
        OpticalModel m = model(10.0, 500.0, new RefractiveIndex(1.5, 0.0), -1.0);
        assertInstanceOf(ValidationError.InvalidParameter.class,
                assertThrows(ValidationException.class, m::validate).error());
        assertInstanceOf(ValidationError.InvalidParameter.class,
                validationErrorOf(assertThrows(CalculationException.class, m::calculate)));
    }

    @Test
    void validModel_isApplicable() {
        OpticalModel m = gold(10.0, 500.0);
        assertDoesNotThrow(m::validate);
        assertTrue(m.isApplicable());
    }

    @Test
    void determinismHolds() {
        OpticalResult a = gold(37.5, 612.0).calculate();
        OpticalResult b = gold(37.5, 612.0).calculate();
        assertEquals(a, b, "Same input must yield identical result (deterministic)");
        assertEquals(Double.doubleToRawLongBits(a.qExt()), Double.doubleToRawLongBits(b.qExt()));
    }

    @Test
    void spectrum_preservesOrderAndLength() {
        List<OpticalResult> spectrum = gold(10.0, 500.0).calculateSpectrum(List.of(300.0, 400.0, 500.0));
        assertEquals(3, spectrum.size());
        assertEquals(300.0, spectrum.get(0).wavelength(), 0.0);
        assertEquals(400.0, spectrum.get(1).wavelength(), 0.0);
        assertEquals(500.0, spectrum.get(2).wavelength(), 0.0);
    }

    @Test
    void spectrum_unsortedInputKeepsItsOrder() {
        List<Double> input = Arrays.asList(700.0, 250.0, 480.0, 250.0);
        List<OpticalResult> spectrum = gold(10.0, 500.0).calculateSpectrum(input);
        for (int i = 0; i < input.size(); i++) {
            assertEquals(input.get(i), spectrum.get(i).wavelength(), 0.0);
        }
        assertEquals(spectrum.get(1), spectrum.get(3));
    }

    @Test
    void spectrum_matchesSinglePointCalculations() {
        OpticalModel base = gold(20.0, 500.0);
        List<OpticalResult> spectrum = base.calculateSpectrum(List.of(350.0, 520.0, 900.0));
        assertEquals(base.withWavelength(350.0).calculate(), spectrum.get(0));
        assertEquals(base.withWavelength(520.0).calculate(), spectrum.get(1));
        assertEquals(base.withWavelength(900.0).calculate(), spectrum.get(2));
    }

    @Test
    void spectrum_isAllOrNothing() {
        OpticalModel base = gold(10.0, 500.0);
        CalculationException e = assertThrows(CalculationException.class,
                () -> base.calculateSpectrum(List.of(300.0, -1.0, 500.0)));
        assertInstanceOf(ValidationError.InvalidParameter.class, validationErrorOf(e));
    }

    @Test
    void emptySpectrum_isEmpty() {
        assertTrue(gold(10.0, 500.0).calculateSpectrum(List.of()).isEmpty());
    }

    @Test
    void nullArguments_throwNpe() {
        OpticalModel base = gold(10.0, 500.0);
        assertThrows(NullPointerException.class, () -> base.calculateSpectrum(null));
        assertThrows(NullPointerException.class, () -> base.calculateSpectrum(Arrays.asList(400.0, null)));
    }

    @Test
    void withWavelength_leavesOriginalUntouched() {
        OpticalModel base = gold(10.0, 500.0);
        OpticalResult before = base.calculate();
        base.withWavelength(300.0).calculate();
        assertEquals(before, base.calculate());
        assertEquals(500.0, before.wavelength(), 0.0);
    }

    @Test
    void warnings_neverBlockCalculation() {
        OpticalModel large = gold(400.0, 500.0);
        assertFalse(large.warnings().isEmpty());
        assertDoesNotThrow(large::calculate);
    }
}

@DisplayName("OpticalModel contract tests (RayleighScatteringModel)")
class RayleighScatteringModelContractTest extends OpticalModelContractTest {
    @Override
    protected OpticalModel model(double radius, double wavelength, RefractiveIndex particle, double medium) {
        return new RayleighScatteringModel(radius, wavelength, particle, medium);
    }
}
