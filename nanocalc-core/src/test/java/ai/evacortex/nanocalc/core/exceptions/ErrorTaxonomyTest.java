/*
 * NanoCalc — Nanoparticle Optics Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.nanocalc.core.exceptions;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ErrorTaxonomyTest {

    @Test
    void validationMessages() {
        assertEquals("Value 5.0 is out of valid range [1.0, 3.0]",
                new ValidationError.OutOfRange(5.0, 1.0, 3.0).message());
        assertEquals("Invalid parameter: Radius must be positive",
                new ValidationError.InvalidParameter("Radius must be positive").message());
        assertEquals("Physical constraint violated: k < 0",
                new ValidationError.PhysicsViolation("k < 0").message());
    }

    @Test
    void calculationMessages() {
        assertEquals("Convergence failed after 120 iterations",
                new CalculationError.ConvergenceFailed(120).message());
        assertEquals("Numerical instability detected: overflow",
                new CalculationError.NumericalInstability("overflow").message());
        assertEquals("Invalid input: empty sweep",
                new CalculationError.InvalidInput("empty sweep").message());
        assertEquals("Model not applicable: x > 10",
                new CalculationError.ModelNotApplicable("x > 10").message());
        assertEquals("Validation error: Invalid parameter: Wavelength must be positive",
                new CalculationError.Validation(new ValidationError.InvalidParameter("Wavelength must be positive")).message());
    }

    @Test
    void calculationException_wrapsValidationException() {
        ValidationError cause = new ValidationError.PhysicsViolation("negative absorption");
        ValidationException v = new ValidationException(cause);
        CalculationException c = new CalculationException(v);

        assertEquals(new CalculationError.Validation(cause), c.error());
        assertSame(v, c.getCause());
        assertEquals("Validation error: Physical constraint violated: negative absorption", c.getMessage());
    }

    @Test
    void errorsAreValues() {
        assertEquals(new CalculationError.ConvergenceFailed(3), new CalculationError.ConvergenceFailed(3));
        assertNotEquals(new ValidationError.OutOfRange(1, 2, 3), new ValidationError.OutOfRange(1, 2, 4));
    }

    @Test
    void nullErrors_areRejected() {
        assertThrows(NullPointerException.class, () -> new ValidationException(null));
        assertThrows(NullPointerException.class, () -> new CalculationException((CalculationError) null));
        assertThrows(NullPointerException.class, () -> new ValidationError.InvalidParameter(null));
        assertThrows(NullPointerException.class, () -> new CalculationError.Validation(null));
    }
}
