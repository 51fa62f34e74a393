/*
 * NanoCalc — Nanoparticle Optics Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.nanocalc.core.math;

import org.junit.jupiter.api.Test;

import java.util.Locale;

import static org.junit.jupiter.api.Assertions.*;

class ComplexTest {

    @Test
    void multiply_followsDefinition() {
        Complex p = new Complex(1.0, 2.0).multiply(new Complex(3.0, -1.0));
        assertEquals(new Complex(5.0, 5.0), p);
    }

    @Test
    void divide_isInverseOfMultiply() {
        Complex a = new Complex(-4.39, 1.41);
        Complex b = new Complex(-1.39, 1.41);
        Complex q = a.divide(b);
        Complex back = q.multiply(b);
        assertEquals(a.real(), back.real(), 1e-12);
        assertEquals(a.imag(), back.imag(), 1e-12);
    }

    @Test
    void divideByZero_throws() {
        assertThrows(ArithmeticException.class, () -> Complex.ONE.divide(Complex.ZERO));
        assertThrows(ArithmeticException.class, () -> Complex.ONE.divide(0.0));
    }

    @Test
    void square_ofImaginaryUnit_isMinusOne() {
        assertEquals(new Complex(-1.0, 0.0), new Complex(0.0, 1.0).square());
    }

    @Test
    void absAndAbsSquared_agree() {
        Complex c = new Complex(3.0, 4.0);
        assertEquals(5.0, c.abs(), 0.0);
        assertEquals(25.0, c.absSquared(), 0.0);
        assertEquals(new Complex(3.0, -4.0), c.conjugate());
    }

    @Test
    void realOffsets_leaveImaginaryPartUntouched() {
        Complex c = new Complex(2.0, 0.5);
        assertEquals(new Complex(1.0, 0.5), c.subtract(1.0));
        assertEquals(new Complex(4.0, 0.5), c.add(2.0));
        assertEquals(new Complex(1.0, 0.25), c.scale(0.5));
    }

    @Test
    void toString_ignoresDefaultLocale() {
        Locale saved = Locale.getDefault();
        try {
            Locale.setDefault(Locale.GERMANY);
            assertEquals("(1.500000 - 0.250000i)", new Complex(1.5, -0.25).toString());
        } finally {
            Locale.setDefault(saved);
        }
    }
}
