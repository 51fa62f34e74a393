/*
 * NanoCalc — Nanoparticle Optics Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.nanocalc.core.math;

import java.util.Locale;

/**
 * Immutable complex number used for refractive indices, permittivities and polarizabilities.
 *
 * <p>Every operation returns a new instance; the same operands always produce the same bits.</p>
 */
public final class Complex {

    public static final Complex ZERO = new Complex(0.0, 0.0);
    public static final Complex ONE = new Complex(1.0, 0.0);

    public final double real;
    public final double imag;

    public Complex(double real, double imag) {
        this.real = real;
        this.imag = imag;
    }

    public double real() {
        return real;
    }

    public double imag() {
        return imag;
    }

    public Complex add(Complex other) {
        return new Complex(this.real + other.real, this.imag + other.imag);
    }

    public Complex add(double value) {
        return new Complex(this.real + value, this.imag);
    }

    public Complex subtract(Complex other) {
        return new Complex(this.real - other.real, this.imag - other.imag);
    }

    public Complex subtract(double value) {
        return new Complex(this.real - value, this.imag);
    }

    public Complex multiply(Complex other) {
        double r = this.real * other.real - this.imag * other.imag;
        double i = this.real * other.imag + this.imag * other.real;
        return new Complex(r, i);
    }

    public Complex square() {
        return multiply(this);
    }

    /**
     * (a + bi) / (c + di) = ((ac + bd) + (bc − ad)i) / (c² + d²)
     *
     * @throws ArithmeticException if {@code other} is exactly zero
     */
    public Complex divide(Complex other) {
        double denominator = other.absSquared();
        if (denominator == 0.0) {
            throw new ArithmeticException("Complex division by zero");
        }
        double r = (this.real * other.real + this.imag * other.imag) / denominator;
        double i = (this.imag * other.real - this.real * other.imag) / denominator;
        return new Complex(r, i);
    }

    /**
     * @throws ArithmeticException if {@code divisor} is zero
     */
    public Complex divide(double divisor) {
        if (divisor == 0.0) {
            throw new ArithmeticException("Complex division by zero");
        }
        return new Complex(this.real / divisor, this.imag / divisor);
    }

    public Complex scale(double factor) {
        return new Complex(this.real * factor, this.imag * factor);
    }

    public Complex conjugate() {
        return new Complex(this.real, -this.imag);
    }

    public double abs() {
        return Math.hypot(this.real, this.imag);
    }

    public double absSquared() {
        return this.real * this.real + this.imag * this.imag;
    }

    @Override
    public String toString() {
        return String.format(Locale.ROOT, "(%f %s %fi)", real, (imag < 0 ? "-" : "+"), Math.abs(imag));
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Complex)) return false;
        Complex other = (Complex) obj;
        return Double.compare(real, other.real) == 0 && Double.compare(imag, other.imag) == 0;
    }

    @Override
    public int hashCode() {
        return Double.hashCode(real) * 31 + Double.hashCode(imag);
    }
}
