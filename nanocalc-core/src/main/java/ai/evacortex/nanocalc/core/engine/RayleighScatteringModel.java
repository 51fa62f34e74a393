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
import ai.evacortex.nanocalc.core.math.Complex;
import ai.evacortex.nanocalc.core.model.Cacheable;
import ai.evacortex.nanocalc.core.model.OpticalModel;
import ai.evacortex.nanocalc.core.model.Parallelizable;
import ai.evacortex.nanocalc.core.result.OpticalMetadata;
import ai.evacortex.nanocalc.core.result.OpticalResult;
import ai.evacortex.nanocalc.core.units.Nanometer;
import ai.evacortex.nanocalc.core.units.Wavelength;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Scattering by a homogeneous sphere in the small-particle (Rayleigh) limit.
 *
 * <p>With size parameter x = 2πr/λ and relative index m = ñ_particle / n_medium:</p>
 * <pre>
 *     F     = (m² − 1) / (m² + 2)
 *     Q_sca = (8/3) · x⁴ · |F|²
 *     Q_abs = 4 · x · Im(F)
 *     Q_ext = Q_sca + Q_abs
 *     C_i   = Q_i · πr²
 * </pre>
 *
 * <p>The approximation holds for x ≪ 1; {@link #warnings()} flags x &gt; 1. Only a single
 * (dipole) term is used, so no series and no convergence loop are involved.</p>
 *
 * <p>Instances are immutable; {@link #withWavelength(double)} returns a copy.</p>
 */
public final class RayleighScatteringModel implements OpticalModel, Cacheable, Parallelizable {

    public static final String NOTE = "Rayleigh approximation";

    private static final double DEFAULT_RADIUS_NM = 50.0;
    private static final double DEFAULT_WAVELENGTH_NM = 500.0;
    private static final RefractiveIndex DEFAULT_PARTICLE_INDEX = new RefractiveIndex(0.5, 2.5);
    private static final double DEFAULT_MEDIUM_INDEX = 1.33;

    private final double radius;
    private final double wavelength;
    private final RefractiveIndex particleIndex;
    private final double mediumIndex;

    /**
     * @param radius        particle radius in nm
     * @param wavelength    wavelength in nm
     * @param particleIndex complex refractive index of the particle
     * @param mediumIndex   real refractive index of the surrounding medium
     */
    public RayleighScatteringModel(double radius, double wavelength, RefractiveIndex particleIndex, double mediumIndex) {
        this.radius = radius;
        this.wavelength = wavelength;
        this.particleIndex = Objects.requireNonNull(particleIndex, "particleIndex must not be null");
        this.mediumIndex = mediumIndex;
    }

    public RayleighScatteringModel(Nanometer radius, Wavelength wavelength, RefractiveIndex particleIndex, double mediumIndex) {
        this(Objects.requireNonNull(radius, "radius must not be null").value(),
                Objects.requireNonNull(wavelength, "wavelength must not be null").nanometers(),
                particleIndex,
                mediumIndex);
    }

    /**
     * A 50 nm gold-like particle (0.5 + 2.5i) in water at 500 nm.
     */
    public static RayleighScatteringModel withDefaults() {
        return new RayleighScatteringModel(DEFAULT_RADIUS_NM, DEFAULT_WAVELENGTH_NM, DEFAULT_PARTICLE_INDEX, DEFAULT_MEDIUM_INDEX);
    }

    public double radius() {
        return radius;
    }

    public double wavelength() {
        return wavelength;
    }

    public RefractiveIndex particleIndex() {
        return particleIndex;
    }

    public double mediumIndex() {
        return mediumIndex;
    }

    /**
     * @return x = 2πr/λ
     */
    public double sizeParameter() {
        return 2.0 * Math.PI * radius / wavelength;
    }

    @Override
    public String name() {
        return "Mie Scattering (Rayleigh Approximation)";
    }

    @Override
    public String description() {
        return "Calculate scattering and absorption for spherical nanoparticles (x < 1)";
    }

    @Override
    public void validate() throws ValidationException {
        requirePositive(radius, "Radius");
        requirePositive(wavelength, "Wavelength");
        requirePositive(mediumIndex, "Medium refractive index");
    }

    @Override
    public List<String> warnings() {
        double x = sizeParameter();
        if (x > 1.0) {
            return List.of(String.format(Locale.ROOT,
                    "Size parameter x=%.2f > 1. Rayleigh approximation may be inaccurate. Full Mie theory recommended.", x));
        }
        return List.of();
    }

    @Override
    public OpticalResult calculate() throws CalculationException {
        try {
            validate();
        } catch (ValidationException e) {
            throw new CalculationException(e);
        }
        return rayleighApproximation();
    }

    @Override
    public List<OpticalResult> calculateSpectrum(List<Double> wavelengths) throws CalculationException {
        Objects.requireNonNull(wavelengths, "wavelengths must not be null");
        List<OpticalResult> results = new ArrayList<>(wavelengths.size());
        for (Double wl : wavelengths) {
            Objects.requireNonNull(wl, "wavelength must not be null");
            results.add(withWavelength(wl).calculate());
        }
        return results;
    }

    @Override
    public RayleighScatteringModel withWavelength(double wavelength) {
        return new RayleighScatteringModel(radius, wavelength, particleIndex, mediumIndex);
    }

    public RayleighScatteringModel withRadius(double radius) {
        return new RayleighScatteringModel(radius, wavelength, particleIndex, mediumIndex);
    }

    @Override
    public String cacheKey() {
        return "rayleigh|r=" + radius
                + "|wl=" + wavelength
                + "|n=" + particleIndex.real()
                + "|k=" + particleIndex.imaginary()
                + "|nm=" + mediumIndex;
    }

    private OpticalResult rayleighApproximation() {
        double x = sizeParameter();
        Complex m = particleIndex.relativeTo(mediumIndex);
        Complex m2 = m.square();

        Complex factor;
        try {
            factor = m2.subtract(1.0).divide(m2.add(2.0));
        } catch (ArithmeticException e) {
            throw new CalculationException(new CalculationError.NumericalInstability(
                    "polarizability denominator m² + 2 vanishes for m = " + m), e);
        }

        double qSca = (8.0 / 3.0) * Math.pow(x, 4) * factor.absSquared();
        double qAbs = 4.0 * x * factor.imag();
        double qExt = qSca + qAbs;
        if (!Double.isFinite(qExt)) {
            throw new CalculationException(new CalculationError.NumericalInstability(
                    "non-finite efficiency at x = " + x));
        }

        double geometricArea = Math.PI * radius * radius;
        double cSca = qSca * geometricArea;
        double cAbs = qAbs * geometricArea;
        double cExt = qExt * geometricArea;
        if (!Double.isFinite(cSca) || !Double.isFinite(cAbs) || !Double.isFinite(cExt)) {
            throw new CalculationException(new CalculationError.NumericalInstability(
                    "non-finite cross-section for r = " + radius + " nm"));
        }

        return new OpticalResult(wavelength, qSca, qAbs, qExt, cSca, cAbs, cExt,
                new OpticalMetadata(1, true, x, List.of(NOTE)));
    }

    private static void requirePositive(double value, String what) {
        if (!(value > 0.0)) {
            throw new ValidationException(new ValidationError.InvalidParameter(what + " must be positive"));
        }
        if (Double.isInfinite(value)) {
            throw new ValidationException(new ValidationError.InvalidParameter(what + " must be finite"));
        }
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof RayleighScatteringModel)) return false;
        RayleighScatteringModel other = (RayleighScatteringModel) obj;
        return Double.compare(radius, other.radius) == 0
                && Double.compare(wavelength, other.wavelength) == 0
                && Double.compare(mediumIndex, other.mediumIndex) == 0
                && particleIndex.equals(other.particleIndex);
    }

    @Override
    public int hashCode() {
        return Objects.hash(radius, wavelength, particleIndex, mediumIndex);
    }

    @Override
    public String toString() {
        return "RayleighScatteringModel[r=" + radius + " nm, λ=" + wavelength + " nm, n=" + particleIndex
                + ", n_medium=" + mediumIndex + "]";
    }
}
