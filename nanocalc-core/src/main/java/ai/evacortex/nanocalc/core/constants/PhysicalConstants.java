/*
 * NanoCalc — Nanoparticle Optics Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.nanocalc.core.constants;

/**
 * Physical constants, CODATA 2018 values.
 *
 * <p>All values are SI unless the name says otherwise. Every unit conversion and every model in
 * this library reads its constants from here; no other class declares a physical literal.</p>
 */
public final class PhysicalConstants {

    private PhysicalConstants() {}

    /** Speed of light in vacuum [m/s]. */
    public static final double C = 2.99792458e8;

    /** Speed of light [nm/s]. */
    public static final double C_NM_S = 2.99792458e17;

    /** Planck constant [J·s]. */
    public static final double H = 6.62607015e-34;

    /** Reduced Planck constant ℏ [J·s]. */
    public static final double HBAR = 1.054571817e-34;

    /** Boltzmann constant [J/K]. */
    public static final double K_B = 1.380649e-23;

    /** Elementary charge [C]. */
    public static final double E = 1.602176634e-19;

    /** Electron mass [kg]. */
    public static final double M_E = 9.1093837015e-31;

    /** Proton mass [kg]. */
    public static final double M_P = 1.67262192369e-27;

    /** Avogadro constant [1/mol]. */
    public static final double N_A = 6.02214076e23;

    /** Vacuum permittivity ε₀ [F/m]. */
    public static final double EPSILON_0 = 8.8541878128e-12;

    /** Vacuum permeability μ₀ [H/m]. */
    public static final double MU_0 = 1.25663706212e-6;

    /** Fine structure constant α. */
    public static final double ALPHA = 7.2973525693e-3;

    /** Rydberg energy [eV]. */
    public static final double RY = 13.605693122994;

    /** Bohr radius [m]. */
    public static final double BOHR_RADIUS = 5.29177210903e-11;

    /** Bohr radius [nm]. */
    public static final double BOHR_RADIUS_NM = 0.05291772109;

    /**
     * Unit conversion factors.
     */
    public static final class Conversions {

        private Conversions() {}

        public static final double EV_TO_J = 1.602176634e-19;
        public static final double J_TO_EV = 6.241509074e18;

        public static final double NM_TO_M = 1e-9;
        public static final double M_TO_NM = 1e9;
        public static final double NM_PER_UM = 1e3;

        /** h·c in eV·nm, photon energy E[eV] = HC_EV_NM / λ[nm]. */
        public static final double HC_EV_NM = 1239.84193;

        public static final double AMU_TO_KG = 1.66053906660e-27;

        /** T[°C] = T[K] − KELVIN_CELSIUS_OFFSET. */
        public static final double KELVIN_CELSIUS_OFFSET = 273.15;
    }

    /**
     * Derived quantities that are handy for nanoscale estimates.
     */
    public static final class Compound {

        private Compound() {}

        /** k_B·T at 300 K [eV]. */
        public static final double K_B_T_300K_EV = 0.02585;

        /** k_B·T at 300 K [J]. */
        public static final double K_B_T_300K_J = 4.14e-21;

        /**
         * Thermal de Broglie wavelength at 300 K, λ = h / √(2π·m·k_B·T).
         *
         * @param massKg particle mass [kg], must be positive
         * @return wavelength [nm]
         */
        public static double thermalDeBroglieNm(double massKg) {
            if (!(massKg > 0.0)) {
                throw new IllegalArgumentException("Mass must be positive: " + massKg);
            }
            double lambda = H / Math.sqrt(2.0 * Math.PI * massKg * K_B * 300.0);
            return lambda * Conversions.M_TO_NM;
        }

        /**
         * Converts a plasma energy ℏω_p to its free-space wavelength.
         *
         * @param omegaPeV plasma energy [eV], must be positive
         * @return wavelength [nm]
         */
        public static double plasmaWavelengthNm(double omegaPeV) {
            if (!(omegaPeV > 0.0)) {
                throw new IllegalArgumentException("Plasma energy must be positive: " + omegaPeV);
            }
            return Conversions.HC_EV_NM / omegaPeV;
        }
    }
}
