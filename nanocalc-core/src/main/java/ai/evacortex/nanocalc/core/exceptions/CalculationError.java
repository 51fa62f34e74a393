/*
 * NanoCalc — Nanoparticle Optics Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.nanocalc.core.exceptions;

import java.util.Objects;

/**
 * Problem raised by the math stage of a model. {@link Validation} carries a
 * {@link ValidationError} through unchanged so callers need a single error channel.
 */
public sealed interface CalculationError
        permits CalculationError.ConvergenceFailed, CalculationError.NumericalInstability,
                CalculationError.InvalidInput, CalculationError.ModelNotApplicable,
                CalculationError.Validation {

    String message();

    record ConvergenceFailed(int iterations) implements CalculationError {
        @Override
        public String message() {
            return "Convergence failed after " + iterations + " iterations";
        }
    }

    record NumericalInstability(String reason) implements CalculationError {
        public NumericalInstability {
            Objects.requireNonNull(reason, "reason");
        }

        @Override
        public String message() {
            return "Numerical instability detected: " + reason;
        }
    }

    record InvalidInput(String reason) implements CalculationError {
        public InvalidInput {
            Objects.requireNonNull(reason, "reason");
        }

        @Override
        public String message() {
            return "Invalid input: " + reason;
        }
    }

    record ModelNotApplicable(String reason) implements CalculationError {
        public ModelNotApplicable {
            Objects.requireNonNull(reason, "reason");
        }

        @Override
        public String message() {
            return "Model not applicable: " + reason;
        }
    }

    record Validation(ValidationError cause) implements CalculationError {
        public Validation {
            Objects.requireNonNull(cause, "cause");
        }

        @Override
        public String message() {
            return "Validation error: " + cause.message();
        }
    }
}
