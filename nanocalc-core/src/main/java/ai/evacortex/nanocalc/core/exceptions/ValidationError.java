/*
 * NanoCalc — Nanoparticle Optics Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.nanocalc.core.exceptions;

import java.util.Locale;
import java.util.Objects;

/**
 * Parameter-shape problem detected before any math runs.
 *
 * <ul>
 *     <li>{@link OutOfRange}: a value outside an accepted interval</li>
 *     <li>{@link InvalidParameter}: a value that makes the model meaningless (e.g. non-positive radius)</li>
 *     <li>{@link PhysicsViolation}: a combination of values that breaks a physical constraint</li>
 * </ul>
 */
public sealed interface ValidationError
        permits ValidationError.OutOfRange, ValidationError.InvalidParameter, ValidationError.PhysicsViolation {

    String message();

    record OutOfRange(double value, double min, double max) implements ValidationError {
        @Override
        public String message() {
            return String.format(Locale.ROOT, "Value %s is out of valid range [%s, %s]",
                    Double.toString(value), Double.toString(min), Double.toString(max));
        }
    }

    record InvalidParameter(String reason) implements ValidationError {
        public InvalidParameter {
            Objects.requireNonNull(reason, "reason");
        }

        @Override
        public String message() {
            return "Invalid parameter: " + reason;
        }
    }

    record PhysicsViolation(String reason) implements ValidationError {
        public PhysicsViolation {
            Objects.requireNonNull(reason, "reason");
        }

        @Override
        public String message() {
            return "Physical constraint violated: " + reason;
        }
    }
}
