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

public class CalculationException extends RuntimeException {

    private final CalculationError error;

    public CalculationException(CalculationError error) {
        super(Objects.requireNonNull(error, "error").message());
        this.error = error;
    }

    public CalculationException(CalculationError error, Throwable cause) {
        super(Objects.requireNonNull(error, "error").message(), cause);
        this.error = error;
    }

    /**
     * Wraps a validation failure as {@link CalculationError.Validation}.
     */
    public CalculationException(ValidationException cause) {
        this(new CalculationError.Validation(cause.error()), cause);
    }

    public CalculationError error() {
        return error;
    }
}
