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

public class ValidationException extends RuntimeException {

    private final ValidationError error;

    public ValidationException(ValidationError error) {
        super(Objects.requireNonNull(error, "error").message());
        this.error = error;
    }

    public ValidationError error() {
        return error;
    }
}
