/*
 * NanoCalc — Nanoparticle Optics Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.nanocalc.core.model;

import ai.evacortex.nanocalc.core.exceptions.ValidationException;

import java.util.List;

/**
 * {@code PhysicsModel} is the root contract of every physical model in NanoCalc.
 *
 * <p>A model is an immutable parameter set plus the theory that evaluates it. Domain
 * extensions ({@link OpticalModel}, {@link ThermalModel}, {@link ElectronicModel}) add the
 * actual calculation; this interface only covers identification and parameter checks.</p>
 *
 * <p>Two kinds of feedback are kept strictly apart:</p>
 * <ul>
 *     <li>{@link #validate()} failures are fatal; a model that does not validate cannot be calculated</li>
 *     <li>{@link #warnings()} are advisory; they never block a calculation</li>
 * </ul>
 *
 * <p>New theories are added by implementing the matching extension; existing models and the
 * code that drives them stay untouched.</p>
 *
 * @see OpticalModel
 * @see Cacheable
 * @see Parallelizable
 */
public interface PhysicsModel {

    /**
     * @return human-readable model name
     */
    String name();

    /**
     * @return short description of what the model calculates
     */
    String description();

    /**
     * Checks the parameters before any math runs.
     *
     * @throws ValidationException if a parameter is outside the model's physical domain
     */
    void validate() throws ValidationException;

    /**
     * @return {@code true} iff {@link #validate()} completes without error
     */
    default boolean isApplicable() {
        try {
            validate();
            return true;
        } catch (ValidationException e) {
            return false;
        }
    }

    /**
     * Non-fatal remarks about the parameter regime, e.g. an approximation stretched beyond its range.
     *
     * @return zero or more advisory messages, never {@code null}
     */
    default List<String> warnings() {
        return List.of();
    }
}
