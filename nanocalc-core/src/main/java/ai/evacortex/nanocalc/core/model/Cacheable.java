/*
 * NanoCalc — Nanoparticle Optics Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.nanocalc.core.model;

/**
 * Marks a model whose results may be memoized by the caller.
 */
public interface Cacheable {

    /**
     * @return key derived from every parameter that influences the result; equal parameter
     *         sets yield equal keys
     */
    String cacheKey();
}
