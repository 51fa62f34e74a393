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
 * Marks a model whose sweep points may be evaluated concurrently. Advisory only: the model
 * itself never schedules threads.
 */
public interface Parallelizable {

    int DEFAULT_CHUNK_SIZE = 100;

    default boolean canParallelize() {
        return true;
    }

    /**
     * @return number of sweep points a worker should take at once
     */
    default int recommendedChunkSize() {
        return DEFAULT_CHUNK_SIZE;
    }
}
