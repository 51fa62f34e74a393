/*
 * NanoCalc — Nanoparticle Optics Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.nanocalc.core.compute;

import ai.evacortex.nanocalc.core.config.NanoCalcConfig;
import ai.evacortex.nanocalc.core.exceptions.CalculationException;
import ai.evacortex.nanocalc.core.model.Cacheable;
import ai.evacortex.nanocalc.core.model.OpticalModel;
import ai.evacortex.nanocalc.core.result.OpticalResult;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Bounded memo of optical results keyed by {@link Cacheable#cacheKey()}.
 *
 * <p>Results are immutable and models are pure, so a cached value is always the value a fresh
 * calculation would produce. Failed calculations are not cached. Models that are not
 * {@link Cacheable} are calculated directly every time.</p>
 */
public final class OpticalResultCache {

    private final Cache<String, OpticalResult> cache;

    public OpticalResultCache(long maximumSize) {
        this.cache = Caffeine.newBuilder()
                .maximumSize(maximumSize)
                .recordStats()
                .build();
    }

    public static OpticalResultCache create(NanoCalcConfig config) {
        return new OpticalResultCache(config.cacheMaximumSize());
    }

    public OpticalResult get(OpticalModel model) throws CalculationException {
        Objects.requireNonNull(model, "model must not be null");
        if (!(model instanceof Cacheable)) {
            return model.calculate();
        }
        String key = ((Cacheable) model).cacheKey();
        return cache.get(key, k -> model.calculate());
    }

    /**
     * Same contract as {@link OpticalModel#calculateSpectrum(List)}, served point by point from the cache.
     */
    public List<OpticalResult> spectrum(OpticalModel model, List<Double> wavelengths) throws CalculationException {
        Objects.requireNonNull(model, "model must not be null");
        Objects.requireNonNull(wavelengths, "wavelengths must not be null");
        List<OpticalResult> results = new ArrayList<>(wavelengths.size());
        for (Double wl : wavelengths) {
            Objects.requireNonNull(wl, "wavelength must not be null");
            results.add(get(model.withWavelength(wl)));
        }
        return results;
    }

    public long hitCount() {
        return cache.stats().hitCount();
    }

    public long missCount() {
        return cache.stats().missCount();
    }

    public long size() {
        return cache.estimatedSize();
    }

    public void invalidateAll() {
        cache.invalidateAll();
    }
}
