/*
 * NanoCalc — Nanoparticle Optics Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.nanocalc.core.config;

import ai.evacortex.nanocalc.core.model.Parallelizable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Tunables for the caller-side sweep and cache helpers, read from JVM system properties.
 *
 * <pre>
 *     nanocalc.spectrum.startNm     default sweep start (300)
 *     nanocalc.spectrum.endNm       default sweep end, inclusive (800)
 *     nanocalc.spectrum.stepNm      default sweep step (5)
 *     nanocalc.parallel.chunkSize   points per worker task (100)
 *     nanocalc.parallel.threads     worker threads (available processors)
 *     nanocalc.cache.maximumSize    result cache bound (10000)
 * </pre>
 *
 * Malformed or non-positive values fall back to the default.
 */
public record NanoCalcConfig(double spectrumStartNm,
                             double spectrumEndNm,
                             double spectrumStepNm,
                             int chunkSize,
                             int parallelThreads,
                             long cacheMaximumSize) {

    private static final Logger log = LoggerFactory.getLogger(NanoCalcConfig.class);

    public static final String SPECTRUM_START = "nanocalc.spectrum.startNm";
    public static final String SPECTRUM_END = "nanocalc.spectrum.endNm";
    public static final String SPECTRUM_STEP = "nanocalc.spectrum.stepNm";
    public static final String CHUNK_SIZE = "nanocalc.parallel.chunkSize";
    public static final String THREADS = "nanocalc.parallel.threads";
    public static final String CACHE_MAX_SIZE = "nanocalc.cache.maximumSize";

    private static final double DEFAULT_START_NM = 300.0;
    private static final double DEFAULT_END_NM = 800.0;
    private static final double DEFAULT_STEP_NM = 5.0;
    private static final long DEFAULT_CACHE_SIZE = 10_000L;

    public NanoCalcConfig {
        if (!(spectrumStepNm > 0.0) || !(spectrumEndNm >= spectrumStartNm)) {
            throw new IllegalArgumentException("Invalid spectrum range: " + spectrumStartNm + ".." + spectrumEndNm
                    + " step " + spectrumStepNm);
        }
        if (chunkSize <= 0 || parallelThreads <= 0 || cacheMaximumSize <= 0) {
            throw new IllegalArgumentException("chunkSize, parallelThreads and cacheMaximumSize must be positive");
        }
    }

    public static NanoCalcConfig defaults() {
        return new NanoCalcConfig(DEFAULT_START_NM, DEFAULT_END_NM, DEFAULT_STEP_NM,
                Parallelizable.DEFAULT_CHUNK_SIZE, defaultThreads(), DEFAULT_CACHE_SIZE);
    }

    public static NanoCalcConfig fromSystemProperties() {
        double start = doubleProperty(SPECTRUM_START, DEFAULT_START_NM);
        double end = doubleProperty(SPECTRUM_END, DEFAULT_END_NM);
        if (end < start) {
            log.warn("{}={} is below {}={}, using default range", SPECTRUM_END, end, SPECTRUM_START, start);
            start = DEFAULT_START_NM;
            end = DEFAULT_END_NM;
        }
        return new NanoCalcConfig(
                start,
                end,
                doubleProperty(SPECTRUM_STEP, DEFAULT_STEP_NM),
                (int) longProperty(CHUNK_SIZE, Parallelizable.DEFAULT_CHUNK_SIZE),
                (int) longProperty(THREADS, defaultThreads()),
                longProperty(CACHE_MAX_SIZE, DEFAULT_CACHE_SIZE));
    }

    private static int defaultThreads() {
        return Runtime.getRuntime().availableProcessors();
    }

    private static double doubleProperty(String key, double fallback) {
        String raw = System.getProperty(key);
        if (raw == null) return fallback;
        double value;
        try {
            value = Double.parseDouble(raw.trim());
        } catch (NumberFormatException e) {
            log.warn("Ignoring {}='{}' ({}), using default {}", key, raw, e.getMessage(), fallback);
            return fallback;
        }
        if (Double.isFinite(value) && value > 0.0) return value;
        log.warn("Ignoring {}='{}', using default {}", key, raw, fallback);
        return fallback;
    }

    private static long longProperty(String key, long fallback) {
        String raw = System.getProperty(key);
        if (raw == null) return fallback;
        long value;
        try {
            value = Long.parseLong(raw.trim());
        } catch (NumberFormatException e) {
            log.warn("Ignoring {}='{}' ({}), using default {}", key, raw, e.getMessage(), fallback);
            return fallback;
        }
        if (value > 0 && value <= Integer.MAX_VALUE) return value;
        log.warn("Ignoring {}='{}', using default {}", key, raw, fallback);
        return fallback;
    }
}
