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
import ai.evacortex.nanocalc.core.exceptions.CalculationError;
import ai.evacortex.nanocalc.core.exceptions.CalculationException;
import ai.evacortex.nanocalc.core.model.OpticalModel;
import ai.evacortex.nanocalc.core.model.Parallelizable;
import ai.evacortex.nanocalc.core.result.OpticalResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Shards a spectral sweep across worker threads.
 *
 * <p>The wavelength list is cut into consecutive chunks of the model's
 * {@link Parallelizable#recommendedChunkSize()} (or the configured default for models without the
 * marker). Each chunk runs {@link OpticalModel#calculateSpectrum(List)} on the executor; chunks are
 * joined in submission order, so the output matches the input order exactly and the error of the
 * earliest failing chunk wins. Models that report {@code canParallelize() == false}, and sweeps that
 * fit in one chunk, run on the calling thread.</p>
 *
 * <p>The result is identical to {@code model.calculateSpectrum(wavelengths)}.</p>
 */
public final class SpectrumEvaluator implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(SpectrumEvaluator.class);

    private final ExecutorService executor;
    private final boolean ownsExecutor;
    private final int defaultChunkSize;

    /**
     * Uses a caller-owned executor; {@link #close()} leaves it running.
     */
    public SpectrumEvaluator(ExecutorService executor, int defaultChunkSize) {
        this(executor, defaultChunkSize, false);
    }

    private SpectrumEvaluator(ExecutorService executor, int defaultChunkSize, boolean ownsExecutor) {
        if (defaultChunkSize <= 0) {
            throw new IllegalArgumentException("Chunk size must be positive: " + defaultChunkSize);
        }
        this.executor = Objects.requireNonNull(executor, "executor must not be null");
        this.defaultChunkSize = defaultChunkSize;
        this.ownsExecutor = ownsExecutor;
    }

    /**
     * Creates an evaluator with its own fixed pool of {@code config.parallelThreads()} daemon threads.
     */
    public static SpectrumEvaluator create(NanoCalcConfig config) {
        AtomicInteger counter = new AtomicInteger();
        ExecutorService pool = Executors.newFixedThreadPool(config.parallelThreads(), r -> {
            Thread t = new Thread(r);
            t.setDaemon(true);
            t.setName("spectrum-worker-" + counter.incrementAndGet());
            return t;
        });
        return new SpectrumEvaluator(pool, config.chunkSize(), true);
    }

    /**
     * @param model       model providing every parameter except the wavelength
     * @param wavelengths wavelengths in nm
     * @return one result per wavelength, in input order
     * @throws CalculationException of the first failing point
     * @throws NullPointerException if an argument or a wavelength is {@code null}
     */
    public List<OpticalResult> evaluate(OpticalModel model, List<Double> wavelengths) throws CalculationException {
        Objects.requireNonNull(model, "model must not be null");
        List<Double> points = List.copyOf(Objects.requireNonNull(wavelengths, "wavelengths must not be null"));

        int chunkSize = chunkSizeFor(model);
        if (!canParallelize(model) || points.size() <= chunkSize) {
            return model.calculateSpectrum(points);
        }

        List<Future<List<OpticalResult>>> futures = new ArrayList<>();
        for (int from = 0; from < points.size(); from += chunkSize) {
            List<Double> chunk = points.subList(from, Math.min(from + chunkSize, points.size()));
            futures.add(executor.submit(() -> model.calculateSpectrum(chunk)));
        }
        log.debug("{}: {} points in {} chunks of {}", model.name(), points.size(), futures.size(), chunkSize);

        List<OpticalResult> results = new ArrayList<>(points.size());
        try {
            for (Future<List<OpticalResult>> future : futures) {
                results.addAll(future.get());
            }
        } catch (InterruptedException e) {
            cancelAll(futures);
            Thread.currentThread().interrupt();
            throw new CalculationException(new CalculationError.NumericalInstability("Spectrum evaluation interrupted"), e);
        } catch (ExecutionException e) {
            cancelAll(futures);
            throw unwrap(e);
        }
        return results;
    }

    private int chunkSizeFor(OpticalModel model) {
        if (model instanceof Parallelizable) {
            int recommended = ((Parallelizable) model).recommendedChunkSize();
            if (recommended > 0) return recommended;
        }
        return defaultChunkSize;
    }

    private static boolean canParallelize(OpticalModel model) {
        return !(model instanceof Parallelizable) || ((Parallelizable) model).canParallelize();
    }

    private static void cancelAll(List<? extends Future<?>> futures) {
        for (Future<?> future : futures) {
            future.cancel(true);
        }
    }

    private static RuntimeException unwrap(ExecutionException e) {
        Throwable cause = e.getCause();
        if (cause instanceof RuntimeException) {
            return (RuntimeException) cause;
        }
        if (cause instanceof Error) {
            throw (Error) cause;
        }
        return new IllegalStateException("Spectrum chunk failed", cause);
    }

    @Override
    public void close() {
        if (!ownsExecutor) return;
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) executor.shutdownNow();
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
