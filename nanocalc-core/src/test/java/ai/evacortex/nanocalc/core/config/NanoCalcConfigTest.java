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
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class NanoCalcConfigTest {

    private static final List<String> KEYS = List.of(
            NanoCalcConfig.SPECTRUM_START, NanoCalcConfig.SPECTRUM_END, NanoCalcConfig.SPECTRUM_STEP,
            NanoCalcConfig.CHUNK_SIZE, NanoCalcConfig.THREADS, NanoCalcConfig.CACHE_MAX_SIZE);

    @AfterEach
    void clearProperties() {
        KEYS.forEach(System::clearProperty);
    }

    @Test
    void defaults_matchApplicationSweep() {
        NanoCalcConfig config = NanoCalcConfig.defaults();
        assertEquals(300.0, config.spectrumStartNm(), 0.0);
        assertEquals(800.0, config.spectrumEndNm(), 0.0);
        assertEquals(5.0, config.spectrumStepNm(), 0.0);
        assertEquals(Parallelizable.DEFAULT_CHUNK_SIZE, config.chunkSize());
        assertTrue(config.parallelThreads() >= 1);
    }

    @Test
    void unsetProperties_giveDefaults() {
        assertEquals(NanoCalcConfig.defaults(), NanoCalcConfig.fromSystemProperties());
    }

    @Test
    void properties_overrideDefaults() {
        System.setProperty(NanoCalcConfig.SPECTRUM_START, "400");
        System.setProperty(NanoCalcConfig.SPECTRUM_END, "700.5");
        System.setProperty(NanoCalcConfig.SPECTRUM_STEP, " 0.5 ");
        System.setProperty(NanoCalcConfig.CHUNK_SIZE, "25");
        System.setProperty(NanoCalcConfig.THREADS, "3");
        System.setProperty(NanoCalcConfig.CACHE_MAX_SIZE, "42");

        NanoCalcConfig config = NanoCalcConfig.fromSystemProperties();

        assertEquals(new NanoCalcConfig(400.0, 700.5, 0.5, 25, 3, 42L), config);
    }

    @Test
    void malformedValues_fallBack() {
        System.setProperty(NanoCalcConfig.SPECTRUM_STEP, "five");
        System.setProperty(NanoCalcConfig.CHUNK_SIZE, "-1");
        System.setProperty(NanoCalcConfig.THREADS, "99999999999");
        System.setProperty(NanoCalcConfig.CACHE_MAX_SIZE, "NaN");

        NanoCalcConfig config = NanoCalcConfig.fromSystemProperties();
        NanoCalcConfig defaults = NanoCalcConfig.defaults();

        assertEquals(defaults, config);
    }

    @Test
    void invertedRange_fallsBackToDefaultRange() {
        System.setProperty(NanoCalcConfig.SPECTRUM_START, "900");
        System.setProperty(NanoCalcConfig.SPECTRUM_END, "400");

        NanoCalcConfig config = NanoCalcConfig.fromSystemProperties();

        assertEquals(300.0, config.spectrumStartNm(), 0.0);
        assertEquals(800.0, config.spectrumEndNm(), 0.0);
    }

    @Test
    void constructor_rejectsInvalidValues() {
        assertThrows(IllegalArgumentException.class, () -> new NanoCalcConfig(300, 800, 0, 100, 1, 10));
        assertThrows(IllegalArgumentException.class, () -> new NanoCalcConfig(800, 300, 5, 100, 1, 10));
        assertThrows(IllegalArgumentException.class, () -> new NanoCalcConfig(300, 800, 5, 0, 1, 10));
        assertThrows(IllegalArgumentException.class, () -> new NanoCalcConfig(300, 800, 5, 100, 0, 10));
        assertThrows(IllegalArgumentException.class, () -> new NanoCalcConfig(300, 800, 5, 100, 1, 0));
    }
}
