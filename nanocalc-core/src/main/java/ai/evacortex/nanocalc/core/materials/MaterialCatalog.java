/*
 * NanoCalc — Nanoparticle Optics Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.nanocalc.core.materials;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Read-only list of {@link MaterialPreset}s loaded from a JSON array on the classpath.
 */
public final class MaterialCatalog {

    private static final Logger log = LoggerFactory.getLogger(MaterialCatalog.class);

    public static final String DEFAULT_RESOURCE = "/materials/presets.json";

    private final List<MaterialPreset> presets;

    private MaterialCatalog(List<MaterialPreset> presets) {
        this.presets = List.copyOf(presets);
    }

    public static MaterialCatalog loadDefault() {
        return load(DEFAULT_RESOURCE);
    }

    /**
     * @param resource absolute classpath resource holding a JSON array of presets
     * @throws UncheckedIOException if the resource is missing or malformed
     */
    public static MaterialCatalog load(String resource) {
        ObjectMapper mapper = new ObjectMapper();
        try (InputStream in = MaterialCatalog.class.getResourceAsStream(resource)) {
            if (in == null) {
                throw new UncheckedIOException(new IOException("Material catalog not found: " + resource));
            }
            List<MaterialPreset> loaded = mapper.readValue(in, new TypeReference<List<MaterialPreset>>() {});
            log.info("Loaded {} material presets from {}", loaded.size(), resource);
            return new MaterialCatalog(loaded);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load material catalog " + resource, e);
        }
    }

    /**
     * @return presets in file order
     */
    public List<MaterialPreset> all() {
        return presets;
    }

    /**
     * Case-insensitive lookup by full name (e.g. "Gold (Au)") or by the symbol in parentheses (e.g. "au").
     */
    public Optional<MaterialPreset> find(String name) {
        if (name == null) return Optional.empty();
        String wanted = name.trim().toLowerCase(Locale.ROOT);
        return presets.stream()
                .filter(p -> p.name().toLowerCase(Locale.ROOT).equals(wanted) || symbolOf(p).equals(wanted))
                .findFirst();
    }

    private static String symbolOf(MaterialPreset preset) {
        String n = preset.name();
        int open = n.indexOf('(');
        int close = n.indexOf(')', open + 1);
        if (open < 0 || close < 0) return "";
        return n.substring(open + 1, close).trim().toLowerCase(Locale.ROOT);
    }

    public int size() {
        return presets.size();
    }
}
