package com.boardsketch.core.renderer;

import java.io.PrintWriter;
import java.util.Map;
import java.util.Objects;

/**
 * Context provided to renderers during execution.
 *
 * @param out destination writer
 * @param settings renderer-specific settings
 */
public record RenderContext(
    PrintWriter out,
    Map<String, String> settings
) {
    /**
     * Compact constructor with validation.
     */
    public RenderContext {
        Objects.requireNonNull(out, "out must not be null");
        if (settings == null) {
            settings = Map.of();
        }
    }

    /**
     * Gets a setting with a default.
     *
     * @param key setting key
     * @param defaultValue default value
     * @return setting value or default
     */
    public String getSettingOrDefault(String key, String defaultValue) {
        return settings.getOrDefault(key, defaultValue);
    }
}
