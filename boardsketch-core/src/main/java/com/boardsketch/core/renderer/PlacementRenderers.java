package com.boardsketch.core.renderer;

import java.util.List;
import java.util.Optional;
import java.util.ServiceLoader;

/**
 * Lookup of the renderers registered via {@code META-INF/services}.
 */
public final class PlacementRenderers {

    private PlacementRenderers() {
        throw new AssertionError("Utility class should not be instantiated");
    }

    public static List<PlacementRenderer> all() {
        return ServiceLoader.load(PlacementRenderer.class).stream()
            .map(ServiceLoader.Provider::get)
            .toList();
    }

    public static Optional<PlacementRenderer> find(String id) {
        return all().stream().filter(r -> r.getId().equalsIgnoreCase(id)).findFirst();
    }
}
