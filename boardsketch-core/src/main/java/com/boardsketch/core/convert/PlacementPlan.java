package com.boardsketch.core.convert;

import com.boardsketch.core.model.Bounds;
import com.boardsketch.core.model.DiagramKind;
import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.List;
import java.util.Objects;

/**
 * Ordered output of the converter.
 *
 * <p>Placements are meant to be created in list order. A connector only references shapes
 * that come before it, so each shape exists by the time a connector needs it.
 *
 * @param kind kind of the converted diagram
 * @param bounds bounding box of the laid-out diagram
 * @param placements shapes and connectors in creation order
 */
public record PlacementPlan(
    DiagramKind kind,
    Bounds bounds,
    List<Placement> placements
) {
    /**
     * Compact constructor with validation.
     */
    public PlacementPlan {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(bounds, "bounds must not be null");
        placements = placements == null ? List.of() : List.copyOf(placements);
        for (int i = 0; i < placements.size(); i++) {
            if (placements.get(i) instanceof ConnectorPlacement connector
                && (connector.startIndex() >= i || connector.endIndex() >= i
                    || !(placements.get(connector.startIndex()) instanceof ShapePlacement)
                    || !(placements.get(connector.endIndex()) instanceof ShapePlacement))) {
                throw new IllegalArgumentException("Connector at " + i + " must reference earlier shapes");
            }
        }
    }

    public int size() {
        return placements.size();
    }

    public Placement get(int index) {
        return placements.get(index);
    }

    @JsonIgnore
    public List<ShapePlacement> shapes() {
        return placements.stream()
            .filter(ShapePlacement.class::isInstance)
            .map(ShapePlacement.class::cast)
            .toList();
    }

    @JsonIgnore
    public List<ConnectorPlacement> connectors() {
        return placements.stream()
            .filter(ConnectorPlacement.class::isInstance)
            .map(ConnectorPlacement.class::cast)
            .toList();
    }

    /**
     * Returns the shapes with the given role, in plan order.
     *
     * @param role shape role
     * @return matching shapes
     */
    public List<ShapePlacement> shapes(ShapeRole role) {
        return shapes().stream().filter(s -> s.role() == role).toList();
    }
}
