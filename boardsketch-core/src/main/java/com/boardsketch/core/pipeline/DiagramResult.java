package com.boardsketch.core.pipeline;

import com.boardsketch.core.convert.PlacementPlan;
import com.boardsketch.core.model.Diagram;

import java.util.Objects;

/**
 * Outcome of a successful pipeline run.
 *
 * @param diagram the parsed and laid-out diagram
 * @param plan placements derived from the diagram
 */
public record DiagramResult(
    Diagram diagram,
    PlacementPlan plan
) {
    /**
     * Compact constructor with validation.
     */
    public DiagramResult {
        Objects.requireNonNull(diagram, "diagram must not be null");
        Objects.requireNonNull(plan, "plan must not be null");
    }
}
