package com.boardsketch.core.config;

import com.boardsketch.core.model.Direction;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Root configuration loaded from {@code boardsketch.yaml}.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * layout:
 *   direction: LR
 *   nodeWidth: 160
 *   nodeHeight: 60
 *   horizontalSpacing: 60
 *   verticalSpacing: 100
 *   crossingPasses: 6
 *
 * limits:
 *   maxNodes: 150
 *
 * parser:
 *   strictReferences: true
 *   requireAcyclic: false
 *
 * output:
 *   format: json
 *   useStencils: true
 * }</pre>
 *
 * <p>Every section is optional; missing values keep the {@link DiagramOptions} defaults.
 *
 * @param layout layout settings
 * @param limits resource limits
 * @param parser parser settings
 * @param output output settings
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record EngineConfig(
    @JsonProperty("layout") LayoutSettings layout,
    @JsonProperty("limits") LimitSettings limits,
    @JsonProperty("parser") ParserSettings parser,
    @JsonProperty("output") OutputSettings output
) {
    /**
     * Compact constructor replacing missing sections with empty ones.
     */
    public EngineConfig {
        if (layout == null) {
            layout = new LayoutSettings(null, null, null, null, null, null, null, null, null, null);
        }
        if (limits == null) {
            limits = new LimitSettings(null);
        }
        if (parser == null) {
            parser = new ParserSettings(null, null);
        }
        if (output == null) {
            output = new OutputSettings(null, null);
        }
    }

    /**
     * Creates a configuration with every value at its default.
     *
     * @return default configuration
     */
    public static EngineConfig defaults() {
        return new EngineConfig(null, null, null, null);
    }

    /**
     * Converts this configuration into diagram options.
     *
     * @return options with configured values applied over the defaults
     */
    public DiagramOptions toOptions() {
        DiagramOptions.Builder b = DiagramOptions.builder();
        if (layout.direction() != null) {
            b.direction(Direction.fromCode(layout.direction())
                .orElseThrow(() -> new IllegalArgumentException("Unknown direction: " + layout.direction())));
        }
        b.nodeSize(orDefault(layout.nodeWidth(), DiagramOptions.DEFAULT_NODE_WIDTH),
            orDefault(layout.nodeHeight(), DiagramOptions.DEFAULT_NODE_HEIGHT));
        b.spacing(orDefault(layout.horizontalSpacing(), DiagramOptions.DEFAULT_HORIZONTAL_SPACING),
            orDefault(layout.verticalSpacing(), DiagramOptions.DEFAULT_VERTICAL_SPACING));
        b.messageSpacing(orDefault(layout.messageSpacing(), DiagramOptions.DEFAULT_MESSAGE_SPACING));
        b.origin(orDefault(layout.startX(), 0), orDefault(layout.startY(), 0));
        b.margin(orDefault(layout.margin(), DiagramOptions.DEFAULT_MARGIN));
        if (layout.crossingPasses() != null) {
            b.crossingPasses(layout.crossingPasses());
        }
        if (limits.maxNodes() != null) {
            b.maxNodes(limits.maxNodes());
        }
        b.strictReferences(Boolean.TRUE.equals(parser.strictReferences()));
        b.requireAcyclic(Boolean.TRUE.equals(parser.requireAcyclic()));
        b.useStencils(Boolean.TRUE.equals(output.useStencils()));
        return b.build();
    }

    private static double orDefault(Double value, double defaultValue) {
        return value != null ? value : defaultValue;
    }

    /**
     * Layout settings.
     *
     * @param direction direction code (TB, TD, BT, LR, RL), overrides the header
     * @param nodeWidth node width in pixels
     * @param nodeHeight node height in pixels
     * @param horizontalSpacing horizontal gap in pixels
     * @param verticalSpacing vertical gap in pixels
     * @param messageSpacing distance between sequence messages
     * @param startX X offset
     * @param startY Y offset
     * @param margin padding around the diagram bounds
     * @param crossingPasses barycenter sweeps
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record LayoutSettings(
        @JsonProperty("direction") String direction,
        @JsonProperty("nodeWidth") Double nodeWidth,
        @JsonProperty("nodeHeight") Double nodeHeight,
        @JsonProperty("horizontalSpacing") Double horizontalSpacing,
        @JsonProperty("verticalSpacing") Double verticalSpacing,
        @JsonProperty("messageSpacing") Double messageSpacing,
        @JsonProperty("startX") Double startX,
        @JsonProperty("startY") Double startY,
        @JsonProperty("margin") Double margin,
        @JsonProperty("crossingPasses") Integer crossingPasses
    ) {}

    /**
     * Resource limits.
     *
     * @param maxNodes node-count ceiling
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record LimitSettings(
        @JsonProperty("maxNodes") Integer maxNodes
    ) {}

    /**
     * Parser settings.
     *
     * @param strictReferences reject undeclared single-mention edge endpoints
     * @param requireAcyclic reject cyclic flowcharts
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ParserSettings(
        @JsonProperty("strictReferences") Boolean strictReferences,
        @JsonProperty("requireAcyclic") Boolean requireAcyclic
    ) {}

    /**
     * Output settings.
     *
     * @param format default renderer id ("json" or "console")
     * @param useStencils use flowchart stencil shapes
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record OutputSettings(
        @JsonProperty("format") String format,
        @JsonProperty("useStencils") Boolean useStencils
    ) {}
}
