package com.boardsketch.cli;

import com.boardsketch.core.config.ConfigLoader;
import com.boardsketch.core.config.DiagramOptions;
import com.boardsketch.core.config.EngineConfig;
import com.boardsketch.core.model.DiagramKind;
import com.boardsketch.core.model.Direction;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Input file and diagram options shared by the commands that process a diagram.
 *
 * <p>Options given on the command line override values from the configuration file.
 */
public class DiagramInput {

    @Parameters(index = "0", arity = "0..1", description = "Diagram file; reads stdin when omitted or '-'")
    private Path file;

    @Option(names = {"-c", "--config"}, description = "Configuration file (default: ${DEFAULT-VALUE})")
    private Path configFile = Paths.get(ConfigLoader.DEFAULT_FILE_NAME);

    @Option(names = {"-k", "--kind"}, description = "Force diagram kind: ${COMPLETION-CANDIDATES}")
    private DiagramKind kind;

    @Option(names = {"-d", "--direction"}, description = "Override direction: TB, TD, BT, LR or RL")
    private String direction;

    @Option(names = "--node-width", description = "Node width in pixels")
    private Double nodeWidth;

    @Option(names = "--node-height", description = "Node height in pixels")
    private Double nodeHeight;

    @Option(names = "--origin", split = ",", description = "Diagram origin as X,Y")
    private double[] origin;

    @Option(names = "--spacing", split = ",", description = "Gap between nodes in a layer and between layers as H,V")
    private double[] spacing;

    @Option(names = "--message-spacing", description = "Vertical distance between sequence messages")
    private Double messageSpacing;

    @Option(names = "--margin", description = "Padding around the flowchart bounds")
    private Double margin;

    @Option(names = "--crossing-passes", description = "Number of crossing-reduction sweeps")
    private Integer crossingPasses;

    @Option(names = "--max-nodes", description = "Node-count ceiling")
    private Integer maxNodes;

    @Option(names = "--strict", description = "Reject undeclared edge endpoints mentioned only once")
    private boolean strict;

    @Option(names = "--acyclic", description = "Reject flowcharts containing a cycle")
    private boolean acyclic;

    @Option(names = "--stencils", description = "Use flowchart stencil shapes")
    private boolean stencils;

    /**
     * Reads the diagram text from the file or standard input.
     *
     * @param stdin stream used when no file is given
     * @return diagram text
     * @throws IOException if the input cannot be read
     */
    public String readText(InputStream stdin) throws IOException {
        if (file == null || "-".equals(file.toString())) {
            return new String(stdin.readAllBytes(), StandardCharsets.UTF_8);
        }
        return Files.readString(file, StandardCharsets.UTF_8);
    }

    /**
     * Describes where the diagram comes from, for messages.
     *
     * @return file name or "stdin"
     */
    public String source() {
        return file == null || "-".equals(file.toString()) ? "stdin" : file.toString();
    }

    public EngineConfig loadConfig() {
        return ConfigLoader.load(configFile);
    }

    /**
     * Resolves diagram options: defaults, then the configuration file, then command-line flags.
     *
     * @param config loaded configuration
     * @return resolved options
     * @throws IllegalArgumentException if a direction is unknown
     */
    public DiagramOptions resolveOptions(EngineConfig config) {
        DiagramOptions base = config.toOptions();
        DiagramOptions.Builder builder = base.toBuilder();
        if (kind != null) {
            builder.kind(kind);
        }
        if (direction != null) {
            builder.direction(Direction.fromCode(direction)
                .orElseThrow(() -> new IllegalArgumentException("Unknown direction: " + direction)));
        }
        if (nodeWidth != null || nodeHeight != null) {
            builder.nodeSize(nodeWidth != null ? nodeWidth : base.nodeWidth(),
                nodeHeight != null ? nodeHeight : base.nodeHeight());
        }
        if (origin != null) {
            if (origin.length != 2) {
                throw new IllegalArgumentException("Origin must be X,Y");
            }
            builder.origin(origin[0], origin[1]);
        }
        if (spacing != null) {
            if (spacing.length != 2) {
                throw new IllegalArgumentException("Spacing must be H,V");
            }
            builder.spacing(spacing[0], spacing[1]);
        }
        if (messageSpacing != null) {
            builder.messageSpacing(messageSpacing);
        }
        if (margin != null) {
            builder.margin(margin);
        }
        if (crossingPasses != null) {
            builder.crossingPasses(crossingPasses);
        }
        if (maxNodes != null) {
            builder.maxNodes(maxNodes);
        }
        if (strict) {
            builder.strictReferences(true);
        }
        if (acyclic) {
            builder.requireAcyclic(true);
        }
        if (stencils) {
            builder.useStencils(true);
        }
        return builder.build();
    }
}
