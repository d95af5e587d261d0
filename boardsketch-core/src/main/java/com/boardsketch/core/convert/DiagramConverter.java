package com.boardsketch.core.convert;

import com.boardsketch.core.config.DiagramOptions;
import com.boardsketch.core.error.DiagramErrors;
import com.boardsketch.core.error.DiagramException;
import com.boardsketch.core.model.Diagram;
import com.boardsketch.core.model.Edge;
import com.boardsketch.core.model.Node;
import com.boardsketch.core.model.NodeShape;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Converts a laid-out {@link Diagram} into a {@link PlacementPlan}.
 *
 * <p><b>Flowcharts</b> become one {@link ShapeRole#NODE} shape per node in declaration
 * order, followed by one elbowed connector per edge.
 *
 * <p><b>Sequence diagrams</b> become one {@link ShapeRole#PARTICIPANT} header per
 * participant, then one {@link ShapeRole#LIFELINE} per participant, then for every message
 * a pair of {@link ShapeRole#ANCHOR} shapes on the two lifelines and a straight connector
 * between them. Message connectors attach to anchors, never to the headers.
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * Diagram diagram = parsers.parse(text, options);
 * layout.apply(diagram, options);
 * PlacementPlan plan = new DiagramConverter().convert(diagram, options);
 * }</pre>
 */
public class DiagramConverter {

    private static final Logger log = LoggerFactory.getLogger(DiagramConverter.class);

    /** Lifeline height used when the diagram carries no bounds. */
    static final double MIN_LIFELINE_HEIGHT = 100;

    /**
     * Converts a diagram with default options.
     *
     * @param diagram laid-out diagram
     * @return placement plan
     * @throws DiagramException UNKNOWN_DIAGRAM_TYPE for kinds without a conversion
     */
    public PlacementPlan convert(Diagram diagram) {
        return convert(diagram, DiagramOptions.defaults());
    }

    /**
     * Converts a diagram.
     *
     * @param diagram laid-out diagram
     * @param options conversion options ({@code useStencils})
     * @return placement plan
     * @throws DiagramException UNKNOWN_DIAGRAM_TYPE for kinds without a conversion
     */
    public PlacementPlan convert(Diagram diagram, DiagramOptions options) {
        Objects.requireNonNull(diagram, "diagram must not be null");
        Objects.requireNonNull(options, "options must not be null");

        List<Placement> placements = switch (diagram.kind()) {
            case FLOWCHART -> convertFlowchart(diagram, options.useStencils());
            case SEQUENCE -> convertSequence(diagram);
            default -> throw DiagramErrors.unknownDiagramType(diagram.kind().name().toLowerCase(Locale.ROOT));
        };

        log.debug("Converted {} diagram into {} placements", diagram.kind(), placements.size());
        return new PlacementPlan(diagram.kind(), diagram.bounds(), placements);
    }

    private List<Placement> convertFlowchart(Diagram diagram, boolean useStencils) {
        List<Placement> placements = new ArrayList<>();
        Map<String, Integer> indexById = new HashMap<>();

        for (Node node : diagram.nodes()) {
            indexById.put(node.id(), placements.size());
            placements.add(toShape(node, useStencils));
        }

        for (Edge edge : diagram.edges()) {
            placements.add(toConnector(edge, indexById.get(edge.from()), indexById.get(edge.to()),
                ShapeStyles.ELBOWED));
        }
        return placements;
    }

    private ShapePlacement toShape(Node node, boolean useStencils) {
        if (useStencils) {
            ShapeStyles.Stencil stencil = ShapeStyles.stencil(node.shape());
            return new ShapePlacement(ShapeRole.NODE, node.id(), stencil.name(), node.label(),
                node.centerX(), node.centerY(), node.width(), node.height(),
                stencil.fillColor(), stencil.borderColor(), true);
        }
        return new ShapePlacement(ShapeRole.NODE, node.id(), ShapeStyles.shapeName(node.shape()), node.label(),
            node.centerX(), node.centerY(), node.width(), node.height(),
            ShapeStyles.fillColor(node.shape()), null, false);
    }

    private List<Placement> convertSequence(Diagram diagram) {
        List<Placement> placements = new ArrayList<>();
        List<Node> participants = diagram.nodes();

        for (Node participant : participants) {
            boolean actor = participant.shape() == NodeShape.CIRCLE;
            placements.add(new ShapePlacement(ShapeRole.PARTICIPANT, participant.id(),
                actor ? "circle" : "rectangle", participant.label(),
                participant.centerX(), participant.centerY(), participant.width(), participant.height(),
                actor ? ShapeStyles.ACTOR_FILL : ShapeStyles.PARTICIPANT_FILL, null, false));
        }

        double bottom = diagram.bounds().maxY();
        for (Node participant : participants) {
            double top = participant.y() + participant.height();
            double height = bottom > top ? bottom - top : MIN_LIFELINE_HEIGHT;
            placements.add(new ShapePlacement(ShapeRole.LIFELINE, participant.id(), "rectangle", "",
                participant.centerX(), top + height / 2, ShapeStyles.LIFELINE_WIDTH, height,
                ShapeStyles.LIFELINE_COLOR, null, false));
        }

        Map<String, Node> byId = new HashMap<>();
        participants.forEach(p -> byId.put(p.id(), p));
        for (Edge message : diagram.edges()) {
            int from = placements.size();
            placements.add(anchor(byId.get(message.from()), message.y()));
            int to = placements.size();
            placements.add(anchor(byId.get(message.to()), message.y()));
            placements.add(toConnector(message, from, to, ShapeStyles.STRAIGHT));
        }
        return placements;
    }

    private ShapePlacement anchor(Node participant, double y) {
        return new ShapePlacement(ShapeRole.ANCHOR, participant.id(), "circle", "",
            participant.centerX(), y, ShapeStyles.ANCHOR_SIZE, ShapeStyles.ANCHOR_SIZE,
            ShapeStyles.ANCHOR_COLOR, null, false);
    }

    private ConnectorPlacement toConnector(Edge edge, int start, int end, String connectorShape) {
        return new ConnectorPlacement(start, end, edge.label(), connectorShape,
            ShapeStyles.strokeStyle(edge.style()), ShapeStyles.strokeWidth(edge.style()),
            ShapeStyles.cap(edge.startCap()), ShapeStyles.cap(edge.endCap()));
    }
}
