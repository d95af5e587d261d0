package com.boardsketch.core.layout.impl;

import com.boardsketch.core.config.DiagramOptions;
import com.boardsketch.core.layout.LayoutEngine;
import com.boardsketch.core.model.Bounds;
import com.boardsketch.core.model.Diagram;
import com.boardsketch.core.model.DiagramKind;
import com.boardsketch.core.model.Edge;
import com.boardsketch.core.model.Node;
import com.boardsketch.core.model.NodeShape;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Direct placement for sequence diagrams.
 *
 * <p>Participants sit in one row in declaration order, one column of
 * {@code nodeWidth + horizontalSpacing} each. Messages are stacked below the headers by
 * slot index, {@code messageSpacing} apart. Actors get a square header of
 * {@code nodeHeight}, centered in their column. Layer and order are left unassigned.
 */
public class SequenceLayout implements LayoutEngine {

    private static final Logger log = LoggerFactory.getLogger(SequenceLayout.class);

    /** Gap between the bottom of the participant headers and the first message row. */
    public static final double HEADER_GAP = 30;

    @Override
    public String getId() {
        return "sequence";
    }

    @Override
    public DiagramKind getKind() {
        return DiagramKind.SEQUENCE;
    }

    @Override
    public void apply(Diagram diagram, DiagramOptions options) {
        Objects.requireNonNull(diagram, "diagram must not be null");
        Objects.requireNonNull(options, "options must not be null");
        if (diagram.kind() != DiagramKind.SEQUENCE) {
            throw new IllegalArgumentException("Sequence layout does not support " + diagram.kind() + " diagrams");
        }

        double column = options.nodeWidth() + options.horizontalSpacing();
        List<Node> participants = diagram.nodes();
        for (int i = 0; i < participants.size(); i++) {
            Node participant = participants.get(i);
            double x = options.startX() + i * column;
            if (participant.shape() == NodeShape.CIRCLE) {
                double size = options.nodeHeight();
                participant.place(x + (options.nodeWidth() - size) / 2, options.startY(), size, size);
            } else {
                participant.place(x, options.startY(), options.nodeWidth(), options.nodeHeight());
            }
        }

        double firstRow = options.startY() + options.nodeHeight() + HEADER_GAP;
        List<Edge> messages = diagram.edges();
        for (int i = 0; i < messages.size(); i++) {
            Edge message = messages.get(i);
            int slot = message.slot() != Edge.NO_SLOT ? message.slot() : i;
            message.placeAt(firstRow + slot * options.messageSpacing());
        }

        // one trailing row below the last message, or a single empty row
        int rows = Math.max(messages.size(), 1);
        double width = participants.isEmpty() ? 0 : (participants.size() - 1) * column + options.nodeWidth();
        double height = options.nodeHeight() + HEADER_GAP + rows * options.messageSpacing();
        diagram.setBounds(new Bounds(options.startX(), options.startY(), width, height));

        log.debug("Laid out sequence diagram: {} participants, {} messages", participants.size(), messages.size());
    }
}
