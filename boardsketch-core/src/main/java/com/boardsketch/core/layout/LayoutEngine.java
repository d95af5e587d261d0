package com.boardsketch.core.layout;

import com.boardsketch.core.config.DiagramOptions;
import com.boardsketch.core.model.Diagram;
import com.boardsketch.core.model.DiagramKind;

/**
 * Interface for layout engines that compute positions for a parsed {@link Diagram}.
 *
 * <p>A layout engine handles exactly one {@link DiagramKind}. It writes node placements,
 * message positions and diagram bounds, and never changes the diagram's topology. Engines
 * are stateless: the same diagram and options always produce the same placement.
 *
 * <p><b>Registration:</b> Register implementations in
 * {@code META-INF/services/com.boardsketch.core.layout.LayoutEngine}
 *
 * @see com.boardsketch.core.layout.impl.SugiyamaLayout
 * @see com.boardsketch.core.layout.impl.SequenceLayout
 */
public interface LayoutEngine {

    /**
     * Returns unique identifier for this engine (e.g., "sugiyama", "sequence").
     *
     * @return unique engine identifier
     */
    String getId();

    /**
     * Returns the diagram kind this engine lays out.
     *
     * @return diagram kind
     */
    DiagramKind getKind();

    /**
     * Lays out the diagram in place.
     *
     * @param diagram diagram of {@link #getKind()}
     * @param options node sizes, spacings, origin and margin
     * @throws IllegalArgumentException if the diagram has another kind
     */
    void apply(Diagram diagram, DiagramOptions options);
}
