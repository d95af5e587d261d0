package com.boardsketch.core.parser;

import com.boardsketch.core.config.DiagramOptions;
import com.boardsketch.core.error.DiagramException;
import com.boardsketch.core.model.Diagram;
import com.boardsketch.core.model.DiagramKind;

/**
 * Interface for parsers that turn diagram text into a {@link Diagram}.
 *
 * <p>Each parser handles one {@link DiagramKind}. Parsers are stateless and discovered via
 * Java Service Provider Interface (SPI).
 *
 * <p><b>Example Implementation:</b>
 * <pre>{@code
 * public class FlowchartParser implements DiagramParser {
 *     @Override
 *     public String getId() {
 *         return "flowchart";
 *     }
 *
 *     @Override
 *     public DiagramKind getKind() {
 *         return DiagramKind.FLOWCHART;
 *     }
 *
 *     @Override
 *     public Diagram parse(String text, DiagramOptions options) {
 *         // header, statements, references ...
 *     }
 * }
 * }</pre>
 *
 * <p><b>Registration:</b> Register implementations in
 * {@code META-INF/services/com.boardsketch.core.parser.DiagramParser}
 *
 * @see DiagramParsers
 */
public interface DiagramParser {

    /**
     * Returns unique identifier for this parser (e.g., "flowchart", "sequence").
     *
     * @return unique parser identifier
     */
    String getId();

    /**
     * Returns the diagram kind this parser produces.
     *
     * @return diagram kind
     */
    DiagramKind getKind();

    /**
     * Parses diagram text.
     *
     * <p>Either returns a complete diagram or throws; a partially parsed diagram is never
     * returned. The returned diagram has no layout yet.
     *
     * @param text raw diagram text, header included
     * @param options parse options (node ceiling, reference policy, direction override)
     * @return parsed diagram
     * @throws DiagramException if the text is not a valid diagram of this kind
     */
    Diagram parse(String text, DiagramOptions options);
}
