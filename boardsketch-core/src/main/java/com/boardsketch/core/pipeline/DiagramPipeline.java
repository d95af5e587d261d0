package com.boardsketch.core.pipeline;

import com.boardsketch.core.config.DiagramOptions;
import com.boardsketch.core.convert.DiagramConverter;
import com.boardsketch.core.convert.PlacementPlan;
import com.boardsketch.core.error.DiagramErrors;
import com.boardsketch.core.error.DiagramException;
import com.boardsketch.core.layout.LayoutEngine;
import com.boardsketch.core.model.Diagram;
import com.boardsketch.core.model.DiagramKind;
import com.boardsketch.core.parser.DiagramParsers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.ServiceLoader;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Runs diagram text through parsing, layout and conversion.
 *
 * <p>Every stage either completes or throws a {@link DiagramException}; a failed run never
 * yields a partial result. Layout only starts once parsing succeeded, so node-count and
 * syntax errors never cost layout work.
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * DiagramPipeline pipeline = DiagramPipeline.fromServiceLoader();
 * DiagramResult result = pipeline.run("flowchart LR\nA --> B", DiagramOptions.defaults());
 * result.plan().placements().forEach(System.out::println);
 * }</pre>
 */
public class DiagramPipeline {

    private static final Logger log = LoggerFactory.getLogger(DiagramPipeline.class);

    private final DiagramParsers parsers;
    private final Map<DiagramKind, LayoutEngine> layouts = new EnumMap<>(DiagramKind.class);
    private final DiagramConverter converter;

    /**
     * Creates a pipeline from explicit components.
     *
     * @param parsers parser registry
     * @param layouts layout engines, at most one per kind
     * @param converter placement converter
     * @throws IllegalArgumentException if two layout engines claim the same kind
     */
    public DiagramPipeline(DiagramParsers parsers, Collection<? extends LayoutEngine> layouts,
                           DiagramConverter converter) {
        this.parsers = Objects.requireNonNull(parsers, "parsers must not be null");
        this.converter = Objects.requireNonNull(converter, "converter must not be null");
        Objects.requireNonNull(layouts, "layouts must not be null");
        for (LayoutEngine layout : layouts) {
            LayoutEngine previous = this.layouts.putIfAbsent(layout.getKind(), layout);
            if (previous != null) {
                throw new IllegalArgumentException("Duplicate layout engine for " + layout.getKind() + ": "
                    + previous.getId() + " and " + layout.getId());
            }
        }
    }

    /**
     * Creates a pipeline from the parsers and layout engines registered via
     * {@code META-INF/services}.
     *
     * @return pipeline
     */
    public static DiagramPipeline fromServiceLoader() {
        List<LayoutEngine> layouts = ServiceLoader.load(LayoutEngine.class).stream()
            .map(ServiceLoader.Provider::get)
            .toList();
        log.debug("Discovered {} layout engines", layouts.size());
        return new DiagramPipeline(DiagramParsers.fromServiceLoader(), layouts, new DiagramConverter());
    }

    /**
     * Returns the kinds that can be taken all the way from text to placements.
     *
     * @return supported kinds
     */
    public Set<DiagramKind> supportedKinds() {
        return parsers.supportedKinds().stream()
            .filter(layouts::containsKey)
            .collect(Collectors.toUnmodifiableSet());
    }

    /**
     * Parses, lays out and converts diagram text.
     *
     * @param text diagram text
     * @param options pipeline options
     * @return laid-out diagram and its placements
     * @throws DiagramException if any stage rejects the input
     */
    public DiagramResult run(String text, DiagramOptions options) {
        Diagram diagram = layout(text, options);
        PlacementPlan plan = converter.convert(diagram, options);
        log.info("Rendered {} diagram: {} nodes, {} edges, {} placements",
            diagram.kind().name().toLowerCase(Locale.ROOT), diagram.nodeCount(), diagram.edges().size(),
            plan.size());
        return new DiagramResult(diagram, plan);
    }

    /**
     * Parses and lays out diagram text without converting it.
     *
     * @param text diagram text
     * @param options pipeline options
     * @return laid-out diagram
     * @throws DiagramException if the text is invalid or its kind cannot be laid out
     */
    public Diagram layout(String text, DiagramOptions options) {
        Objects.requireNonNull(options, "options must not be null");
        Diagram diagram = parsers.parse(text, options);

        LayoutEngine layout = layouts.get(diagram.kind());
        if (layout == null) {
            throw DiagramErrors.unknownDiagramType(diagram.kind().name().toLowerCase(Locale.ROOT));
        }
        layout.apply(diagram, options);
        log.debug("Applied layout '{}' to {}", layout.getId(), diagram);
        return diagram;
    }
}
