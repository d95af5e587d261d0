package com.boardsketch.core.renderer;

import com.boardsketch.core.pipeline.DiagramResult;

/**
 * Interface for renderers that emit a pipeline result in some output format.
 *
 * <p>Renderers are discovered via Java Service Provider Interface (SPI) and selected by
 * {@link #getId()}.
 *
 * <p><b>Example Implementation:</b>
 * <pre>{@code
 * public class JsonPlacementRenderer implements PlacementRenderer {
 *     @Override
 *     public String getId() {
 *         return "json";
 *     }
 *
 *     @Override
 *     public void render(DiagramResult result, RenderContext context) {
 *         context.out().println(mapper.writeValueAsString(result.plan()));
 *     }
 * }
 * }</pre>
 *
 * <p><b>Registration:</b> Register implementations in
 * {@code META-INF/services/com.boardsketch.core.renderer.PlacementRenderer}
 *
 * @see RenderContext
 */
public interface PlacementRenderer {

    /**
     * Returns unique identifier for this renderer.
     *
     * <p>Used for selecting the output format. Should be lowercase (e.g., "json", "console").
     *
     * @return unique renderer identifier
     */
    String getId();

    /**
     * Writes the result to the context's output stream.
     *
     * @param result pipeline result
     * @param context output stream and renderer settings
     * @throws IllegalStateException if the result cannot be written
     */
    void render(DiagramResult result, RenderContext context);
}
