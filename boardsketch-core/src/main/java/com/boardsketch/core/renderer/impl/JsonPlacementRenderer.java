package com.boardsketch.core.renderer.impl;

import com.boardsketch.core.pipeline.DiagramResult;
import com.boardsketch.core.renderer.PlacementRenderer;
import com.boardsketch.core.renderer.RenderContext;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes the placement plan as JSON.
 *
 * <p><b>Configuration Settings:</b>
 * <ul>
 *   <li>{@code json.pretty} - Indent output ("true"/"false", default: "true")</li>
 * </ul>
 */
public class JsonPlacementRenderer implements PlacementRenderer {

    private static final Logger log = LoggerFactory.getLogger(JsonPlacementRenderer.class);

    private final ObjectMapper mapper = new ObjectMapper();

    @Override
    public String getId() {
        return "json";
    }

    @Override
    public void render(DiagramResult result, RenderContext context) {
        boolean pretty = Boolean.parseBoolean(context.getSettingOrDefault("json.pretty", "true"));
        try {
            ObjectWriter writer = pretty ? mapper.writerWithDefaultPrettyPrinter() : mapper.writer();
            String json = writer.writeValueAsString(result.plan());
            context.out().println(json);
            context.out().flush();
            log.debug("Wrote {} placements as JSON", result.plan().size());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize placement plan", e);
        }
    }
}
