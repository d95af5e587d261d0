package com.boardsketch.core.parser;

import com.boardsketch.core.layout.LayoutEngine;
import com.boardsketch.core.renderer.PlacementRenderer;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.ServiceLoader;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Integration test validating SPI registration for parsers, layout engines and renderers.
 *
 * <p>Guards against typos in {@code META-INF/services} files and constructor failures during
 * instantiation.
 */
class ParserServiceLoaderTest {

    @Test
    void serviceLoader_discoversAllRegisteredParsers() {
        List<DiagramParser> parsers = ServiceLoader.load(DiagramParser.class).stream()
            .map(ServiceLoader.Provider::get)
            .toList();

        assertThat(parsers)
            .extracting(DiagramParser::getId)
            .containsExactly("flowchart", "sequence");
    }

    @Test
    void serviceLoader_discoversAllRegisteredLayoutEngines() {
        List<LayoutEngine> layouts = ServiceLoader.load(LayoutEngine.class).stream()
            .map(ServiceLoader.Provider::get)
            .toList();

        assertThat(layouts)
            .extracting(LayoutEngine::getId)
            .containsExactly("sugiyama", "sequence");
    }

    @Test
    void serviceLoader_discoversAllRegisteredRenderers() {
        List<PlacementRenderer> renderers = ServiceLoader.load(PlacementRenderer.class).stream()
            .map(ServiceLoader.Provider::get)
            .toList();

        assertThat(renderers)
            .extracting(PlacementRenderer::getId)
            .doesNotHaveDuplicates()
            .containsExactlyInAnyOrder("json", "console");
    }

    @Test
    void fromServiceLoader_supportsBothDialects() {
        assertThat(DiagramParsers.fromServiceLoader().supportedKinds()).hasSize(2);
    }
}
