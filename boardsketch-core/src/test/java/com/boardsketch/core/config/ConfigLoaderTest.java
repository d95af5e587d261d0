package com.boardsketch.core.config;

import com.boardsketch.core.model.Direction;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link ConfigLoader}.
 */
class ConfigLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void load_validYaml_returnsConfig() throws IOException {
        Path configFile = tempDir.resolve("boardsketch.yaml");
        Files.writeString(configFile, """
            layout:
              direction: LR
              nodeWidth: 160
              nodeHeight: 60
              horizontalSpacing: 40
              verticalSpacing: 90
              crossingPasses: 6

            limits:
              maxNodes: 150

            parser:
              strictReferences: true

            output:
              format: console
              useStencils: true
            """);

        EngineConfig config = ConfigLoader.load(configFile);

        assertThat(config.layout().direction()).isEqualTo("LR");
        assertThat(config.layout().nodeWidth()).isEqualTo(160.0);
        assertThat(config.limits().maxNodes()).isEqualTo(150);
        assertThat(config.parser().strictReferences()).isTrue();
        assertThat(config.parser().requireAcyclic()).isNull();
        assertThat(config.output().format()).isEqualTo("console");
        assertThat(config.output().useStencils()).isTrue();
    }

    @Test
    void load_validYaml_convertsToOptions() throws IOException {
        Path configFile = tempDir.resolve("boardsketch.yaml");
        Files.writeString(configFile, """
            layout:
              direction: BT
              nodeWidth: 160
              startX: 10
              startY: 20
            limits:
              maxNodes: 150
            """);

        DiagramOptions options = ConfigLoader.load(configFile).toOptions();

        assertThat(options.direction()).isEqualTo(Direction.BOTTOM_TO_TOP);
        assertThat(options.nodeWidth()).isEqualTo(160);
        assertThat(options.nodeHeight()).isEqualTo(DiagramOptions.DEFAULT_NODE_HEIGHT);
        assertThat(options.startX()).isEqualTo(10);
        assertThat(options.startY()).isEqualTo(20);
        assertThat(options.maxNodes()).isEqualTo(150);
        assertThat(options.strictReferences()).isFalse();
    }

    @Test
    void load_unknownProperties_areIgnored() throws IOException {
        Path configFile = tempDir.resolve("boardsketch.yaml");
        Files.writeString(configFile, """
            layout:
              nodeWidth: 120
              theme: dark
            board:
              id: abc
            """);

        EngineConfig config = ConfigLoader.load(configFile);

        assertThat(config.layout().nodeWidth()).isEqualTo(120.0);
    }

    @Test
    void load_nonExistentFile_returnsDefaults() {
        EngineConfig config = ConfigLoader.load(tempDir.resolve("missing.yaml"));

        assertThat(config).isEqualTo(EngineConfig.defaults());
        assertThat(config.toOptions()).isEqualTo(DiagramOptions.defaults());
    }

    @Test
    void load_invalidYaml_returnsDefaults() throws IOException {
        Path configFile = tempDir.resolve("boardsketch.yaml");
        Files.writeString(configFile, "layout: [unclosed\n  nodeWidth: : 3");

        EngineConfig config = ConfigLoader.load(configFile);

        assertThat(config).isEqualTo(EngineConfig.defaults());
    }

    @Test
    void load_emptyFile_returnsDefaults() throws IOException {
        Path configFile = tempDir.resolve("boardsketch.yaml");
        Files.writeString(configFile, "");

        assertThat(ConfigLoader.load(configFile)).isEqualTo(EngineConfig.defaults());
    }

    @Test
    void load_directory_returnsDefaults() {
        assertThat(ConfigLoader.load(tempDir)).isEqualTo(EngineConfig.defaults());
    }

    @Test
    void toOptions_unknownDirection_throwsException() throws IOException {
        Path configFile = tempDir.resolve("boardsketch.yaml");
        Files.writeString(configFile, "layout:\n  direction: sideways\n");

        EngineConfig config = ConfigLoader.load(configFile);

        assertThatThrownBy(config::toOptions)
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("sideways");
    }
}
