package org.teamelites.swarm.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.teamelites.junit.extensions.logging.LogWatchExtension;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

/**
 * Verifies the configuration layering:
 * <ol>
 *   <li>System properties (highest priority)</li>
 *   <li>Environment variables</li>
 *   <li>Configuration file</li>
 *   <li>reference.conf defaults (lowest priority)</li>
 * </ol>
 */
@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class ConfigLoaderTest {

    @TempDir
    Path tempDir;

    private final List<String> messages = new ArrayList<>();

    @BeforeEach
    void setUp() {
        ConfigFactory.invalidateCaches();
    }

    @AfterEach
    void tearDown() {
        System.clearProperty("team-elites.evolution.population-size");
        System.clearProperty("team-elites.hub.url");
        ConfigFactory.invalidateCaches();
    }

    private Path writeConfig(String content) throws IOException {
        Path file = tempDir.resolve(ConfigLoader.CONFIG_FILE_NAME);
        Files.writeString(file, content);
        return file;
    }

    @Test
    @DisplayName("Defaults come from reference.conf")
    void defaultsComeFromReference() {
        Config config = ConfigLoader.load(null).getConfig(ConfigLoader.ROOT);

        assertThat(config.getString("hub.url")).isEqualTo("http://localhost:1731/mcp");
        assertThat(config.getString("gateway.url")).isEqualTo(config.getString("hub.url"));
        assertThat(config.getConfigList("evolution.niches")).hasSize(10);
        assertThat(config.getBoolean("evolution.enabled")).isFalse();
        assertThat(config.getBoolean("reasoning.enabled")).isFalse();
    }

    @Test
    @DisplayName("File values override defaults and reach substitutions")
    void fileOverridesDefaultsAndSubstitutions() throws IOException {
        Path file = writeConfig("team-elites.hub.url = \"http://hub.internal:9000/mcp\"\n"
                + "team-elites.evolution.population-size = 3");

        Config config = ConfigLoader.load(file).getConfig(ConfigLoader.ROOT);

        assertThat(config.getInt("evolution.population-size")).isEqualTo(3);
        assertThat(config.getString("gateway.url")).isEqualTo("http://hub.internal:9000/mcp");
        assertThat(config.getInt("evolution.max-agents")).isEqualTo(10);
    }

    @Test
    @DisplayName("System properties override the file")
    void systemPropertyOverridesFile() throws IOException {
        Path file = writeConfig("team-elites.evolution.population-size = 3");
        System.setProperty("team-elites.evolution.population-size", "7");
        ConfigFactory.invalidateCaches();

        Config config = ConfigLoader.load(file).getConfig(ConfigLoader.ROOT);

        assertThat(config.getInt("evolution.population-size")).isEqualTo(7);
    }

    @Test
    void explicitFileIsReported() throws IOException {
        Path file = writeConfig("team-elites.events.enabled = false");

        Config config = ConfigLoader.resolve(file, (level, message) -> messages.add(level + " " + message));

        assertThat(config.getBoolean("team-elites.events.enabled")).isFalse();
        assertThat(messages).singleElement().asString().startsWith("INFO Using configuration file");
    }

    @Test
    void missingExplicitFileIsAnError() {
        Path missing = tempDir.resolve("nope.conf");

        assertThatThrownBy(() -> ConfigLoader.resolve(missing, (level, message) -> messages.add(message)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("nope.conf");
    }

    @Test
    void withoutAnyFileDefaultsAreUsedWithWarning() {
        Config config = ConfigLoader.resolve(null, (level, message) -> messages.add(level + " " + message));

        assertThat(config.hasPath("team-elites.data-dir")).isTrue();
        assertThat(messages).last().asString().startsWith("WARN No config/team-elites.conf found");
    }
}
