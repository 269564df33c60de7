package replacer.config;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Properties;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;

@DisplayName("ReplacerConfigLoader")
class ReplacerConfigLoaderTest {

    @TempDir
    Path tempDir;

    @AfterEach
    void clearOverrides() {
        System.clearProperty("replacer.batch.size");
    }

    private static Properties props(String... keyValues) {
        Properties p = new Properties();
        for (int i = 0; i < keyValues.length; i += 2) {
            p.setProperty(keyValues[i], keyValues[i + 1]);
        }
        return p;
    }

    @Nested
    @DisplayName("classpath")
    class Classpath {

        @Test
        @DisplayName("should load nested YAML keys from replacer.yml")
        void shouldLoadYamlFromClasspath() {
            ReplacerConfig config = ReplacerConfigLoader.load();

            assertEquals(25, config.batchSize());
            assertEquals(2, config.rewriteWorkers());
            assertEquals(5, config.maxAttempts());
            assertThat(config.backoffBase()).isEqualTo(Duration.ofMillis(200));
            assertThat(config.backoffMax()).isEqualTo(Duration.ofMillis(4000));
            assertThat(config.backoffJitter()).isEqualTo(0.25);
            assertThat(config.deployPollInterval()).isEqualTo(Duration.ofSeconds(2));
            assertThat(config.deployMaxWait()).isEqualTo(Duration.ofMinutes(10));
            assertThat(config.continueOnError()).isTrue();
            assertThat(config.workspaceDir()).isEqualTo(Path.of("build/report-migration"));
            assertThat(config.alertLevel()).isEqualTo(AlertLevel.DEBUG);
        }

        @Test
        @DisplayName("should let system properties override file values")
        void shouldPreferSystemProperties() {
            System.setProperty("replacer.batch.size", "7");

            assertEquals(7, ReplacerConfigLoader.load().batchSize());
        }
    }

    @Nested
    @DisplayName("files")
    class FromFile {

        @Test
        @DisplayName("should load a properties file")
        void shouldLoadProperties() throws Exception {
            Path file = tempDir.resolve("custom.properties");
            Files.writeString(file, "replacer.batch.size=40\nreplacer.api.version=62.0\nreplacer.timeout.connector=90\n");

            ReplacerConfig config = ReplacerConfigLoader.loadFromFile(file);

            assertEquals(40, config.batchSize());
            assertThat(config.apiVersion()).isEqualTo("62.0");
            assertThat(config.connectorTimeout()).isEqualTo(Duration.ofSeconds(90));
        }

        @Test
        @DisplayName("should load a .yaml file")
        void shouldLoadYamlFile() throws Exception {
            Path file = tempDir.resolve("custom.yaml");
            Files.writeString(file, "replacer:\n  batch:\n    size: 12\n");

            assertEquals(12, ReplacerConfigLoader.loadFromFile(file).batchSize());
        }

        @Test
        @DisplayName("should reject unparseable YAML")
        void shouldRejectBrokenYaml() throws Exception {
            Path file = tempDir.resolve("broken.yml");
            Files.writeString(file, "replacer: [unclosed\n");

            assertThatThrownBy(() -> ReplacerConfigLoader.loadFromFile(file))
                    .isInstanceOf(ReplacerConfigException.class)
                    .hasMessageContaining("broken.yml");
        }

        @Test
        @DisplayName("should treat an empty YAML file as all defaults")
        void shouldAcceptEmptyYaml() throws Exception {
            Path file = tempDir.resolve("empty.yml");
            Files.writeString(file, "");

            assertEquals(ReplacerConfig.DEFAULTS.batchSize(), ReplacerConfigLoader.loadFromFile(file).batchSize());
        }
    }

    @Nested
    @DisplayName("invalid values")
    class InvalidValues {

        @Test
        @DisplayName("should keep defaults for values that do not parse or validate")
        void shouldIgnoreInvalidValues() {
            ReplacerConfig config = ReplacerConfigLoader.parse(props(
                    "replacer.batch.size", "many",
                    "replacer.rewrite.workers", "0",
                    "replacer.retry.backoff.jitter", "1.5",
                    "replacer.alert.level", "LOUD"));

            assertEquals(100, config.batchSize());
            assertEquals(4, config.rewriteWorkers());
            assertThat(config.backoffJitter()).isEqualTo(0.1);
            assertThat(config.alertLevel()).isEqualTo(AlertLevel.WARNING);
        }

        @Test
        @DisplayName("should fall back to default backoff when max is below base")
        void shouldRepairInconsistentBackoff() {
            ReplacerConfig config = ReplacerConfigLoader.parse(props(
                    "replacer.retry.backoff.base.ms", "5000",
                    "replacer.retry.backoff.max.ms", "100",
                    "replacer.batch.size", "10"));

            assertThat(config.backoffBase()).isEqualTo(Duration.ofSeconds(1));
            assertThat(config.backoffMax()).isEqualTo(Duration.ofSeconds(30));
            assertEquals(10, config.batchSize());
        }

        @Test
        @DisplayName("should disable the connector timeout for zero or negative seconds")
        void shouldDisableTimeout() {
            ReplacerConfig config = ReplacerConfigLoader.parse(props("replacer.timeout.connector", "-1"));

            assertThat(config.connectorTimeout()).isEqualTo(Duration.ZERO);
        }
    }
}
