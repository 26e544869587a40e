package io.spekcheck.standalone.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;
import java.util.function.Function;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Tests for the environment variable overlay of {@link ConfigLoader}.
 *
 * <p>
 * Env vars take precedence over YAML values. A variable is "set" only if it is defined and its
 * trimmed value is non-empty; blank values leave the YAML value in place.
 */
@DisplayName("Environment variable overlay")
class EnvVarOverlayTest {

    /** Env var map that the test populates; passed as lookup function. */
    private final Map<String, String> envVars = new HashMap<>();

    private Path fullConfigPath;

    private Function<String, String> envLookup() {
        return envVars::get;
    }

    @BeforeEach
    void setUp() throws Exception {
        fullConfigPath = Path.of(EnvVarOverlayTest.class
                .getClassLoader()
                .getResource("config/full-config.yaml")
                .toURI());
        envVars.clear();
    }

    @Nested
    @DisplayName("String overrides")
    class StringOverrides {

        @Test
        @DisplayName("Every data location can be overridden")
        void dataLocations() {
            envVars.put("SPEKCHECK_DATA_DIR", "/data");
            envVars.put("SPEKCHECK_DYES", "d");
            envVars.put("SPEKCHECK_EXCITATIONS", "e");
            envVars.put("SPEKCHECK_FILTERS", "f");
            envVars.put("SPEKCHECK_DETECTORS", "c");
            envVars.put("SPEKCHECK_SETS", "s.txt");

            SpekCheckConfig config = ConfigLoader.load(fullConfigPath, envLookup());

            assertThat(config.dataDir()).isEqualTo("/data");
            assertThat(config.dyesDir()).isEqualTo("d");
            assertThat(config.excitationsDir()).isEqualTo("e");
            assertThat(config.filtersDir()).isEqualTo("f");
            assertThat(config.detectorsDir()).isEqualTo("c");
            assertThat(config.setsPath()).isEqualTo(Path.of("/data", "s.txt"));
        }

        @Test
        @DisplayName("Logging format and level, trimmed")
        void logging() {
            envVars.put("LOG_FORMAT", " text ");
            envVars.put("LOG_LEVEL", "WARN");

            SpekCheckConfig config = ConfigLoader.load(fullConfigPath, envLookup());

            assertThat(config.loggingFormat()).isEqualTo("text");
            assertThat(config.loggingLevel()).isEqualTo("WARN");
        }

        @Test
        @DisplayName("Blank values are treated as unset")
        void blankIsUnset() {
            envVars.put("SPEKCHECK_DATA_DIR", "   ");
            envVars.put("LOG_LEVEL", "");

            SpekCheckConfig config = ConfigLoader.load(fullConfigPath, envLookup());

            assertThat(config.dataDir()).isEqualTo("/srv/spekcheck");
            assertThat(config.loggingLevel()).isEqualTo("DEBUG");
        }
    }

    @Nested
    @DisplayName("Integer overrides")
    class IntegerOverrides {

        @Test
        void numbers() {
            envVars.put("SPEKCHECK_FETCH_THREADS", "2");
            envVars.put("SPEKCHECK_FETCH_TIMEOUT_MS", "100");
            envVars.put("SPEKCHECK_RANKING_TOP", "0");

            SpekCheckConfig config = ConfigLoader.load(fullConfigPath, envLookup());

            assertThat(config.fetchThreads()).isEqualTo(2);
            assertThat(config.fetchTimeoutMs()).isEqualTo(100);
            assertThat(config.rankingTop()).isZero();
        }

        @Test
        @DisplayName("A non-integer value names the variable")
        void notAnInteger() {
            envVars.put("SPEKCHECK_RANKING_TOP", "ten");

            assertThatThrownBy(() -> ConfigLoader.load(fullConfigPath, envLookup()))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessage("SPEKCHECK_RANKING_TOP must be an integer, got 'ten'")
                    .hasCauseInstanceOf(NumberFormatException.class);
        }

        @Test
        @DisplayName("Overrides are validated like YAML values")
        void validated() {
            envVars.put("SPEKCHECK_RANKING_TOP", "-1");

            assertThatThrownBy(() -> ConfigLoader.load(fullConfigPath, envLookup()))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessage("ranking.top must not be negative, got -1");
        }
    }

    @Test
    @DisplayName("Without a file, the environment overlays the defaults")
    void fromEnvironment() {
        envVars.put("SPEKCHECK_DATA_DIR", "/opt/data");

        SpekCheckConfig config = ConfigLoader.fromEnvironment(envLookup());

        assertThat(config.dataDir()).isEqualTo("/opt/data");
        assertThat(config.fetchThreads()).isEqualTo(4);
    }
}
