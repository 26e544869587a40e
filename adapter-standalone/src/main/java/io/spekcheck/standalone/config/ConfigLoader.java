package io.spekcheck.standalone.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.IntConsumer;

/**
 * Loads {@link SpekCheckConfig} from a YAML file with an environment variable overlay.
 *
 * <p>
 * The file is {@code spekcheck.yaml} in the current directory unless {@code --config <path>} is
 * given. Missing keys keep the defaults of {@link SpekCheckConfig.Builder}.
 *
 * <p>
 * Every key can be overridden by an environment variable, which takes precedence over YAML. A
 * variable is "set" only if it is defined and not blank after trimming.
 */
public final class ConfigLoader {

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());
    static final String DEFAULT_CONFIG_FILE = "spekcheck.yaml";

    private ConfigLoader() {
        // utility class
    }

    /**
     * Loads the configuration, applying overrides from {@link System#getenv}.
     *
     * @throws ConfigLoadException if the file is missing or invalid
     */
    public static SpekCheckConfig load(Path configPath) {
        return load(configPath, System::getenv);
    }

    /**
     * Loads the configuration, applying overrides from {@code envLookup}.
     *
     * @param envLookup maps variable names to values, {@code null} when not defined
     * @throws ConfigLoadException if the file is missing or invalid
     */
    public static SpekCheckConfig load(Path configPath, Function<String, String> envLookup) {
        if (!Files.exists(configPath)) {
            throw new ConfigLoadException(
                    "Configuration file not found: " + configPath + ". Use --config <path> to specify a config file.");
        }
        try (InputStream in = Files.newInputStream(configPath)) {
            JsonNode root = YAML_MAPPER.readTree(in);
            return mapToConfig(root == null ? MissingNode.getInstance() : root, envLookup);
        } catch (ConfigLoadException e) {
            throw e;
        } catch (IOException e) {
            throw new ConfigLoadException("Failed to parse YAML configuration: " + configPath, e);
        }
    }

    /** Defaults plus environment overrides, for runs without a configuration file. */
    public static SpekCheckConfig fromEnvironment(Function<String, String> envLookup) {
        return mapToConfig(MissingNode.getInstance(), envLookup);
    }

    /**
     * Resolves the config file path from command-line arguments.
     *
     * @return the {@code --config} value, or {@code spekcheck.yaml}
     */
    public static Path resolveConfigPath(String[] args) {
        for (int i = 0; i < args.length; i++) {
            if ("--config".equals(args[i])) {
                if (i + 1 >= args.length) {
                    throw new IllegalArgumentException("--config requires a file path argument");
                }
                return Path.of(args[i + 1]);
            }
        }
        return Path.of(DEFAULT_CONFIG_FILE);
    }

    /** Whether {@code --config} was given explicitly. */
    public static boolean hasExplicitConfig(String[] args) {
        for (String arg : args) {
            if ("--config".equals(arg)) {
                return true;
            }
        }
        return false;
    }

    private static SpekCheckConfig mapToConfig(JsonNode root, Function<String, String> envLookup) {
        SpekCheckConfig.Builder builder = SpekCheckConfig.builder();

        // --- YAML mapping ---

        JsonNode data = root.path("data");
        if (data.has("dir")) builder.dataDir(data.get("dir").asText());
        if (data.has("dyes")) builder.dyesDir(data.get("dyes").asText());
        if (data.has("excitations")) builder.excitationsDir(data.get("excitations").asText());
        if (data.has("filters")) builder.filtersDir(data.get("filters").asText());
        if (data.has("detectors")) builder.detectorsDir(data.get("detectors").asText());
        if (data.has("sets")) builder.setsFile(data.get("sets").asText());

        JsonNode fetch = root.path("fetch");
        if (fetch.has("threads")) builder.fetchThreads(intValue(fetch, "threads", "fetch.threads"));
        if (fetch.has("timeout-ms")) builder.fetchTimeoutMs(intValue(fetch, "timeout-ms", "fetch.timeout-ms"));

        JsonNode ranking = root.path("ranking");
        if (ranking.has("top")) builder.rankingTop(intValue(ranking, "top", "ranking.top"));

        JsonNode logging = root.path("logging");
        if (logging.has("format")) builder.loggingFormat(logging.get("format").asText());
        if (logging.has("level")) builder.loggingLevel(logging.get("level").asText());

        // --- Env var overlay ---

        envString(envLookup, "SPEKCHECK_DATA_DIR", builder::dataDir);
        envString(envLookup, "SPEKCHECK_DYES", builder::dyesDir);
        envString(envLookup, "SPEKCHECK_EXCITATIONS", builder::excitationsDir);
        envString(envLookup, "SPEKCHECK_FILTERS", builder::filtersDir);
        envString(envLookup, "SPEKCHECK_DETECTORS", builder::detectorsDir);
        envString(envLookup, "SPEKCHECK_SETS", builder::setsFile);
        envString(envLookup, "LOG_FORMAT", builder::loggingFormat);
        envString(envLookup, "LOG_LEVEL", builder::loggingLevel);

        envInt(envLookup, "SPEKCHECK_FETCH_THREADS", builder::fetchThreads);
        envInt(envLookup, "SPEKCHECK_FETCH_TIMEOUT_MS", builder::fetchTimeoutMs);
        envInt(envLookup, "SPEKCHECK_RANKING_TOP", builder::rankingTop);

        return builder.build();
    }

    // --- Env var helpers ---

    /** Defined and non-blank after trimming. */
    private static boolean isSet(Function<String, String> envLookup, String envVar) {
        String value = envLookup.apply(envVar);
        return value != null && !value.trim().isEmpty();
    }

    private static void envString(Function<String, String> envLookup, String envVar, Consumer<String> setter) {
        if (isSet(envLookup, envVar)) {
            setter.accept(envLookup.apply(envVar).trim());
        }
    }

    private static void envInt(Function<String, String> envLookup, String envVar, IntConsumer setter) {
        if (isSet(envLookup, envVar)) {
            String value = envLookup.apply(envVar).trim();
            try {
                setter.accept(Integer.parseInt(value));
            } catch (NumberFormatException e) {
                throw new ConfigLoadException(envVar + " must be an integer, got '" + value + "'", e);
            }
        }
    }

    // --- YAML helpers ---

    private static int intValue(JsonNode node, String field, String key) {
        JsonNode value = node.get(field);
        if (!(value.isIntegralNumber() && value.canConvertToInt()) && !value.isTextual()) {
            throw new ConfigLoadException(key + " must be an integer, got '" + value.asText() + "'");
        }
        try {
            return value.isTextual() ? Integer.parseInt(value.asText().trim()) : value.asInt();
        } catch (NumberFormatException e) {
            throw new ConfigLoadException(key + " must be an integer, got '" + value.asText() + "'", e);
        }
    }
}
