package io.spekcheck.standalone.cli;

import io.spekcheck.core.collection.Catalog;
import io.spekcheck.core.engine.DyeRanker;
import io.spekcheck.core.engine.DyeRanking;
import io.spekcheck.core.engine.Setup;
import io.spekcheck.core.engine.SetupResolver;
import io.spekcheck.core.model.SetupDescription;
import io.spekcheck.standalone.catalog.CatalogLoader;
import io.spekcheck.standalone.catalog.DirectoryTextSource;
import io.spekcheck.standalone.config.ConfigLoader;
import io.spekcheck.standalone.config.SpekCheckConfig;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs one report.
 *
 * <p>
 * Steps:
 * <ol>
 * <li>Load configuration from YAML and the environment</li>
 * <li>Configure logging</li>
 * <li>Build the catalog over the data directory</li>
 * <li>Assemble the setup from {@code --setup}, {@code --dye} and {@code --excitation}</li>
 * <li>Print its efficiencies and brightness, then the dye ranking if {@code --rank} is given</li>
 * </ol>
 *
 * <p>
 * Separate from {@link io.spekcheck.standalone.StandaloneMain} so it can be tested without
 * {@code main()}.
 */
public final class ReportApp {

    private static final Logger LOG = LoggerFactory.getLogger(ReportApp.class);

    private ReportApp() {
        // utility class
    }

    public static void run(String[] args, PrintStream out) {
        run(args, out, System::getenv);
    }

    /**
     * @param envLookup environment used for configuration overrides
     * @throws io.spekcheck.standalone.config.ConfigLoadException if the configuration is invalid
     * @throws io.spekcheck.core.error.SpekCheckException          if an entity cannot be loaded or
     *                                                            a setup is unknown
     */
    public static void run(String[] args, PrintStream out, Function<String, String> envLookup) {
        CliOptions options = CliOptions.parse(args);
        SpekCheckConfig config = loadConfig(args, envLookup);
        LogbackConfigurator.configure(config.loggingFormat(), config.loggingLevel());

        ExecutorService executor = Executors.newFixedThreadPool(config.fetchThreads(), fetchThreads());
        try {
            DirectoryTextSource source = new DirectoryTextSource(Path.of(config.dataDir()), executor);
            Catalog catalog = CatalogLoader.load(config, source);
            Setup setup = assemble(catalog, options, config.fetchTimeoutMs());

            ReportWriter writer = new ReportWriter(out);
            writer.writeSetup(options.setup() == null ? "(custom)" : options.setup(), setup);
            if (options.rank()) {
                DyeRanking ranking =
                        await(new DyeRanker(catalog.dyes()).rank(setup, config.rankingTop()), config.fetchTimeoutMs());
                out.println();
                writer.writeRanking(ranking);
            }
        } finally {
            executor.shutdownNow();
        }
    }

    static Setup assemble(Catalog catalog, CliOptions options, long timeoutMs) {
        Setup setup = new Setup();
        if (options.setup() != null) {
            SetupDescription description = catalog.setups().get(options.setup());
            await(new SetupResolver(catalog).apply(setup, description), timeoutMs);
            LOG.info("Loaded setup '{}'", options.setup());
        }
        if (options.dye() != null) {
            setup.setDye(await(catalog.dyes().get(options.dye()), timeoutMs));
        }
        if (options.excitation() != null) {
            setup.setExcitation(await(catalog.excitations().get(options.excitation()), timeoutMs));
        }
        return setup;
    }

    private static SpekCheckConfig loadConfig(String[] args, Function<String, String> envLookup) {
        Path configPath = ConfigLoader.resolveConfigPath(args);
        if (!ConfigLoader.hasExplicitConfig(args) && !Files.exists(configPath)) {
            return ConfigLoader.fromEnvironment(envLookup);
        }
        return ConfigLoader.load(configPath, envLookup);
    }

    /** Waits for a fetch, rethrowing its failure as is. */
    static <T> T await(CompletableFuture<T> future, long timeoutMs) {
        try {
            return future.get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof RuntimeException cause) {
                throw cause;
            }
            throw new IllegalStateException("Fetch failed: " + e.getCause().getMessage(), e.getCause());
        } catch (TimeoutException e) {
            throw new IllegalStateException("Data not loaded within " + timeoutMs + " ms", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while loading data", e);
        }
    }

    private static ThreadFactory fetchThreads() {
        AtomicInteger count = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "spekcheck-fetch-" + count.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
