package io.spekcheck.standalone.catalog;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import io.spekcheck.core.collection.Catalog;
import io.spekcheck.core.error.EntityFetchException;
import io.spekcheck.core.error.SetupParseException;
import io.spekcheck.core.error.SpectrumParseException;
import io.spekcheck.core.model.Dye;
import io.spekcheck.standalone.DataDirectory;
import io.spekcheck.standalone.config.SpekCheckConfig;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.LoggerFactory;

@DisplayName("CatalogLoader")
class CatalogLoaderTest {

    @TempDir
    Path dataDir;

    private SpekCheckConfig config;
    private DirectoryTextSource source;

    private ListAppender<ILoggingEvent> logAppender;
    private Logger loaderLogger;

    @BeforeEach
    void setUp() throws Exception {
        DataDirectory.write(dataDir);
        config = SpekCheckConfig.builder().dataDir(dataDir.toString()).build();
        source = new DirectoryTextSource(dataDir, Runnable::run);

        loaderLogger = (Logger) LoggerFactory.getLogger(CatalogLoader.class);
        logAppender = new ListAppender<>();
        logAppender.start();
        loaderLogger.addAppender(logAppender);
    }

    @AfterEach
    void tearDown() {
        loaderLogger.detachAppender(logAppender);
        logAppender.stop();
    }

    @Test
    @DisplayName("lists every key space and parses the setups file without reading entities")
    void load() {
        Catalog catalog = CatalogLoader.load(config, source);

        assertThat(catalog.dyes().keys()).containsExactly("broken", "egfp", "mcherry");
        assertThat(catalog.excitations().keys()).containsExactly("led-470");
        assertThat(catalog.filters().keys()).containsExactly("bp-470", "di-495");
        assertThat(catalog.detectors().keys()).containsExactly("camera");
        assertThat(catalog.setups().keys()).containsExactly("GFP", "BLUE");
        assertThat(catalog.dyes().isLoaded("egfp")).isFalse();
    }

    @Test
    @DisplayName("entities are parsed on first access")
    void lazyEntities() {
        Catalog catalog = CatalogLoader.load(config, source);

        Dye egfp = catalog.dyes().get("egfp").join();

        assertThat(egfp.exCoeff()).isEqualTo(56000.0);
        assertThat(egfp.qYield()).isEqualTo(0.6);
        assertThat(catalog.dyes().isLoaded("egfp")).isTrue();
        assertThat(catalog.dyes().isLoaded("mcherry")).isFalse();
        assertThatThrownBy(() -> catalog.dyes().get("broken").join())
                .cause()
                .isInstanceOf(EntityFetchException.class)
                .hasCauseInstanceOf(SpectrumParseException.class);
    }

    @Test
    @DisplayName("a missing setups file gives no setups and a warning")
    void missingSetups() throws Exception {
        Files.delete(dataDir.resolve("sets"));

        Catalog catalog = CatalogLoader.load(config, source);

        assertThat(catalog.setups().size()).isZero();
        assertThat(logAppender.list).anySatisfy(e -> assertThat(e.getFormattedMessage()).startsWith("No setups file"));
    }

    @Test
    @DisplayName("a malformed setups file is reported with its line")
    void malformedSetups() throws Exception {
        Files.writeString(dataDir.resolve("sets"), DataDirectory.SETS + "LAST, egfp, lamp, bp-470 z\n");

        assertThatThrownBy(() -> CatalogLoader.load(config, source))
                .isInstanceOf(SetupParseException.class)
                .hasMessage("line 4: invalid filter mode 'z'")
                .satisfies(e -> assertThat(((SetupParseException) e).source()).isEqualTo("sets:4"));
    }
}
