package io.spekcheck.standalone.catalog;

import io.spekcheck.core.collection.Catalog;
import io.spekcheck.core.collection.LazyCollection;
import io.spekcheck.core.collection.ObservableCollection;
import io.spekcheck.core.model.SetupDescription;
import io.spekcheck.core.parse.SetupDescriptionParser;
import io.spekcheck.core.parse.SpectrumFileParser;
import io.spekcheck.core.spi.EntityReader;
import io.spekcheck.standalone.config.SpekCheckConfig;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds a {@link Catalog} over a data directory. Only the uid lists and the setups file are read
 * here; every entity is read on first use.
 */
public final class CatalogLoader {

    private static final Logger LOG = LoggerFactory.getLogger(CatalogLoader.class);

    private CatalogLoader() {
        // utility class
    }

    public static Catalog load(SpekCheckConfig config, DirectoryTextSource source) {
        Catalog catalog = new Catalog(
                collection(source, config.dyesDir(), SpectrumFileParser::readDye),
                collection(source, config.excitationsDir(), SpectrumFileParser::readExcitation),
                collection(source, config.filtersDir(), SpectrumFileParser::readFilter),
                collection(source, config.detectorsDir(), SpectrumFileParser::readDetector),
                setups(config.setsPath()));
        LOG.info(
                "Catalog loaded from {}: dyes={}, excitations={}, filters={}, detectors={}, setups={}",
                source.dataDir(),
                catalog.dyes().size(),
                catalog.excitations().size(),
                catalog.filters().size(),
                catalog.detectors().size(),
                catalog.setups().size());
        return catalog;
    }

    private static <V> LazyCollection<V> collection(
            DirectoryTextSource source, String keySpace, EntityReader<V> reader) {
        List<String> uids = source.listUids(keySpace);
        return new LazyCollection<>(keySpace, uids, source, reader);
    }

    /**
     * @throws io.spekcheck.core.error.SetupParseException if a line is malformed
     */
    static ObservableCollection<String, SetupDescription> setups(Path setsFile) {
        if (!Files.isRegularFile(setsFile)) {
            LOG.warn("No setups file at {}", setsFile);
            return new ObservableCollection<>();
        }
        String text;
        try {
            text = Files.readString(setsFile);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read " + setsFile, e);
        }
        return SetupDescriptionParser.parse(text, setsFile.getFileName().toString());
    }
}
