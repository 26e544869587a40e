package io.spekcheck.standalone.catalog;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.spekcheck.core.spi.TextSource;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Serves data files from a directory tree: {@code <dataDir>/<keySpace>/<uid>.csv}.
 *
 * <p>
 * Files are read on the given executor. The uids of a key space come from the index file
 * {@code <dataDir>/<keySpace>.json}, a JSON array of strings, or from the {@code .csv} file
 * names when there is no index.
 */
public final class DirectoryTextSource implements TextSource {

    private static final Logger LOG = LoggerFactory.getLogger(DirectoryTextSource.class);
    private static final ObjectMapper JSON_MAPPER = new ObjectMapper();
    private static final String EXTENSION = ".csv";

    private final Path dataDir;
    private final Executor executor;

    public DirectoryTextSource(Path dataDir, Executor executor) {
        this.dataDir = Objects.requireNonNull(dataDir, "dataDir must not be null");
        this.executor = Objects.requireNonNull(executor, "executor must not be null");
    }

    public Path dataDir() {
        return dataDir;
    }

    @Override
    public CompletableFuture<String> fetchText(String keySpace, String uid) {
        Path file;
        try {
            file = fileOf(keySpace, uid);
        } catch (IllegalArgumentException e) {
            return CompletableFuture.failedFuture(e);
        }
        return CompletableFuture.supplyAsync(
                () -> {
                    try {
                        return Files.readString(file);
                    } catch (IOException e) {
                        throw new UncheckedIOException("Cannot read " + file, e);
                    }
                },
                executor);
    }

    /**
     * Lists the uids available in a key space.
     *
     * @return uids in index order, or sorted file names; empty if the key space does not exist
     * @throws UncheckedIOException if the index or the directory cannot be read
     */
    public List<String> listUids(String keySpace) {
        Path index = dataDir.resolve(keySpace + ".json");
        if (Files.isRegularFile(index)) {
            try {
                return JSON_MAPPER.readValue(index.toFile(), new TypeReference<List<String>>() {});
            } catch (IOException e) {
                throw new UncheckedIOException("Cannot read index " + index, e);
            }
        }
        Path dir = dataDir.resolve(keySpace);
        if (!Files.isDirectory(dir)) {
            LOG.warn("No index and no directory for '{}' under {}", keySpace, dataDir);
            return List.of();
        }
        List<String> uids = new ArrayList<>();
        try (Stream<Path> files = Files.list(dir)) {
            files.map(p -> p.getFileName().toString())
                    .filter(name -> name.endsWith(EXTENSION))
                    .sorted()
                    .forEach(name -> uids.add(name.substring(0, name.length() - EXTENSION.length())));
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot list " + dir, e);
        }
        return uids;
    }

    /** Path of one data file; rejects uids that would escape the key space directory. */
    Path fileOf(String keySpace, String uid) {
        Path dir = dataDir.resolve(keySpace).normalize();
        Path file = dir.resolve(uid + EXTENSION).normalize();
        if (!dir.equals(file.getParent())) {
            throw new IllegalArgumentException("Invalid uid '" + uid + "' for key space '" + keySpace + "'");
        }
        return file;
    }
}
