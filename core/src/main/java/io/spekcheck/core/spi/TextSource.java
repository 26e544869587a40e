package io.spekcheck.core.spi;

import java.util.concurrent.CompletableFuture;

/**
 * Where data-file text comes from: a directory, a web server, a bundled archive.
 *
 * <p>
 * Implementations may complete the future on any thread. A missing or unreadable file completes it
 * exceptionally; it must not throw from {@link #fetchText(String, String)} itself.
 */
@FunctionalInterface
public interface TextSource {

    /**
     * Starts reading the data file of one entity.
     *
     * @param keySpace collection name, e.g. {@code "dyes"} or {@code "filters"}
     * @param uid      entity uid within that collection
     * @return a future completed with the raw file text
     */
    CompletableFuture<String> fetchText(String keySpace, String uid);
}
