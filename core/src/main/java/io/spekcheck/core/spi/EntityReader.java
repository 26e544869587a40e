package io.spekcheck.core.spi;

import java.util.Map;

/**
 * Turns the text of one data file into an entity.
 *
 * @param <V> entity type
 */
@FunctionalInterface
public interface EntityReader<V> {

    /**
     * @param text  raw data-file text
     * @param attrs attributes known before reading: {@code "uid"} and, when read from a collection,
     *              {@code "keySpace"}
     * @return the entity, never {@code null}
     * @throws io.spekcheck.core.error.SpectrumParseException if the text is malformed
     */
    V read(String text, Map<String, String> attrs);
}
