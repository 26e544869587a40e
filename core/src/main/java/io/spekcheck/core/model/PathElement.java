package io.spekcheck.core.model;

import java.util.Objects;

/**
 * One position of a light path: a shared filter and the way it is used there.
 *
 * @param filter the filter, shared with its collection
 * @param mode   transmit or reflect
 */
public record PathElement(Filter filter, Mode mode) {

    public PathElement {
        Objects.requireNonNull(filter, "filter must not be null");
        Objects.requireNonNull(mode, "mode must not be null");
    }

    /** The spectrum this element passes on: transmission or reflection. */
    public Spectrum activeSpectrum() {
        return filter.spectrumFor(mode);
    }

    public PathElement withMode(Mode newMode) {
        return new PathElement(filter, newMode);
    }

    /** Projection without the filter reference. */
    public FilterPosition describe() {
        return new FilterPosition(filter.uid(), mode);
    }
}
