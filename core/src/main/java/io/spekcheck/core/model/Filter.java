package io.spekcheck.core.model;

/**
 * An optical filter or dichroic. Whether it is used in transmission or reflection is not a property
 * of the filter but of its position in a path, see {@link PathElement}.
 *
 * <p>
 * Reflection is {@code 1 - transmission}, computed on first use and kept.
 */
public final class Filter extends OpticalEntity {

    private final Spectrum transmission;
    private Spectrum reflection; // lazily derived unless measured

    public Filter(String uid, Spectrum transmission) {
        super(uid);
        this.transmission = transmission;
    }

    private Filter(String uid, Spectrum transmission, Spectrum reflection) {
        super(uid);
        this.transmission = transmission;
        this.reflection = reflection;
    }

    /**
     * Creates a filter from measured reflection data. Transmission is derived from it; the
     * measured reflection is kept as-is.
     */
    public static Filter fromReflection(String uid, Spectrum reflection) {
        Spectrum transmission = reflection == null ? null : reflection.complement();
        return new Filter(uid, transmission, reflection);
    }

    public Spectrum transmission() {
        return transmission;
    }

    public Spectrum reflection() {
        if (reflection == null && transmission != null) {
            reflection = transmission.complement();
        }
        return reflection;
    }

    /** Spectrum that passes on in the given mode. */
    public Spectrum spectrumFor(Mode mode) {
        return mode == Mode.REFLECT ? reflection() : transmission;
    }

    @Override
    public String validate() {
        return checkSpectrum("transmission", transmission);
    }
}
