package io.spekcheck.core.model;

/** A camera or photodetector, described by its quantum efficiency over wavelength. */
public final class Detector extends OpticalEntity {

    private final Spectrum qe;

    public Detector(String uid, Spectrum qe) {
        super(uid);
        this.qe = qe;
    }

    /** Quantum efficiency. */
    public Spectrum qe() {
        return qe;
    }

    @Override
    public String validate() {
        return checkSpectrum("qe", qe);
    }
}
