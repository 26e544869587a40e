package io.spekcheck.core.model;

/** A light source: lamp, LED or laser line, described by its relative intensity. */
public final class Excitation extends OpticalEntity {

    private final Spectrum intensity;

    public Excitation(String uid, Spectrum intensity) {
        super(uid);
        this.intensity = intensity;
    }

    public Spectrum intensity() {
        return intensity;
    }

    @Override
    public String validate() {
        return checkSpectrum("intensity", intensity);
    }
}
