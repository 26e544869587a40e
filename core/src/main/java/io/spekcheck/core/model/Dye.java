package io.spekcheck.core.model;

/**
 * A fluorophore: absorption ({@code excitation}) and {@code emission} spectra plus the scalar
 * photophysics used for brightness. Extinction coefficient and quantum yield are unknown for some
 * dyes and are then {@code null}.
 */
public final class Dye extends OpticalEntity {

    /**
     * Brightness of Alexa Fluor 488 (quantum yield 0.92, extinction coefficient 73000), the
     * reference for relative brightness.
     */
    public static final double REFERENCE_BRIGHTNESS = 0.92 * 73000;

    private final Spectrum excitation;
    private final Spectrum emission;
    private final Double exCoeff;
    private final Double qYield;

    public Dye(String uid, Spectrum excitation, Spectrum emission, Double exCoeff, Double qYield) {
        super(uid);
        this.excitation = excitation;
        this.emission = emission;
        this.exCoeff = exCoeff;
        this.qYield = qYield;
    }

    /** Absorption spectrum. */
    public Spectrum excitation() {
        return excitation;
    }

    public Spectrum emission() {
        return emission;
    }

    /** Extinction coefficient, or {@code null} if unknown. */
    public Double exCoeff() {
        return exCoeff;
    }

    /** Quantum yield, or {@code null} if unknown. */
    public Double qYield() {
        return qYield;
    }

    @Override
    public String validate() {
        String error = checkSpectrum("emission", emission);
        if (error != null) {
            return error;
        }
        error = checkSpectrum("excitation", excitation);
        if (error != null) {
            return error;
        }
        if (exCoeff != null && !(exCoeff >= 0.0)) {
            return "Extinction Coefficient must be a positive number";
        }
        if (qYield != null && !(qYield >= 0.0)) {
            return "Quantum Yield must be a positive number";
        }
        return null;
    }
}
