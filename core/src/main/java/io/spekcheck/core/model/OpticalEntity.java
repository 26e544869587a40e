package io.spekcheck.core.model;

import java.util.Objects;

/**
 * Base for the things we have a data file for: dyes, excitation sources, filters and detectors.
 *
 * <p>
 * Instances are immutable and shared by reference between the collection that loaded them and
 * every setup using them. Bad content is not rejected at construction; subclasses implement
 * {@link #validate()} and callers check {@link #isValid()} before use.
 */
public abstract class OpticalEntity {

    private final String uid;

    protected OpticalEntity(String uid) {
        this.uid = Objects.requireNonNull(uid, "uid must not be null");
    }

    /** Unique name of this entity within its collection. */
    public String uid() {
        return uid;
    }

    /**
     * Checks the entity content.
     *
     * @return an error message, or {@code null} if valid
     */
    public abstract String validate();

    public final boolean isValid() {
        return validate() == null;
    }

    public final String validationError() {
        return validate();
    }

    /** Validation message for a required spectrum, or {@code null} if it is present and valid. */
    protected static String checkSpectrum(String name, Spectrum spectrum) {
        if (spectrum == null) {
            return "'" + name + "' property is not a Spectrum object";
        }
        return spectrum.validate();
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + uid + "]";
    }
}
