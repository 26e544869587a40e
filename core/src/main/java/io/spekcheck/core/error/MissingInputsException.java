package io.spekcheck.core.error;

import java.util.List;

/** Thrown when a setup quantity is requested without the dye or excitation it depends on. */
public final class MissingInputsException extends ComputationException {

    private static final long serialVersionUID = 1L;

    private final List<String> missingInputs;

    public MissingInputsException(String quantity, List<String> missingInputs) {
        super("cannot compute " + quantity + ": no " + String.join(" or ", missingInputs) + " set", quantity);
        this.missingInputs = List.copyOf(missingInputs);
    }

    /** Names of the unset inputs, e.g. {@code ["dye", "excitation"]}. */
    public List<String> missingInputs() {
        return missingInputs;
    }
}
