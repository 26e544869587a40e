package io.spekcheck.core.error;

/** Thrown when a setup cannot be described because the resulting description is invalid. */
public final class InvalidSetupException extends ComputationException {

    private static final long serialVersionUID = 1L;

    public InvalidSetupException(String message) {
        super(message, "setup");
    }
}
