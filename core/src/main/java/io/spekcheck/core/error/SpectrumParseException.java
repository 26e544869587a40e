package io.spekcheck.core.error;

/** Thrown when a spectrum data file has a malformed header or CSV section. */
public final class SpectrumParseException extends LoadException {

    private static final long serialVersionUID = 1L;

    public SpectrumParseException(String message, String uid, String source) {
        super(message, uid, source);
    }

    public SpectrumParseException(String message, Throwable cause, String uid, String source) {
        super(message, cause, uid, source);
    }
}
