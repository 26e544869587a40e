package io.spekcheck.core.error;

/** Thrown when a line of the setups text cannot be parsed into a setup description. */
public final class SetupParseException extends LoadException {

    private static final long serialVersionUID = 1L;

    public SetupParseException(String message, String uid, String source) {
        super(message, uid, source);
    }

    public SetupParseException(String message, Throwable cause, String uid, String source) {
        super(message, cause, uid, source);
    }
}
