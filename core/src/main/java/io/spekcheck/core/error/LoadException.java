package io.spekcheck.core.error;

/**
 * Abstract parent for errors raised while turning raw text into entities or setup descriptions.
 * Carries an additional {@code source} field identifying the key space, file or line that caused
 * the error.
 */
public abstract class LoadException extends SpekCheckException {

    private static final long serialVersionUID = 1L;

    private final String source;

    protected LoadException(String message, String subject, String source) {
        super(message, subject, Phase.LOAD);
        this.source = source;
    }

    protected LoadException(String message, Throwable cause, String subject, String source) {
        super(message, cause, subject, Phase.LOAD);
        this.source = source;
    }

    /** The key space, file or resource identifier that caused the error. */
    public String source() {
        return source;
    }
}
