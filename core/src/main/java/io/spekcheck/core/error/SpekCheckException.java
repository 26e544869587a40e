package io.spekcheck.core.error;

/**
 * Abstract base for all spekcheck exceptions. Never thrown directly; use the concrete subclasses
 * under {@link LoadException}, {@link ComputationException} or {@link UnknownKeyException}.
 */
public abstract class SpekCheckException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /** Phase in which the error occurred. */
    public enum Phase {
        LOAD,
        COMPUTATION,
        LOOKUP
    }

    private final String subject;
    private final Phase phase;

    protected SpekCheckException(String message, String subject, Phase phase) {
        super(message);
        this.subject = subject;
        this.phase = phase;
    }

    protected SpekCheckException(String message, Throwable cause, String subject, Phase phase) {
        super(message, cause);
        this.subject = subject;
        this.phase = phase;
    }

    /** The uid or input name that triggered the error, or {@code null} if not identified. */
    public String subject() {
        return subject;
    }

    /** Human-readable error description (alias for {@link #getMessage()}). */
    public String detail() {
        return getMessage();
    }

    /** The phase in which the error occurred. */
    public Phase phase() {
        return phase;
    }
}
