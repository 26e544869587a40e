package io.spekcheck.core.error;

/**
 * Thrown when the cumulative transmission of a filter path with no filters is requested. Callers
 * that want pass-through semantics use {@code transmissionOf} or check {@code isEmpty()} first.
 */
public final class EmptyPathException extends ComputationException {

    private static final long serialVersionUID = 1L;

    public EmptyPathException() {
        super("no filters on path to compute transmission", "transmission");
    }
}
