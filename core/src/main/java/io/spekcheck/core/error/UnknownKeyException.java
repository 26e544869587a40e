package io.spekcheck.core.error;

/** Thrown when a collection is asked for a key that was never registered. */
public final class UnknownKeyException extends SpekCheckException {

    private static final long serialVersionUID = 1L;

    public UnknownKeyException(Object key) {
        super("no entry '" + key + "' in collection", String.valueOf(key), Phase.LOOKUP);
    }
}
