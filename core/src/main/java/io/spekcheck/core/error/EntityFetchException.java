package io.spekcheck.core.error;

/**
 * Thrown (through a failed future) when a lazily loaded entity could not be fetched or read. The
 * failure belongs to that one uid; other entries of the collection are unaffected.
 */
public final class EntityFetchException extends LoadException {

    private static final long serialVersionUID = 1L;

    public EntityFetchException(String message, Throwable cause, String uid, String keySpace) {
        super(message, cause, uid, keySpace);
    }
}
