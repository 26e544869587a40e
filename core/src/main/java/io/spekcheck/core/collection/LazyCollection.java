package io.spekcheck.core.collection;

import io.spekcheck.core.error.EntityFetchException;
import io.spekcheck.core.error.UnknownKeyException;
import io.spekcheck.core.event.EventKind;
import io.spekcheck.core.event.ModelListener;
import io.spekcheck.core.event.Notifier;
import io.spekcheck.core.event.Observable;
import io.spekcheck.core.model.OpticalEntity;
import io.spekcheck.core.spi.EntityReader;
import io.spekcheck.core.spi.TextSource;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Collection of entities known by uid up front and read from their data file on first access.
 *
 * <p>
 * Each uid is fetched at most once: the first {@link #get(String)} starts the fetch and every
 * later or concurrent call gets the same future. A failed fetch stays failed for that uid and does
 * not affect the others. Fetches only complete their own future and never write back to the
 * uid table, so {@link #delete} and {@link #clear} take effect even while a fetch is running.
 * Bookkeeping is synchronized, so futures may be completed on any thread.
 *
 * @param <V> entity type
 */
public final class LazyCollection<V> implements Observable {

    private static final Logger LOG = LoggerFactory.getLogger(LazyCollection.class);

    private final String keySpace;
    private final TextSource source;
    private final EntityReader<V> reader;
    private final Notifier notifier = new Notifier(this);

    // null value: known uid, fetch not started
    private final Map<String, CompletableFuture<V>> byUid = new LinkedHashMap<>();

    /**
     * @param keySpace collection name passed to the text source, e.g. {@code "dyes"}
     * @param uids     uids available from the source
     * @param source   where data-file text is read from
     * @param reader   turns the text into an entity
     */
    public LazyCollection(String keySpace, Collection<String> uids, TextSource source, EntityReader<V> reader) {
        this.keySpace = Objects.requireNonNull(keySpace, "keySpace must not be null");
        this.source = Objects.requireNonNull(source, "source must not be null");
        this.reader = Objects.requireNonNull(reader, "reader must not be null");
        for (String uid : uids) {
            byUid.put(Objects.requireNonNull(uid, "uid must not be null"), null);
        }
    }

    public String keySpace() {
        return keySpace;
    }

    /**
     * Returns the entity, fetching it on first access.
     *
     * @return a future completed with the entity; failed with {@link UnknownKeyException} for an
     *         unknown uid or with {@link EntityFetchException} if it could not be fetched or read
     */
    public CompletableFuture<V> get(String uid) {
        CompletableFuture<V> future;
        synchronized (this) {
            if (!byUid.containsKey(uid)) {
                return CompletableFuture.failedFuture(new UnknownKeyException(uid));
            }
            future = byUid.get(uid);
            if (future != null) {
                return future;
            }
            future = new CompletableFuture<>();
            byUid.put(uid, future);
        }
        fetch(uid, future);
        return future;
    }

    public synchronized boolean has(String uid) {
        return byUid.containsKey(uid);
    }

    /** Whether the entity has been read successfully. */
    public synchronized boolean isLoaded(String uid) {
        CompletableFuture<V> future = byUid.get(uid);
        return future != null && future.isDone() && !future.isCompletedExceptionally();
    }

    /** Known uids in registration order. */
    public synchronized List<String> keys() {
        return new ArrayList<>(byUid.keySet());
    }

    public synchronized int size() {
        return byUid.size();
    }

    /**
     * Registers an entity that is already in memory, e.g. imported by the user. Publishes
     * {@link EventKind#ADD} for a new uid, {@link EventKind#CHANGE} otherwise.
     */
    public void set(String uid, V value) {
        Objects.requireNonNull(uid, "uid must not be null");
        Objects.requireNonNull(value, "value must not be null");
        boolean present;
        synchronized (this) {
            present = byUid.containsKey(uid);
            byUid.put(uid, CompletableFuture.completedFuture(value));
        }
        notifier.publish(present ? EventKind.CHANGE : EventKind.ADD, uid, value);
    }

    /**
     * Forgets a uid, whether it was never fetched, is being fetched or is loaded. A fetch in
     * flight still completes the future its callers hold; the uid stays unknown afterwards.
     *
     * @return {@code false}, without an event, if the uid is unknown
     */
    public boolean delete(String uid) {
        synchronized (this) {
            if (!byUid.containsKey(uid)) {
                return false;
            }
            byUid.remove(uid);
        }
        notifier.publish(EventKind.DELETE, uid, null);
        return true;
    }

    /** Forgets every uid and publishes {@link EventKind#CLEAR}. */
    public void clear() {
        synchronized (this) {
            byUid.clear();
        }
        notifier.publish(EventKind.CLEAR);
    }

    /** Not supported: it would force a fetch of every entity. */
    public List<V> values() {
        throw new UnsupportedOperationException("values() would fetch every " + keySpace + " entry");
    }

    /** Not supported: it would force a fetch of every entity. */
    public List<Map.Entry<String, V>> entries() {
        throw new UnsupportedOperationException("entries() would fetch every " + keySpace + " entry");
    }

    @Override
    public long subscribe(EventKind kind, ModelListener listener) {
        return notifier.subscribe(kind, listener);
    }

    @Override
    public boolean unsubscribe(long subscriptionId) {
        return notifier.unsubscribe(subscriptionId);
    }

    private void fetch(String uid, CompletableFuture<V> target) {
        LOG.debug("Fetching {} '{}'", keySpace, uid);
        CompletableFuture<String> text;
        try {
            text = source.fetchText(keySpace, uid);
        } catch (RuntimeException e) {
            text = CompletableFuture.failedFuture(e);
        }
        text.whenComplete((body, error) -> {
            if (error != null) {
                fail(uid, target, unwrap(error));
                return;
            }
            V value;
            try {
                value = reader.read(body, Map.of("uid", uid, "keySpace", keySpace));
            } catch (RuntimeException e) {
                fail(uid, target, e);
                return;
            }
            if (value == null) {
                fail(uid, target, new IllegalStateException("reader returned no entity"));
                return;
            }
            if (value instanceof OpticalEntity entity && !entity.isValid()) {
                LOG.warn("Loaded {} '{}' is invalid: {}", keySpace, uid, entity.validationError());
            }
            target.complete(value);
        });
    }

    private void fail(String uid, CompletableFuture<V> target, Throwable cause) {
        LOG.warn("Failed to load {} '{}': {}", keySpace, uid, cause.getMessage());
        target.completeExceptionally(new EntityFetchException(
                "Failed to load " + keySpace + " '" + uid + "': " + cause.getMessage(), cause, uid, keySpace));
    }

    private static Throwable unwrap(Throwable error) {
        if (error instanceof CompletionException && error.getCause() != null) {
            return error.getCause();
        }
        return error;
    }

    @Override
    public String toString() {
        return "LazyCollection[" + keySpace + "]";
    }
}
