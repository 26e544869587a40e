package io.spekcheck.core.event;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Publish/subscribe helper owned by each stateful object (paths, setups, collections).
 *
 * <p>
 * Listeners are called synchronously, in subscription order. A listener that throws is logged and
 * skipped: it does not affect the other listeners nor the change that was already applied.
 * Subscribing or unsubscribing from inside a listener takes effect from the next publish.
 */
public final class Notifier implements Observable {

    private static final Logger LOG = LoggerFactory.getLogger(Notifier.class);

    private final Object source;
    private final Map<EventKind, Map<Long, ModelListener>> listeners = new EnumMap<>(EventKind.class);
    private long nextId = 1;

    /**
     * @param source the object reported as {@link ModelEvent#source()}
     */
    public Notifier(Object source) {
        this.source = Objects.requireNonNull(source, "source must not be null");
    }

    @Override
    public long subscribe(EventKind kind, ModelListener listener) {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(listener, "listener must not be null");
        long id = nextId++;
        listeners.computeIfAbsent(kind, k -> new LinkedHashMap<>()).put(id, listener);
        return id;
    }

    @Override
    public boolean unsubscribe(long subscriptionId) {
        for (Map<Long, ModelListener> byId : listeners.values()) {
            if (byId.remove(subscriptionId) != null) {
                return true;
            }
        }
        return false;
    }

    /** Publishes an event without key or value. */
    public void publish(EventKind kind) {
        publish(kind, null, null);
    }

    /**
     * Publishes an event to every listener subscribed to {@code kind}.
     *
     * @param key   affected key, or {@code null}
     * @param value new value, or {@code null}
     */
    public void publish(EventKind kind, Object key, Object value) {
        Map<Long, ModelListener> byId = listeners.get(kind);
        if (byId == null || byId.isEmpty()) {
            return;
        }
        ModelEvent event = new ModelEvent(kind, source, key, value);
        List<ModelListener> snapshot = new ArrayList<>(byId.values());
        for (ModelListener listener : snapshot) {
            try {
                listener.onEvent(event);
            } catch (RuntimeException e) {
                LOG.warn("Listener failed on {} event from {}: {}", kind, source, e.getMessage(), e);
            }
        }
    }

    /** Number of listeners subscribed to {@code kind}. */
    public int listenerCount(EventKind kind) {
        Map<Long, ModelListener> byId = listeners.get(kind);
        return byId == null ? 0 : byId.size();
    }
}
