package io.spekcheck.core.collection;

import io.spekcheck.core.error.UnknownKeyException;
import io.spekcheck.core.event.EventKind;
import io.spekcheck.core.event.ModelListener;
import io.spekcheck.core.event.Notifier;
import io.spekcheck.core.event.Observable;
import java.util.AbstractMap;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Insertion-ordered map that publishes an event for every change.
 *
 * <p>
 * {@link #set} publishes {@link EventKind#ADD} for a new key and {@link EventKind#CHANGE} for an
 * existing one, {@link #delete} publishes {@link EventKind#DELETE} and {@link #clear} publishes
 * {@link EventKind#CLEAR}. Events carry the key and, for additions and changes, the new value.
 *
 * @param <K> key type
 * @param <V> value type
 */
public class ObservableCollection<K, V> implements Observable {

    private final Map<K, V> entries = new LinkedHashMap<>();
    private final Notifier notifier = new Notifier(this);

    public ObservableCollection() {}

    /** Creates a collection holding {@code initial}, without publishing anything. */
    public ObservableCollection(Map<K, V> initial) {
        entries.putAll(initial);
    }

    /**
     * @throws UnknownKeyException if {@code key} is not registered
     */
    public V get(K key) {
        if (!entries.containsKey(key)) {
            throw new UnknownKeyException(key);
        }
        return entries.get(key);
    }

    public Optional<V> find(K key) {
        return Optional.ofNullable(entries.get(key));
    }

    public boolean has(K key) {
        return entries.containsKey(key);
    }

    public void set(K key, V value) {
        Objects.requireNonNull(key, "key must not be null");
        boolean present = entries.containsKey(key);
        entries.put(key, value);
        notifier.publish(present ? EventKind.CHANGE : EventKind.ADD, key, value);
    }

    /**
     * @return the removed value
     * @throws UnknownKeyException if {@code key} is not registered
     */
    public V delete(K key) {
        if (!entries.containsKey(key)) {
            throw new UnknownKeyException(key);
        }
        V removed = entries.remove(key);
        notifier.publish(EventKind.DELETE, key, null);
        return removed;
    }

    public void clear() {
        entries.clear();
        notifier.publish(EventKind.CLEAR);
    }

    /** Keys in insertion order. */
    public List<K> keys() {
        return new ArrayList<>(entries.keySet());
    }

    public int size() {
        return entries.size();
    }

    public List<V> values() {
        return new ArrayList<>(entries.values());
    }

    public List<Map.Entry<K, V>> entries() {
        List<Map.Entry<K, V>> copy = new ArrayList<>(entries.size());
        for (Map.Entry<K, V> entry : entries.entrySet()) {
            copy.add(new AbstractMap.SimpleImmutableEntry<>(entry.getKey(), entry.getValue()));
        }
        return copy;
    }

    @Override
    public long subscribe(EventKind kind, ModelListener listener) {
        return notifier.subscribe(kind, listener);
    }

    @Override
    public boolean unsubscribe(long subscriptionId) {
        return notifier.unsubscribe(subscriptionId);
    }

    /** For subclasses that keep their own storage but share the event channel. */
    protected Notifier notifier() {
        return notifier;
    }
}
