package io.spekcheck.core.event;

/**
 * Event delivered to a {@link ModelListener}.
 *
 * @param kind   what happened
 * @param source the object that changed
 * @param key    affected collection key, or {@code null}
 * @param value  new value for {@code ADD}/{@code CHANGE} on collections, or {@code null}
 */
public record ModelEvent(EventKind kind, Object source, Object key, Object value) {}
