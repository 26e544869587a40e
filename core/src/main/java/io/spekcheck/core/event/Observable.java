package io.spekcheck.core.event;

/** Something that publishes {@link ModelEvent}s to subscribed listeners. */
public interface Observable {

    /**
     * Subscribes a listener to one kind of event.
     *
     * @param kind     the event kind to receive
     * @param listener the callback
     * @return a subscription id for {@link #unsubscribe(long)}
     */
    long subscribe(EventKind kind, ModelListener listener);

    /**
     * Removes a subscription.
     *
     * @return {@code true} if the subscription existed
     */
    boolean unsubscribe(long subscriptionId);
}
