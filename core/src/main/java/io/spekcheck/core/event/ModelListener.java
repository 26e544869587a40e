package io.spekcheck.core.event;

/** Callback for {@link ModelEvent}s. Runs synchronously on the thread that made the change. */
@FunctionalInterface
public interface ModelListener {

    void onEvent(ModelEvent event);
}
