package io.sentex.core;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Append-only listener registry keyed by {@link SentexEvent}.
 * <p>
 * Listeners are invoked synchronously in registration order. There is no
 * unsubscribe. Exceptions thrown by a listener propagate to the caller of
 * {@code fire}; listeners registered after it are not invoked.
 */
public final class EventListeners {

    private final Map<SentexEvent, List<CountListener>> countListeners = new EnumMap<>(SentexEvent.class);
    private final List<Runnable> resetListeners = new ArrayList<>();

    public EventListeners() {
        for (SentexEvent event : SentexEvent.values()) {
            if (event.carriesCount()) {
                countListeners.put(event, new ArrayList<>());
            }
        }
    }

    public void on(SentexEvent event, CountListener listener) {
        Objects.requireNonNull(event, "event");
        Objects.requireNonNull(listener, "listener");
        if (!event.carriesCount()) {
            throw new IllegalArgumentException(event + " carries no count, register it with onReset");
        }
        countListeners.get(event).add(listener);
    }

    public void onReset(Runnable listener) {
        resetListeners.add(Objects.requireNonNull(listener, "listener"));
    }

    public void fire(SentexEvent event, int count) {
        if (!event.carriesCount()) {
            throw new IllegalArgumentException(event + " carries no count");
        }
        for (CountListener listener : countListeners.get(event)) {
            listener.onEvent(count);
        }
    }

    public void fireReset() {
        for (Runnable listener : resetListeners) {
            listener.run();
        }
    }

    public int listenerCount(SentexEvent event) {
        return event.carriesCount() ? countListeners.get(event).size() : resetListeners.size();
    }
}
