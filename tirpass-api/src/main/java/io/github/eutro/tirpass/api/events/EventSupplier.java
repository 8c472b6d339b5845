package io.github.eutro.tirpass.api.events;

import org.jetbrains.annotations.NotNull;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Holds listeners by event class, and dispatches events to them.
 *
 * @param <S> The supertype of the events that can be listened to and dispatched.
 */
public class EventSupplier<S> implements EventDispatcher<S> {
    private final Map<Class<?>, List<Consumer<?>>> listeners = new ConcurrentHashMap<>();

    @Override
    public <T extends S> void listen(Class<T> eventClass, @NotNull Consumer<T> listener) {
        listeners.computeIfAbsent(eventClass, $ -> new CopyOnWriteArrayList<>()).add(listener);
    }

    /**
     * Run the listeners of {@code eventClass} on an event, on the calling thread.
     * <p>
     * If the event is a {@link CancellableEvent}, dispatch stops as soon as it is cancelled.
     *
     * @param eventClass The class to dispatch the event as.
     * @param event      The event.
     * @param <T>        The type of the event.
     * @return The event, so that callers can read back what listeners changed.
     */
    @SuppressWarnings("unchecked")
    public <T extends S> T dispatch(Class<T> eventClass, T event) {
        List<Consumer<?>> eventListeners = listeners.get(eventClass);
        if (eventListeners == null) return event;
        for (Consumer<?> listener : eventListeners) {
            if (isCancelled(event)) break;
            ((Consumer<T>) listener).accept(event);
        }
        return event;
    }

    private static boolean isCancelled(Object event) {
        return event instanceof CancellableEvent && ((CancellableEvent) event).isCancelled();
    }
}
