package io.github.eutro.tirpass.api.events;

import org.jetbrains.annotations.NotNull;

import java.util.function.Consumer;

/**
 * Something that listeners can be registered on.
 *
 * @param <S> The supertype of the events that can be listened to.
 */
public interface EventDispatcher<S> {
    /**
     * Register a listener for an event type.
     * <p>
     * Listeners are only run for events dispatched as exactly {@code eventClass}, and run in the order
     * they were registered.
     *
     * @param eventClass The event class.
     * @param listener   The listener.
     * @param <T>        The event type.
     */
    <T extends S> void listen(Class<T> eventClass, @NotNull Consumer<T> listener);
}
