package io.github.eutro.tirpass.api.events;

/**
 * An event that a listener can cancel, so that no later listener receives it,
 * and the action it announces is not taken.
 */
public interface CancellableEvent {
    boolean isCancelled();

    void cancel();
}
