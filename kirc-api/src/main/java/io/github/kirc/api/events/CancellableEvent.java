package io.github.kirc.api.events;

/**
 * An event that can be cancelled, preventing later listeners from receiving it.
 */
public interface CancellableEvent {
    boolean isCancelled();

    void cancel();
}
