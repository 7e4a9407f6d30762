package io.github.drompincen.mockjira.runtime.store;

/**
 * Receives store events. Called on the mutating thread while the store write lock is held, so
 * implementations must hand work off rather than block.
 */
@FunctionalInterface
public interface StoreEventListener {

    void onEvent(StoreEvent event);
}
