package com.mercuri.vault.adapter.inmemory.world;

/**
 * In-memory component whose state can be captured and restored by {@link InMemoryWorld}.
 *
 * @author Mercuri Vault Team
 * @since 1.0.0
 */
public interface Journaled {

    /**
     * Captures a deep copy of the component state.
     *
     * @return opaque state copy
     */
    Object captureState();

    /**
     * Restores a state previously returned by {@link #captureState()}.
     *
     * @param state captured state
     */
    void restoreState(Object state);
}
