package com.outbreaksentinel.core.runner;

import java.util.Optional;

/**
 * Durable home of the {@link RunState}. The runner loads it once when it is
 * built and saves it after every pass.
 */
public interface RunStateStore {

    /**
     * @return the last saved state, or empty if nothing was saved yet
     * @throws IllegalStateException if a saved state exists but cannot be read
     */
    Optional<RunState> load();

    /**
     * @throws IllegalStateException if the state cannot be written
     */
    void save(RunState state);
}
