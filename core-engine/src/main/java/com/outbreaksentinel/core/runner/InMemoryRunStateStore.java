package com.outbreaksentinel.core.runner;

import java.util.Optional;

/**
 * {@link RunStateStore} that lives as long as the process. Used by tests and
 * by runners that do not need to survive a restart.
 */
public class InMemoryRunStateStore implements RunStateStore {

    private volatile RunState state;

    @Override
    public Optional<RunState> load() {
        return Optional.ofNullable(state);
    }

    @Override
    public void save(RunState state) {
        this.state = state;
    }
}
