package com.phonepe.soulwire.core.session;

import java.util.concurrent.atomic.AtomicReference;

public class InMemorySessionStateStore implements SessionStateStore {
    private final AtomicReference<SessionState> state = new AtomicReference<>(SessionState.defaults());

    @Override
    public SessionState load() {
        return state.get();
    }

    @Override
    public void save(SessionState state) {
        this.state.set(state);
    }
}
