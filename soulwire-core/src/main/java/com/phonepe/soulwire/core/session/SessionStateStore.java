package com.phonepe.soulwire.core.session;

/**
 * Persistence of {@link SessionState}
 */
public interface SessionStateStore {

    /**
     * @return The stored state, or defaults if there is none or it cannot be read
     */
    SessionState load();

    void save(SessionState state);
}
