package org.arenasync.arena.api;

import java.util.List;

/**
 * A component that owns a thread for the lifetime of the arena: the tick
 * driver and the leaderboard publisher.
 */
public interface IService {

    enum State {
        STOPPED,
        RUNNING,
        /** The loop failed and the service will not run again. */
        ERROR
    }

    void start();

    void stop();

    State getCurrentState();

    List<OperationalError> getErrors();

    void clearErrors();
}
