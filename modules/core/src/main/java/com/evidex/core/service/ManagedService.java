package com.evidex.core.service;

/**
 * Lifecycle contract for infrastructure beans that other components must
 * wait for. Every state change is announced as a {@link ServiceStateChangedEvent}.
 */
public interface ManagedService {

    enum State { STOPPED, STARTING, RUNNING, STOPPING, FAILED }

    String serviceId();

    State state();

    void start() throws Exception;

    void stop() throws Exception;

    void fail(Throwable cause);

    default boolean isRunning() {
        return state() == State.RUNNING;
    }
}
