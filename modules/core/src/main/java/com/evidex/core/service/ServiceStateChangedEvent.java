package com.evidex.core.service;

import java.time.Instant;

/**
 * CDI event fired on each {@link ManagedService} state transition.
 */
public record ServiceStateChangedEvent(
        String serviceId,
        ManagedService.State oldState,
        ManagedService.State newState,
        Instant timestamp
) {
    public boolean isFailure() {
        return newState == ManagedService.State.FAILED;
    }
}
