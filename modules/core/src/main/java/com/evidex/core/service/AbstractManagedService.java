package com.evidex.core.service;

import jakarta.enterprise.event.Event;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Skeleton for {@link ManagedService} beans.
 *
 * <p>Holds the state in an {@link AtomicReference}, checks {@link DependsOn}
 * prerequisites before {@link #doStart()}, and fires a
 * {@link ServiceStateChangedEvent} for each transition. Failure propagation
 * to dependants lives in {@link ServiceDependencyCascade}.
 */
public abstract class AbstractManagedService implements ManagedService {

    private final AtomicReference<State> state = new AtomicReference<>(State.STOPPED);

    @Inject
    Event<ServiceStateChangedEvent> stateEvent;

    @Inject
    Instance<ManagedService> allServices;

    protected final Logger log = Logger.getLogger(getClass());

    protected abstract void doStart() throws Exception;

    protected abstract void doStop() throws Exception;

    @Override
    public State state() {
        return state.get();
    }

    @Override
    public void start() throws Exception {
        if (state.get() == State.RUNNING) {
            return;
        }
        requireDependenciesRunning();

        transition(State.STARTING);
        try {
            doStart();
            transition(State.RUNNING);
        } catch (Exception e) {
            fail(e);
            throw e;
        }
    }

    @Override
    public void stop() throws Exception {
        if (state.get() == State.STOPPED) {
            return;
        }

        transition(State.STOPPING);
        try {
            doStop();
            transition(State.STOPPED);
        } catch (Exception e) {
            fail(e);
            throw e;
        }
    }

    @Override
    public void fail(Throwable cause) {
        State previous = state.get();
        if (previous == State.FAILED) {
            return;
        }
        log.errorf("Service '%s' failed (was %s): %s", serviceId(), previous, cause.getMessage());
        transition(State.FAILED);
    }

    /**
     * Sets the state without events or callbacks. Tests use it to restore a
     * service after driving it into FAILED.
     */
    public void forceState(State newState) {
        state.set(newState);
    }

    public List<Class<? extends ManagedService>> getDependencies() {
        List<Class<? extends ManagedService>> deps = new ArrayList<>();
        for (DependsOn d : getClass().getAnnotationsByType(DependsOn.class)) {
            deps.add(d.value());
        }
        return deps;
    }

    /**
     * Throws unless the service is RUNNING. Used by accessors that hand out
     * resources owned by the service.
     */
    protected void requireRunning() {
        if (!isRunning()) {
            throw new IllegalStateException(
                    serviceId() + " service is not running (state=" + state() + ")");
        }
    }

    private void transition(State newState) {
        State previous = state.getAndSet(newState);
        log.infof("Service '%s': %s -> %s", serviceId(), previous, newState);
        stateEvent.fire(new ServiceStateChangedEvent(serviceId(), previous, newState, Instant.now()));
    }

    private void requireDependenciesRunning() {
        for (Class<? extends ManagedService> dep : getDependencies()) {
            for (ManagedService svc : allServices) {
                if (dep.isInstance(svc) && !svc.isRunning()) {
                    throw new IllegalStateException("Cannot start '" + serviceId()
                            + "': dependency '" + svc.serviceId() + "' is " + svc.state());
                }
            }
        }
    }
}
