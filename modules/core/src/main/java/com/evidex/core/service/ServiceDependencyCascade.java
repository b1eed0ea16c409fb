package com.evidex.core.service;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

/**
 * Fails every service that declares {@link DependsOn} on a service that just
 * moved to FAILED.
 *
 * <p>Kept out of {@link AbstractManagedService} so that observing the event
 * never instantiates a service from inside another one's {@code @PostConstruct}.
 */
@ApplicationScoped
public class ServiceDependencyCascade {

    private static final Logger log = Logger.getLogger(ServiceDependencyCascade.class);

    @Inject
    Instance<ManagedService> allServices;

    void onStateChanged(@Observes ServiceStateChangedEvent event) {
        if (!event.isFailure()) {
            return;
        }

        for (ManagedService svc : allServices) {
            if (!(svc instanceof AbstractManagedService managed)) {
                continue;
            }
            for (Class<? extends ManagedService> dep : managed.getDependencies()) {
                if (isServiceOfType(event.serviceId(), dep)) {
                    log.warnf("Dependency '%s' failed, failing '%s'", event.serviceId(), svc.serviceId());
                    svc.fail(new IllegalStateException("Dependency '" + event.serviceId() + "' failed"));
                }
            }
        }
    }

    private boolean isServiceOfType(String serviceId, Class<? extends ManagedService> type) {
        for (ManagedService svc : allServices) {
            if (type.isInstance(svc) && svc.serviceId().equals(serviceId)) {
                return true;
            }
        }
        return false;
    }
}
