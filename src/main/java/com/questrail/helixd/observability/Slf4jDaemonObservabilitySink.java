package com.questrail.helixd.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of DaemonObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jDaemonObservabilitySink implements DaemonObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jDaemonObservabilitySink.class);

    @Override
    public void onJobTransition(JobTransitionEvent event) {
        if (event.isAdmission()) {
            log.info("Sync {} queued for {} {} {}",
                event.syncId(),
                event.key().tool(),
                event.key().repoRoot(),
                event.key().directory());
            return;
        }

        switch (event.to()) {
            case FAILED -> log.warn("Sync {}: {} -> FAILED ({})", event.syncId(), event.from(), event.detail());
            case SUCCEEDED -> log.info("Sync {}: {} -> SUCCEEDED", event.syncId(), event.from());
            default -> log.debug("Sync {}: {} -> {}", event.syncId(), event.from(), event.to());
        }
    }

    @Override
    public void onConnectionEvent(ConnectionEvent event) {
        log.debug("Connection {} {}", event.connectionId(), event.kind());
    }

    @Override
    public void onLifecycleEvent(LifecycleEvent event) {
        switch (event.kind()) {
            case LISTENING -> log.info("helixd listening on {}", event.detail());
            case SHUTDOWN_REQUESTED -> log.info("Shutdown requested: {}", event.detail());
            case STOPPED -> log.info("helixd stopped ({})", event.detail());
        }
    }

    @Override
    public void onError(DaemonErrorEvent event) {
        log.error("helixd error: {}", event.message(), event.cause());
    }
}
