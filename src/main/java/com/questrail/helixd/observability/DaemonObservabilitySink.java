package com.questrail.helixd.observability;

/**
 * Main interface for receiving helixd observability events.
 * Implementations can provide logging, metrics, or tracing.
 */
public interface DaemonObservabilitySink {
    /**
     * Called when a sync job is admitted or changes state.
     * @param event the transition details
     */
    void onJobTransition(JobTransitionEvent event);

    /**
     * Called when a client connection opens or closes.
     * @param event the connection event
     */
    void onConnectionEvent(ConnectionEvent event);

    /**
     * Called on daemon lifecycle milestones (listening, shutdown requested, stopped).
     * @param event the lifecycle event
     */
    void onLifecycleEvent(LifecycleEvent event);

    /**
     * Called when an error is isolated by the daemon rather than propagated.
     * @param event the error event
     */
    void onError(DaemonErrorEvent event);
}
