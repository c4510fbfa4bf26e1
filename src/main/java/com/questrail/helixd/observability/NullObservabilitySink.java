package com.questrail.helixd.observability;

/**
 * No-op implementation of DaemonObservabilitySink.
 */
public final class NullObservabilitySink implements DaemonObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onJobTransition(JobTransitionEvent event) {}

    @Override
    public void onConnectionEvent(ConnectionEvent event) {}

    @Override
    public void onLifecycleEvent(LifecycleEvent event) {}

    @Override
    public void onError(DaemonErrorEvent event) {}
}
