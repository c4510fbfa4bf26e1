package com.questrail.helixd.observability;

import com.questrail.helixd.protocol.model.SyncState;
import com.questrail.helixd.queue.QueueKey;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class Slf4jDaemonObservabilitySinkTest {

    private final Slf4jDaemonObservabilitySink sink = new Slf4jDaemonObservabilitySink();
    private final QueueKey key = new QueueKey("/repo", "hbd", "docs");

    @Test
    void acceptsEveryJobTransition() {
        Instant now = Instant.now();
        assertDoesNotThrow(() -> {
            sink.onJobTransition(new JobTransitionEvent(now, "s1", key, null, SyncState.QUEUED, null));
            sink.onJobTransition(new JobTransitionEvent(now, "s1", key, SyncState.QUEUED, SyncState.RUNNING, null));
            sink.onJobTransition(new JobTransitionEvent(now, "s1", key, SyncState.RUNNING, SyncState.SUCCEEDED, null));
            sink.onJobTransition(new JobTransitionEvent(now, "s2", key, SyncState.RUNNING, SyncState.FAILED, "boom"));
        });
    }

    @Test
    void acceptsLifecycleConnectionAndErrorEvents() {
        Instant now = Instant.now();
        assertDoesNotThrow(() -> {
            sink.onLifecycleEvent(new LifecycleEvent(now, LifecycleEvent.Kind.LISTENING, "/tmp/helixd.sock"));
            sink.onLifecycleEvent(new LifecycleEvent(now, LifecycleEvent.Kind.SHUTDOWN_REQUESTED, "test"));
            sink.onLifecycleEvent(new LifecycleEvent(now, LifecycleEvent.Kind.STOPPED, "test"));
            sink.onConnectionEvent(new ConnectionEvent(now, 1, ConnectionEvent.Kind.OPENED));
            sink.onError(new DaemonErrorEvent(now, "failure", new IllegalStateException("x")));
        });
    }

    @Test
    void admissionIsTheTransitionWithoutPreviousState() {
        Instant now = Instant.now();
        assertTrue(new JobTransitionEvent(now, "s1", key, null, SyncState.QUEUED, null).isAdmission());
        assertFalse(new JobTransitionEvent(now, "s1", key, SyncState.QUEUED, SyncState.RUNNING, null).isAdmission());
    }
}
