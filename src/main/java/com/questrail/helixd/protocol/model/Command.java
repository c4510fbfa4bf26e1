package com.questrail.helixd.protocol.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.util.Objects;

/**
 * Command carried by a {@link Request}, tagged on the wire by its {@code type}.
 *
 * <pre>
 *   { "type": "ping" }
 *   { "type": "enqueue_sync", "directory": "...", "force": false }
 *   { "type": "wait_sync", "sync_id": "...", "timeout_ms": 5000 }
 *   { "type": "status" }
 *   { "type": "shutdown", "reason": "..." }
 * </pre>
 *
 * <p>There is deliberately no cancel command; running work cannot be stopped
 * through the protocol.</p>
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = Command.Ping.class, name = "ping"),
        @JsonSubTypes.Type(value = Command.EnqueueSync.class, name = "enqueue_sync"),
        @JsonSubTypes.Type(value = Command.WaitSync.class, name = "wait_sync"),
        @JsonSubTypes.Type(value = Command.Status.class, name = "status"),
        @JsonSubTypes.Type(value = Command.Shutdown.class, name = "shutdown")
})
public sealed interface Command {

    /** Liveness check; answered without touching the sync queue. */
    record Ping() implements Command {}

    /**
     * Request a sync of {@code directory}. With {@code force} a new job is
     * started even when one is already active for the same key.
     */
    record EnqueueSync(
            @JsonProperty(value = "directory", required = true) String directory,
            @JsonProperty("force") boolean force
    ) implements Command {
        public EnqueueSync {
            Objects.requireNonNull(directory, "directory");
        }
    }

    /** Wait up to {@code timeoutMs} for the named job to become terminal. */
    record WaitSync(
            @JsonProperty(value = "sync_id", required = true) String syncId,
            @JsonProperty(value = "timeout_ms", required = true) long timeoutMs
    ) implements Command {
        public WaitSync {
            Objects.requireNonNull(syncId, "sync_id");
            if (timeoutMs < 0) {
                throw new IllegalArgumentException("timeout_ms must be >= 0");
            }
        }
    }

    record Status() implements Command {}

    record Shutdown(
            @JsonProperty(value = "reason", required = true) String reason
    ) implements Command {
        public Shutdown {
            Objects.requireNonNull(reason, "reason");
        }
    }
}
