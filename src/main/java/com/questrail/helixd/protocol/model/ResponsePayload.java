package com.questrail.helixd.protocol.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.util.List;

/**
 * Command-shaped success data of a {@link Response}, tagged with the same
 * {@code type} as the command that produced it.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = ResponsePayload.Ping.class, name = "ping"),
        @JsonSubTypes.Type(value = ResponsePayload.EnqueueSync.class, name = "enqueue_sync"),
        @JsonSubTypes.Type(value = ResponsePayload.WaitSync.class, name = "wait_sync"),
        @JsonSubTypes.Type(value = ResponsePayload.Status.class, name = "status"),
        @JsonSubTypes.Type(value = ResponsePayload.Shutdown.class, name = "shutdown")
})
public sealed interface ResponsePayload {

    record Ping(
            @JsonProperty("daemon_version") String daemonVersion
    ) implements ResponsePayload {}

    /**
     * {@code isNew} is {@code false} when the request collapsed onto a job
     * that was already queued or running for the same key.
     */
    record EnqueueSync(
            @JsonProperty("sync_id") String syncId,
            @JsonProperty("queued_at_ms") long queuedAtMs,
            @JsonProperty("is_new") boolean isNew
    ) implements ResponsePayload {}

    @JsonInclude(JsonInclude.Include.NON_NULL)
    record WaitSync(
            @JsonProperty("sync_id") String syncId,
            @JsonProperty("state") SyncState state,
            @JsonProperty("stats") SyncStats stats,
            @JsonProperty("error") String error
    ) implements ResponsePayload {}

    record Status(
            @JsonProperty("queues") List<QueueStatus> queues,
            @JsonProperty("uptime_ms") long uptimeMs
    ) implements ResponsePayload {
        public Status {
            queues = List.copyOf(queues);
        }
    }

    record Shutdown() implements ResponsePayload {}
}
