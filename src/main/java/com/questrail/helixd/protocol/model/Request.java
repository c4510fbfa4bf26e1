package com.questrail.helixd.protocol.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Request envelope.
 *
 * <p>{@code id} is an opaque caller-chosen correlation token echoed on the
 * response. {@code tool} and {@code repoRoot} identify the caller and, together
 * with an {@code enqueue_sync} directory, form the queue key.</p>
 */
public record Request(
        @JsonProperty(value = "id", required = true) String id,
        @JsonProperty(value = "version", required = true) int version,
        @JsonProperty(value = "tool", required = true) String tool,
        @JsonProperty(value = "repo_root", required = true) String repoRoot,
        @JsonProperty(value = "command", required = true) Command command
) {
    public Request {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(tool, "tool");
        Objects.requireNonNull(repoRoot, "repo_root");
        Objects.requireNonNull(command, "command");
    }
}
