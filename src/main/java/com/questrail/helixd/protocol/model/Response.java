package com.questrail.helixd.protocol.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Response envelope.
 *
 * <p>Exactly one of {@code payload} and {@code error} is present, matching
 * {@code ok}. The absent one is omitted from the JSON.</p>
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Response(
        @JsonProperty("id") String id,
        @JsonProperty("ok") boolean ok,
        @JsonProperty("payload") ResponsePayload payload,
        @JsonProperty("error") ProtocolError error
) {
    public Response {
        Objects.requireNonNull(id, "id");
        if (ok == (payload == null) || ok == (error != null)) {
            throw new IllegalArgumentException("ok response needs a payload, error response needs an error");
        }
    }

    public static Response ok(String id, ResponsePayload payload) {
        return new Response(id, true, Objects.requireNonNull(payload, "payload"), null);
    }

    public static Response error(String id, ErrorCode code, String message) {
        return new Response(id, false, null, new ProtocolError(code, message));
    }
}
