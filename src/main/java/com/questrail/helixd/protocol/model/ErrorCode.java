package com.questrail.helixd.protocol.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Closed set of protocol error codes.
 *
 * <ul>
 *   <li>{@link #INVALID_REQUEST}: malformed or oversized input; a caller bug</li>
 *   <li>{@link #INCOMPATIBLE_VERSION}: protocol skew; retry after renegotiating</li>
 *   <li>{@link #TIMEOUT}: a wait did not resolve in time, or named an unknown sync</li>
 *   <li>{@link #INTERNAL_ERROR}: unexpected failure inside the daemon</li>
 * </ul>
 */
public enum ErrorCode {
    @JsonProperty("invalid_request")
    INVALID_REQUEST,

    @JsonProperty("incompatible_version")
    INCOMPATIBLE_VERSION,

    @JsonProperty("timeout")
    TIMEOUT,

    @JsonProperty("internal_error")
    INTERNAL_ERROR;

    /**
     * Whether a well-behaved client may simply retry after seeing this code.
     */
    public boolean isRetryable() {
        return this == INCOMPATIBLE_VERSION || this == TIMEOUT;
    }
}
