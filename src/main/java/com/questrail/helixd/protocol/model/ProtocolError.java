package com.questrail.helixd.protocol.model;

import java.util.Objects;

/**
 * Error body carried by a failed {@link Response}.
 */
public record ProtocolError(ErrorCode code, String message) {
    public ProtocolError {
        Objects.requireNonNull(code, "code");
        Objects.requireNonNull(message, "message");
    }
}
