package com.questrail.helixd.protocol.codec;

import com.questrail.helixd.protocol.model.ErrorCode;
import com.questrail.helixd.protocol.model.Response;

import java.util.Objects;

/**
 * Indicates that a request line could not be accepted.
 *
 * <p>Carries the protocol {@link ErrorCode} to report and the correlation id
 * of the offending request, or the empty string when the id itself could not
 * be read.</p>
 */
public final class ProtocolException extends RuntimeException
{
    private final ErrorCode code;
    private final String requestId;

    public ProtocolException(ErrorCode code, String requestId, String message) {
        this(code, requestId, message, null);
    }

    public ProtocolException(ErrorCode code, String requestId, String message, Throwable cause) {
        super(message, cause);
        this.code = Objects.requireNonNull(code, "code");
        this.requestId = Objects.requireNonNullElse(requestId, "");
    }

    public ErrorCode code() {
        return code;
    }

    public String requestId() {
        return requestId;
    }

    public Response toResponse() {
        return Response.error(requestId, code, String.valueOf(getMessage()));
    }
}
