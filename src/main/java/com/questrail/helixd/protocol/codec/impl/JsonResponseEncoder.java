package com.questrail.helixd.protocol.codec.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.questrail.helixd.protocol.codec.ResponseEncoder;
import com.questrail.helixd.protocol.model.Response;

import java.util.Objects;

/**
 * Jackson-backed {@link ResponseEncoder}. Emits compact JSON followed by the
 * line delimiter.
 */
public final class JsonResponseEncoder implements ResponseEncoder
{
    private final ObjectMapper mapper;

    public JsonResponseEncoder()
    {
        this(ProtocolJson.mapper());
    }

    public JsonResponseEncoder(ObjectMapper mapper)
    {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    @Override
    public byte[] encode(Response response)
    {
        Objects.requireNonNull(response, "response");
        try {
            return LineFraming.terminate(mapper.writeValueAsBytes(response));
        }
        catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to encode response " + response.id(), e);
        }
    }
}
