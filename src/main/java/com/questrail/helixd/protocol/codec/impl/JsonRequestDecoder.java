package com.questrail.helixd.protocol.codec.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.questrail.helixd.protocol.HelixProtocol;
import com.questrail.helixd.protocol.codec.ProtocolException;
import com.questrail.helixd.protocol.codec.RequestDecoder;
import com.questrail.helixd.protocol.model.ErrorCode;
import com.questrail.helixd.protocol.model.Request;

import java.io.IOException;
import java.math.BigInteger;
import java.util.Objects;

/**
 * JsonRequestDecoder
 * -----------------------------------------------------------------------------
 * Jackson-backed {@link RequestDecoder}.
 *
 * <p>Decoding happens in this order:</p>
 * <ol>
 *   <li>Size check on the raw line, before any parsing</li>
 *   <li>Parse into a JSON tree</li>
 *   <li>Read the envelope {@code id} (best effort) and {@code version}</li>
 *   <li>Version gate: a mismatch is reported whatever the command holds</li>
 *   <li>Bind the tree to {@link Request}, including the tagged command</li>
 * </ol>
 */
public final class JsonRequestDecoder implements RequestDecoder
{
    private final ObjectMapper mapper;
    private final int protocolVersion;
    private final int maxMessageSize;

    public JsonRequestDecoder()
    {
        this(ProtocolJson.mapper(), HelixProtocol.PROTOCOL_VERSION, HelixProtocol.MAX_MESSAGE_SIZE);
    }

    public JsonRequestDecoder(ObjectMapper mapper, int protocolVersion, int maxMessageSize)
    {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        if (maxMessageSize <= 0) {
            throw new IllegalArgumentException("maxMessageSize must be > 0");
        }
        this.protocolVersion = protocolVersion;
        this.maxMessageSize = maxMessageSize;
    }

    @Override
    public Request decode(byte[] line)
    {
        Objects.requireNonNull(line, "line");

        final byte[] content = LineFraming.stripLineEnding(line);
        if (LineFraming.exceedsLimit(content.length, maxMessageSize)) {
            throw new ProtocolException(ErrorCode.INVALID_REQUEST, "", "Message too large");
        }

        final JsonNode tree;
        try {
            tree = mapper.readTree(content);
        }
        catch (JsonProcessingException e) {
            throw new ProtocolException(ErrorCode.INVALID_REQUEST, "", e.getOriginalMessage(), e);
        }
        catch (IOException e) {
            throw new ProtocolException(ErrorCode.INVALID_REQUEST, "", e.getMessage(), e);
        }

        if (tree == null || !tree.isObject()) {
            throw new ProtocolException(ErrorCode.INVALID_REQUEST, "", "Request must be a JSON object");
        }

        final JsonNode idNode = tree.get("id");
        final String id = idNode != null && idNode.isTextual() ? idNode.textValue() : "";

        final JsonNode versionNode = tree.get("version");
        if (versionNode == null || !versionNode.isIntegralNumber()) {
            throw new ProtocolException(ErrorCode.INVALID_REQUEST, id, "Missing or non-integer field `version`");
        }

        // any integer is a version claim, including ones outside int range
        if (!versionNode.bigIntegerValue().equals(BigInteger.valueOf(protocolVersion))) {
            throw new ProtocolException(
                    ErrorCode.INCOMPATIBLE_VERSION,
                    id,
                    "Protocol version mismatch: expected " + protocolVersion + ", got " + versionNode.asText());
        }

        try {
            return mapper.treeToValue(tree, Request.class);
        }
        catch (JsonProcessingException | IllegalArgumentException e) {
            String message = e instanceof JsonProcessingException jpe ? jpe.getOriginalMessage() : e.getMessage();
            throw new ProtocolException(ErrorCode.INVALID_REQUEST, id, message, e);
        }
    }
}
