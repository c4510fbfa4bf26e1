package com.questrail.helixd.protocol.codec;

import com.questrail.helixd.protocol.model.Request;

/**
 * RequestDecoder
 * -----------------------------------------------------------------------------
 * Inbound boundary between one framed request line and a validated
 * {@link Request}.
 *
 * <p>The decoder is responsible for:</p>
 * <ul>
 *   <li>Rejecting oversized lines before parsing</li>
 *   <li>Checking the envelope version against the supported protocol version</li>
 *   <li>Structural validation of the envelope and its command</li>
 * </ul>
 *
 * <p>It never executes a command. A returned request is always at the
 * supported protocol version.</p>
 */
public interface RequestDecoder
{
    /**
     * Decode a single request line, delimiter already removed.
     *
     * @param line raw line bytes (UTF-8)
     * @return the decoded request
     * @throws ProtocolException with {@code INVALID_REQUEST} or
     *         {@code INCOMPATIBLE_VERSION} when the line cannot be accepted
     */
    Request decode(byte[] line);
}
