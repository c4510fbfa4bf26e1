package com.questrail.helixd.protocol.codec;

import com.questrail.helixd.protocol.model.Response;

/**
 * ResponseEncoder
 * -----------------------------------------------------------------------------
 * Outbound boundary between a {@link Response} and the bytes written back to
 * the client.
 *
 * <p>The returned array is a complete line, delimiter included, suitable for
 * immediate transmission without further modification.</p>
 */
public interface ResponseEncoder
{
    byte[] encode(Response response);
}
