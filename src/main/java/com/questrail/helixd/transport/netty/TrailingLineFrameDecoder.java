package com.questrail.helixd.transport.netty;

import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.LineBasedFrameDecoder;

import java.util.List;

/**
 * Line framer that also emits an unterminated final line.
 *
 * <p>{@link LineBasedFrameDecoder} drops buffered bytes that never saw a
 * delimiter when the input ends. Here they become one last frame, so a request
 * written without a trailing {@code \n} before a half-close is still served.</p>
 *
 * <p>Delimiters are stripped and overlong lines are discarded without failing
 * fast, as for the plain decoder.</p>
 */
final class TrailingLineFrameDecoder extends LineBasedFrameDecoder
{
    TrailingLineFrameDecoder(int maxLength)
    {
        super(maxLength, true, false);
    }

    @Override
    protected void decodeLast(ChannelHandlerContext ctx, ByteBuf in, List<Object> out) throws Exception
    {
        super.decodeLast(ctx, in, out);
        // an overlong remainder has already been skipped by the decoder
        if (in.isReadable()) {
            out.add(in.readRetainedSlice(in.readableBytes()));
        }
    }
}
