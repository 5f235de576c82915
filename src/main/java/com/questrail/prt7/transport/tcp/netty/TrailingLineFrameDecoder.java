package com.questrail.prt7.transport.tcp.netty;

import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.LineBasedFrameDecoder;
import io.netty.handler.codec.TooLongFrameException;

import java.util.List;

/**
 * TrailingLineFrameDecoder
 * -----------------------------------------------------------------------------
 * {@link LineBasedFrameDecoder} that also delivers an unterminated final line
 * when the connection closes.
 *
 * <p>Terminated lines are framed exactly as by the parent class. On channel
 * close, any readable bytes left after the last terminator are emitted as one
 * more frame, with a trailing {@code \r} removed. A leftover longer than the
 * maximum line length is discarded and reported as a
 * {@link TooLongFrameException}, as for terminated lines.</p>
 */
final class TrailingLineFrameDecoder extends LineBasedFrameDecoder
{
    private final int maxLength;

    TrailingLineFrameDecoder(int maxLength)
    {
        super(maxLength, true, false);
        this.maxLength = maxLength;
    }

    @Override
    protected void decodeLast(ChannelHandlerContext ctx, ByteBuf in, List<Object> out) throws Exception
    {
        super.decodeLast(ctx, in, out);

        int length = in.readableBytes();
        if (length == 0) {
            return;
        }
        if (in.getByte(in.readerIndex() + length - 1) == '\r') {
            length--;
        }

        if (length == 0) {
            in.skipBytes(in.readableBytes());
            return;
        }
        if (length > maxLength) {
            in.skipBytes(in.readableBytes());
            ctx.fireExceptionCaught(new TooLongFrameException(
                    "trailing line length (" + length + ") exceeds the allowed maximum (" + maxLength + ')'));
            return;
        }

        out.add(in.readRetainedSlice(length));
        in.skipBytes(in.readableBytes());
    }
}
