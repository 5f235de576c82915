package com.questrail.prt7.transport.tcp.netty;

import com.questrail.prt7.transport.LineEndpoint;
import com.questrail.prt7.transport.LineEndpointListener;

import io.netty.bootstrap.Bootstrap;
import io.netty.channel.*;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;
import io.netty.handler.codec.TooLongFrameException;
import io.netty.handler.codec.string.StringDecoder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * NettyTcpLineEndpoint
 * =============================================================================
 * Netty-backed implementation of the {@link LineEndpoint} port.
 *
 * <h2>Architectural Role</h2>
 * This class is a <strong>pure transport adapter</strong> for a TCP feed of
 * PRT-7 lines, typically a serial-to-TCP bridge in front of the device.
 *
 * It MUST NOT:
 * <ul>
 *   <li>Decode PRT-7 frames</li>
 *   <li>Touch the rotor or the assembly buffer</li>
 *   <li>Retry or reconnect</li>
 * </ul>
 *
 * <h2>Netty containment rule</h2>
 * Netty types (e.g., {@code Channel}, {@code EventLoopGroup}, {@code ByteBuf})
 * MUST NOT escape this package. Inbound bytes are framed by
 * {@link TrailingLineFrameDecoder} (terminators stripped, an unterminated last
 * line delivered on close), decoded as ASCII and handed to the listener as
 * {@code String}s.
 *
 * <h2>Lifecycle</h2>
 * - {@link #start()} connects to the remote address.
 * - {@link #stop()} closes the channel and shuts down the event loop group.
 * - The remote closing the connection is reported as an orderly transport down.
 */
public final class NettyTcpLineEndpoint implements LineEndpoint
{
    private static final Logger log = LoggerFactory.getLogger(NettyTcpLineEndpoint.class);

    private final InetSocketAddress remoteAddress;
    private final int maxLineLength;

    private final EventLoopGroup group;
    private final Bootstrap bootstrap;
    private final AtomicBoolean downReported = new AtomicBoolean(false);

    private volatile LineEndpointListener listener;
    private volatile Channel channel;

    /**
     * Construct a Netty TCP endpoint connecting to the specified remote address.
     *
     * @param remoteAddress host and port of the line feed
     * @param maxLineLength longest accepted line; longer lines are discarded
     */
    public NettyTcpLineEndpoint(InetSocketAddress remoteAddress, int maxLineLength)
    {
        this.remoteAddress = Objects.requireNonNull(remoteAddress, "remoteAddress");
        if (maxLineLength < 1) {
            throw new IllegalArgumentException("maxLineLength must be positive");
        }
        this.maxLineLength = maxLineLength;

        this.group = new NioEventLoopGroup(1);
        this.bootstrap = new Bootstrap();

        bootstrap.group(group)
                .channel(NioSocketChannel.class)
                .option(ChannelOption.TCP_NODELAY, true)
                .handler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch)
                    {
                        ch.pipeline().addLast(pipelineHandlers());
                    }
                });
    }

    @Override
    public void setListener(LineEndpointListener listener)
    {
        this.listener = Objects.requireNonNull(listener, "listener");
    }

    @Override
    public void start()
    {
        LineEndpointListener l = requireListener();

        // Connect asynchronously; notify listener on success/failure.
        ChannelFuture f = bootstrap.connect(remoteAddress);
        f.addListener((ChannelFutureListener) future -> {
            if (future.isSuccess()) {
                channel = future.channel();
                l.onTransportUp();
            }
            else {
                reportDown(future.cause());
            }
        });
    }

    @Override
    public void stop()
    {
        Channel ch = channel;
        if (ch != null) {
            ch.close();
        }

        // Shut down the event loop group.
        group.shutdownGracefully();

        reportDown(null);
    }

    @Override
    public String describe()
    {
        return "tcp://" + remoteAddress.getHostString() + ':' + remoteAddress.getPort();
    }

    /**
     * Fresh handler chain for one connection: line framing, ASCII decoding, and
     * the inbound adapter. Package-private so the chain can be exercised on an
     * embedded channel.
     */
    ChannelHandler[] pipelineHandlers()
    {
        return new ChannelHandler[] {
                new TrailingLineFrameDecoder(maxLineLength),
                new StringDecoder(StandardCharsets.US_ASCII),
                new InboundHandler()
        };
    }

    private void reportDown(Throwable cause)
    {
        LineEndpointListener l = listener;
        if (l != null && downReported.compareAndSet(false, true)) {
            l.onTransportDown(cause);
        }
    }

    private LineEndpointListener requireListener()
    {
        LineEndpointListener l = listener;
        if (l == null) {
            throw new IllegalStateException("LineEndpointListener must be set before start()");
        }
        return l;
    }

    /**
     * InboundHandler
     * -------------------------------------------------------------------------
     * Receives decoded lines and forwards them to the port listener.
     */
    private final class InboundHandler extends SimpleChannelInboundHandler<String>
    {
        @Override
        protected void channelRead0(ChannelHandlerContext ctx, String line)
        {
            LineEndpointListener l = listener;
            if (l == null) {
                return;
            }
            l.onLine(line);
        }

        @Override
        public void channelInactive(ChannelHandlerContext ctx)
        {
            reportDown(null);
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause)
        {
            if (cause instanceof TooLongFrameException) {
                // the framer has already discarded the oversized line
                log.warn("Discarding oversized line from {}: {}", describe(), cause.getMessage());
                return;
            }
            reportDown(cause);
            ctx.close();
        }
    }
}
