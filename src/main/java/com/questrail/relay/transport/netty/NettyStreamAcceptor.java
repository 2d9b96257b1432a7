package com.questrail.relay.transport.netty;

import com.questrail.relay.transport.StreamAcceptor;
import com.questrail.relay.transport.StreamAcceptorListener;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInboundHandlerAdapter;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.util.concurrent.DefaultThreadFactory;

import java.net.InetSocketAddress;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * NettyStreamAcceptor
 * =============================================================================
 * Netty-backed implementation of the {@link StreamAcceptor} port.
 *
 * <h2>Single cooperative event loop</h2>
 * One {@link NioEventLoopGroup} with a single thread serves both the listening
 * channel and every accepted channel. All listener callbacks and all connection
 * callbacks therefore run one at a time on that thread, which is what lets the
 * server keep its client registry without locks.
 *
 * <h2>Accept loop</h2>
 * The listening channel keeps accepting while an accepted connection is being set
 * up; the listener is never idle. An accept failure is reported via
 * {@link StreamAcceptorListener#onAcceptFailed} and the channel keeps listening.
 *
 * <h2>Lifecycle</h2>
 * - {@link #start()} binds asynchronously and reports the outcome to the listener.
 * - {@link #stop()} closes the listening channel and shuts down the event loop
 *   group, which closes every accepted channel. Only the first call has an effect.
 * - The listener hears {@code onTransportDown} once: from {@link #start()} when
 *   the bind fails, otherwise from {@link #stop()}.
 */
public final class NettyStreamAcceptor implements StreamAcceptor
{
    private final InetSocketAddress bindAddress;

    private final EventLoopGroup group;
    private final ServerBootstrap bootstrap;

    private final AtomicBoolean stopped = new AtomicBoolean();

    private volatile StreamAcceptorListener listener;
    private volatile Channel channel;

    public NettyStreamAcceptor(InetSocketAddress bindAddress)
    {
        this.bindAddress = Objects.requireNonNull(bindAddress, "bindAddress");

        this.group = new NioEventLoopGroup(1, new DefaultThreadFactory("relay-server-loop"));
        this.bootstrap = new ServerBootstrap();

        bootstrap.group(group, group)
                .channel(NioServerSocketChannel.class)
                .option(ChannelOption.SO_REUSEADDR, true)
                .handler(new AcceptFailureHandler())
                .childOption(ChannelOption.TCP_NODELAY, true)
                .childHandler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch)
                    {
                        NettyStreamConnection.install(ch);
                        ch.pipeline().addLast(new ActivationHandler());
                    }
                });
    }

    @Override
    public void setListener(StreamAcceptorListener listener)
    {
        this.listener = Objects.requireNonNull(listener, "listener");
    }

    @Override
    public void start()
    {
        StreamAcceptorListener l = requireListener();

        ChannelFuture f = bootstrap.bind(bindAddress);
        f.addListener((ChannelFutureListener) future -> {
            if (future.isSuccess()) {
                channel = future.channel();
                l.onTransportUp(channel.localAddress());
            }
            else {
                l.onTransportDown(future.cause());
            }
        });
    }

    @Override
    public void stop()
    {
        if (!stopped.compareAndSet(false, true)) {
            return;
        }
        StreamAcceptorListener l = listener;

        Channel ch = channel;
        if (ch != null) {
            ch.close().syncUninterruptibly();
        }

        group.shutdownGracefully().syncUninterruptibly();

        // A failed bind already reported its own down event.
        if (l != null && ch != null) {
            l.onTransportDown(null);
        }
    }

    private StreamAcceptorListener requireListener()
    {
        StreamAcceptorListener l = listener;
        if (l == null) {
            throw new IllegalStateException("StreamAcceptorListener must be set before start()");
        }
        return l;
    }

    /**
     * Hands an accepted connection to the listener once the channel is active.
     */
    private final class ActivationHandler extends ChannelInboundHandlerAdapter
    {
        @Override
        public void channelActive(ChannelHandlerContext ctx)
        {
            StreamAcceptorListener l = listener;
            if (l != null) {
                l.onAccepted(NettyStreamConnection.of(ctx.channel()));
            }
            ctx.fireChannelActive();
        }
    }

    /**
     * Sits on the listening channel. Netty reports accept failures here; the
     * channel is left open so listening continues.
     */
    private final class AcceptFailureHandler extends ChannelInboundHandlerAdapter
    {
        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause)
        {
            StreamAcceptorListener l = listener;
            if (l != null) {
                l.onAcceptFailed(cause);
            }
        }
    }
}
