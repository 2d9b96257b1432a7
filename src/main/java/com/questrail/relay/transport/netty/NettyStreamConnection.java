package com.questrail.relay.transport.netty;

import com.questrail.relay.transport.ConnectionClosedException;
import com.questrail.relay.transport.MatchCondition;
import com.questrail.relay.transport.ReadAccumulator;
import com.questrail.relay.transport.ReadCallback;
import com.questrail.relay.transport.StreamConnection;
import com.questrail.relay.transport.WriteBuffer;
import com.questrail.relay.transport.WriteCallback;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInboundHandlerAdapter;
import io.netty.channel.EventLoop;
import io.netty.channel.socket.DuplexChannel;
import io.netty.util.AttributeKey;
import io.netty.util.ReferenceCountUtil;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.SocketAddress;
import java.util.Objects;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Consumer;

/**
 * NettyStreamConnection
 * =============================================================================
 * Netty-backed implementation of the {@link StreamConnection} port.
 *
 * <h2>Architectural Role</h2>
 * This class is a <strong>pure transport adapter</strong>. It copies inbound
 * {@link ByteBuf} content into the connection's {@link ReadAccumulator} and wraps
 * outbound {@link WriteBuffer}s without copying. It does not decode frames.
 *
 * <h2>Execution context</h2>
 * Every operation runs on the channel's {@link EventLoop}. A call made from any
 * other thread (e.g. the interactive client's console thread) is submitted to the
 * loop's task queue, which is drained only by the loop thread. The accumulation
 * buffer is therefore never touched concurrently.
 *
 * <h2>Netty containment rule</h2>
 * Netty types MUST NOT escape this package. Higher layers see only
 * {@link StreamConnection}.
 */
public final class NettyStreamConnection implements StreamConnection
{
    private static final Logger log = LoggerFactory.getLogger(NettyStreamConnection.class);

    private static final AttributeKey<NettyStreamConnection> CONNECTION_KEY =
            AttributeKey.valueOf(NettyStreamConnection.class, "connection");

    private final Channel channel;
    private final ReadAccumulator accumulator = new ReadAccumulator();

    private NettyStreamConnection(Channel channel)
    {
        this.channel = Objects.requireNonNull(channel, "channel");
    }

    /**
     * Attach a new connection to {@code channel}: installs the inbound handler
     * that feeds the read buffer and records the connection as a channel attribute.
     * Must be called from the channel initializer.
     */
    static NettyStreamConnection install(Channel channel)
    {
        NettyStreamConnection connection = new NettyStreamConnection(channel);
        channel.attr(CONNECTION_KEY).set(connection);
        channel.pipeline().addLast(connection.new InboundHandler());
        return connection;
    }

    /**
     * Returns the connection previously installed on {@code channel}.
     */
    static NettyStreamConnection of(Channel channel)
    {
        NettyStreamConnection connection = channel.attr(CONNECTION_KEY).get();
        if (connection == null) {
            throw new IllegalStateException("No connection installed on " + channel);
        }
        return connection;
    }

    @Override
    public void readUntil(MatchCondition condition, ReadCallback callback)
    {
        Objects.requireNonNull(condition, "condition");
        Objects.requireNonNull(callback, "callback");

        runOnLoop(
                () -> accumulator.readUntil(condition, callback),
                rejected -> callback.onRead(new ConnectionClosedException("Event loop is shut down"), new byte[0])
        );
    }

    @Override
    public void write(WriteBuffer data, WriteCallback callback)
    {
        Objects.requireNonNull(data, "data");
        final WriteCallback cb = (callback == null) ? WriteCallback.NONE : callback;

        runOnLoop(
                () -> {
                    // Wraps the shared bytes; no copy per recipient.
                    ByteBuf buf = Unpooled.wrappedBuffer(data.asReadOnlyBuffer());
                    channel.writeAndFlush(buf).addListener((ChannelFutureListener) future -> {
                        if (future.isSuccess()) {
                            cb.onWrite(null, data.length());
                        }
                        else {
                            cb.onWrite(future.cause(), 0);
                        }
                    });
                },
                rejected -> cb.onWrite(rejected, 0)
        );
    }

    @Override
    public void close()
    {
        runOnLoop(this::closeOnLoop,
                rejected -> log.warn("Close of {} skipped: event loop already shut down", remoteAddress()));
    }

    @Override
    public boolean isOpen()
    {
        return channel.isOpen();
    }

    @Override
    public SocketAddress remoteAddress()
    {
        return channel.remoteAddress();
    }

    private void closeOnLoop()
    {
        if (!channel.isOpen()) {
            return;
        }

        final SocketAddress remote = channel.remoteAddress();
        if (channel instanceof DuplexChannel duplex && !duplex.isShutdown()) {
            duplex.shutdown().addListener((ChannelFutureListener) future -> {
                if (!future.isSuccess()) {
                    // Peer state is unknown either way; the socket is released below.
                    log.warn("Socket shutdown failed for {}: {}", remote, future.cause().toString());
                }
                closeChannel(remote);
            });
        }
        else {
            closeChannel(remote);
        }
    }

    private void closeChannel(SocketAddress remote)
    {
        channel.close().addListener((ChannelFutureListener) future -> {
            if (!future.isSuccess()) {
                log.warn("Socket close failed for {}: {}", remote, future.cause().toString());
            }
        });
    }

    private void runOnLoop(Runnable task, Consumer<RejectedExecutionException> onRejected)
    {
        EventLoop loop = channel.eventLoop();
        if (loop.inEventLoop()) {
            task.run();
            return;
        }
        try {
            loop.execute(task);
        }
        catch (RejectedExecutionException e) {
            onRejected.accept(e);
        }
    }

    @Override
    public String toString()
    {
        return "NettyStreamConnection[" + channel.remoteAddress() + ']';
    }

    /**
     * InboundHandler
     * -------------------------------------------------------------------------
     * Copies inbound bytes into the read buffer and converts channel teardown into
     * a terminal read error. Reference-counted buffers are released here.
     */
    private final class InboundHandler extends ChannelInboundHandlerAdapter
    {
        @Override
        public void channelRead(ChannelHandlerContext ctx, Object msg)
        {
            if (!(msg instanceof ByteBuf)) {
                ctx.fireChannelRead(msg);
                return;
            }

            final byte[] bytes;
            try {
                ByteBuf content = (ByteBuf) msg;
                bytes = new byte[content.readableBytes()];
                content.readBytes(bytes);
            }
            finally {
                ReferenceCountUtil.release(msg);
            }
            accumulator.append(bytes);
        }

        @Override
        public void channelInactive(ChannelHandlerContext ctx)
        {
            accumulator.fail(new ConnectionClosedException("Connection to " + ctx.channel().remoteAddress() + " closed"));
            ctx.fireChannelInactive();
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause)
        {
            log.debug("Transport error on {}", ctx.channel().remoteAddress(), cause);
            accumulator.fail(cause);
            ctx.close();
        }
    }
}
