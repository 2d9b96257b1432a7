package com.questrail.relay.transport.netty;

import com.questrail.relay.transport.StreamConnection;
import com.questrail.relay.transport.StreamConnector;

import io.netty.bootstrap.Bootstrap;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;
import io.netty.util.concurrent.DefaultThreadFactory;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.SocketAddress;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * NettyStreamConnector
 * =============================================================================
 * Netty-backed implementation of the {@link StreamConnector} port.
 *
 * <p>Owns a dedicated single-thread event loop: the network execution context of
 * the interactive client. Connect attempts, reads and writes for every connection
 * it opens run on that thread.</p>
 */
public final class NettyStreamConnector implements StreamConnector
{
    private static final Logger log = LoggerFactory.getLogger(NettyStreamConnector.class);

    private final EventLoopGroup group;
    private final Bootstrap bootstrap;

    public NettyStreamConnector()
    {
        this.group = new NioEventLoopGroup(1, new DefaultThreadFactory("relay-client-loop"));
        this.bootstrap = new Bootstrap();

        bootstrap.group(group)
                .channel(NioSocketChannel.class)
                .option(ChannelOption.TCP_NODELAY, true)
                .handler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch)
                    {
                        NettyStreamConnection.install(ch);
                    }
                });
    }

    @Override
    public CompletableFuture<StreamConnection> connect(List<? extends SocketAddress> candidates)
    {
        Objects.requireNonNull(candidates, "candidates");
        if (candidates.isEmpty()) {
            throw new IllegalArgumentException("candidates must not be empty");
        }

        CompletableFuture<StreamConnection> result = new CompletableFuture<>();
        attempt(new ArrayList<>(candidates), 0, null, result);
        return result;
    }

    private void attempt(List<SocketAddress> candidates,
                         int index,
                         Throwable lastFailure,
                         CompletableFuture<StreamConnection> result)
    {
        if (index >= candidates.size()) {
            result.completeExceptionally(lastFailure);
            return;
        }

        SocketAddress remote = candidates.get(index);
        bootstrap.connect(remote).addListener((ChannelFutureListener) future -> {
            if (future.isSuccess()) {
                result.complete(NettyStreamConnection.of(future.channel()));
            }
            else {
                log.debug("Connect to {} failed: {}", remote, future.cause().toString());
                attempt(candidates, index + 1, future.cause(), result);
            }
        });
    }

    @Override
    public void shutdown()
    {
        group.shutdownGracefully();
    }
}
