package com.questrail.relay.transport.netty;

import com.questrail.relay.transport.StreamAcceptorListener;
import com.questrail.relay.transport.StreamConnection;

import org.junit.jupiter.api.Test;

import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.SocketAddress;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Lifecycle notifications of the real acceptor over loopback.
 */
final class NettyStreamAcceptorTest {

    private static final long TIMEOUT_MS = 5_000;

    private static final class RecordingListener implements StreamAcceptorListener {
        final BlockingQueue<SocketAddress> up = new LinkedBlockingQueue<>();
        final List<Throwable> down = new CopyOnWriteArrayList<>();
        final BlockingQueue<Boolean> downSignal = new LinkedBlockingQueue<>();

        @Override
        public void onTransportUp(SocketAddress localAddress) {
            up.add(localAddress);
        }

        @Override
        public void onTransportDown(Throwable cause) {
            down.add(cause);
            downSignal.add(cause != null);
        }

        @Override
        public void onAccepted(StreamConnection connection) {
            connection.close();
        }

        @Override
        public void onAcceptFailed(Throwable cause) {
            // not exercised
        }
    }

    @Test
    void bindFailureIsTheOnlyDownNotification() throws Exception {
        try (ServerSocket occupied = new ServerSocket(0, 1, InetAddress.getLoopbackAddress())) {
            NettyStreamAcceptor acceptor = new NettyStreamAcceptor(
                    new InetSocketAddress(InetAddress.getLoopbackAddress(), occupied.getLocalPort()));
            RecordingListener listener = new RecordingListener();
            acceptor.setListener(listener);

            acceptor.start();
            assertEquals(Boolean.TRUE, listener.downSignal.poll(TIMEOUT_MS, TimeUnit.MILLISECONDS));

            acceptor.stop();
            acceptor.stop();

            assertEquals(1, listener.down.size());
            assertNotNull(listener.down.get(0));
            assertTrue(listener.up.isEmpty());
        }
    }

    @Test
    void stopAfterSuccessfulBindReportsDownOnce() throws Exception {
        NettyStreamAcceptor acceptor = new NettyStreamAcceptor(
                new InetSocketAddress(InetAddress.getLoopbackAddress(), 0));
        RecordingListener listener = new RecordingListener();
        acceptor.setListener(listener);

        acceptor.start();
        assertNotNull(listener.up.poll(TIMEOUT_MS, TimeUnit.MILLISECONDS));

        acceptor.stop();
        acceptor.stop();

        assertEquals(List.of(Boolean.FALSE), List.copyOf(listener.downSignal));
    }
}
