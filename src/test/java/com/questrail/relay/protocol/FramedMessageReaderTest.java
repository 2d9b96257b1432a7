package com.questrail.relay.protocol;

import com.questrail.relay.codec.ChatFrame;
import com.questrail.relay.codec.ChatFrameEncoder;
import com.questrail.relay.codec.CommandTag;
import com.questrail.relay.codec.FrameDecodeException;
import com.questrail.relay.transport.ConnectionClosedException;
import com.questrail.relay.transport.FakeStreamConnection;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FramedMessageReaderTest
{
    private static final class RecordingListener implements FrameListener
    {
        final List<ChatFrame> frames = new ArrayList<>();
        final List<Throwable> failures = new ArrayList<>();

        @Override
        public void onFrame(ChatFrame frame)
        {
            frames.add(frame);
        }

        @Override
        public void onFailure(Throwable cause)
        {
            failures.add(cause);
        }
    }

    private final ChatFrameEncoder encoder = new ChatFrameEncoder();
    private final FakeStreamConnection connection = new FakeStreamConnection();
    private final FramedMessageReader reader = new FramedMessageReader(connection, 1024);

    @Test
    void deliversFrameWithPayload()
    {
        RecordingListener listener = new RecordingListener();
        reader.readMessage(listener);

        connection.inject(encoder.encode(ChatFrame.rename("alice")));

        assertEquals(1, listener.frames.size());
        assertEquals(CommandTag.NAME, listener.frames.get(0).tag());
        assertEquals("alice", listener.frames.get(0).payloadText());
    }

    @Test
    void zeroLengthFrameIsDeliveredWithoutPayloadRead()
    {
        RecordingListener listener = new RecordingListener();
        reader.readMessage(listener);

        connection.inject(encoder.encode(ChatFrame.quit()));

        assertEquals(1, listener.frames.size());
        assertEquals(0, listener.frames.get(0).payloadLength());
        assertFalse(connection.isReadPending());
    }

    @Test
    void frameSplitAcrossManyChunksIsReassembled()
    {
        RecordingListener listener = new RecordingListener();
        reader.readMessage(listener);

        byte[] wire = encoder.encode(ChatFrame.chat("hello world"));
        for (int i = 0; i < wire.length; i++) {
            connection.inject(Arrays.copyOfRange(wire, i, i + 1));
        }

        assertEquals(1, listener.frames.size());
        assertEquals("hello world", listener.frames.get(0).payloadText());
    }

    @Test
    void doesNotReArmAfterDelivery()
    {
        RecordingListener listener = new RecordingListener();
        reader.readMessage(listener);

        byte[] first = encoder.encode(ChatFrame.chat("one"));
        byte[] second = encoder.encode(ChatFrame.chat("two"));
        byte[] both = new byte[first.length + second.length];
        System.arraycopy(first, 0, both, 0, first.length);
        System.arraycopy(second, 0, both, first.length, second.length);
        connection.inject(both);

        assertEquals(1, listener.frames.size());

        reader.readMessage(listener);
        assertEquals(2, listener.frames.size());
        assertEquals("two", listener.frames.get(1).payloadText());
    }

    @Test
    void failureDuringHeaderIsReportedOnce()
    {
        RecordingListener listener = new RecordingListener();
        reader.readMessage(listener);

        connection.inject(new byte[] { 'c', 'h' });
        connection.injectEof();

        assertTrue(listener.frames.isEmpty());
        assertEquals(1, listener.failures.size());
        assertInstanceOf(ConnectionClosedException.class, listener.failures.get(0));
    }

    @Test
    void failureDuringPayloadIsReported()
    {
        RecordingListener listener = new RecordingListener();
        reader.readMessage(listener);

        byte[] wire = encoder.encode(ChatFrame.chat("truncated"));
        connection.inject(Arrays.copyOf(wire, wire.length - 3));
        connection.injectEof();

        assertTrue(listener.frames.isEmpty());
        assertEquals(1, listener.failures.size());
    }

    @Test
    void oversizedLengthIsRejectedBeforePayloadRead()
    {
        RecordingListener listener = new RecordingListener();
        reader.readMessage(listener);

        connection.inject(new byte[] { 'c', 'h', 'a', 't', 0, 0, 0x04, 0x01 });

        assertEquals(1, listener.failures.size());
        assertInstanceOf(FrameDecodeException.class, listener.failures.get(0));
        assertFalse(connection.isReadPending());
    }
}
