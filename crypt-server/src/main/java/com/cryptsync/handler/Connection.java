package com.cryptsync.handler;

import com.cryptsync.auth.PlayerSession;
import com.cryptsync.protocol.Message;
import com.cryptsync.protocol.MessageSerializer;
import com.cryptsync.protocol.MessageType;
import io.netty.channel.Channel;
import io.netty.channel.EventLoop;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * One WebSocket connection and the player identity bound to it.
 *
 * Thread Safety:
 * - Channel and id are immutable after creation
 * - The bound player uses AtomicReference
 * - Sending only enqueues; frames are written on the channel's event loop
 *   while the channel is writable, so a slow client never blocks the sender
 */
public class Connection {

    private static final Logger logger = LoggerFactory.getLogger(Connection.class);

    private final String connectionId;
    private final Channel channel;
    private final long connectedAt;
    private final MessageSerializer serializer;
    private final OutboundQueue queue;
    private final AtomicReference<PlayerSession> player = new AtomicReference<>(null);
    private final AtomicBoolean drainScheduled = new AtomicBoolean(false);

    public Connection(Channel channel, MessageSerializer serializer, int queueCapacity) {
        this.connectionId = channel.id().asShortText();
        this.channel = channel;
        this.connectedAt = System.currentTimeMillis();
        this.serializer = serializer;
        this.queue = new OutboundQueue(queueCapacity);
    }

    public String getConnectionId() {
        return connectionId;
    }

    public Channel getChannel() {
        return channel;
    }

    public long getConnectedAt() {
        return connectedAt;
    }

    public PlayerSession getPlayer() {
        return player.get();
    }

    /**
     * @return the previously bound player, or null
     */
    PlayerSession bind(PlayerSession session) {
        return player.getAndSet(session);
    }

    public boolean isAuthenticated() {
        return player.get() != null;
    }

    public boolean isActive() {
        return channel.isActive();
    }

    OutboundQueue getQueue() {
        return queue;
    }

    // === Sending ===

    public void send(Message message) {
        sendSerialized(message.getType(), serializer.serialize(message));
    }

    /**
     * Queues an already serialized message, e.g. one broadcast to many connections.
     */
    public void sendSerialized(MessageType type, String json) {
        if (!channel.isActive()) {
            return;
        }
        switch (queue.offer(type, json)) {
            case QUEUED -> scheduleDrain();
            case DROPPED -> logger.debug("Dropped {} for slow connection {}", type, connectionId);
            case OVERFLOW -> {
                if (channel.isOpen()) {
                    logger.warn("Connection {} fell {} frames behind, closing", connectionId, queue.getCapacity());
                    channel.close();
                }
            }
        }
    }

    /**
     * Writes queued frames while the channel accepts them. Re-run when the
     * channel becomes writable again.
     */
    void drain() {
        drainScheduled.set(false);
        if (!channel.isActive()) {
            queue.clear();
            return;
        }
        boolean wrote = false;
        OutboundQueue.Frame frame;
        while (channel.isWritable() && (frame = queue.poll()) != null) {
            channel.write(new TextWebSocketFrame(frame.getJson()));
            wrote = true;
        }
        if (wrote) {
            channel.flush();
        }
    }

    private void scheduleDrain() {
        EventLoop loop = channel.eventLoop();
        if (loop.inEventLoop()) {
            drain();
        } else if (drainScheduled.compareAndSet(false, true)) {
            loop.execute(this::drain);
        }
    }

    public void close() {
        channel.close();
    }

    @Override
    public String toString() {
        PlayerSession p = player.get();
        return "Connection{" +
                "id='" + connectionId + '\'' +
                ", player=" + (p == null ? "-" : p.getDisplayName()) +
                ", active=" + isActive() +
                '}';
    }
}
