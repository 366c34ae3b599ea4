package com.cryptsync.handler;

import com.cryptsync.auth.PlayerSession;
import com.cryptsync.protocol.Message;
import com.cryptsync.protocol.MessageSerializer;
import com.cryptsync.protocol.MessageType;
import io.netty.channel.Channel;
import io.netty.channel.ChannelId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Collections;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Tracks open connections by channel and by bound player.
 *
 * Thread Safety:
 * - Both indexes are ConcurrentHashMaps
 * - Player bindings are replaced and removed with atomic map operations, so
 *   a superseded connection can never unbind its successor
 */
public class ConnectionRegistry {

    private static final Logger logger = LoggerFactory.getLogger(ConnectionRegistry.class);

    private final ConcurrentHashMap<ChannelId, Connection> byChannel = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Connection> byPlayer = new ConcurrentHashMap<>();
    private final MessageSerializer serializer;
    private final int queueCapacity;

    public ConnectionRegistry(MessageSerializer serializer, int queueCapacity) {
        this.serializer = serializer;
        this.queueCapacity = queueCapacity;
    }

    public Connection register(Channel channel) {
        Connection connection = new Connection(channel, serializer, queueCapacity);
        byChannel.put(channel.id(), connection);
        logger.info("Connection opened: {} ({} open)", connection.getConnectionId(), byChannel.size());
        return connection;
    }

    /**
     * Removes a closed channel. Does not touch the player binding; see
     * {@link #unbindPlayer(Connection)}.
     */
    public Connection remove(Channel channel) {
        Connection connection = byChannel.remove(channel.id());
        if (connection != null) {
            logger.info("Connection closed: {} ({} open)", connection.getConnectionId(), byChannel.size());
        }
        return connection;
    }

    public Connection get(Channel channel) {
        return byChannel.get(channel.id());
    }

    /**
     * Binds a player to a connection.
     *
     * @return the connection the player was bound to before, if it was a different one
     */
    public Connection bindPlayer(Connection connection, PlayerSession player) {
        PlayerSession previousPlayer = connection.bind(player);
        if (previousPlayer != null && !previousPlayer.getPlayerId().equals(player.getPlayerId())) {
            byPlayer.remove(previousPlayer.getPlayerId(), connection);
        }
        Connection previous = byPlayer.put(player.getPlayerId(), connection);
        return previous == connection ? null : previous;
    }

    /**
     * Removes the player binding if it still points at this connection.
     *
     * @return true if this connection was the player's current one
     */
    public boolean unbindPlayer(Connection connection) {
        PlayerSession player = connection.getPlayer();
        return player != null && byPlayer.remove(player.getPlayerId(), connection);
    }

    public Connection getByPlayer(String playerId) {
        return byPlayer.get(playerId);
    }

    /**
     * Queues a message for a player if they have an open connection.
     *
     * @return false if the player is not connected
     */
    public boolean sendTo(String playerId, Message message) {
        Connection connection = byPlayer.get(playerId);
        if (connection == null || !connection.isActive()) {
            return false;
        }
        connection.send(message);
        return true;
    }

    /**
     * Serializes once and queues the message for every listed player.
     */
    public void broadcast(Collection<String> playerIds, Message message) {
        if (playerIds.isEmpty()) {
            return;
        }
        String json = serializer.serialize(message);
        MessageType type = message.getType();
        for (String playerId : playerIds) {
            Connection connection = byPlayer.get(playerId);
            if (connection != null && connection.isActive()) {
                connection.sendSerialized(type, json);
            }
        }
    }

    public Collection<Connection> getAllConnections() {
        return Collections.unmodifiableCollection(byChannel.values());
    }

    public int getConnectionCount() {
        return byChannel.size();
    }
}
