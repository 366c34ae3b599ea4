package com.cryptsync.handler;

import com.cryptsync.auth.PlayerSession;
import com.cryptsync.config.ServerConfig;
import com.cryptsync.protocol.CryptSyncException;
import com.cryptsync.protocol.ErrorCode;
import com.cryptsync.protocol.Message;
import com.cryptsync.protocol.MessageSerializer;
import com.cryptsync.session.SessionManager;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketFrame;
import io.netty.handler.timeout.IdleState;
import io.netty.handler.timeout.IdleStateEvent;
import io.netty.util.concurrent.ScheduledFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.TimeUnit;

/**
 * Per-connection gateway: decodes frames, hands them to the dispatcher and
 * reports the connection's end to its game session.
 *
 * Threading Model:
 * - One instance per channel, driven by that channel's event loop
 * - Game work is forwarded to session executors and never runs here
 * - Replies and broadcasts are queued on the {@link Connection} and written
 *   back on this event loop
 *
 * Errors in a single frame never close the connection. Only transport errors,
 * idle and unauthenticated timeouts, and the connection limit do.
 */
public class WebSocketFrameHandler extends SimpleChannelInboundHandler<WebSocketFrame> {

    private static final Logger logger = LoggerFactory.getLogger(WebSocketFrameHandler.class);

    private final ConnectionRegistry registry;
    private final MessageDispatcher dispatcher;
    private final SessionManager sessionManager;
    private final MessageSerializer serializer;
    private final ServerConfig config;

    private Connection connection;
    private ScheduledFuture<?> authTimeout;

    public WebSocketFrameHandler(ConnectionRegistry registry, MessageDispatcher dispatcher,
                                 SessionManager sessionManager, MessageSerializer serializer,
                                 ServerConfig config) {
        this.registry = registry;
        this.dispatcher = dispatcher;
        this.sessionManager = sessionManager;
        this.serializer = serializer;
        this.config = config;
    }

    /**
     * Called when a new connection is established.
     */
    @Override
    public void handlerAdded(ChannelHandlerContext ctx) {
        connection = registry.register(ctx.channel());
        if (registry.getConnectionCount() > config.getMaxConnections()) {
            logger.warn("Connection limit {} reached, rejecting {}",
                    config.getMaxConnections(), connection.getConnectionId());
            ctx.close();
            return;
        }
        authTimeout = ctx.executor().schedule(() -> {
            if (!connection.isAuthenticated()) {
                logger.warn("Connection {} did not authenticate in time, closing", connection.getConnectionId());
                ctx.close();
            }
        }, config.getAuthTimeout().toMillis(), TimeUnit.MILLISECONDS);
    }

    /**
     * Called when the connection is closed. The player keeps their identity
     * and game slot until the disconnect deadline.
     */
    @Override
    public void handlerRemoved(ChannelHandlerContext ctx) {
        if (authTimeout != null) {
            authTimeout.cancel(false);
        }
        Connection removed = registry.remove(ctx.channel());
        if (removed == null) {
            return;
        }
        PlayerSession player = removed.getPlayer();
        if (player != null && registry.unbindPlayer(removed)) {
            logger.info("Player {} disconnected", player.getDisplayName());
            sessionManager.disconnect(player).whenComplete((ignored, error) -> {
                if (error != null) {
                    logger.warn("Failed to record disconnect of {}", player.getDisplayName(), error);
                }
            });
        }
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, WebSocketFrame frame) {
        if (!(frame instanceof TextWebSocketFrame)) {
            logger.debug("Unsupported frame type {} on {}", frame.getClass().getSimpleName(),
                    connection.getConnectionId());
            connection.send(Messages.error(ErrorCode.MALFORMED_MESSAGE, "Only text frames are supported", null));
            return;
        }

        String json = ((TextWebSocketFrame) frame).text();
        Message message;
        try {
            message = serializer.deserialize(json);
        } catch (CryptSyncException e) {
            connection.send(Messages.error(e.getCode(), e.getMessage(), null));
            return;
        }

        dispatcher.dispatch(connection, message);
    }

    @Override
    public void channelWritabilityChanged(ChannelHandlerContext ctx) throws Exception {
        if (ctx.channel().isWritable() && connection != null) {
            connection.drain();
        }
        super.channelWritabilityChanged(ctx);
    }

    /**
     * Closes connections that have been silent for too long.
     */
    @Override
    public void userEventTriggered(ChannelHandlerContext ctx, Object evt) throws Exception {
        if (evt instanceof IdleStateEvent) {
            IdleStateEvent e = (IdleStateEvent) evt;
            if (e.state() == IdleState.READER_IDLE) {
                logger.warn("Connection idle timeout, closing: {}", ctx.channel().id());
                ctx.close();
            }
        }
        super.userEventTriggered(ctx, evt);
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        logger.error("WebSocket error on {}", ctx.channel().id(), cause);
        ctx.close();
    }

    Connection getConnection() {
        return connection;
    }
}
