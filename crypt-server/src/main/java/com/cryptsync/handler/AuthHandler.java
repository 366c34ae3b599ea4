package com.cryptsync.handler;

import com.cryptsync.auth.AuthService;
import com.cryptsync.auth.PlayerSession;
import com.cryptsync.protocol.Message;
import com.cryptsync.session.SessionManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletableFuture;

/**
 * AUTH: {@code {display_name}} creates an identity, {@code {token}} resumes one.
 *
 * Resuming an identity that is still bound to another open connection closes
 * that older connection.
 */
public class AuthHandler {

    private static final Logger logger = LoggerFactory.getLogger(AuthHandler.class);

    private final AuthService authService;
    private final ConnectionRegistry registry;
    private final SessionManager sessionManager;

    public AuthHandler(AuthService authService, ConnectionRegistry registry, SessionManager sessionManager) {
        this.authService = authService;
        this.registry = registry;
        this.sessionManager = sessionManager;
    }

    public CompletableFuture<?> handleAuth(Connection connection, Message message) {
        String token = message.payloadText("token");
        PlayerSession player = token != null
                ? authService.verify(token)
                : authService.authenticate(message.payloadText("display_name"));

        PlayerSession current = connection.getPlayer();
        if (current != null && !current.getPlayerId().equals(player.getPlayerId())
                && registry.unbindPlayer(connection)) {
            // Switching identity on an open connection drops the old one
            sessionManager.disconnect(current);
        }

        Connection previous = registry.bindPlayer(connection, player);
        if (previous != null) {
            logger.info("Player {} resumed on {}, closing older connection {}",
                    player.getDisplayName(), connection.getConnectionId(), previous.getConnectionId());
            previous.close();
        }
        connection.send(Messages.authSuccess(player, message.getRequestId()));
        return null;
    }
}
