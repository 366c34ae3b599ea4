package com.cryptsync.handler;

import com.cryptsync.auth.AuthException;
import com.cryptsync.protocol.CryptSyncException;
import com.cryptsync.protocol.ErrorCode;
import com.cryptsync.protocol.Message;
import com.cryptsync.protocol.MessageType;
import com.cryptsync.protocol.ProtocolException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Routes inbound messages through a table of registered handlers.
 *
 * Adding a message type means registering a handler; the routing code does
 * not change. Every failure ends up as an ERROR (or AUTH_FAILURE) reply to
 * the sender that echoes its request_id.
 */
public class MessageDispatcher {

    private static final Logger logger = LoggerFactory.getLogger(MessageDispatcher.class);

    private final Map<MessageType, Route> routes = new EnumMap<>(MessageType.class);
    private final Duration requestTimeout;

    public MessageDispatcher(Duration requestTimeout) {
        this.requestTimeout = requestTimeout;
    }

    /**
     * Registers a handler that requires an authenticated connection.
     */
    public MessageDispatcher register(MessageType type, MessageHandler handler) {
        return register(type, handler, true);
    }

    public synchronized MessageDispatcher register(MessageType type, MessageHandler handler, boolean requiresAuth) {
        Route previous = routes.put(type, new Route(handler, requiresAuth));
        if (previous != null) {
            logger.warn("Replaced handler for {}", type);
        }
        return this;
    }

    public synchronized Set<MessageType> getRegisteredTypes() {
        return Collections.unmodifiableSet(routes.keySet());
    }

    /**
     * Runs the handler for a message. Never throws; errors are replied.
     */
    public void dispatch(Connection connection, Message message) {
        Route route;
        synchronized (this) {
            route = routes.get(message.getType());
        }
        CompletableFuture<?> result;
        try {
            if (route == null) {
                throw new ProtocolException(ErrorCode.UNKNOWN_MESSAGE_TYPE,
                        "Unsupported message type: " + message.getType());
            }
            if (route.requiresAuth && !connection.isAuthenticated()) {
                throw new ProtocolException(ErrorCode.NOT_AUTHENTICATED, "Authenticate first");
            }
            logger.debug("Dispatching {} from {}", message.getType(), connection.getConnectionId());
            result = route.handler.handle(connection, message);
        } catch (RuntimeException e) {
            replyError(connection, message, e);
            return;
        }
        if (result == null) {
            return;
        }
        result.orTimeout(requestTimeout.toMillis(), TimeUnit.MILLISECONDS)
                .whenComplete((value, error) -> {
                    if (error != null) {
                        replyError(connection, message, error);
                    }
                });
    }

    /**
     * Converts a failure into the reply the client expects.
     */
    void replyError(Connection connection, Message request, Throwable error) {
        Throwable cause = unwrap(error);
        String requestId = request.getRequestId();
        if (cause instanceof AuthException) {
            AuthException e = (AuthException) cause;
            logger.debug("Auth failed on {}: {}", connection.getConnectionId(), e.getMessage());
            connection.send(Messages.authFailure(e.getCode(), e.getMessage(), requestId));
        } else if (cause instanceof CryptSyncException) {
            CryptSyncException e = (CryptSyncException) cause;
            logger.debug("{} from {} rejected: {}", request.getType(), connection.getConnectionId(), e.getMessage());
            connection.send(Messages.error(e.getCode(), e.getMessage(), requestId));
        } else if (cause instanceof TimeoutException) {
            logger.warn("{} from {} timed out", request.getType(), connection.getConnectionId());
            connection.send(Messages.error(ErrorCode.TIMEOUT, "Request timed out", requestId));
        } else {
            logger.error("Unexpected error handling {} from {}", request.getType(), connection.getConnectionId(), cause);
            connection.send(Messages.error(ErrorCode.INTERNAL_ERROR, "Internal server error", requestId));
        }
    }

    private static Throwable unwrap(Throwable error) {
        Throwable cause = error;
        while ((cause instanceof CompletionException || cause instanceof ExecutionException)
                && cause.getCause() != null) {
            cause = cause.getCause();
        }
        return cause;
    }

    private static final class Route {
        private final MessageHandler handler;
        private final boolean requiresAuth;

        private Route(MessageHandler handler, boolean requiresAuth) {
            this.handler = handler;
            this.requiresAuth = requiresAuth;
        }
    }
}
