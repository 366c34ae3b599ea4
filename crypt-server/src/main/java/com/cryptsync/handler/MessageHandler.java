package com.cryptsync.handler;

import com.cryptsync.protocol.Message;

import java.util.concurrent.CompletableFuture;

/**
 * Handles one inbound message type.
 *
 * Implementations either throw or return a future that completes
 * exceptionally to have an error sent back. Successful replies are sent by
 * the handler itself.
 */
@FunctionalInterface
public interface MessageHandler {

    CompletableFuture<?> handle(Connection connection, Message message);
}
