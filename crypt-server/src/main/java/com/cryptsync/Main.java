package com.cryptsync;

import com.cryptsync.config.ServerConfig;
import com.cryptsync.game.arena.ArenaRules;
import com.cryptsync.server.DungeonServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for the Crypt Sync multiplayer dungeon server.
 *
 * Settings come from {@code crypt-server.properties}, {@code -Dcrypt.*}
 * system properties and {@code CRYPT_*} environment variables. The first
 * command-line argument, if present, overrides the port.
 */
public class Main {

    private static final Logger logger = LoggerFactory.getLogger(Main.class);

    public static void main(String[] args) {
        ServerConfig config = ServerConfig.load();

        // Allow port override via command line argument
        if (args.length > 0) {
            try {
                config = config.toBuilder().port(Integer.parseInt(args[0])).build();
            } catch (IllegalArgumentException e) {
                logger.warn("Invalid port argument '{}', using port {}", args[0], config.getPort());
            }
        }

        logger.info("===========================================");
        logger.info("  Crypt Sync Dungeon Server");
        logger.info("  Starting on port {}", config.getPort());
        logger.info("===========================================");

        DungeonServer server = new DungeonServer(config, new ArenaRules());

        // Graceful shutdown hook
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            logger.info("Shutdown signal received, stopping server...");
            server.shutdown();
        }));

        try {
            server.start();
        } catch (Exception e) {
            logger.error("Failed to start server", e);
            System.exit(1);
        }
    }
}
