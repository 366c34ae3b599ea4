package com.cryptsync.server;

import com.cryptsync.auth.AuthService;
import com.cryptsync.config.ServerConfig;
import com.cryptsync.game.GameRules;
import com.cryptsync.handler.AuthHandler;
import com.cryptsync.handler.ConnectionRegistry;
import com.cryptsync.handler.GameLobbyHandler;
import com.cryptsync.handler.GamePlayHandler;
import com.cryptsync.handler.MessageDispatcher;
import com.cryptsync.handler.SessionBroadcaster;
import com.cryptsync.handler.WebSocketFrameHandler;
import com.cryptsync.protocol.MessageSerializer;
import com.cryptsync.protocol.MessageType;
import com.cryptsync.session.SessionManager;
import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpServerCodec;
import io.netty.handler.codec.http.websocketx.WebSocketServerProtocolHandler;
import io.netty.handler.codec.http.websocketx.extensions.compression.WebSocketServerCompressionHandler;
import io.netty.handler.timeout.IdleStateHandler;
import io.netty.util.concurrent.DefaultEventExecutorGroup;
import io.netty.util.concurrent.EventExecutorGroup;
import io.netty.util.concurrent.ScheduledFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.time.Clock;
import java.util.concurrent.TimeUnit;

/**
 * WebSocket game server built on Netty's NIO transport.
 *
 * Threading Model:
 * - Boss Group: 1 thread that accepts incoming connections
 * - Worker Group: N threads (CPU cores) that handle socket I/O
 * - Session Group: serial executors, one per game session, that own all
 *   game-state mutation. Also runs the periodic sweep.
 *
 * I/O threads never mutate game state and session executors never write to
 * sockets directly.
 */
public class DungeonServer {

    private static final Logger logger = LoggerFactory.getLogger(DungeonServer.class);

    private final ServerConfig config;
    private final MessageSerializer serializer;
    private final AuthService authService;
    private final ConnectionRegistry registry;
    private final EventExecutorGroup sessionExecutors;
    private final SessionManager sessionManager;
    private final MessageDispatcher dispatcher;

    // Netty event loop groups
    private EventLoopGroup bossGroup;
    private EventLoopGroup workerGroup;
    private Channel serverChannel;
    private ScheduledFuture<?> sweepTask;
    private volatile boolean stopped;

    public DungeonServer(ServerConfig config, GameRules rules) {
        this(config, rules, Clock.systemUTC());
    }

    public DungeonServer(ServerConfig config, GameRules rules, Clock clock) {
        this.config = config;
        this.serializer = new MessageSerializer();
        this.authService = new AuthService(config.getTokenTtl(), clock);
        this.registry = new ConnectionRegistry(serializer, config.getOutboundQueueCapacity());
        this.sessionExecutors = new DefaultEventExecutorGroup(Math.max(2, Runtime.getRuntime().availableProcessors()));
        this.sessionManager = new SessionManager(config, authService, rules, sessionExecutors, clock);
        this.sessionManager.setListener(new SessionBroadcaster(registry));
        this.dispatcher = createDispatcher(config, authService, registry, sessionManager);
    }

    /**
     * Builds the routing table for every client message type.
     */
    public static MessageDispatcher createDispatcher(ServerConfig config, AuthService authService,
                                                     ConnectionRegistry registry, SessionManager sessionManager) {
        AuthHandler auth = new AuthHandler(authService, registry, sessionManager);
        GameLobbyHandler lobby = new GameLobbyHandler(sessionManager);
        GamePlayHandler play = new GamePlayHandler(sessionManager);

        return new MessageDispatcher(config.getRequestTimeout())
                .register(MessageType.AUTH, auth::handleAuth, false)
                .register(MessageType.CREATE_GAME, lobby::handleCreate)
                .register(MessageType.JOIN_GAME, lobby::handleJoin)
                .register(MessageType.LEAVE_GAME, lobby::handleLeave)
                .register(MessageType.LIST_GAMES, lobby::handleList)
                .register(MessageType.READY, lobby::handleReady)
                .register(MessageType.RECONNECT, lobby::handleReconnect)
                .register(MessageType.ACTION, play::handleAction)
                .register(MessageType.PASS, play::handlePass)
                .register(MessageType.CHAT, play::handleChat)
                .register(MessageType.RESYNC, play::handleResync);
    }

    /**
     * Starts the WebSocket server.
     * This method blocks until the server is shut down.
     */
    public void start() throws InterruptedException {
        bind();
        try {
            // Block until the server channel is closed
            serverChannel.closeFuture().sync();
        } finally {
            shutdown();
        }
    }

    /**
     * Binds the listening socket and returns once the server accepts connections.
     */
    public void bind() throws InterruptedException {
        // Boss group: accepts incoming connections (1 thread is enough)
        bossGroup = new NioEventLoopGroup(1);
        // Worker group: handles I/O for accepted connections
        workerGroup = new NioEventLoopGroup();

        ServerBootstrap bootstrap = new ServerBootstrap();
        bootstrap.group(bossGroup, workerGroup)
                .channel(NioServerSocketChannel.class)
                .option(ChannelOption.SO_BACKLOG, 128)
                .childOption(ChannelOption.SO_KEEPALIVE, true)
                .childOption(ChannelOption.TCP_NODELAY, true)
                .childHandler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch) {
                        ChannelPipeline pipeline = ch.pipeline();

                        // Closes connections that send nothing for too long
                        pipeline.addLast(new IdleStateHandler(
                                config.getIdleTimeout().toSeconds(), 0, 0, TimeUnit.SECONDS));

                        // HTTP codec and aggregation for the WebSocket handshake
                        pipeline.addLast(new HttpServerCodec());
                        pipeline.addLast(new HttpObjectAggregator(65536));

                        pipeline.addLast(new WebSocketServerCompressionHandler());

                        // Handshake, ping/pong and close frames
                        pipeline.addLast(new WebSocketServerProtocolHandler(
                                config.getWebsocketPath(),
                                null,      // subprotocols
                                true,      // allow extensions
                                config.getMaxFrameSize(),
                                false,     // allow mask mismatch
                                true,      // check starting slash
                                10000L     // handshake timeout ms
                        ));

                        pipeline.addLast(new WebSocketFrameHandler(
                                registry, dispatcher, sessionManager, serializer, config));
                    }
                });

        serverChannel = bootstrap.bind(config.getHost(), config.getPort()).sync().channel();

        long sweepMillis = config.getSweepInterval().toMillis();
        sweepTask = sessionExecutors.scheduleAtFixedRate(this::sweep, sweepMillis, sweepMillis, TimeUnit.MILLISECONDS);

        logger.info("Server started with {}", config);
        logger.info("WebSocket endpoint: ws://{}:{}{}", config.getHost(), getPort(), config.getWebsocketPath());
    }

    private void sweep() {
        try {
            sessionManager.sweep();
        } catch (RuntimeException e) {
            logger.error("Session sweep failed", e);
        }
    }

    /**
     * Gracefully shuts down the server.
     * - Ends every running game so players get a final GAME_END
     * - Stops accepting new connections
     * - Releases all event loops
     */
    public synchronized void shutdown() {
        if (stopped) {
            return;
        }
        stopped = true;
        logger.info("Shutting down server...");

        if (sweepTask != null) {
            sweepTask.cancel(false);
        }
        try {
            sessionManager.shutdown().get(5, TimeUnit.SECONDS);
        } catch (Exception e) {
            logger.warn("Not every game ended cleanly", e);
        }
        if (serverChannel != null) {
            serverChannel.close();
        }
        if (bossGroup != null) {
            bossGroup.shutdownGracefully();
        }
        if (workerGroup != null) {
            workerGroup.shutdownGracefully();
        }
        sessionExecutors.shutdownGracefully();

        logger.info("Server shutdown complete.");
    }

    /**
     * The bound port, which differs from the configured one when that is 0.
     */
    public int getPort() {
        if (serverChannel == null) {
            return config.getPort();
        }
        return ((InetSocketAddress) serverChannel.localAddress()).getPort();
    }

    public SessionManager getSessionManager() {
        return sessionManager;
    }

    public ConnectionRegistry getConnectionRegistry() {
        return registry;
    }

    public AuthService getAuthService() {
        return authService;
    }
}
