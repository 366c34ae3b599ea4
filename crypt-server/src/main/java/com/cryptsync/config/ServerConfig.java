package com.cryptsync.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;

/**
 * Immutable server settings.
 *
 * Resolution order for {@link #load()} (later wins):
 * 1. Built-in defaults
 * 2. {@code crypt-server.properties} on the classpath
 * 3. System properties prefixed with {@code crypt.} (e.g. {@code -Dcrypt.port=9000})
 * 4. Environment variables prefixed with {@code CRYPT_} (e.g. {@code CRYPT_PORT=9000})
 */
public final class ServerConfig {

    private static final Logger logger = LoggerFactory.getLogger(ServerConfig.class);

    public static final String RESOURCE_NAME = "crypt-server.properties";
    private static final String PROPERTY_PREFIX = "crypt.";
    private static final String ENV_PREFIX = "CRYPT_";

    private final String host;
    private final int port;
    private final String websocketPath;
    private final int maxConnections;
    private final int maxFrameSize;
    private final int maxPlayersPerSession;
    private final int maxActionsPerRound;
    private final Duration disconnectDeadline;
    private final Duration sessionGracePeriod;
    private final Duration authTimeout;
    private final Duration idleTimeout;
    private final Duration requestTimeout;
    private final Duration tokenTtl;
    private final int outboundQueueCapacity;
    private final int chatLogSize;
    private final Duration sweepInterval;
    private final Long seed;

    private ServerConfig(Builder b) {
        this.host = b.host;
        this.port = b.port;
        this.websocketPath = b.websocketPath;
        this.maxConnections = b.maxConnections;
        this.maxFrameSize = b.maxFrameSize;
        this.maxPlayersPerSession = b.maxPlayersPerSession;
        this.maxActionsPerRound = b.maxActionsPerRound;
        this.disconnectDeadline = b.disconnectDeadline;
        this.sessionGracePeriod = b.sessionGracePeriod;
        this.authTimeout = b.authTimeout;
        this.idleTimeout = b.idleTimeout;
        this.requestTimeout = b.requestTimeout;
        this.tokenTtl = b.tokenTtl;
        this.outboundQueueCapacity = b.outboundQueueCapacity;
        this.chatLogSize = b.chatLogSize;
        this.sweepInterval = b.sweepInterval;
        this.seed = b.seed;
    }

    /**
     * Loads the configuration from classpath defaults, system properties and
     * the environment.
     */
    public static ServerConfig load() {
        return load(System.getProperties(), System.getenv());
    }

    static ServerConfig load(Properties systemProperties, Map<String, String> environment) {
        Properties merged = new Properties();
        try (InputStream in = ServerConfig.class.getClassLoader().getResourceAsStream(RESOURCE_NAME)) {
            if (in != null) {
                merged.load(in);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + RESOURCE_NAME, e);
        }

        for (String name : systemProperties.stringPropertyNames()) {
            if (name.startsWith(PROPERTY_PREFIX)) {
                merged.setProperty(name.substring(PROPERTY_PREFIX.length()), systemProperties.getProperty(name));
            }
        }
        environment.forEach((name, value) -> {
            if (name.startsWith(ENV_PREFIX)) {
                merged.setProperty(name.substring(ENV_PREFIX.length()).toLowerCase(Locale.ROOT), value);
            }
        });

        return fromProperties(merged);
    }

    /**
     * Builds a configuration from snake_case keys such as {@code max_actions_per_round}.
     * Missing keys keep their defaults.
     */
    public static ServerConfig fromProperties(Properties props) {
        Builder b = builder();
        String value;
        if ((value = props.getProperty("host")) != null) b.host(value.trim());
        if ((value = props.getProperty("port")) != null) b.port(parseInt("port", value));
        if ((value = props.getProperty("path")) != null) b.websocketPath(value.trim());
        if ((value = props.getProperty("max_connections")) != null) b.maxConnections(parseInt("max_connections", value));
        if ((value = props.getProperty("max_frame_size")) != null) b.maxFrameSize(parseInt("max_frame_size", value));
        if ((value = props.getProperty("max_players_per_session")) != null) {
            b.maxPlayersPerSession(parseInt("max_players_per_session", value));
        }
        if ((value = props.getProperty("max_actions_per_round")) != null) {
            b.maxActionsPerRound(parseInt("max_actions_per_round", value));
        }
        if ((value = props.getProperty("disconnect_deadline_seconds")) != null) {
            b.disconnectDeadline(seconds("disconnect_deadline_seconds", value));
        }
        if ((value = props.getProperty("session_grace_period_seconds")) != null) {
            b.sessionGracePeriod(seconds("session_grace_period_seconds", value));
        }
        if ((value = props.getProperty("auth_timeout_seconds")) != null) b.authTimeout(seconds("auth_timeout_seconds", value));
        if ((value = props.getProperty("idle_timeout_seconds")) != null) b.idleTimeout(seconds("idle_timeout_seconds", value));
        if ((value = props.getProperty("request_timeout_seconds")) != null) {
            b.requestTimeout(seconds("request_timeout_seconds", value));
        }
        if ((value = props.getProperty("token_ttl_seconds")) != null) b.tokenTtl(seconds("token_ttl_seconds", value));
        if ((value = props.getProperty("outbound_queue_capacity")) != null) {
            b.outboundQueueCapacity(parseInt("outbound_queue_capacity", value));
        }
        if ((value = props.getProperty("chat_log_size")) != null) b.chatLogSize(parseInt("chat_log_size", value));
        if ((value = props.getProperty("sweep_interval_millis")) != null) {
            b.sweepInterval(Duration.ofMillis(parseLong("sweep_interval_millis", value)));
        }
        if ((value = props.getProperty("seed")) != null && !value.isBlank()) b.seed(parseLong("seed", value));
        return b.build();
    }

    private static int parseInt(String key, String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid integer for '" + key + "': " + value, e);
        }
    }

    private static long parseLong(String key, String value) {
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid number for '" + key + "': " + value, e);
        }
    }

    private static Duration seconds(String key, String value) {
        return Duration.ofSeconds(parseLong(key, value));
    }

    public String getHost() {
        return host;
    }

    public int getPort() {
        return port;
    }

    public String getWebsocketPath() {
        return websocketPath;
    }

    public int getMaxConnections() {
        return maxConnections;
    }

    public int getMaxFrameSize() {
        return maxFrameSize;
    }

    public int getMaxPlayersPerSession() {
        return maxPlayersPerSession;
    }

    public int getMaxActionsPerRound() {
        return maxActionsPerRound;
    }

    public Duration getDisconnectDeadline() {
        return disconnectDeadline;
    }

    public Duration getSessionGracePeriod() {
        return sessionGracePeriod;
    }

    public Duration getAuthTimeout() {
        return authTimeout;
    }

    public Duration getIdleTimeout() {
        return idleTimeout;
    }

    public Duration getRequestTimeout() {
        return requestTimeout;
    }

    public Duration getTokenTtl() {
        return tokenTtl;
    }

    public int getOutboundQueueCapacity() {
        return outboundQueueCapacity;
    }

    public int getChatLogSize() {
        return chatLogSize;
    }

    public Duration getSweepInterval() {
        return sweepInterval;
    }

    /**
     * Fixed dungeon seed, or null to pick a random seed per session.
     */
    public Long getSeed() {
        return seed;
    }

    public Builder toBuilder() {
        return builder()
                .host(host)
                .port(port)
                .websocketPath(websocketPath)
                .maxConnections(maxConnections)
                .maxFrameSize(maxFrameSize)
                .maxPlayersPerSession(maxPlayersPerSession)
                .maxActionsPerRound(maxActionsPerRound)
                .disconnectDeadline(disconnectDeadline)
                .sessionGracePeriod(sessionGracePeriod)
                .authTimeout(authTimeout)
                .idleTimeout(idleTimeout)
                .requestTimeout(requestTimeout)
                .tokenTtl(tokenTtl)
                .outboundQueueCapacity(outboundQueueCapacity)
                .chatLogSize(chatLogSize)
                .sweepInterval(sweepInterval)
                .seed(seed);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String host = "0.0.0.0";
        private int port = 8765;
        private String websocketPath = "/play";
        private int maxConnections = 100;
        private int maxFrameSize = 65536;
        private int maxPlayersPerSession = 4;
        private int maxActionsPerRound = 4;
        private Duration disconnectDeadline = Duration.ofSeconds(120);
        private Duration sessionGracePeriod = Duration.ofSeconds(60);
        private Duration authTimeout = Duration.ofSeconds(30);
        private Duration idleTimeout = Duration.ofSeconds(300);
        private Duration requestTimeout = Duration.ofSeconds(10);
        private Duration tokenTtl = Duration.ofHours(24);
        private int outboundQueueCapacity = 256;
        private int chatLogSize = 50;
        private Duration sweepInterval = Duration.ofSeconds(1);
        private Long seed;

        public Builder host(String host) {
            this.host = host;
            return this;
        }

        public Builder port(int port) {
            this.port = port;
            return this;
        }

        public Builder websocketPath(String websocketPath) {
            this.websocketPath = websocketPath;
            return this;
        }

        public Builder maxConnections(int maxConnections) {
            this.maxConnections = maxConnections;
            return this;
        }

        public Builder maxFrameSize(int maxFrameSize) {
            this.maxFrameSize = maxFrameSize;
            return this;
        }

        public Builder maxPlayersPerSession(int maxPlayersPerSession) {
            this.maxPlayersPerSession = maxPlayersPerSession;
            return this;
        }

        public Builder maxActionsPerRound(int maxActionsPerRound) {
            this.maxActionsPerRound = maxActionsPerRound;
            return this;
        }

        public Builder disconnectDeadline(Duration disconnectDeadline) {
            this.disconnectDeadline = disconnectDeadline;
            return this;
        }

        public Builder sessionGracePeriod(Duration sessionGracePeriod) {
            this.sessionGracePeriod = sessionGracePeriod;
            return this;
        }

        public Builder authTimeout(Duration authTimeout) {
            this.authTimeout = authTimeout;
            return this;
        }

        public Builder idleTimeout(Duration idleTimeout) {
            this.idleTimeout = idleTimeout;
            return this;
        }

        public Builder requestTimeout(Duration requestTimeout) {
            this.requestTimeout = requestTimeout;
            return this;
        }

        public Builder tokenTtl(Duration tokenTtl) {
            this.tokenTtl = tokenTtl;
            return this;
        }

        public Builder outboundQueueCapacity(int outboundQueueCapacity) {
            this.outboundQueueCapacity = outboundQueueCapacity;
            return this;
        }

        public Builder chatLogSize(int chatLogSize) {
            this.chatLogSize = chatLogSize;
            return this;
        }

        public Builder sweepInterval(Duration sweepInterval) {
            this.sweepInterval = sweepInterval;
            return this;
        }

        public Builder seed(Long seed) {
            this.seed = seed;
            return this;
        }

        public ServerConfig build() {
            if (port < 0 || port > 65535) {
                throw new IllegalArgumentException("port out of range: " + port);
            }
            if (websocketPath == null || !websocketPath.startsWith("/")) {
                throw new IllegalArgumentException("path must start with '/': " + websocketPath);
            }
            requirePositive("max_connections", maxConnections);
            requirePositive("max_frame_size", maxFrameSize);
            requirePositive("max_players_per_session", maxPlayersPerSession);
            requirePositive("max_actions_per_round", maxActionsPerRound);
            requirePositive("outbound_queue_capacity", outboundQueueCapacity);
            requirePositive("chat_log_size", chatLogSize);
            requirePositive("disconnect_deadline_seconds", disconnectDeadline);
            requirePositive("session_grace_period_seconds", sessionGracePeriod);
            requirePositive("auth_timeout_seconds", authTimeout);
            requirePositive("idle_timeout_seconds", idleTimeout);
            requirePositive("request_timeout_seconds", requestTimeout);
            requirePositive("token_ttl_seconds", tokenTtl);
            requirePositive("sweep_interval_millis", sweepInterval);
            return new ServerConfig(this);
        }

        private static void requirePositive(String key, int value) {
            if (value <= 0) {
                throw new IllegalArgumentException(key + " must be positive: " + value);
            }
        }

        private static void requirePositive(String key, Duration value) {
            if (value == null || value.isNegative() || value.isZero()) {
                throw new IllegalArgumentException(key + " must be positive: " + value);
            }
        }
    }

    @Override
    public String toString() {
        return "ServerConfig{" +
                "host='" + host + '\'' +
                ", port=" + port +
                ", path='" + websocketPath + '\'' +
                ", maxPlayersPerSession=" + maxPlayersPerSession +
                ", maxActionsPerRound=" + maxActionsPerRound +
                ", disconnectDeadline=" + disconnectDeadline +
                ", sessionGracePeriod=" + sessionGracePeriod +
                '}';
    }
}
