package com.cryptsync.session;

import com.cryptsync.auth.AuthService;
import com.cryptsync.auth.PlayerSession;
import com.cryptsync.config.ServerConfig;
import com.cryptsync.game.GameRules;
import com.cryptsync.protocol.ErrorCode;
import com.cryptsync.protocol.action.ActionCodec;
import io.netty.util.concurrent.EventExecutorGroup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry of game sessions.
 *
 * Thread Safety:
 * - Sessions live in a ConcurrentHashMap that is only changed with atomic
 *   operations (put, remove(key, value)).
 * - Anything that touches a session's state is forwarded to that session's
 *   serial executor. This class never mutates a session directly.
 *
 * Each session draws one executor from the shared group, so sessions run in
 * parallel with each other but each one has a single writer.
 */
public class SessionManager {

    private static final Logger logger = LoggerFactory.getLogger(SessionManager.class);

    private final ConcurrentHashMap<String, GameSession> sessions = new ConcurrentHashMap<>();

    private final ServerConfig config;
    private final AuthService authService;
    private final GameRules rules;
    private final ActionCodec codec;
    private final EventExecutorGroup executors;
    private final Clock clock;
    private volatile SessionListener listener = SessionListener.NOOP;

    public SessionManager(ServerConfig config, AuthService authService, GameRules rules,
                          EventExecutorGroup executors, Clock clock) {
        this.config = config;
        this.authService = authService;
        this.rules = rules;
        this.executors = executors;
        this.clock = clock;
        this.codec = new ActionCodec();
        rules.registerActions(codec);
    }

    /**
     * Sets where sessions created from now on deliver their messages.
     */
    public void setListener(SessionListener listener) {
        this.listener = listener;
    }

    public ActionCodec getCodec() {
        return codec;
    }

    public AuthService getAuthService() {
        return authService;
    }

    // === Lifecycle operations ===

    /**
     * Creates a lobby at the server's player limit and joins the owner to it.
     */
    public CompletableFuture<JoinResult> createGame(PlayerSession owner, String gameName) {
        return createGame(owner, gameName, null);
    }

    /**
     * Creates a lobby and joins the owner to it.
     *
     * @param maxPlayers requested seat count, clamped to the server limit; null for the limit itself
     */
    public CompletableFuture<JoinResult> createGame(PlayerSession owner, String gameName, Integer maxPlayers) {
        if (owner.isInGame()) {
            return CompletableFuture.failedFuture(new SessionException(ErrorCode.ALREADY_IN_SESSION,
                    "Already in game " + owner.getGameSessionId()));
        }
        String sessionId = newSessionId();
        String name = gameName == null || gameName.isBlank() ? owner.getDisplayName() + "'s game" : gameName.trim();
        GameSession session = GameSession.builder()
                .sessionId(sessionId)
                .name(name)
                .ownerId(owner.getPlayerId())
                .rules(rules)
                .codec(codec)
                .executor(executors.next())
                .listener(listener)
                .clock(clock)
                .maxPlayers(seatLimit(maxPlayers))
                .maxActionsPerRound(config.getMaxActionsPerRound())
                .disconnectDeadline(config.getDisconnectDeadline())
                .chatLogSize(config.getChatLogSize())
                .seed(config.getSeed())
                .build();
        sessions.put(sessionId, session);
        logger.info("Game {} '{}' created by {}", sessionId, name, owner.getDisplayName());

        return session.join(owner).whenComplete((result, error) -> {
            if (error != null && sessions.remove(sessionId, session)) {
                logger.info("Game {} discarded, owner could not join: {}", sessionId, error.getMessage());
            }
        });
    }

    private int seatLimit(Integer requested) {
        int limit = config.getMaxPlayersPerSession();
        if (requested == null) {
            return limit;
        }
        return Math.max(1, Math.min(requested, limit));
    }

    public CompletableFuture<JoinResult> joinGame(String sessionId, PlayerSession player) {
        GameSession session = sessionId == null ? null : sessions.get(sessionId);
        if (session == null) {
            return notFound(sessionId);
        }
        return session.join(player);
    }

    /**
     * Resumes a roster slot for the holder of {@code token}.
     */
    public CompletableFuture<JoinResult> reconnect(String token, String sessionId, String requestId) {
        PlayerSession player;
        try {
            player = authService.verify(token);
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
        return reconnect(player, sessionId, requestId);
    }

    public CompletableFuture<JoinResult> reconnect(PlayerSession player, String sessionId, String requestId) {
        GameSession session = sessionId == null ? null : sessions.get(sessionId);
        if (session == null) {
            return notFound(sessionId);
        }
        return session.reconnect(player, requestId);
    }

    public CompletableFuture<Void> leaveGame(PlayerSession player) {
        GameSession session = findSession(player);
        if (session == null) {
            return CompletableFuture.failedFuture(new SessionException(ErrorCode.NOT_IN_SESSION, "Not in a game"));
        }
        return session.leave(player.getPlayerId()).thenRun(() -> removeIfAbandoned(session));
    }

    /**
     * Notifies the player's session that their connection is gone. No-op if
     * the player is not in a game.
     */
    public CompletableFuture<Void> disconnect(PlayerSession player) {
        GameSession session = findSession(player);
        if (session == null) {
            return CompletableFuture.completedFuture(null);
        }
        return session.disconnect(player.getPlayerId());
    }

    /**
     * Lobbies that can still be joined, oldest first.
     */
    public List<SessionInfo> listGames() {
        List<SessionInfo> joinable = new ArrayList<>();
        for (GameSession session : sessions.values()) {
            SessionInfo info = session.getInfo();
            if (info.isJoinable()) {
                joinable.add(info);
            }
        }
        joinable.sort(Comparator.comparingLong(SessionInfo::getCreatedAt).thenComparing(SessionInfo::getSessionId));
        return joinable;
    }

    // === Housekeeping ===

    /**
     * Expires overdue disconnected players, tears down finished sessions past
     * their grace period and purges expired tokens. Called periodically.
     *
     * @return number of sessions torn down
     */
    public int sweep() {
        Instant now = clock.instant();
        int removed = 0;
        for (GameSession session : sessions.values()) {
            if (session.getStatus() != SessionStatus.ENDED) {
                session.expireDisconnected(now).whenComplete((count, error) -> {
                    if (error != null) {
                        logger.warn("Expiry sweep failed for game {}", session.getSessionId(), error);
                    } else {
                        removeIfAbandoned(session);
                    }
                });
                continue;
            }
            Instant endedAt = session.getEndedAt();
            boolean expired = session.isAbandoned()
                    || (endedAt != null && !now.isBefore(endedAt.plus(config.getSessionGracePeriod())));
            if (expired && sessions.remove(session.getSessionId(), session)) {
                removed++;
                logger.info("Game {} torn down", session.getSessionId());
            }
        }
        int purged = authService.purgeExpired();
        if (removed > 0 || purged > 0) {
            logger.debug("Sweep removed {} games and {} expired tokens", removed, purged);
        }
        return removed;
    }

    /**
     * Ends every running session. Used on server shutdown.
     */
    public CompletableFuture<Void> shutdown() {
        List<CompletableFuture<Void>> pending = new ArrayList<>();
        for (GameSession session : sessions.values()) {
            pending.add(session.forceEnd("server_shutdown"));
        }
        return CompletableFuture.allOf(pending.toArray(new CompletableFuture[0]));
    }

    // === Lookup ===

    public GameSession getSession(String sessionId) {
        return sessionId == null ? null : sessions.get(sessionId);
    }

    /**
     * The session the player is currently bound to, or null.
     */
    public GameSession findSession(PlayerSession player) {
        String sessionId = player.getGameSessionId();
        return sessionId == null ? null : sessions.get(sessionId);
    }

    public Collection<GameSession> getAllSessions() {
        return Collections.unmodifiableCollection(sessions.values());
    }

    public int getSessionCount() {
        return sessions.size();
    }

    private void removeIfAbandoned(GameSession session) {
        if (session.isAbandoned() && sessions.remove(session.getSessionId(), session)) {
            logger.info("Game {} torn down (empty lobby)", session.getSessionId());
        }
    }

    private static CompletableFuture<JoinResult> notFound(String sessionId) {
        return CompletableFuture.failedFuture(new SessionException(ErrorCode.SESSION_NOT_FOUND,
                "No game with id " + sessionId));
    }

    private static String newSessionId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }
}
