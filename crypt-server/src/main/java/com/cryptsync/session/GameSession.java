package com.cryptsync.session;

import com.cryptsync.auth.PlayerSession;
import com.cryptsync.game.Coord;
import com.cryptsync.game.DungeonMap;
import com.cryptsync.game.EntityView;
import com.cryptsync.game.GameAction;
import com.cryptsync.game.GameRules;
import com.cryptsync.game.GameState;
import com.cryptsync.game.Outcome;
import com.cryptsync.protocol.CryptSyncException;
import com.cryptsync.protocol.ErrorCode;
import com.cryptsync.protocol.action.ActionCodec;
import com.cryptsync.protocol.action.ActionException;
import com.cryptsync.sync.DeltaEncoder;
import com.cryptsync.sync.EntityState;
import com.cryptsync.sync.StateDelta;
import com.cryptsync.sync.StateSnapshot;
import com.cryptsync.sync.StateSynchronizer;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadLocalRandom;

/**
 * One shared dungeon run: roster, lifecycle, round budget and the game state.
 *
 * Thread Safety Strategy:
 * 1. Every operation is submitted as a single task to this session's serial
 *    executor. Tasks run one at a time in submission order, so the game state,
 *    roster and round counters have exactly one writer.
 * 2. Results come back as CompletableFutures. Failures complete the future
 *    exceptionally with a {@link CryptSyncException}.
 * 3. Everything other threads may read (status, summary, last snapshot) is
 *    published through volatile fields holding immutable values.
 *
 * Design Notes:
 * - All outbound traffic for a step is handed to the {@link SessionListener}
 *   from inside the step, so broadcast order equals mutation order.
 * - A step publishes at most one delta. Round completion triggered by an
 *   action is folded into that action's delta.
 * - An exception escaping the game rules during execute or the environment
 *   turn ends this session only.
 */
public class GameSession {

    private static final Logger logger = LoggerFactory.getLogger(GameSession.class);

    public static final int MAX_CHAT_LENGTH = 500;

    private final String sessionId;
    private final String name;
    private final String ownerId;
    private final GameRules rules;
    private final ActionCodec codec;
    private final Executor executor;
    private final SessionListener listener;
    private final Clock clock;
    private final int maxPlayers;
    private final Duration disconnectDeadline;
    private final int chatLogSize;
    private final Long seed;
    private final long createdAt;
    private final StateSynchronizer synchronizer;

    // Executor-confined state
    private final Map<String, RosterEntry> roster = new LinkedHashMap<>();
    private final Map<String, String> expiredPlayers = new LinkedHashMap<>();
    private final RoundState round;
    private final Deque<ChatEntry> chatLog = new ArrayDeque<>();
    private GameState gameState;
    private Boolean victory;
    private long nextSequence = 1;

    // Published for other threads
    private volatile SessionStatus status = SessionStatus.LOBBY;
    private volatile Instant endedAt;
    private volatile boolean abandoned;
    private volatile SessionInfo info;

    private GameSession(Builder builder) {
        this.sessionId = Objects.requireNonNull(builder.sessionId, "sessionId");
        this.name = builder.name == null ? "Game " + sessionId : builder.name;
        this.ownerId = builder.ownerId;
        this.rules = Objects.requireNonNull(builder.rules, "rules");
        this.codec = Objects.requireNonNull(builder.codec, "codec");
        this.executor = Objects.requireNonNull(builder.executor, "executor");
        this.listener = builder.listener;
        this.clock = builder.clock;
        this.maxPlayers = builder.maxPlayers;
        this.disconnectDeadline = builder.disconnectDeadline;
        this.chatLogSize = builder.chatLogSize;
        this.seed = builder.seed;
        this.createdAt = clock.millis();
        this.synchronizer = new StateSynchronizer(new DeltaEncoder());
        this.round = new RoundState(builder.maxActionsPerRound);
        refreshInfo();
    }

    public static Builder builder() {
        return new Builder();
    }

    // === Read-only accessors (any thread) ===

    public String getSessionId() {
        return sessionId;
    }

    public String getName() {
        return name;
    }

    public SessionStatus getStatus() {
        return status;
    }

    public SessionInfo getInfo() {
        return info;
    }

    /**
     * When the session reached ENDED, or null.
     */
    public Instant getEndedAt() {
        return endedAt;
    }

    /**
     * True once a lobby lost its last member; such a session is torn down at once.
     */
    public boolean isAbandoned() {
        return abandoned;
    }

    /**
     * The last published snapshot, or null before the game started.
     */
    public StateSnapshot getLastSnapshot() {
        return synchronizer.getCurrent();
    }

    // === Lobby operations ===

    /**
     * Adds a player to the roster. A former member joining a running game is
     * treated as a reconnect.
     */
    public CompletableFuture<JoinResult> join(PlayerSession player) {
        return submit("join", () -> {
            RosterEntry existing = roster.get(player.getPlayerId());
            if (existing != null && status != SessionStatus.LOBBY) {
                return doReconnect(player, null);
            }
            if (status != SessionStatus.LOBBY) {
                throw new SessionException(ErrorCode.INVALID_STATE, "Game " + sessionId + " is already " + status);
            }
            if (existing == null) {
                if (roster.size() >= maxPlayers) {
                    throw new SessionException(ErrorCode.SESSION_FULL, "Game " + sessionId + " is full");
                }
                if (!player.bindGameSession(sessionId)) {
                    throw new SessionException(ErrorCode.ALREADY_IN_SESSION,
                            "Already in game " + player.getGameSessionId());
                }
                roster.put(player.getPlayerId(), new RosterEntry(player));
                player.markConnected();
                logger.info("Player {} joined game {} ({}/{})",
                        player.getDisplayName(), sessionId, roster.size(), maxPlayers);
                listener.playerJoined(sessionId, recipientsExcept(player.getPlayerId()), player);
            } else {
                if (!player.bindGameSession(sessionId)) {
                    throw new SessionException(ErrorCode.ALREADY_IN_SESSION,
                            "Already in game " + player.getGameSessionId());
                }
                existing.player.markConnected();
            }
            return new JoinResult(info(), null, chatHistory(), existing != null);
        });
    }

    /**
     * Leaves the session. In the lobby the slot is freed; in a running game the
     * player is marked disconnected and the slot expires at the deadline.
     */
    public CompletableFuture<Void> leave(String playerId) {
        return submit("leave", () -> {
            RosterEntry entry = requireMember(playerId);
            PlayerSession player = entry.player;
            switch (status) {
                case LOBBY -> {
                    removeFromRoster(playerId);
                    player.clearGameSessionId(sessionId);
                    logger.info("Player {} left lobby {}", player.getDisplayName(), sessionId);
                    listener.playerLeft(sessionId, recipients(), player, "left");
                    if (roster.isEmpty()) {
                        abandon();
                    } else {
                        tryStart();
                    }
                }
                case ACTIVE -> {
                    player.clearGameSessionId(sessionId);
                    if (player.isConnected() || player.getDisconnectDeadline() == null) {
                        player.markDisconnected(clock.instant().plus(disconnectDeadline));
                    }
                    logger.info("Player {} left running game {}", player.getDisplayName(), sessionId);
                    listener.playerLeft(sessionId, recipientsExcept(playerId), player, "left");
                    List<String> events = new ArrayList<>();
                    events.add(player.getDisplayName() + " left the game");
                    afterRosterChange(events, null, null);
                }
                case ENDED -> {
                    removeFromRoster(playerId);
                    player.clearGameSessionId(sessionId);
                }
            }
            return null;
        });
    }

    /**
     * Sets a lobby member's ready flag. The game starts as soon as every
     * member is ready.
     *
     * @return true if this call started the game
     */
    public CompletableFuture<Boolean> setReady(String playerId, boolean ready) {
        return submit("ready", () -> {
            RosterEntry entry = requireMember(playerId);
            if (status != SessionStatus.LOBBY) {
                throw new SessionException(ErrorCode.INVALID_STATE, "Game " + sessionId + " is already " + status);
            }
            if (!entry.player.isConnected()) {
                throw new SessionException(ErrorCode.INVALID_STATE, "Disconnected players cannot ready up");
            }
            round.setReady(playerId, ready);
            listener.systemNotice(sessionId, recipients(), "info", entry.player.getDisplayName()
                    + (ready ? " is ready" : " is not ready")
                    + " (" + round.getReadyCount() + "/" + roster.size() + ")");
            return maybeStart();
        });
    }

    // === Game operations ===

    /**
     * Decodes, validates and applies one action. On success the resulting
     * delta has already been broadcast when the future completes.
     */
    public CompletableFuture<StateDelta> submitAction(String playerId, String actionType, JsonNode params,
                                                      String requestId) {
        return submit("action", () -> {
            RosterEntry entry = requireActivePlayer(playerId);
            if (round.isBudgetExhausted()) {
                throw new ActionException(ErrorCode.BUDGET_EXHAUSTED, "No actions left this round");
            }

            GameAction action = codec.decode(actionType, entry.entityId, params);
            boolean valid;
            try {
                valid = action.validate(gameState);
            } catch (RuntimeException e) {
                logger.debug("Validation of {} threw in game {}", actionType, sessionId, e);
                valid = false;
            }
            if (!valid) {
                throw new ActionException(ErrorCode.INVALID_ACTION, actionType + " is not allowed now");
            }

            Outcome outcome;
            try {
                outcome = action.execute(gameState);
            } catch (RuntimeException e) {
                corrupt("Action " + actionType + " failed", e);
                throw new CryptSyncException(ErrorCode.INTERNAL_ERROR, "Game ended after an internal error");
            }
            if (!outcome.isSuccess()) {
                if (synchronizer.hasUnpublishedChanges(draft())) {
                    corrupt("Action " + actionType + " failed after changing the state",
                            new IllegalStateException(actionType + " reported failure but mutated the game"));
                    throw new CryptSyncException(ErrorCode.INTERNAL_ERROR, "Game ended after an internal error");
                }
                String reason = outcome.getMessages().isEmpty() ? actionType + " failed" : outcome.getMessages().get(0);
                throw new ActionException(ErrorCode.INVALID_ACTION, reason);
            }

            ActionEnvelope envelope = new ActionEnvelope(nextSequence++, playerId,
                    actionType.toUpperCase(Locale.ROOT), params, clock.instant(), requestId);
            round.record(envelope);
            logger.debug("Game {} applied {}", sessionId, envelope);

            List<String> events = new ArrayList<>(outcome.getMessages());
            if (round.isBudgetExhausted() && !completeRound(events)) {
                throw new CryptSyncException(ErrorCode.INTERNAL_ERROR, "Game ended after an internal error");
            }
            return publishStep(events, playerId, requestId);
        });
    }

    /**
     * Gives up the rest of this player's round. The round ends early once all
     * connected living players have passed.
     */
    public CompletableFuture<StateDelta> pass(String playerId, String requestId) {
        return submit("pass", () -> {
            RosterEntry entry = requireActivePlayer(playerId);
            round.markPassed(playerId);
            List<String> events = new ArrayList<>();
            events.add(entry.player.getDisplayName() + " passes");
            if (allPassed() && !completeRound(events)) {
                throw new CryptSyncException(ErrorCode.INTERNAL_ERROR, "Game ended after an internal error");
            }
            return publishStep(events, playerId, requestId);
        });
    }

    public CompletableFuture<ChatEntry> chat(String playerId, String text) {
        return submit("chat", () -> {
            RosterEntry entry = requireMember(playerId);
            if (text == null || text.isBlank() || text.length() > MAX_CHAT_LENGTH) {
                throw new CryptSyncException(ErrorCode.INVALID_PARAMS,
                        "Chat text must be 1-" + MAX_CHAT_LENGTH + " characters");
            }
            ChatEntry chat = new ChatEntry(playerId, entry.player.getDisplayName(), text, clock.millis());
            chatLog.addLast(chat);
            while (chatLog.size() > chatLogSize) {
                chatLog.removeFirst();
            }
            listener.chatPosted(sessionId, recipients(), chat);
            return chat;
        });
    }

    /**
     * Sends the current full snapshot to one member. Always honored once the
     * game has started.
     */
    public CompletableFuture<StateSnapshot> requestSnapshot(String playerId, String requestId) {
        return submit("resync", () -> {
            requireMember(playerId);
            StateSnapshot snapshot = synchronizer.getCurrent();
            if (snapshot == null) {
                throw new SessionException(ErrorCode.INVALID_STATE, "Game " + sessionId + " has not started");
            }
            listener.snapshotSent(playerId, snapshot, requestId);
            return snapshot;
        });
    }

    // === Connection continuity ===

    /**
     * Marks a member's connection as lost. The slot is kept until the
     * disconnect deadline.
     */
    public CompletableFuture<Void> disconnect(String playerId) {
        return submit("disconnect", () -> {
            RosterEntry entry = roster.get(playerId);
            if (entry == null || !entry.player.isConnected()) {
                return null;
            }
            PlayerSession player = entry.player;
            player.markDisconnected(clock.instant().plus(disconnectDeadline));
            logger.info("Player {} disconnected from game {} (deadline {})",
                    player.getDisplayName(), sessionId, player.getDisconnectDeadline());
            if (status == SessionStatus.ENDED) {
                return null;
            }
            listener.playerLeft(sessionId, recipientsExcept(playerId), player, "disconnected");
            if (status == SessionStatus.LOBBY) {
                round.setReady(playerId, false);
                refreshInfo();
                return null;
            }
            List<String> events = new ArrayList<>();
            events.add(player.getDisplayName() + " disconnected");
            afterRosterChange(events, null, null);
            return null;
        });
    }

    /**
     * Re-binds a roster member after a dropped connection and sends them the
     * current snapshot.
     */
    public CompletableFuture<JoinResult> reconnect(PlayerSession player, String requestId) {
        return submit("reconnect", () -> doReconnect(player, requestId));
    }

    /**
     * Removes every disconnected member whose deadline has passed.
     *
     * @return number of players removed
     */
    public CompletableFuture<Integer> expireDisconnected(Instant now) {
        return submit("expire", () -> {
            if (status == SessionStatus.ENDED) {
                return 0;
            }
            List<String> events = new ArrayList<>();
            int expired = expireOverdue(now, events);
            if (expired > 0) {
                if (status == SessionStatus.LOBBY) {
                    if (roster.isEmpty()) {
                        abandon();
                    } else {
                        tryStart();
                    }
                } else {
                    afterRosterChange(events, null, null);
                }
            }
            return expired;
        });
    }

    /**
     * Ends the session regardless of its state, e.g. on server shutdown.
     */
    public CompletableFuture<Void> forceEnd(String reason) {
        return submit("end", () -> {
            if (status != SessionStatus.ENDED) {
                end(reason, null, Collections.emptyList());
            }
            return null;
        });
    }

    // === Internals (executor only) ===

    private <T> CompletableFuture<T> submit(String operation, Callable<T> task) {
        CompletableFuture<T> future = new CompletableFuture<>();
        try {
            executor.execute(() -> {
                try {
                    future.complete(task.call());
                } catch (CryptSyncException e) {
                    logger.debug("Game {} rejected {}: {}", sessionId, operation, e.getMessage());
                    future.completeExceptionally(e);
                } catch (Exception e) {
                    logger.error("Unexpected error during {} in game {}", operation, sessionId, e);
                    future.completeExceptionally(e);
                } finally {
                    refreshInfo();
                }
            });
        } catch (RejectedExecutionException e) {
            future.completeExceptionally(new SessionException(ErrorCode.SESSION_NOT_FOUND,
                    "Game " + sessionId + " is shut down"));
        }
        return future;
    }

    private JoinResult doReconnect(PlayerSession player, String requestId) {
        String playerId = player.getPlayerId();
        RosterEntry entry = roster.get(playerId);
        if (entry == null) {
            if (expiredPlayers.containsKey(playerId)) {
                throw new SessionException(ErrorCode.RECONNECT_EXPIRED, "Reconnect deadline has passed");
            }
            throw new SessionException(ErrorCode.NOT_IN_SESSION, "Not a member of game " + sessionId);
        }

        if (status == SessionStatus.ENDED) {
            StateSnapshot last = synchronizer.getCurrent();
            if (last != null) {
                listener.snapshotSent(playerId, last, requestId);
            }
            return new JoinResult(info(), last, chatHistory(), true);
        }

        Instant now = clock.instant();
        if (entry.player.isDeadlineExpired(now)) {
            List<String> events = new ArrayList<>();
            expire(entry, events);
            if (status == SessionStatus.LOBBY) {
                if (roster.isEmpty()) {
                    abandon();
                }
            } else {
                afterRosterChange(events, null, null);
            }
            throw new SessionException(ErrorCode.RECONNECT_EXPIRED, "Reconnect deadline has passed");
        }
        if (!player.bindGameSession(sessionId)) {
            throw new SessionException(ErrorCode.ALREADY_IN_SESSION, "Already in game " + player.getGameSessionId());
        }

        boolean wasConnected = entry.player.isConnected();
        entry.player.markConnected();
        logger.info("Player {} reconnected to game {}", player.getDisplayName(), sessionId);
        if (!wasConnected) {
            listener.playerJoined(sessionId, recipientsExcept(playerId), player);
        }

        if (status == SessionStatus.LOBBY) {
            return new JoinResult(info(), null, chatHistory(), true);
        }

        List<String> events = new ArrayList<>();
        if (!wasConnected) {
            events.add(player.getDisplayName() + " reconnected");
        }
        StateDelta delta = synchronizer.publishDelta(draft(), events);
        if (delta != null) {
            listener.statePublished(recipientsExcept(playerId), delta, null, null);
        }
        StateSnapshot snapshot = synchronizer.getCurrent();
        listener.snapshotSent(playerId, snapshot, requestId);
        return new JoinResult(info(), snapshot, chatHistory(), true);
    }

    private boolean maybeStart() {
        if (status != SessionStatus.LOBBY || roster.isEmpty()) {
            return false;
        }
        for (String playerId : roster.keySet()) {
            if (!round.isReady(playerId)) {
                return false;
            }
        }
        start();
        return true;
    }

    /**
     * Starts the game if the remaining members are all ready. Used where a
     * roster change, not a READY, completed the ready set: a failed start only
     * resets readiness and must not fail that change.
     */
    private void tryStart() {
        try {
            maybeStart();
        } catch (SessionException e) {
            logger.warn("Game {} could not start after a roster change: {}", sessionId, e.getMessage());
        }
    }

    private void start() {
        long gameSeed = seed != null ? seed : ThreadLocalRandom.current().nextLong();
        int playerCount = roster.size();
        GameState state;
        try {
            DungeonMap map = rules.getMapGenerator().generate(gameSeed);
            List<Coord> spawns = map.findSpawnPositions(playerCount);
            if (spawns == null || spawns.size() != playerCount || new HashSet<>(spawns).size() != playerCount) {
                round.clearReady();
                listener.systemNotice(sessionId, recipients(), "error", "Could not place every player, ready up again");
                throw new SessionException(ErrorCode.INVALID_STATE,
                        "Map has no " + playerCount + " distinct spawn positions");
            }
            state = rules.newGame(map, gameSeed);
            int i = 0;
            for (RosterEntry entry : roster.values()) {
                entry.entityId = state.spawnPlayer(entry.player.getPlayerId(), entry.player.getDisplayName(),
                        spawns.get(i++));
            }
        } catch (SessionException e) {
            throw e;
        } catch (RuntimeException e) {
            logger.error("Failed to start game {} with seed {}", sessionId, gameSeed, e);
            round.clearReady();
            listener.systemNotice(sessionId, recipients(), "error", "The game could not be started, ready up again");
            throw new SessionException(ErrorCode.INVALID_STATE, "Game could not be started");
        }

        gameState = state;
        status = SessionStatus.ACTIVE;
        round.clearReady();
        StateSnapshot snapshot = synchronizer.publishSnapshot(draft());
        logger.info("Game {} started with {} players (seed {})", sessionId, playerCount, gameSeed);
        listener.gameStarted(recipients(), snapshot);

        if (gameState.isGameOver()) {
            end(gameState.isVictory() ? "victory" : "defeat", gameState.isVictory(), Collections.emptyList());
        }
    }

    /**
     * Runs the round boundary: expire overdue slots, the environment turn, then
     * counter reset.
     *
     * @return false if the environment turn failed and the session ended
     */
    private boolean completeRound(List<String> events) {
        expireOverdue(clock.instant(), events);
        try {
            rules.getTurnSystem().processRound(gameState);
        } catch (RuntimeException e) {
            corrupt("Environment turn failed", e);
            return false;
        }
        long finished = round.getRoundNumber();
        round.advance();
        logger.debug("Game {} finished round {}", sessionId, finished);
        events.add("Round " + round.getRoundNumber() + " begins");
        return true;
    }

    /**
     * Publishes the delta of one step, then ends the game if it is over.
     */
    private StateDelta publishStep(List<String> events, String originPlayerId, String requestId) {
        if (roster.isEmpty()) {
            end("abandoned", null, events);
            return null;
        }
        if (gameState.isGameOver()) {
            boolean won = gameState.isVictory();
            return end(won ? "victory" : "defeat", won, events, originPlayerId, requestId);
        }
        StateDelta delta = synchronizer.publishDelta(draft(), events);
        if (delta != null) {
            listener.statePublished(recipients(), delta, originPlayerId, requestId);
        }
        return delta;
    }

    /**
     * Called after a player dropped, left or expired during a running game.
     */
    private void afterRosterChange(List<String> events, String originPlayerId, String requestId) {
        if (status != SessionStatus.ACTIVE) {
            return;
        }
        if (!roster.isEmpty() && allPassed() && !completeRound(events)) {
            return;
        }
        publishStep(events, originPlayerId, requestId);
    }

    private StateDelta end(String reason, Boolean won, List<String> events) {
        return end(reason, won, events, null, null);
    }

    private StateDelta end(String reason, Boolean won, List<String> events, String originPlayerId, String requestId) {
        SessionStatus previous = status;
        status = SessionStatus.ENDED;
        victory = won;
        endedAt = clock.instant();
        logger.info("Game {} ended: {}", sessionId, reason);

        StateDelta delta = null;
        if (previous == SessionStatus.ACTIVE && synchronizer.hasSnapshot()) {
            delta = synchronizer.publishDelta(draft(), events);
            if (delta != null) {
                listener.statePublished(recipients(), delta, originPlayerId, requestId);
            }
            listener.gameEnded(recipients(), synchronizer.getCurrent(), reason);
        }
        for (RosterEntry entry : roster.values()) {
            entry.player.clearGameSessionId(sessionId);
        }
        return delta;
    }

    private void corrupt(String what, RuntimeException e) {
        logger.error("{} in game {}, ending the session", what, sessionId, e);
        listener.systemNotice(sessionId, recipients(), "error", "The game hit an internal error and has ended");
        status = SessionStatus.ENDED;
        victory = null;
        endedAt = clock.instant();

        StateSnapshot.Builder finalDraft;
        try {
            finalDraft = draft();
        } catch (RuntimeException captureFailure) {
            logger.warn("Could not capture final state of game {}", sessionId, captureFailure);
            finalDraft = synchronizer.getCurrent().toBuilder().status(status.name()).gameOver(true);
        }
        StateSnapshot last = synchronizer.publishSnapshot(finalDraft);
        listener.gameEnded(recipients(), last, "error");
        for (RosterEntry entry : roster.values()) {
            entry.player.clearGameSessionId(sessionId);
        }
    }

    private void abandon() {
        status = SessionStatus.ENDED;
        abandoned = true;
        endedAt = clock.instant();
        logger.info("Lobby {} is empty, tearing down", sessionId);
    }

    private int expireOverdue(Instant now, List<String> events) {
        List<RosterEntry> overdue = new ArrayList<>();
        for (RosterEntry entry : roster.values()) {
            if (entry.player.isDeadlineExpired(now)) {
                overdue.add(entry);
            }
        }
        for (RosterEntry entry : overdue) {
            expire(entry, events);
        }
        return overdue.size();
    }

    private void expire(RosterEntry entry, List<String> events) {
        PlayerSession player = entry.player;
        removeFromRoster(player.getPlayerId());
        expiredPlayers.put(player.getPlayerId(), player.getDisplayName());
        player.clearGameSessionId(sessionId);
        if (gameState != null && entry.entityId != null) {
            gameState.removeEntity(entry.entityId);
        }
        logger.info("Player {} missed the reconnect deadline in game {}, slot removed",
                player.getDisplayName(), sessionId);
        events.add(player.getDisplayName() + " was removed after disconnecting");
        listener.playerLeft(sessionId, recipients(), player, "expired");
    }

    private void removeFromRoster(String playerId) {
        roster.remove(playerId);
        round.forget(playerId);
    }

    private boolean allPassed() {
        int active = 0;
        for (RosterEntry entry : roster.values()) {
            if (!isActing(entry)) {
                continue;
            }
            active++;
            if (!round.hasPassed(entry.player.getPlayerId())) {
                return false;
            }
        }
        return active > 0;
    }

    private boolean isActing(RosterEntry entry) {
        if (!entry.player.isConnected() || entry.entityId == null) {
            return false;
        }
        Optional<EntityView> entity = gameState.getPlayer(entry.entityId);
        return entity.isPresent() && entity.get().isAlive();
    }

    private RosterEntry requireMember(String playerId) {
        RosterEntry entry = roster.get(playerId);
        if (entry == null) {
            if (expiredPlayers.containsKey(playerId)) {
                throw new SessionException(ErrorCode.RECONNECT_EXPIRED, "Your slot in game " + sessionId + " expired");
            }
            throw new SessionException(ErrorCode.NOT_IN_SESSION, "Not a member of game " + sessionId);
        }
        return entry;
    }

    private RosterEntry requireActivePlayer(String playerId) {
        RosterEntry entry = requireMember(playerId);
        if (status != SessionStatus.ACTIVE) {
            throw new SessionException(ErrorCode.INVALID_STATE, "Game " + sessionId + " is " + status);
        }
        if (!isActing(entry)) {
            throw new ActionException(ErrorCode.PLAYER_INACTIVE, "Player cannot act");
        }
        return entry;
    }

    private StateSnapshot.Builder draft() {
        StateSnapshot.Builder builder = StateSnapshot.builder()
                .sessionId(sessionId)
                .status(status.name())
                .roundNumber(round.getRoundNumber())
                .actionsTaken(round.getActionsTaken())
                .maxActions(round.getMaxActionsPerRound())
                .gameOver(status == SessionStatus.ENDED)
                .victory(status == SessionStatus.ENDED ? victory : null);
        if (gameState != null) {
            for (EntityView entity : gameState.getEntities()) {
                builder.entity(EntityState.capture(entity));
            }
        }
        for (RosterEntry entry : roster.values()) {
            Map<String, Object> fields = new LinkedHashMap<>();
            fields.put("display_name", entry.player.getDisplayName());
            fields.put("entity_id", entry.entityId);
            fields.put("connected", entry.player.isConnected());
            fields.put("ready", round.isReady(entry.player.getPlayerId()));
            fields.put("passed", round.hasPassed(entry.player.getPlayerId()));
            builder.player(EntityState.of(entry.player.getPlayerId(), fields));
        }
        return builder;
    }

    /**
     * Members still bound to this game. A player who left a running game keeps
     * a slot but no longer receives its traffic.
     */
    private List<String> recipients() {
        List<String> ids = new ArrayList<>();
        for (RosterEntry entry : roster.values()) {
            if (sessionId.equals(entry.player.getGameSessionId())) {
                ids.add(entry.player.getPlayerId());
            }
        }
        return ids;
    }

    private List<String> recipientsExcept(String playerId) {
        List<String> ids = recipients();
        ids.remove(playerId);
        return ids;
    }

    private List<ChatEntry> chatHistory() {
        return new ArrayList<>(chatLog);
    }

    private SessionInfo info() {
        refreshInfo();
        return info;
    }

    private void refreshInfo() {
        List<String> names = new ArrayList<>();
        for (RosterEntry entry : roster.values()) {
            names.add(entry.player.getDisplayName());
        }
        info = new SessionInfo(sessionId, name, ownerId, status, names, maxPlayers, createdAt);
    }

    /**
     * Roster slot. Executor-confined.
     */
    private static final class RosterEntry {
        private final PlayerSession player;
        private String entityId;

        private RosterEntry(PlayerSession player) {
            this.player = player;
        }
    }

    public static class Builder {
        private String sessionId;
        private String name;
        private String ownerId;
        private GameRules rules;
        private ActionCodec codec;
        private Executor executor;
        private SessionListener listener = SessionListener.NOOP;
        private Clock clock = Clock.systemUTC();
        private int maxPlayers = 4;
        private int maxActionsPerRound = 4;
        private Duration disconnectDeadline = Duration.ofSeconds(120);
        private int chatLogSize = 50;
        private Long seed;

        public Builder sessionId(String sessionId) {
            this.sessionId = sessionId;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder ownerId(String ownerId) {
            this.ownerId = ownerId;
            return this;
        }

        public Builder rules(GameRules rules) {
            this.rules = rules;
            return this;
        }

        public Builder codec(ActionCodec codec) {
            this.codec = codec;
            return this;
        }

        /**
         * Serial executor for this session. Must run tasks one at a time in
         * submission order.
         */
        public Builder executor(Executor executor) {
            this.executor = executor;
            return this;
        }

        public Builder listener(SessionListener listener) {
            this.listener = listener;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public Builder maxPlayers(int maxPlayers) {
            this.maxPlayers = maxPlayers;
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

        public Builder chatLogSize(int chatLogSize) {
            this.chatLogSize = chatLogSize;
            return this;
        }

        public Builder seed(Long seed) {
            this.seed = seed;
            return this;
        }

        public GameSession build() {
            return new GameSession(this);
        }
    }

    @Override
    public String toString() {
        return "GameSession{" + sessionId + " '" + name + "' " + status + '}';
    }
}
