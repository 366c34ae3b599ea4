package com.cryptsync.session;

import com.cryptsync.auth.AuthService;
import com.cryptsync.auth.PlayerSession;
import com.cryptsync.config.ServerConfig;
import com.cryptsync.protocol.CryptSyncException;
import com.cryptsync.protocol.ErrorCode;
import com.cryptsync.support.MutableClock;
import com.cryptsync.support.RecordingListener;
import com.cryptsync.support.ScriptedRules;
import io.netty.util.concurrent.ImmediateEventExecutor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Session Manager Tests")
class SessionManagerTest {

    private MutableClock clock;
    private AuthService auth;
    private SessionManager manager;
    private RecordingListener listener;

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
        ServerConfig config = ServerConfig.builder()
                .maxPlayersPerSession(2)
                .sessionGracePeriod(Duration.ofSeconds(60))
                .disconnectDeadline(Duration.ofSeconds(120))
                .tokenTtl(Duration.ofHours(1))
                .seed(7L)
                .build();
        auth = new AuthService(config.getTokenTtl(), clock);
        manager = new SessionManager(config, auth, new ScriptedRules(), ImmediateEventExecutor.INSTANCE, clock);
        listener = new RecordingListener();
        manager.setListener(listener);
    }

    private static ErrorCode failureCode(CompletableFuture<?> future) {
        CompletionException e = assertThrows(CompletionException.class, future::join);
        assertTrue(e.getCause() instanceof CryptSyncException, "unexpected failure: " + e.getCause());
        return ((CryptSyncException) e.getCause()).getCode();
    }

    @Test
    @DisplayName("Creating a game registers a lobby owned by the creator")
    void testCreateGame() {
        PlayerSession alice = auth.authenticate("Alice");
        JoinResult result = manager.createGame(alice, null).join();

        SessionInfo info = result.getSession();
        assertEquals("Alice's game", info.getName());
        assertEquals(alice.getPlayerId(), info.getOwnerId());
        assertEquals(List.of("Alice"), info.getPlayers());
        assertEquals(SessionStatus.LOBBY, info.getStatus());
        assertEquals(info.getSessionId(), alice.getGameSessionId());
        assertSame(manager.getSession(info.getSessionId()), manager.findSession(alice));
        assertEquals(1, manager.getSessionCount());
        System.out.println("✓ Created game " + info.getSessionId());
    }

    @Test
    @DisplayName("A player can only be in one game")
    void testAlreadyInSession() {
        PlayerSession alice = auth.authenticate("Alice");
        manager.createGame(alice, "first").join();

        assertEquals(ErrorCode.ALREADY_IN_SESSION, failureCode(manager.createGame(alice, "second")));
        assertEquals(1, manager.getSessionCount());
    }

    @Test
    @DisplayName("Joining unknown and full games fails")
    void testJoinFailures() {
        PlayerSession alice = auth.authenticate("Alice");
        PlayerSession bob = auth.authenticate("Bob");
        PlayerSession carol = auth.authenticate("Carol");
        String id = manager.createGame(alice, "g").join().getSession().getSessionId();

        assertEquals(ErrorCode.SESSION_NOT_FOUND, failureCode(manager.joinGame("nope", bob)));
        assertEquals(ErrorCode.SESSION_NOT_FOUND, failureCode(manager.joinGame(null, bob)));

        JoinResult joined = manager.joinGame(id, bob).join();
        assertEquals(2, joined.getSession().getPlayerCount());
        assertEquals(ErrorCode.SESSION_FULL, failureCode(manager.joinGame(id, carol)));
        assertTrue(listener.getEvents().contains("joined:Bob"));
    }

    @Test
    @DisplayName("A per-game seat count is honored and clamped to the server limit")
    void testCreateWithMaxPlayers() {
        PlayerSession alice = auth.authenticate("Alice");
        PlayerSession bob = auth.authenticate("Bob");
        PlayerSession carol = auth.authenticate("Carol");
        PlayerSession dave = auth.authenticate("Dave");

        JoinResult solo = manager.createGame(alice, "solo", 1).join();
        assertEquals(1, solo.getSession().getMaxPlayers());
        assertEquals(ErrorCode.SESSION_FULL, failureCode(manager.joinGame(solo.getSession().getSessionId(), bob)));

        String big = manager.createGame(bob, "big", 10).join().getSession().getSessionId();
        assertEquals(2, manager.getSession(big).getInfo().getMaxPlayers());
        manager.joinGame(big, carol).join();
        assertEquals(ErrorCode.SESSION_FULL, failureCode(manager.joinGame(big, dave)));
        System.out.println("✓ Seat limits 1 and 10 -> 2 enforced");
    }

    @Test
    @DisplayName("Listing shows joinable lobbies only, oldest first")
    void testListGames() {
        PlayerSession alice = auth.authenticate("Alice");
        PlayerSession bob = auth.authenticate("Bob");
        PlayerSession carol = auth.authenticate("Carol");

        String first = manager.createGame(alice, "first").join().getSession().getSessionId();
        clock.advance(Duration.ofSeconds(1));
        String second = manager.createGame(bob, "second").join().getSession().getSessionId();

        List<SessionInfo> games = manager.listGames();
        assertEquals(2, games.size());
        assertEquals(first, games.get(0).getSessionId());
        assertEquals(second, games.get(1).getSessionId());

        manager.joinGame(first, carol).join();
        games = manager.listGames();
        assertEquals(1, games.size());
        assertEquals(second, games.get(0).getSessionId());
    }

    @Test
    @DisplayName("Leaving the last seat of a lobby tears it down")
    void testLeaveTearsDownEmptyLobby() {
        PlayerSession alice = auth.authenticate("Alice");
        String id = manager.createGame(alice, null).join().getSession().getSessionId();

        manager.leaveGame(alice).join();

        assertNull(manager.getSession(id));
        assertNull(alice.getGameSessionId());
        assertEquals(ErrorCode.NOT_IN_SESSION, failureCode(manager.leaveGame(alice)));
    }

    @Test
    @DisplayName("Ended games are removed after the grace period")
    void testSweepAfterGracePeriod() {
        PlayerSession alice = auth.authenticate("Alice");
        String id = manager.createGame(alice, null).join().getSession().getSessionId();
        GameSession session = manager.getSession(id);
        session.setReady(alice.getPlayerId(), true).join();
        session.forceEnd("test").join();

        clock.advance(Duration.ofSeconds(30));
        assertEquals(0, manager.sweep());
        assertNotNull(manager.getSession(id));

        clock.advance(Duration.ofSeconds(30));
        assertEquals(1, manager.sweep());
        assertNull(manager.getSession(id));
    }

    @Test
    @DisplayName("Sweep expires disconnected players and drops emptied lobbies")
    void testSweepExpiresLobbyMembers() {
        PlayerSession alice = auth.authenticate("Alice");
        String id = manager.createGame(alice, null).join().getSession().getSessionId();
        manager.disconnect(alice).join();

        clock.advance(Duration.ofSeconds(121));
        manager.sweep();

        assertNull(manager.getSession(id));
        assertNull(alice.getGameSessionId());
    }

    @Test
    @DisplayName("Reconnect by token resumes the seat")
    void testReconnectByToken() {
        PlayerSession alice = auth.authenticate("Alice");
        PlayerSession bob = auth.authenticate("Bob");
        String id = manager.createGame(alice, null).join().getSession().getSessionId();
        manager.joinGame(id, bob).join();
        GameSession session = manager.getSession(id);
        session.setReady(alice.getPlayerId(), true).join();
        session.setReady(bob.getPlayerId(), true).join();

        manager.disconnect(bob).join();
        assertFalse(bob.isConnected());

        JoinResult result = manager.reconnect(bob.getToken(), id, "r1").join();
        assertTrue(result.isRejoined());
        assertNotNull(result.getSnapshot());
        assertTrue(bob.isConnected());

        assertEquals(ErrorCode.INVALID_TOKEN, failureCode(manager.reconnect("bogus", id, null)));
        assertEquals(ErrorCode.SESSION_NOT_FOUND, failureCode(manager.reconnect(bob.getToken(), "missing", null)));
    }

    @Test
    @DisplayName("Shutdown ends every running game")
    void testShutdown() {
        PlayerSession alice = auth.authenticate("Alice");
        String id = manager.createGame(alice, null).join().getSession().getSessionId();
        manager.getSession(id).setReady(alice.getPlayerId(), true).join();

        manager.shutdown().join();

        assertEquals(SessionStatus.ENDED, manager.getSession(id).getStatus());
        assertEquals("server_shutdown", listener.getEndReason());
    }
}
