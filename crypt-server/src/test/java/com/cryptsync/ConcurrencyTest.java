package com.cryptsync;

import com.cryptsync.auth.AuthService;
import com.cryptsync.auth.PlayerSession;
import com.cryptsync.config.ServerConfig;
import com.cryptsync.protocol.CryptSyncException;
import com.cryptsync.protocol.ErrorCode;
import com.cryptsync.protocol.action.ActionCodec;
import com.cryptsync.session.GameSession;
import com.cryptsync.session.SessionManager;
import com.cryptsync.support.RecordingListener;
import com.cryptsync.support.ScriptedRules;
import com.cryptsync.sync.DeltaEncoder;
import com.cryptsync.sync.StateDelta;
import com.cryptsync.sync.StateReplica;
import io.netty.util.concurrent.DefaultEventExecutor;
import io.netty.util.concurrent.DefaultEventExecutorGroup;
import org.junit.jupiter.api.*;

import java.time.Clock;
import java.time.Duration;
import java.util.*;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the single-writer session model:
 * - Concurrent submissions are serialized per session
 * - Round budget holds under contention
 * - Revisions stay gapless and in order
 */
@DisplayName("Concurrency & Session Executor Tests")
class ConcurrencyTest {

    private DefaultEventExecutor executor;
    private DefaultEventExecutorGroup group;
    private AuthService auth;

    @BeforeEach
    void setUp() {
        executor = new DefaultEventExecutor();
        group = new DefaultEventExecutorGroup(4);
        auth = new AuthService(Duration.ofHours(1), Clock.systemUTC());
    }

    @AfterEach
    void tearDown() throws Exception {
        executor.shutdownGracefully(0, 1, TimeUnit.SECONDS).sync();
        group.shutdownGracefully(0, 1, TimeUnit.SECONDS).sync();
    }

    private GameSession startedSession(ScriptedRules rules, RecordingListener listener, List<PlayerSession> players)
            throws Exception {
        ActionCodec codec = new ActionCodec();
        rules.registerActions(codec);
        GameSession session = GameSession.builder()
                .sessionId("C1")
                .rules(rules)
                .codec(codec)
                .executor(executor)
                .listener(listener)
                .maxPlayers(players.size())
                .maxActionsPerRound(4)
                .seed(1L)
                .build();
        for (PlayerSession p : players) {
            session.join(p).get(5, TimeUnit.SECONDS);
        }
        for (PlayerSession p : players) {
            session.setReady(p.getPlayerId(), true).get(5, TimeUnit.SECONDS);
        }
        return session;
    }

    // ==========================================
    // Test: Serialized Actions
    // ==========================================

    @Test
    @DisplayName("Actions from many threads keep the budget and a gapless revision order")
    void testConcurrentActions() throws Exception {
        List<PlayerSession> players = new ArrayList<>();
        for (int i = 0; i < 4; i++) {
            players.add(auth.authenticate("P" + i));
        }
        ScriptedRules rules = new ScriptedRules();
        RecordingListener listener = new RecordingListener();
        GameSession session = startedSession(rules, listener, players);

        int threads = 8;
        int actionsPerThread = 50;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Integer>> results = new ArrayList<>();

        for (int t = 0; t < threads; t++) {
            PlayerSession actor = players.get(t % players.size());
            results.add(pool.submit(() -> {
                start.await();
                int ok = 0;
                for (int i = 0; i < actionsPerThread; i++) {
                    StateDelta delta = session.submitAction(actor.getPlayerId(), "LOOT", null, null)
                            .get(5, TimeUnit.SECONDS);
                    assertNotNull(delta);
                    ok++;
                }
                return ok;
            }));
        }
        start.countDown();

        int total = 0;
        for (Future<Integer> f : results) {
            total += f.get(30, TimeUnit.SECONDS);
        }
        pool.shutdown();

        int expected = threads * actionsPerThread;
        assertEquals(expected, total);
        assertEquals(expected / 4, rules.getEnvironmentTurns());

        List<StateDelta> deltas = listener.getDeltas();
        assertEquals(expected, deltas.size());
        long revision = 1;
        for (StateDelta delta : deltas) {
            assertEquals(revision, delta.getBaseRevision());
            assertEquals(revision + 1, delta.getNewRevision());
            assertTrue(delta.getActionsTaken() < delta.getMaxActions());
            revision++;
        }

        StateReplica replica = new StateReplica(new DeltaEncoder());
        replica.acceptSnapshot(listener.getStartSnapshot());
        deltas.forEach(replica::acceptDelta);
        assertEquals(session.getLastSnapshot(), replica.getState());

        System.out.println("✓ " + total + " concurrent actions, " + rules.getEnvironmentTurns()
                + " rounds, final revision " + revision);
    }

    // ==========================================
    // Test: Roster Races
    // ==========================================

    @Test
    @DisplayName("Concurrent joins never overfill a lobby")
    void testConcurrentJoins() throws Exception {
        ActionCodec codec = new ActionCodec();
        GameSession session = GameSession.builder()
                .sessionId("C2")
                .rules(new ScriptedRules())
                .codec(codec)
                .executor(executor)
                .maxPlayers(4)
                .build();

        int contenders = 12;
        ExecutorService pool = Executors.newFixedThreadPool(contenders);
        CountDownLatch start = new CountDownLatch(1);
        AtomicInteger joined = new AtomicInteger();
        AtomicInteger full = new AtomicInteger();
        List<Future<?>> futures = new ArrayList<>();

        for (int i = 0; i < contenders; i++) {
            PlayerSession player = auth.authenticate("J" + i);
            futures.add(pool.submit(() -> {
                start.await();
                try {
                    session.join(player).get(5, TimeUnit.SECONDS);
                    joined.incrementAndGet();
                } catch (ExecutionException e) {
                    CryptSyncException cause = (CryptSyncException) e.getCause();
                    assertEquals(ErrorCode.SESSION_FULL, cause.getCode());
                    full.incrementAndGet();
                }
                return null;
            }));
        }
        start.countDown();
        for (Future<?> f : futures) {
            f.get(10, TimeUnit.SECONDS);
        }
        pool.shutdown();

        assertEquals(4, joined.get());
        assertEquals(contenders - 4, full.get());
        assertEquals(4, session.getInfo().getPlayerCount());
        System.out.println("✓ " + joined.get() + " joined, " + full.get() + " turned away");
    }

    @Test
    @DisplayName("One player creating games from several threads ends up in exactly one")
    void testConcurrentCreate() throws Exception {
        ServerConfig config = ServerConfig.builder().build();
        SessionManager manager = new SessionManager(config, auth, new ScriptedRules(), group, Clock.systemUTC());
        PlayerSession owner = auth.authenticate("Owner");

        int attempts = 8;
        ExecutorService pool = Executors.newFixedThreadPool(attempts);
        CountDownLatch start = new CountDownLatch(1);
        AtomicInteger created = new AtomicInteger();
        List<Future<?>> futures = new ArrayList<>();

        for (int i = 0; i < attempts; i++) {
            futures.add(pool.submit(() -> {
                start.await();
                try {
                    manager.createGame(owner, null).get(5, TimeUnit.SECONDS);
                    created.incrementAndGet();
                } catch (ExecutionException e) {
                    assertEquals(ErrorCode.ALREADY_IN_SESSION, ((CryptSyncException) e.getCause()).getCode());
                }
                return null;
            }));
        }
        start.countDown();
        for (Future<?> f : futures) {
            f.get(10, TimeUnit.SECONDS);
        }
        pool.shutdown();

        assertEquals(1, created.get());
        assertEquals(1, manager.getSessionCount());
        assertNotNull(manager.findSession(owner));
    }
}
