package com.cryptsync.handler;

import com.cryptsync.auth.AuthService;
import com.cryptsync.config.ServerConfig;
import com.cryptsync.protocol.MessageSerializer;
import com.cryptsync.server.DungeonServer;
import com.cryptsync.session.SessionManager;
import com.cryptsync.support.MutableClock;
import com.cryptsync.support.ScriptedRules;
import com.fasterxml.jackson.databind.JsonNode;
import io.netty.buffer.Unpooled;
import io.netty.channel.DefaultChannelId;
import io.netty.channel.embedded.EmbeddedChannel;
import io.netty.handler.codec.http.websocketx.BinaryWebSocketFrame;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import io.netty.handler.timeout.IdleStateEvent;
import io.netty.util.concurrent.ImmediateEventExecutor;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Gateway tests on embedded channels. Sessions run on an immediate executor,
 * so every reply is already queued when writeInbound returns.
 */
@DisplayName("WebSocket Gateway Tests")
class WebSocketFrameHandlerTest {

    private final MessageSerializer serializer = new MessageSerializer();
    private final List<EmbeddedChannel> channels = new ArrayList<>();

    private ServerConfig config;
    private AuthService auth;
    private ConnectionRegistry registry;
    private SessionManager manager;
    private MessageDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        setUp(ServerConfig.builder().seed(3L).build());
    }

    private void setUp(ServerConfig serverConfig) {
        config = serverConfig;
        MutableClock clock = new MutableClock();
        auth = new AuthService(config.getTokenTtl(), clock);
        registry = new ConnectionRegistry(serializer, config.getOutboundQueueCapacity());
        manager = new SessionManager(config, auth, new ScriptedRules(), ImmediateEventExecutor.INSTANCE, clock);
        manager.setListener(new SessionBroadcaster(registry));
        dispatcher = DungeonServer.createDispatcher(config, auth, registry, manager);
    }

    @AfterEach
    void tearDown() {
        for (EmbeddedChannel channel : channels) {
            channel.finishAndReleaseAll();
        }
    }

    // ==========================================
    // Helpers
    // ==========================================

    private EmbeddedChannel connect() {
        EmbeddedChannel channel = new EmbeddedChannel(DefaultChannelId.newInstance(),
                new WebSocketFrameHandler(registry, dispatcher, manager, serializer, config));
        channels.add(channel);
        return channel;
    }

    private static void send(EmbeddedChannel channel, String json) {
        channel.writeInbound(new TextWebSocketFrame(json));
    }

    private List<JsonNode> drain(EmbeddedChannel channel) throws Exception {
        List<JsonNode> messages = new ArrayList<>();
        Object out;
        while ((out = channel.readOutbound()) != null) {
            TextWebSocketFrame frame = (TextWebSocketFrame) out;
            try {
                messages.add(serializer.getObjectMapper().readTree(frame.text()));
            } finally {
                frame.release();
            }
        }
        return messages;
    }

    /**
     * Drains the channel and returns the first message of {@code type}.
     */
    private JsonNode expect(EmbeddedChannel channel, String type) throws Exception {
        List<JsonNode> messages = drain(channel);
        for (JsonNode message : messages) {
            if (type.equals(message.get("type").asText())) {
                return message;
            }
        }
        fail("No " + type + " among " + messages);
        return null;
    }

    private List<String> types(List<JsonNode> messages) {
        List<String> types = new ArrayList<>();
        messages.forEach(m -> types.add(m.get("type").asText()));
        return types;
    }

    private JsonNode login(EmbeddedChannel channel, String name) throws Exception {
        send(channel, "{\"type\":\"AUTH\",\"payload\":{\"display_name\":\"" + name + "\"}}");
        return expect(channel, "AUTH_SUCCESS").get("payload");
    }

    // ==========================================
    // Protocol errors
    // ==========================================

    @Test
    @DisplayName("Requests before AUTH are refused with not_authenticated")
    void testNotAuthenticated() throws Exception {
        EmbeddedChannel channel = connect();
        send(channel, "{\"type\":\"CREATE_GAME\",\"request_id\":\"c1\"}");

        JsonNode error = expect(channel, "ERROR");
        assertEquals("not_authenticated", error.get("payload").get("reason").asText());
        assertEquals("c1", error.get("request_id").asText());
        assertTrue(channel.isActive());
    }

    @Test
    @DisplayName("Malformed frames get an error and the connection stays open")
    void testMalformedFrames() throws Exception {
        EmbeddedChannel channel = connect();

        send(channel, "{oops");
        assertEquals("malformed_message", expect(channel, "ERROR").get("payload").get("reason").asText());

        send(channel, "{\"type\":\"TELEPORT\"}");
        assertEquals("unknown_message_type", expect(channel, "ERROR").get("payload").get("reason").asText());

        channel.writeInbound(new BinaryWebSocketFrame(Unpooled.wrappedBuffer(new byte[]{1, 2, 3})));
        assertEquals("malformed_message", expect(channel, "ERROR").get("payload").get("reason").asText());

        // Server-to-client types are not accepted from clients
        login(channel, "Alice");
        send(channel, "{\"type\":\"DELTA\",\"request_id\":\"x\"}");
        JsonNode error = expect(channel, "ERROR");
        assertEquals("unknown_message_type", error.get("payload").get("reason").asText());
        assertEquals("x", error.get("request_id").asText());
        assertTrue(channel.isActive());
    }

    // ==========================================
    // Authentication
    // ==========================================

    @Test
    @DisplayName("AUTH issues a token that resumes the same identity")
    void testAuthAndResume() throws Exception {
        EmbeddedChannel first = connect();
        JsonNode identity = login(first, "Alice");
        assertEquals("Alice", identity.get("display_name").asText());
        String token = identity.get("token").asText();
        assertFalse(token.isEmpty());

        EmbeddedChannel second = connect();
        send(second, "{\"type\":\"AUTH\",\"payload\":{\"token\":\"" + token + "\"},\"request_id\":\"a2\"}");
        JsonNode resumed = expect(second, "AUTH_SUCCESS");
        assertEquals(identity.get("player_id"), resumed.get("payload").get("player_id"));
        assertEquals("a2", resumed.get("request_id").asText());

        // The older connection is superseded
        assertFalse(first.isOpen());
        assertSame(registry.getByPlayer(identity.get("player_id").asText()).getChannel(), second);
    }

    @Test
    @DisplayName("Bad names and tokens yield AUTH_FAILURE")
    void testAuthFailure() throws Exception {
        EmbeddedChannel channel = connect();
        send(channel, "{\"type\":\"AUTH\",\"payload\":{\"display_name\":\"\"}}");
        assertEquals("invalid_name", expect(channel, "AUTH_FAILURE").get("payload").get("reason").asText());

        send(channel, "{\"type\":\"AUTH\",\"payload\":{\"token\":\"forged\"}}");
        assertEquals("invalid_token", expect(channel, "AUTH_FAILURE").get("payload").get("reason").asText());
        assertTrue(channel.isActive());
    }

    @Test
    @DisplayName("Unauthenticated connections are closed after the auth timeout")
    void testAuthTimeout() throws Exception {
        setUp(ServerConfig.builder().authTimeout(Duration.ofMillis(50)).build());
        EmbeddedChannel idle = connect();
        EmbeddedChannel authed = connect();
        login(authed, "Alice");

        Thread.sleep(150);
        idle.runScheduledPendingTasks();
        authed.runScheduledPendingTasks();

        assertFalse(idle.isOpen());
        assertTrue(authed.isOpen());
    }

    @Test
    @DisplayName("Connections over the limit are rejected")
    void testConnectionLimit() {
        setUp(ServerConfig.builder().maxConnections(1).build());
        EmbeddedChannel first = connect();
        EmbeddedChannel second = connect();

        assertTrue(first.isOpen());
        assertFalse(second.isOpen());
        assertEquals(1, registry.getConnectionCount());
    }

    @Test
    @DisplayName("Reader idle events close the connection")
    void testIdleClose() throws Exception {
        EmbeddedChannel channel = connect();
        login(channel, "Sleepy");

        channel.pipeline().fireUserEventTriggered(IdleStateEvent.FIRST_READER_IDLE_STATE_EVENT);

        assertFalse(channel.isOpen());
        assertEquals(0, registry.getConnectionCount());
    }

    // ==========================================
    // Game flow
    // ==========================================

    @Test
    @DisplayName("Create, join, ready and act over the wire")
    void testGameFlow() throws Exception {
        EmbeddedChannel alice = connect();
        EmbeddedChannel bob = connect();
        login(alice, "Alice");
        login(bob, "Bob");

        send(alice, "{\"type\":\"CREATE_GAME\",\"payload\":{\"name\":\"Crypt\"},\"request_id\":\"c\"}");
        JsonNode created = expect(alice, "GAME_CREATED");
        assertEquals("c", created.get("request_id").asText());
        String sessionId = created.get("payload").get("session_id").asText();
        assertEquals("Crypt", created.get("payload").get("name").asText());

        send(bob, "{\"type\":\"LIST_GAMES\"}");
        JsonNode games = expect(bob, "GAME_LIST").get("payload").get("games");
        assertEquals(1, games.size());
        assertEquals(sessionId, games.get(0).get("session_id").asText());

        send(bob, "{\"type\":\"JOIN_GAME\",\"payload\":{\"session_id\":\"" + sessionId + "\"}}");
        assertEquals(2, expect(bob, "GAME_JOINED").get("payload").get("player_count").asInt());
        assertEquals("Bob", expect(alice, "PLAYER_JOINED").get("payload").get("display_name").asText());

        send(alice, "{\"type\":\"READY\",\"payload\":{\"ready\":true}}");
        send(bob, "{\"type\":\"READY\"}");

        List<JsonNode> aliceInbox = drain(alice);
        assertTrue(types(aliceInbox).containsAll(List.of("SYSTEM", "GAME_START", "STATE")),
                "unexpected " + types(aliceInbox));
        assertTrue(types(aliceInbox).indexOf("GAME_START") < types(aliceInbox).indexOf("STATE"));
        JsonNode state = expect(bob, "STATE").get("payload");
        assertEquals(1, state.get("revision").asLong());
        assertEquals("ACTIVE", state.get("status").asText());

        send(alice, "{\"type\":\"ACTION\",\"payload\":{\"action_type\":\"move\",\"params\":{\"dx\":0,\"dy\":1}},"
                + "\"request_id\":\"m1\"}");
        JsonNode own = expect(alice, "DELTA");
        assertEquals("m1", own.get("request_id").asText());
        assertEquals(2, own.get("payload").get("new_revision").asLong());
        assertEquals(1, own.get("payload").get("actions_taken").asInt());
        JsonNode other = expect(bob, "DELTA");
        assertNull(other.get("request_id"));
        assertEquals(own.get("payload").get("entities"), other.get("payload").get("entities"));

        send(alice, "{\"type\":\"ACTION\",\"payload\":{\"action_type\":\"MOVE\",\"params\":{\"dx\":0,\"dy\":-5}},"
                + "\"request_id\":\"m2\"}");
        JsonNode rejected = expect(alice, "ERROR");
        assertEquals("invalid_action", rejected.get("payload").get("reason").asText());
        assertEquals("m2", rejected.get("request_id").asText());
        assertTrue(drain(bob).isEmpty());

        send(bob, "{\"type\":\"CHAT\",\"payload\":{\"text\":\"hi\"}}");
        assertEquals("hi", expect(alice, "CHAT_MESSAGE").get("payload").get("text").asText());
        System.out.println("✓ Full lobby-to-delta flow over embedded channels");
    }

    @Test
    @DisplayName("CREATE_GAME max_players limits the lobby")
    void testCreateWithMaxPlayers() throws Exception {
        EmbeddedChannel alice = connect();
        EmbeddedChannel bob = connect();
        EmbeddedChannel carol = connect();
        login(alice, "Alice");
        login(bob, "Bob");
        login(carol, "Carol");

        send(carol, "{\"type\":\"CREATE_GAME\",\"payload\":{\"max_players\":\"two\"}}");
        assertEquals("malformed_message", expect(carol, "ERROR").get("payload").get("reason").asText());
        send(carol, "{\"type\":\"CREATE_GAME\",\"payload\":{\"max_players\":0}}");
        assertEquals("malformed_message", expect(carol, "ERROR").get("payload").get("reason").asText());

        send(alice, "{\"type\":\"CREATE_GAME\",\"payload\":{\"name\":\"Duo\",\"max_players\":2}}");
        JsonNode created = expect(alice, "GAME_CREATED").get("payload");
        assertEquals(2, created.get("max_players").asInt());
        String sessionId = created.get("session_id").asText();

        send(bob, "{\"type\":\"JOIN_GAME\",\"payload\":{\"session_id\":\"" + sessionId + "\"}}");
        expect(bob, "GAME_JOINED");
        send(carol, "{\"type\":\"JOIN_GAME\",\"payload\":{\"session_id\":\"" + sessionId + "\"}}");
        assertEquals("session_full", expect(carol, "ERROR").get("payload").get("reason").asText());
    }

    @Test
    @DisplayName("A dropped connection can reconnect with its token and gets a fresh STATE")
    void testDisconnectAndReconnect() throws Exception {
        EmbeddedChannel alice = connect();
        EmbeddedChannel bob = connect();
        login(alice, "Alice");
        String bobToken = login(bob, "Bob").get("token").asText();

        send(alice, "{\"type\":\"CREATE_GAME\"}");
        String sessionId = expect(alice, "GAME_CREATED").get("payload").get("session_id").asText();
        send(bob, "{\"type\":\"JOIN_GAME\",\"payload\":{\"session_id\":\"" + sessionId + "\"}}");
        send(alice, "{\"type\":\"READY\"}");
        send(bob, "{\"type\":\"READY\"}");
        drain(alice);
        drain(bob);

        bob.close();
        List<JsonNode> seen = drain(alice);
        assertTrue(types(seen).contains("PLAYER_LEFT"), "unexpected " + types(seen));
        assertTrue(types(seen).contains("DELTA"));

        EmbeddedChannel bobAgain = connect();
        send(bobAgain, "{\"type\":\"AUTH\",\"payload\":{\"token\":\"" + bobToken + "\"}}");
        assertEquals(sessionId, expect(bobAgain, "AUTH_SUCCESS").get("payload").get("session_id").asText());

        send(bobAgain, "{\"type\":\"RECONNECT\",\"request_id\":\"r\"}");
        List<JsonNode> inbox = drain(bobAgain);
        assertEquals(List.of("STATE", "GAME_JOINED"), types(inbox));
        assertTrue(inbox.get(1).get("payload").get("rejoined").asBoolean());
        assertEquals("r", inbox.get(0).get("request_id").asText());

        List<JsonNode> aliceInbox = drain(alice);
        assertTrue(types(aliceInbox).contains("PLAYER_JOINED"));
        long revision = inbox.get(0).get("payload").get("revision").asLong();
        JsonNode delta = aliceInbox.get(types(aliceInbox).indexOf("DELTA"));
        assertEquals(revision, delta.get("payload").get("new_revision").asLong());
    }

    @Test
    @DisplayName("Game requests outside a game report not_in_session")
    void testNotInSession() throws Exception {
        EmbeddedChannel channel = connect();
        login(channel, "Alice");

        send(channel, "{\"type\":\"PASS\",\"request_id\":\"p\"}");
        assertEquals("not_in_session", expect(channel, "ERROR").get("payload").get("reason").asText());

        send(channel, "{\"type\":\"JOIN_GAME\",\"payload\":{}}");
        assertEquals("malformed_message", expect(channel, "ERROR").get("payload").get("reason").asText());

        send(channel, "{\"type\":\"JOIN_GAME\",\"payload\":{\"session_id\":\"missing\"}}");
        assertEquals("session_not_found", expect(channel, "ERROR").get("payload").get("reason").asText());
    }
}
