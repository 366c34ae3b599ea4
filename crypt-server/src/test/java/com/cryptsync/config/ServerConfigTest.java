package com.cryptsync.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Server Config Tests")
class ServerConfigTest {

    @Test
    @DisplayName("Classpath defaults are loaded")
    void testDefaults() {
        ServerConfig config = ServerConfig.load(new Properties(), Map.of());

        assertEquals(8765, config.getPort());
        assertEquals("/play", config.getWebsocketPath());
        assertEquals(4, config.getMaxPlayersPerSession());
        assertEquals(4, config.getMaxActionsPerRound());
        assertEquals(Duration.ofSeconds(120), config.getDisconnectDeadline());
        assertEquals(Duration.ofSeconds(60), config.getSessionGracePeriod());
        assertEquals(256, config.getOutboundQueueCapacity());
        assertNull(config.getSeed());
    }

    @Test
    @DisplayName("System properties override defaults and the environment overrides both")
    void testOverrides() {
        Properties system = new Properties();
        system.setProperty("crypt.port", "9000");
        system.setProperty("crypt.max_actions_per_round", "6");
        system.setProperty("unrelated.port", "1");

        ServerConfig config = ServerConfig.load(system, Map.of(
                "CRYPT_PORT", "9100",
                "CRYPT_SEED", "1234",
                "PATH", "/usr/bin"));

        assertEquals(9100, config.getPort());
        assertEquals(6, config.getMaxActionsPerRound());
        assertEquals(1234L, config.getSeed());
        assertEquals("/play", config.getWebsocketPath());
    }

    @Test
    @DisplayName("Invalid values are rejected at startup")
    void testValidation() {
        Properties badNumber = new Properties();
        badNumber.setProperty("port", "eighty");
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> ServerConfig.fromProperties(badNumber));
        assertTrue(e.getMessage().contains("port"));

        assertThrows(IllegalArgumentException.class, () -> ServerConfig.builder().port(70000).build());
        assertThrows(IllegalArgumentException.class, () -> ServerConfig.builder().websocketPath("play").build());
        assertThrows(IllegalArgumentException.class, () -> ServerConfig.builder().maxActionsPerRound(0).build());
        assertThrows(IllegalArgumentException.class,
                () -> ServerConfig.builder().disconnectDeadline(Duration.ZERO).build());
    }

    @Test
    @DisplayName("toBuilder copies every field")
    void testToBuilder() {
        ServerConfig base = ServerConfig.builder().port(1234).chatLogSize(7).seed(9L).build();
        ServerConfig copy = base.toBuilder().port(4321).build();

        assertEquals(4321, copy.getPort());
        assertEquals(7, copy.getChatLogSize());
        assertEquals(9L, copy.getSeed());
    }
}
