package com.cryptsync.protocol.action;

import com.cryptsync.game.GameAction;
import com.cryptsync.game.GameState;
import com.cryptsync.game.Outcome;
import com.cryptsync.protocol.ErrorCode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Action Codec Tests")
class ActionCodecTest {

    private ActionCodec codec;

    @BeforeEach
    void setUp() {
        codec = new ActionCodec();
        codec.register("STEP", (actor, params) -> {
            if (!params.has("n")) {
                throw new IllegalArgumentException("n is required");
            }
            return new Noop(actor);
        });
        codec.register("rest", (actor, params) -> new Noop(actor));
    }

    @Test
    @DisplayName("Registered types are normalized to upper case")
    void testRegistration() {
        assertEquals(Set.of("REST", "STEP"), codec.getRegisteredTypes());
        assertTrue(codec.isRegistered("rest"));
        assertThrows(IllegalArgumentException.class, () -> codec.register(" ", (a, p) -> new Noop(a)));
        assertThrows(IllegalArgumentException.class, () -> codec.register("JUMP", null));
    }

    @Test
    @DisplayName("Decoding builds an action for the actor")
    void testDecode() {
        ObjectNode params = JsonNodeFactory.instance.objectNode();
        params.put("n", 1);

        GameAction action = codec.decode("step", "e:1", params);
        assertEquals("e:1", action.getActorId());
        assertEquals("e:2", codec.decode("REST", "e:2", null).getActorId());
    }

    @Test
    @DisplayName("Unknown types and bad params are reported distinctly")
    void testDecodeErrors() {
        assertEquals(ErrorCode.UNKNOWN_ACTION,
                assertThrows(ActionException.class, () -> codec.decode("FLY", "e:1", null)).getCode());
        assertEquals(ErrorCode.INVALID_PARAMS,
                assertThrows(ActionException.class, () -> codec.decode(" ", "e:1", null)).getCode());
        assertEquals(ErrorCode.INVALID_PARAMS,
                assertThrows(ActionException.class, () -> codec.decode("STEP", "e:1", null)).getCode());
        assertEquals(ErrorCode.INVALID_PARAMS, assertThrows(ActionException.class,
                () -> codec.decode("STEP", "e:1", JsonNodeFactory.instance.arrayNode())).getCode());
    }

    private static final class Noop implements GameAction {
        private final String actor;

        Noop(String actor) {
            this.actor = actor;
        }

        @Override
        public String getActorId() {
            return actor;
        }

        @Override
        public boolean validate(GameState context) {
            return true;
        }

        @Override
        public Outcome execute(GameState context) {
            return Outcome.success();
        }
    }
}
