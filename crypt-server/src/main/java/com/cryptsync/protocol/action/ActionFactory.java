package com.cryptsync.protocol.action;

import com.cryptsync.game.GameAction;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Builds a concrete action from wire parameters.
 */
@FunctionalInterface
public interface ActionFactory {

    /**
     * @param actorId entity id of the acting player
     * @param params  the {@code params} object of the ACTION payload, never null
     * @throws ActionException with {@code INVALID_PARAMS} if the parameters are unusable
     */
    GameAction create(String actorId, JsonNode params);
}
