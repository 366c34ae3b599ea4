package com.cryptsync.protocol.action;

import com.cryptsync.game.GameAction;
import com.cryptsync.protocol.ErrorCode;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Maps {@code {action_type, params}} to concrete {@link GameAction} objects.
 *
 * Action types are looked up in an open registry, so rulesets and plugins add
 * new actions with {@link #register} without touching the codec. Type names
 * are case-insensitive.
 *
 * Thread Safety:
 * - Registry is a ConcurrentHashMap; registration may happen at any time
 * - Factories themselves must be stateless
 */
public class ActionCodec {

    private static final Logger logger = LoggerFactory.getLogger(ActionCodec.class);

    private final Map<String, ActionFactory> factories = new ConcurrentHashMap<>();

    /**
     * Registers (or replaces) the factory for an action type.
     */
    public void register(String actionType, ActionFactory factory) {
        if (actionType == null || actionType.isBlank()) {
            throw new IllegalArgumentException("Action type must not be blank");
        }
        if (factory == null) {
            throw new IllegalArgumentException("Factory must not be null");
        }
        ActionFactory previous = factories.put(normalize(actionType), factory);
        if (previous != null) {
            logger.warn("Replaced factory for action type {}", actionType);
        } else {
            logger.debug("Registered action type: {}", actionType);
        }
    }

    public boolean isRegistered(String actionType) {
        return actionType != null && factories.containsKey(normalize(actionType));
    }

    public Set<String> getRegisteredTypes() {
        return Collections.unmodifiableSet(new TreeSet<>(factories.keySet()));
    }

    /**
     * Builds the action for a request.
     *
     * @throws ActionException {@code UNKNOWN_ACTION} if no factory is registered,
     *                         {@code INVALID_PARAMS} if the factory rejects the parameters
     */
    public GameAction decode(String actionType, String actorId, JsonNode params) {
        if (actionType == null || actionType.isBlank()) {
            throw new ActionException(ErrorCode.INVALID_PARAMS, "action_type is required");
        }
        ActionFactory factory = factories.get(normalize(actionType));
        if (factory == null) {
            throw new ActionException(ErrorCode.UNKNOWN_ACTION, "Unknown action type: " + actionType);
        }

        JsonNode effectiveParams = params != null && !params.isNull()
                ? params
                : JsonNodeFactory.instance.objectNode();
        if (!effectiveParams.isObject()) {
            throw new ActionException(ErrorCode.INVALID_PARAMS, "params must be an object");
        }

        GameAction action;
        try {
            action = factory.create(actorId, effectiveParams);
        } catch (ActionException e) {
            throw e;
        } catch (RuntimeException e) {
            logger.debug("Factory for {} rejected params {}", actionType, effectiveParams, e);
            throw new ActionException(ErrorCode.INVALID_PARAMS,
                    "Invalid params for " + actionType + ": " + e.getMessage());
        }
        if (action == null) {
            throw new ActionException(ErrorCode.INVALID_PARAMS, "No action built for " + actionType);
        }
        return action;
    }

    private static String normalize(String actionType) {
        return actionType.trim().toUpperCase(Locale.ROOT);
    }
}
