package com.cryptsync.game;

import java.util.Collections;
import java.util.Map;

/**
 * Read access to one entity of a {@link GameState}.
 *
 * Only the canonical fields (hp, position, inventory and the like) are ever
 * captured into snapshots and diffed. Display hints are derived,
 * presentation-only values and never leave the game state.
 */
public interface EntityView {

    String getId();

    String getKind();

    boolean isAlive();

    /**
     * Persisted fields of this entity. Values must be JSON-convertible
     * (numbers, strings, booleans, lists, maps).
     */
    Map<String, Object> getCanonicalFields();

    default Map<String, Object> getDisplayHints() {
        return Collections.emptyMap();
    }
}
