package com.cryptsync.sync;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.List;

/**
 * Tracks the last-broadcast snapshot of one session and numbers revisions.
 *
 * Publishing is done by the owning session on its executor. The current
 * snapshot is published through a volatile field so readers on other threads
 * always see a complete, immutable snapshot.
 */
public class StateSynchronizer {

    private static final Logger logger = LoggerFactory.getLogger(StateSynchronizer.class);

    private final DeltaEncoder encoder;
    private volatile StateSnapshot current;

    public StateSynchronizer(DeltaEncoder encoder) {
        this.encoder = encoder;
    }

    /**
     * Publishes a full snapshot, e.g. when the game starts.
     *
     * @param draft snapshot contents; its revision is assigned here
     */
    public StateSnapshot publishSnapshot(StateSnapshot.Builder draft) {
        StateSnapshot snapshot = draft.revision(getRevision() + 1).build();
        current = snapshot;
        logger.debug("Published snapshot {} for session {}", snapshot.getRevision(), snapshot.getSessionId());
        return snapshot;
    }

    /**
     * Publishes the next revision as a delta against the last broadcast.
     *
     * @param draft  snapshot contents; its revision is assigned here
     * @param events display-only messages to attach
     * @return the delta, or null if nothing synchronized changed (no revision is consumed)
     */
    public StateDelta publishDelta(StateSnapshot.Builder draft, List<String> events) {
        StateSnapshot base = current;
        if (base == null) {
            throw new IllegalStateException("No snapshot has been published yet");
        }
        StateSnapshot next = draft.revision(base.getRevision() + 1).build();
        StateDelta delta = encoder.computeDelta(base, next, events);
        if (delta.isEmpty()) {
            return null;
        }
        current = next;
        logger.debug("Published delta {} for session {}: {} entity, {} roster changes",
                next.getRevision(), next.getSessionId(), delta.getEntities().size(), delta.getPlayers().size());
        return delta;
    }

    /**
     * Whether {@code draft} differs from the last broadcast in anything that
     * would be synchronized. Nothing is published.
     */
    public boolean hasUnpublishedChanges(StateSnapshot.Builder draft) {
        StateSnapshot base = current;
        if (base == null) {
            return true;
        }
        StateSnapshot next = draft.revision(base.getRevision() + 1).build();
        return !encoder.computeDelta(base, next, Collections.emptyList()).isEmpty();
    }

    /**
     * The last published snapshot, or null before the first publish.
     */
    public StateSnapshot getCurrent() {
        return current;
    }

    public long getRevision() {
        StateSnapshot snapshot = current;
        return snapshot == null ? 0 : snapshot.getRevision();
    }

    public boolean hasSnapshot() {
        return current != null;
    }
}
