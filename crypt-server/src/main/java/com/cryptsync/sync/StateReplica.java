package com.cryptsync.sync;

/**
 * A receiver-side copy of a session's state.
 *
 * Deltas are applied only if they start exactly at the replica's revision.
 * Anything else is discarded and the replica flags that it needs a full
 * snapshot; it never guesses.
 */
public class StateReplica {

    private final DeltaEncoder encoder;
    private StateSnapshot state;
    private boolean resyncRequired = true;

    public StateReplica(DeltaEncoder encoder) {
        this.encoder = encoder;
    }

    public void acceptSnapshot(StateSnapshot snapshot) {
        this.state = snapshot;
        this.resyncRequired = false;
    }

    /**
     * @return true if the delta was applied, false if it was discarded and a
     *         resync is now required
     */
    public boolean acceptDelta(StateDelta delta) {
        if (state == null) {
            resyncRequired = true;
            return false;
        }
        if (delta.getNewRevision() <= state.getRevision()) {
            // already covered by a newer snapshot
            return false;
        }
        try {
            state = encoder.applyDelta(state, delta);
            return true;
        } catch (StaleRevisionException e) {
            resyncRequired = true;
            return false;
        }
    }

    public StateSnapshot getState() {
        return state;
    }

    public long getRevision() {
        return state == null ? 0 : state.getRevision();
    }

    public boolean isResyncRequired() {
        return resyncRequired;
    }
}
