package com.cryptsync.sync;

import com.cryptsync.protocol.CryptSyncException;
import com.cryptsync.protocol.ErrorCode;

/**
 * A delta was offered to a replica whose revision is not the delta's base.
 * The replica must discard it and request a full snapshot.
 */
public class StaleRevisionException extends CryptSyncException {

    private final long expectedBase;
    private final long actualRevision;

    public StaleRevisionException(long expectedBase, long actualRevision) {
        super(ErrorCode.STALE_REVISION,
                "Delta is based on revision " + expectedBase + " but replica is at " + actualRevision);
        this.expectedBase = expectedBase;
        this.actualRevision = actualRevision;
    }

    public long getExpectedBase() {
        return expectedBase;
    }

    public long getActualRevision() {
        return actualRevision;
    }
}
