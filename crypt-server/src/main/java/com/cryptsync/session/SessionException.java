package com.cryptsync.session;

import com.cryptsync.protocol.CryptSyncException;
import com.cryptsync.protocol.ErrorCode;

/**
 * A request that the session or session manager cannot honor in its current
 * state (unknown session, full roster, wrong lifecycle phase, expired reconnect).
 */
public class SessionException extends CryptSyncException {

    public SessionException(ErrorCode code, String message) {
        super(code, message);
    }
}
