package com.cryptsync.protocol.action;

import com.cryptsync.protocol.CryptSyncException;
import com.cryptsync.protocol.ErrorCode;

/**
 * An action was rejected. The game state is untouched and only the
 * originating player is told.
 */
public class ActionException extends CryptSyncException {

    public ActionException(ErrorCode code, String message) {
        super(code, message);
    }
}
