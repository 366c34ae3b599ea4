package com.cryptsync.auth;

import com.cryptsync.protocol.CryptSyncException;
import com.cryptsync.protocol.ErrorCode;

/**
 * Authentication failed: bad display name, or unknown/expired token.
 * Reported to the client as AUTH_FAILURE.
 */
public class AuthException extends CryptSyncException {

    public AuthException(ErrorCode code, String message) {
        super(code, message);
    }
}
