package com.cryptsync.protocol;

/**
 * A frame could not be understood: malformed JSON, unknown type, or a message
 * sent before authentication. The connection stays open.
 */
public class ProtocolException extends CryptSyncException {

    public ProtocolException(ErrorCode code, String message) {
        super(code, message);
    }

    public ProtocolException(ErrorCode code, String message, Throwable cause) {
        super(code, message, cause);
    }
}
