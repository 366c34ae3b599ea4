package com.cryptsync.protocol;

/**
 * Base class for every failure that is reported back to a client.
 * The {@link ErrorCode} becomes the {@code reason} of the reply.
 */
public class CryptSyncException extends RuntimeException {

    private final ErrorCode code;

    public CryptSyncException(ErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    public CryptSyncException(ErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public ErrorCode getCode() {
        return code;
    }
}
