package io.syncbeat.mirror;

/**
 * Base type for failures talking to the remote system.
 */
public abstract class RemoteFetchException extends RuntimeException {

    protected RemoteFetchException(String message) {
        super(message);
    }

    protected RemoteFetchException(String message, Throwable cause) {
        super(message, cause);
    }
}
