package io.syncbeat.mirror;

/**
 * The remote rejected the credentials or returned no usable session.
 */
public class RemoteAuthException extends RemoteFetchException {

    public RemoteAuthException(String message) {
        super(message);
    }

    public RemoteAuthException(String message, Throwable cause) {
        super(message, cause);
    }
}
