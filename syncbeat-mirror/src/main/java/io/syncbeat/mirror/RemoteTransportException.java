package io.syncbeat.mirror;

/**
 * Network failure, non-success status or malformed response from the remote.
 */
public class RemoteTransportException extends RemoteFetchException {

    public RemoteTransportException(String message) {
        super(message);
    }

    public RemoteTransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
