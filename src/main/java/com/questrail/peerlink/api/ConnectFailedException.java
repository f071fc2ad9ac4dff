package com.questrail.peerlink.api;

/**
 * A dial attempt failed: no transport configured, peer unreachable or refused,
 * or the transport's connect timeout elapsed.
 *
 * <p>Fatal to that attempt only. The runtime never retries on its own.</p>
 */
public final class ConnectFailedException extends NetworkException
{
    public ConnectFailedException(String message) {
        super(message);
    }

    public ConnectFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
