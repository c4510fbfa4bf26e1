package com.questrail.helixd.server;

/**
 * The daemon could not start serving: the socket path could not be prepared
 * or the endpoint could not be bound. This is the only fatal error.
 */
public final class DaemonStartupException extends RuntimeException
{
    public DaemonStartupException(String message, Throwable cause) {
        super(message, cause);
    }
}
