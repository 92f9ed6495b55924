package com.questrail.meshlink.error;

/**
 * The transport endpoint or the target characteristic is absent, typically
 * because the link was torn down while work was queued. Never retried.
 */
public final class TransportUnavailableException extends MeshLinkException
{
    public TransportUnavailableException(String message) {
        super(message);
    }
}
