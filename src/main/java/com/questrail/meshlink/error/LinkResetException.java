package com.questrail.meshlink.error;

/**
 * Work was discarded because the link was reset (reconnect, teardown or
 * explicit disconnect).
 */
public final class LinkResetException extends MeshLinkException
{
    public LinkResetException(String reason) {
        super("link reset: " + reason);
    }
}
