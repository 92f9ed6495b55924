package com.questrail.meshlink.internal.lifecycle;

/**
 * Progress of the configuration handshake.
 */
public enum HandshakeProgress
{
    NOT_STARTED,
    SENDING_HANDSHAKE,
    WAITING_FOR_CONFIG,
    DOWNLOADING_CONFIG,
    COMPLETE
}
