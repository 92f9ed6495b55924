package com.questrail.meshlink.error;

/**
 * Root of every failure the link core reports through futures and listeners.
 *
 * <p>Unchecked: failures travel inside {@code CompletableFuture}s and are
 * inspected by type, not declared.</p>
 */
public class MeshLinkException extends RuntimeException
{
    public MeshLinkException(String message) {
        super(message);
    }

    public MeshLinkException(String message, Throwable cause) {
        super(message, cause);
    }
}
