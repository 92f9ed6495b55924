package com.questrail.meshlink.api;

/**
 * Receives every published {@link ConnectionState}, in order.
 */
@FunctionalInterface
public interface ConnectionStateListener
{
    void onConnectionState(ConnectionState state);
}
