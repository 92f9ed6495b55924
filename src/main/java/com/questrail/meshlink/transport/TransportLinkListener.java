package com.questrail.meshlink.transport;

/**
 * TransportLinkListener
 * -----------------------------------------------------------------------------
 * Callback sink for {@link TransportLink}.
 *
 * <p>Callbacks may arrive on any thread. The receiving side marshals them onto
 * the link executor before touching state.</p>
 */
public interface TransportLinkListener
{
    /** The physical link is connected. */
    void onLinkUp();

    /**
     * The physical link dropped or could not be established. Not called for
     * a close requested through {@link TransportLink#disconnect()}.
     *
     * @param reasonCode transport status code, classified by the lifecycle
     */
    void onLinkDown(int reasonCode);

    /** Outcome of {@link TransportLink#requestAuthorization}. */
    void onAuthorizationResult(boolean granted);

    /** Notification on a characteristic with notifications enabled. */
    void onNotification(CharacteristicId source, byte[] value);
}
