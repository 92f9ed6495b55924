package com.questrail.meshlink.transport;

import com.questrail.meshlink.api.PeerDevice;

import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

/**
 * TransportLink
 * -----------------------------------------------------------------------------
 * Port for a single-operation-at-a-time radio link (BLE GATT or an equivalent).
 *
 * <p>The link core never issues two data operations concurrently: the
 * operation queue guarantees that at most one of {@link #performWrite},
 * {@link #performRead}, {@link #setNotify} and {@link #performReliableWrite}
 * is outstanding. Implementations may rely on that.</p>
 *
 * <p>Every asynchronous result completes exactly once, on any thread. The link
 * core marshals completions onto its own executor.</p>
 */
public interface TransportLink
{
    /**
     * Register the listener for lifecycle and notification callbacks.
     * Must be called before {@link #connect(PeerDevice)}.
     */
    void setListener(TransportLinkListener listener);

    /**
     * Start connecting. Success is reported with
     * {@link TransportLinkListener#onLinkUp()}, failure with
     * {@link TransportLinkListener#onLinkDown(int)}.
     */
    void connect(PeerDevice device);

    /**
     * Close the link and release its resources. Idempotent. A link closed
     * this way is not reported through {@link TransportLinkListener#onLinkDown(int)}.
     */
    void disconnect();

    /**
     * Start pairing with {@code device}. The outcome is reported with
     * {@link TransportLinkListener#onAuthorizationResult(boolean)}.
     */
    void requestAuthorization(PeerDevice device);

    /**
     * {@code true} while the link is up and {@code characteristic} was resolved.
     */
    boolean isAvailable(CharacteristicId characteristic);

    /**
     * Discover the services of the connected peer.
     *
     * @return the characteristics found
     */
    CompletionStage<Set<CharacteristicId>> discoverServices();

    /**
     * Ask for a larger transfer unit.
     *
     * @return the negotiated size
     */
    CompletionStage<Integer> requestTransferUnit(int requestedSize);

    CompletionStage<Void> performWrite(CharacteristicId destination, byte[] payload);

    /**
     * Read the current value of {@code source}. An empty array means there is
     * nothing to read.
     */
    CompletionStage<byte[]> performRead(CharacteristicId source);

    CompletionStage<Void> setNotify(CharacteristicId source, boolean enabled);

    /**
     * Write with peer confirmation (begin, write, verify echo, execute or abort).
     */
    CompletionStage<Void> performReliableWrite(CharacteristicId destination, byte[] payload);

    /**
     * Drop the platform's cached service table for the connected peer.
     * Optional capability.
     */
    default CompletionStage<Void> invalidateCache() {
        return CompletableFuture.failedFuture(new UnsupportedOperationException("cache invalidation not supported"));
    }

    /**
     * Restart the local radio adapter (disable, then enable). Optional capability.
     */
    default CompletionStage<Void> restartAdapter() {
        return CompletableFuture.failedFuture(new UnsupportedOperationException("adapter restart not supported"));
    }
}
