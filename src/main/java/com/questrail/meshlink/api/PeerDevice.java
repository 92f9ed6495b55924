package com.questrail.meshlink.api;

import java.util.Objects;

/**
 * Identity of a discovered radio peer.
 *
 * @param address transport address (MAC address, {@code host:port}, ...)
 * @param name    advertised device name, used for quirk classification; may be empty
 * @param bonded  whether pairing with this device is already established
 */
public record PeerDevice(String address, String name, boolean bonded)
{
    public PeerDevice {
        Objects.requireNonNull(address, "address");
        name = name == null ? "" : name;
    }

    public static PeerDevice bonded(String address, String name) {
        return new PeerDevice(address, name, true);
    }
}
