package com.questrail.meshlink.transport;

import java.util.Objects;
import java.util.UUID;

/**
 * Addressable endpoint on the peer (a GATT characteristic for radio links).
 *
 * @param uuid characteristic UUID
 * @param name short diagnostic name used in logs
 */
public record CharacteristicId(UUID uuid, String name)
{
    public CharacteristicId {
        Objects.requireNonNull(uuid, "uuid");
        Objects.requireNonNull(name, "name");
    }

    @Override
    public String toString() {
        return name;
    }
}
