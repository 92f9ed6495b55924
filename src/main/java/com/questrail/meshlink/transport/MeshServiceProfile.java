package com.questrail.meshlink.transport;

import java.util.Set;
import java.util.UUID;

/**
 * Service and characteristic layout exposed by a mesh radio.
 *
 * <ul>
 *   <li>{@link #TO_RADIO}: outbound frames (write / reliable write)</li>
 *   <li>{@link #FROM_RADIO}: inbound frames, read until empty</li>
 *   <li>{@link #FROM_NUM}: notifies that new inbound frames are waiting</li>
 * </ul>
 */
public final class MeshServiceProfile
{
    public static final UUID SERVICE_UUID = UUID.fromString("6ba1b218-15a8-461f-9fa8-5dcae273eafd");

    public static final CharacteristicId TO_RADIO =
            new CharacteristicId(UUID.fromString("f75c76d2-129e-4dad-a1dd-7866124401e7"), "ToRadio");

    public static final CharacteristicId FROM_RADIO =
            new CharacteristicId(UUID.fromString("2c55e69e-4993-11ed-b878-0242ac120002"), "FromRadio");

    public static final CharacteristicId FROM_NUM =
            new CharacteristicId(UUID.fromString("ed9da18c-a800-4f66-a670-aa7547e34453"), "FromNum");

    /** Characteristics without which the link cannot be used. */
    public static final Set<CharacteristicId> REQUIRED = Set.of(TO_RADIO, FROM_RADIO, FROM_NUM);

    private MeshServiceProfile() {
    }
}
