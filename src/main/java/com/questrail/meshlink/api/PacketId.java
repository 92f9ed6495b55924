package com.questrail.meshlink.api;

/**
 * PacketId
 * -----------------------------------------------------------------------------
 * Unsigned 32-bit identifier of an application packet.
 *
 * <p>The value is stored in a Java {@code int} and interpreted as unsigned.
 * Zero is reserved by the radio ("let the device pick an id") and is never a
 * valid packet id.</p>
 */
public record PacketId(int value)
{
    public PacketId {
        if (value == 0) {
            throw new IllegalArgumentException("packet id must be non-zero");
        }
    }

    public static PacketId of(long unsignedValue) {
        if (unsignedValue <= 0 || unsignedValue > 0xFFFF_FFFFL) {
            throw new IllegalArgumentException("packet id out of range: " + unsignedValue);
        }
        return new PacketId((int) unsignedValue);
    }

    public long unsignedValue() {
        return Integer.toUnsignedLong(value);
    }

    @Override
    public String toString() {
        return Long.toString(unsignedValue());
    }
}
