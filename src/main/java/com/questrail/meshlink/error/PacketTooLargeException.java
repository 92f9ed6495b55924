package com.questrail.meshlink.error;

/**
 * A framed packet exceeds what the radio accepts in one write.
 */
public final class PacketTooLargeException extends MeshLinkException
{
    private final int actualSize;
    private final int maxSize;

    public PacketTooLargeException(int actualSize, int maxSize) {
        super("packet of " + actualSize + " bytes exceeds maximum of " + maxSize);
        this.actualSize = actualSize;
        this.maxSize = maxSize;
    }

    public int actualSize() {
        return actualSize;
    }

    public int maxSize() {
        return maxSize;
    }
}
