package com.questrail.meshlink.internal.delivery;

import com.questrail.meshlink.api.PacketId;

/**
 * Produces packet ids from a counter that wraps modulo {@code 2^32 - 1}; the
 * id is the counter plus one, so it is never zero and the sequence runs
 * {@code 1 .. 2^32 - 1} before starting over.
 *
 * <p>Not thread-safe; owned by the delivery queue on the link executor.</p>
 */
public final class PacketIdGenerator
{
    private static final long COUNTER_MASK = 0xFFFF_FFFFL;
    private static final long ID_SPACE = 0xFFFF_FFFFL;

    private long counter;

    public PacketIdGenerator() {
        this(0);
    }

    /**
     * @param seed starting counter value; randomize it to avoid reusing ids
     *             across process restarts
     */
    public PacketIdGenerator(long seed) {
        this.counter = (seed & COUNTER_MASK) % ID_SPACE;
    }

    public PacketId next() {
        counter = (counter + 1) % ID_SPACE;
        return PacketId.of(counter + 1);
    }
}
