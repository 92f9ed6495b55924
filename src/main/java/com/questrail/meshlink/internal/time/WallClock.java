package com.questrail.meshlink.internal.time;

import java.time.Instant;

/**
 * Wall-clock source used for observability event stamps and
 * {@code PendingPacket.createdAt}. May jump; never used for timing decisions.
 */
public interface WallClock
{
    Instant now();
}
