package com.questrail.meshlink.config;

/**
 * Connection quirks of a {@link DeviceClass}.
 *
 * @param invalidateCacheOnConnect drop the cached service table after every link-up
 */
public record DeviceQuirks(boolean invalidateCacheOnConnect)
{
    public static final DeviceQuirks NONE = new DeviceQuirks(false);
}
