package com.questrail.meshlink.config;

import java.util.Objects;

/**
 * Family of radio devices that share connection quirks.
 * Plain data so that new families can be added by configuration.
 */
public record DeviceClass(String name)
{
    public static final DeviceClass GENERIC = new DeviceClass("generic");

    public DeviceClass {
        Objects.requireNonNull(name, "name");
    }
}
