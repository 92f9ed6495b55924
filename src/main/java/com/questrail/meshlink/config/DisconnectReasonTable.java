package com.questrail.meshlink.config;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Maps transport disconnect codes to {@link DisconnectCategory}.
 * Codes not in the table are {@link DisconnectCategory#LOST_CONNECTION}.
 */
public final class DisconnectReasonTable
{
    private final Map<Integer, DisconnectCategory> categories;

    private DisconnectReasonTable(Map<Integer, DisconnectCategory> categories) {
        this.categories = Map.copyOf(categories);
    }

    public DisconnectCategory classify(int reasonCode) {
        return categories.getOrDefault(reasonCode, DisconnectCategory.LOST_CONNECTION);
    }

    /**
     * Android GATT status codes as observed with mesh radios:
     * 133 (GATT_ERROR) points at a stale service cache, 257 (GATT_FAILURE) at a
     * stack fault that survives link retries. Everything else counts as a lost
     * connection.
     */
    public static DisconnectReasonTable defaults() {
        return builder()
                .map(133, DisconnectCategory.STALE_CACHE)
                .map(257, DisconnectCategory.PERSISTENT_STACK_FAULT)
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private final Map<Integer, DisconnectCategory> categories = new HashMap<>();

        public Builder map(int reasonCode, DisconnectCategory category) {
            categories.put(reasonCode, Objects.requireNonNull(category, "category"));
            return this;
        }

        public DisconnectReasonTable build() {
            return new DisconnectReasonTable(categories);
        }
    }
}
