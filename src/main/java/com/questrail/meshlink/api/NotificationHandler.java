package com.questrail.meshlink.api;

import java.util.Objects;
import java.util.concurrent.Executor;

/**
 * Callback for unsolicited inbound data on a {@link Topic}.
 *
 * <p>Handlers run on the link's serialized executor, in arrival order. They must
 * return quickly: a handler that needs to do real work should hand it off, for
 * example with {@link #async(Executor, NotificationHandler)}.</p>
 */
@FunctionalInterface
public interface NotificationHandler
{
    void onNotification(Topic topic, byte[] data);

    /**
     * Wraps a handler so that it runs on {@code executor} instead of the link
     * executor. The payload is handed over as-is.
     */
    static NotificationHandler async(Executor executor, NotificationHandler handler) {
        Objects.requireNonNull(executor, "executor");
        Objects.requireNonNull(handler, "handler");
        return (topic, data) -> executor.execute(() -> handler.onNotification(topic, data));
    }
}
