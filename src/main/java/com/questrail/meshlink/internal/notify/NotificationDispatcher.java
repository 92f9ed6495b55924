package com.questrail.meshlink.internal.notify;

import com.questrail.meshlink.api.NotificationHandler;
import com.questrail.meshlink.api.Topic;
import com.questrail.meshlink.internal.time.WallClock;
import com.questrail.meshlink.observability.MeshLinkErrorEvent;
import com.questrail.meshlink.observability.MeshLinkObservabilitySink;
import com.questrail.meshlink.observability.NullObservabilitySink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * NotificationDispatcher
 * -----------------------------------------------------------------------------
 * Topic to handler registry for unsolicited inbound data.
 *
 * <p>One handler per topic; registering again replaces the previous handler.
 * Registration may happen from any thread. {@link #dispatch} runs on the link
 * executor, so handlers see frames in arrival order. A handler that throws is
 * logged and reported; dispatch of later frames is unaffected.</p>
 */
public final class NotificationDispatcher
{
    private static final Logger log = LoggerFactory.getLogger(NotificationDispatcher.class);

    private final Map<Topic, NotificationHandler> handlers = new ConcurrentHashMap<>();
    private final WallClock wallClock;
    private final MeshLinkObservabilitySink observabilitySink;

    public NotificationDispatcher(WallClock wallClock, MeshLinkObservabilitySink observabilitySink) {
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        this.observabilitySink = Objects.requireNonNullElse(observabilitySink, NullObservabilitySink.INSTANCE);
    }

    /**
     * Registers {@code handler} for {@code topic}.
     *
     * @return the handler it replaced, if any
     */
    public Optional<NotificationHandler> register(Topic topic, NotificationHandler handler) {
        Objects.requireNonNull(topic, "topic");
        Objects.requireNonNull(handler, "handler");
        return Optional.ofNullable(handlers.put(topic, handler));
    }

    /**
     * Removes the registration for {@code topic}. Idempotent.
     */
    public void unregister(Topic topic) {
        Objects.requireNonNull(topic, "topic");
        handlers.remove(topic);
    }

    /**
     * Removes the registration only if {@code handler} is still the one registered.
     */
    public void unregister(Topic topic, NotificationHandler handler) {
        Objects.requireNonNull(topic, "topic");
        Objects.requireNonNull(handler, "handler");
        handlers.remove(topic, handler);
    }

    public boolean isRegistered(Topic topic) {
        return handlers.containsKey(topic);
    }

    /**
     * Hands {@code data} to the handler registered for {@code topic}.
     *
     * @return {@code true} if a handler was registered (whether or not it threw)
     */
    public boolean dispatch(Topic topic, byte[] data) {
        Objects.requireNonNull(topic, "topic");
        Objects.requireNonNull(data, "data");

        NotificationHandler handler = handlers.get(topic);
        if (handler == null) {
            log.debug("No handler for {}; {} byte(s) dropped", topic, data.length);
            return false;
        }

        try {
            handler.onNotification(topic, data);
        } catch (RuntimeException e) {
            log.warn("Handler for {} failed", topic, e);
            observabilitySink.onError(new MeshLinkErrorEvent(
                    wallClock.now(), "Notification handler for " + topic + " failed", e));
        }
        return true;
    }
}
