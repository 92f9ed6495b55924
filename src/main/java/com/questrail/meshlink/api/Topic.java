package com.questrail.meshlink.api;

import java.util.Objects;
import java.util.Set;

/**
 * Topic
 * -----------------------------------------------------------------------------
 * Identifier under which unsolicited inbound data is dispatched.
 *
 * <p>Application topics correspond to mesh application ports (for example
 * {@code port:1} for text messages). A small set of reserved topics carries the
 * link's own control traffic: acknowledgment frames, radio queue status and
 * configuration download frames. Reserved topics are consumed internally and
 * cannot be registered through {@link MeshLinkClient}.</p>
 */
public record Topic(String value)
{
    /** Routing frames that acknowledge (or reject) a previously sent packet. */
    public static final Topic ROUTING = new Topic("link:routing");

    /** Radio transmit-queue status reports. */
    public static final Topic QUEUE_STATUS = new Topic("link:queue-status");

    /** Marker that ends the configuration download started by the handshake. */
    public static final Topic CONFIG_COMPLETE = new Topic("link:config-complete");

    /** Configuration records streamed during the handshake. */
    public static final Topic CONFIG = new Topic("link:config");

    private static final Set<Topic> RESERVED = Set.of(ROUTING, QUEUE_STATUS, CONFIG_COMPLETE, CONFIG);

    public Topic {
        Objects.requireNonNull(value, "value");
        if (value.isBlank()) {
            throw new IllegalArgumentException("topic must not be blank");
        }
    }

    /**
     * Topic for a mesh application port number.
     */
    public static Topic port(int portNumber) {
        if (portNumber < 0 || portNumber > 0xFFFF) {
            throw new IllegalArgumentException("port out of range: " + portNumber);
        }
        return new Topic("port:" + portNumber);
    }

    /**
     * Port number of an application topic, or -1 when the topic is not a port topic.
     */
    public int portNumber() {
        if (!value.startsWith("port:")) {
            return -1;
        }
        try {
            return Integer.parseInt(value.substring(5));
        } catch (NumberFormatException e) {
            return -1;
        }
    }

    public boolean isReserved() {
        return RESERVED.contains(this);
    }

    @Override
    public String toString() {
        return value;
    }
}
