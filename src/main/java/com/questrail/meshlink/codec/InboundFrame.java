package com.questrail.meshlink.codec;

import com.questrail.meshlink.api.Topic;

import java.util.Objects;

/**
 * An inbound frame classified by topic. {@code payload} is the frame body
 * without the classification header.
 */
public record InboundFrame(Topic topic, byte[] payload)
{
    public InboundFrame {
        Objects.requireNonNull(topic, "topic");
        Objects.requireNonNull(payload, "payload");
    }
}
