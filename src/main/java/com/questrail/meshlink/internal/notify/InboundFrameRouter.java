package com.questrail.meshlink.internal.notify;

import com.questrail.meshlink.codec.FrameCodec;
import com.questrail.meshlink.codec.FrameDecodeException;
import com.questrail.meshlink.codec.InboundFrame;
import com.questrail.meshlink.internal.time.WallClock;
import com.questrail.meshlink.observability.MeshLinkErrorEvent;
import com.questrail.meshlink.observability.MeshLinkObservabilitySink;
import com.questrail.meshlink.observability.NullObservabilitySink;

import java.util.Objects;

/**
 * Decodes raw FromRadio frames and passes them to the dispatcher.
 *
 * <p>This is the decode boundary: a frame that does not decode is reported and
 * dropped, and the link carries on.</p>
 */
public final class InboundFrameRouter
{
    private final FrameCodec codec;
    private final NotificationDispatcher dispatcher;
    private final WallClock wallClock;
    private final MeshLinkObservabilitySink observabilitySink;

    public InboundFrameRouter(FrameCodec codec,
                              NotificationDispatcher dispatcher,
                              WallClock wallClock,
                              MeshLinkObservabilitySink observabilitySink)
    {
        this.codec = Objects.requireNonNull(codec, "codec");
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        this.observabilitySink = Objects.requireNonNullElse(observabilitySink, NullObservabilitySink.INSTANCE);
    }

    /**
     * Routes one raw frame. Must be called on the link executor.
     */
    public void route(byte[] raw) {
        InboundFrame frame;
        try {
            frame = codec.decode(raw);
        } catch (FrameDecodeException e) {
            observabilitySink.onError(new MeshLinkErrorEvent(wallClock.now(), "Dropped undecodable frame", e));
            return;
        }
        dispatcher.dispatch(frame.topic(), frame.payload());
    }
}
