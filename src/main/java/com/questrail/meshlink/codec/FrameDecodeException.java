package com.questrail.meshlink.codec;

/**
 * An inbound frame could not be classified or one of its fields could not
 * be parsed. Frames that fail to decode are dropped at the routing boundary;
 * they never affect link or packet state.
 */
public final class FrameDecodeException extends RuntimeException
{
    public FrameDecodeException(String message) {
        super(message);
    }
}
