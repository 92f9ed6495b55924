package com.questrail.meshlink.error;

import java.util.Objects;

/**
 * The link could not be brought to the ready state. Surfaced to the caller
 * of {@code connect}; the lifecycle does not retry it on its own.
 */
public final class HandshakeFailedException extends MeshLinkException
{
    /**
     * Lifecycle step at which the handshake broke down.
     */
    public enum Stage {
        AUTHORIZATION("authorization"),
        SERVICE_RESOLUTION("service resolution"),
        CONFIG_REQUEST("configuration request"),
        CONFIG_DOWNLOAD("configuration download"),
        RECONNECT("reconnect");

        private final String label;

        Stage(String label) {
            this.label = label;
        }

        public String label() {
            return label;
        }
    }

    private final Stage stage;

    public HandshakeFailedException(Stage stage, String message) {
        super("Handshake failed during " + Objects.requireNonNull(stage, "stage").label() + ": " + message);
        this.stage = stage;
    }

    public Stage stage() {
        return stage;
    }
}
