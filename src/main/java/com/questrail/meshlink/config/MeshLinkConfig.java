package com.questrail.meshlink.config;

import java.util.Objects;

/**
 * Aggregated configuration of one mesh link.
 */
public record MeshLinkConfig(
        OperationTimingPolicy operationTiming,
        ReconnectPolicy reconnect,
        HandshakePolicy handshake,
        DeliveryPolicy delivery,
        DeviceQuirkTable deviceQuirks,
        DisconnectReasonTable disconnectReasons
) {
    public MeshLinkConfig {
        Objects.requireNonNull(operationTiming, "operationTiming");
        Objects.requireNonNull(reconnect, "reconnect");
        Objects.requireNonNull(handshake, "handshake");
        Objects.requireNonNull(delivery, "delivery");
        Objects.requireNonNull(deviceQuirks, "deviceQuirks");
        Objects.requireNonNull(disconnectReasons, "disconnectReasons");
    }

    public static MeshLinkConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private OperationTimingPolicy operationTiming = OperationTimingPolicy.defaults();
        private ReconnectPolicy reconnect = ReconnectPolicy.defaults();
        private HandshakePolicy handshake = HandshakePolicy.defaults();
        private DeliveryPolicy delivery = DeliveryPolicy.defaults();
        private DeviceQuirkTable deviceQuirks = DeviceQuirkTable.defaults();
        private DisconnectReasonTable disconnectReasons = DisconnectReasonTable.defaults();

        public Builder withOperationTiming(OperationTimingPolicy operationTiming) {
            this.operationTiming = operationTiming;
            return this;
        }

        public Builder withReconnect(ReconnectPolicy reconnect) {
            this.reconnect = reconnect;
            return this;
        }

        public Builder withHandshake(HandshakePolicy handshake) {
            this.handshake = handshake;
            return this;
        }

        public Builder withDelivery(DeliveryPolicy delivery) {
            this.delivery = delivery;
            return this;
        }

        public Builder withDeviceQuirks(DeviceQuirkTable deviceQuirks) {
            this.deviceQuirks = deviceQuirks;
            return this;
        }

        public Builder withDisconnectReasons(DisconnectReasonTable disconnectReasons) {
            this.disconnectReasons = disconnectReasons;
            return this;
        }

        public MeshLinkConfig build() {
            return new MeshLinkConfig(operationTiming, reconnect, handshake, delivery, deviceQuirks, disconnectReasons);
        }
    }
}
