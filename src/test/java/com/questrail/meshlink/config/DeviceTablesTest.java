package com.questrail.meshlink.config;

import com.questrail.meshlink.api.PeerDevice;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * DeviceTablesTest
 * -----------------------------------------------------------------------------
 * Device classification and disconnect reason mapping.
 */
class DeviceTablesTest {

    private static PeerDevice named(String name) {
        return PeerDevice.bonded("AA:BB:CC:DD:EE:FF", name);
    }

    @Test
    void esp32BoardsDropServiceCacheOnConnect() {
        DeviceQuirkTable table = DeviceQuirkTable.defaults();

        assertEquals(new DeviceClass("esp32"), table.classify(named("T-Beam 5e6f")));
        assertEquals(new DeviceClass("esp32"), table.classify(named("heltec v3")));
        assertTrue(table.quirksFor(named("TLoRa 12ab")).invalidateCacheOnConnect());
    }

    @Test
    void nrf52BoardsKeepServiceCache() {
        DeviceQuirkTable table = DeviceQuirkTable.defaults();

        assertEquals(new DeviceClass("nrf52"), table.classify(named("RAK4631 77aa")));
        assertFalse(table.quirksFor(named("T-Echo 0101")).invalidateCacheOnConnect());
    }

    @Test
    void unknownDevicesAreGeneric() {
        DeviceQuirkTable table = DeviceQuirkTable.defaults();

        assertEquals(DeviceClass.GENERIC, table.classify(named("Meshtastic 1a2b")));
        assertEquals(DeviceQuirks.NONE, table.quirksFor(named("Meshtastic 1a2b")));
    }

    @Test
    void firstMatchingRuleWins() {
        DeviceClass first = new DeviceClass("first");
        DeviceClass second = new DeviceClass("second");
        DeviceQuirkTable table = DeviceQuirkTable.builder()
                .rule("Node.*", first)
                .rule("Node 1.*", second)
                .quirks(second, new DeviceQuirks(true))
                .build();

        assertEquals(first, table.classify(named("Node 1234")));
        assertEquals(DeviceQuirks.NONE, table.quirksFor(named("Node 1234")));
    }

    @Test
    void disconnectCodesMapToCategories() {
        DisconnectReasonTable reasons = DisconnectReasonTable.defaults();

        assertEquals(DisconnectCategory.STALE_CACHE, reasons.classify(133));
        assertEquals(DisconnectCategory.PERSISTENT_STACK_FAULT, reasons.classify(257));
        assertEquals(DisconnectCategory.LOST_CONNECTION, reasons.classify(8));
        assertEquals(DisconnectCategory.LOST_CONNECTION, reasons.classify(-1));
    }

    @Test
    void customReasonTableOverridesDefaults() {
        DisconnectReasonTable reasons = DisconnectReasonTable.builder()
                .map(19, DisconnectCategory.PERSISTENT_STACK_FAULT)
                .build();

        assertEquals(DisconnectCategory.PERSISTENT_STACK_FAULT, reasons.classify(19));
        assertEquals(DisconnectCategory.LOST_CONNECTION, reasons.classify(133));
    }
}
