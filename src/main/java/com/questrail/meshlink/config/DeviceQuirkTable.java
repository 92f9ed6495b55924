package com.questrail.meshlink.config;

import com.questrail.meshlink.api.PeerDevice;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * DeviceQuirkTable
 * -----------------------------------------------------------------------------
 * Injected policy that classifies a peer device and yields its quirks.
 *
 * <p>Classification walks the rules in insertion order; the first rule whose
 * pattern matches the advertised device name wins. Unmatched devices are
 * {@link DeviceClass#GENERIC}. Classes without an explicit quirk entry have
 * {@link DeviceQuirks#NONE}.</p>
 */
public final class DeviceQuirkTable
{
    /**
     * One classification rule.
     */
    public record Rule(Pattern namePattern, DeviceClass deviceClass) {
        public Rule {
            Objects.requireNonNull(namePattern, "namePattern");
            Objects.requireNonNull(deviceClass, "deviceClass");
        }
    }

    private final List<Rule> rules;
    private final Map<DeviceClass, DeviceQuirks> quirks;

    private DeviceQuirkTable(List<Rule> rules, Map<DeviceClass, DeviceQuirks> quirks) {
        this.rules = List.copyOf(rules);
        this.quirks = Map.copyOf(quirks);
    }

    public DeviceClass classify(PeerDevice device) {
        Objects.requireNonNull(device, "device");
        for (Rule rule : rules) {
            if (rule.namePattern().matcher(device.name()).matches()) {
                return rule.deviceClass();
            }
        }
        return DeviceClass.GENERIC;
    }

    public DeviceQuirks quirksFor(PeerDevice device) {
        return quirks.getOrDefault(classify(device), DeviceQuirks.NONE);
    }

    /**
     * ESP32 based boards keep a stale service table across firmware updates and
     * need the cache dropped on connect; nRF52 boards disconnect when it is
     * dropped and must skip it.
     */
    public static DeviceQuirkTable defaults() {
        DeviceClass esp32 = new DeviceClass("esp32");
        DeviceClass nrf52 = new DeviceClass("nrf52");
        return builder()
                .rule("(?i)(t-?beam|tlora|t-?lora|heltec|station g\\d).*", esp32)
                .rule("(?i)(rak|wisblock|t-?echo|nrf).*", nrf52)
                .quirks(esp32, new DeviceQuirks(true))
                .quirks(nrf52, DeviceQuirks.NONE)
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private final List<Rule> rules = new ArrayList<>();
        private final Map<DeviceClass, DeviceQuirks> quirks = new HashMap<>();

        public Builder rule(String nameRegex, DeviceClass deviceClass) {
            rules.add(new Rule(Pattern.compile(nameRegex), deviceClass));
            return this;
        }

        public Builder quirks(DeviceClass deviceClass, DeviceQuirks deviceQuirks) {
            quirks.put(Objects.requireNonNull(deviceClass, "deviceClass"),
                    Objects.requireNonNull(deviceQuirks, "deviceQuirks"));
            return this;
        }

        public DeviceQuirkTable build() {
            return new DeviceQuirkTable(rules, quirks);
        }
    }
}
