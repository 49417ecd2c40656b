package com.perimeter.sync.service;

import com.perimeter.sync.dto.DeviceIdentity;
import com.perimeter.sync.dto.DeviceRecord;
import com.perimeter.sync.dto.EffectiveState;
import org.springframework.stereotype.Component;

/**
 * Builds the status text written back to production for a derived state.
 *
 * Every string produced here maps back to the effective state it encodes,
 * so a cycle reading its own write-back reaches the same state.
 */
@Component
public class CanonicalStatusFormatter {

    static final String LINK_CONNECTED = StatusClassifier.GLOBAL_LINK_MARKER + StatusClassifier.CONNECTED_KEYWORD;
    static final String LINK_DISCONNECTED = StatusClassifier.GLOBAL_LINK_MARKER + StatusClassifier.DISCONNECTED_KEYWORD;

    /**
     * Fence zone text, e.g. {@code "Fence Controller FC-14 Line 0 Zone Z22 Fail"}.
     */
    public String zoneStatus(DeviceIdentity identity, EffectiveState state) {
        return zoneName(identity) + " " + keyword(state);
    }

    /**
     * Conventional production name of a fence zone device.
     */
    public String zoneName(DeviceIdentity identity) {
        return String.format("Fence Controller FC-%d Line %d Zone Z%d",
            identity.controllerId(), identity.line(), identity.zone());
    }

    public String linkStatus(boolean connected) {
        return connected ? LINK_CONNECTED : LINK_DISCONNECTED;
    }

    /**
     * Zone text for fence zones; devices without a zone keep their current text.
     */
    public String forZoneEvent(DeviceRecord device, EffectiveState state) {
        if (!device.isFenceZone()) {
            return device.rawState();
        }
        return zoneStatus(device.identity(), state);
    }

    /**
     * Text for a device swept up by a global-link event: fence zones get zone
     * text in their own vocabulary, everything else gets the link text.
     */
    public String forLinkEvent(DeviceRecord device, boolean connected) {
        if (device.isFenceZone()) {
            return zoneStatus(device.identity(), connected ? EffectiveState.NORMAL : EffectiveState.FAIL);
        }
        return linkStatus(connected);
    }

    private static String keyword(EffectiveState state) {
        return switch (state) {
            case FAIL -> StatusClassifier.FAIL_KEYWORD;
            case NORMAL -> StatusClassifier.NORMAL_KEYWORD;
            case ALARM -> StatusClassifier.ALARM_KEYWORD;
            case UNKNOWN -> throw new IllegalArgumentException("No canonical text for UNKNOWN");
        };
    }
}
