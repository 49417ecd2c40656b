package com.perimeter.sync.dto;

/**
 * Structural position of a device on the perimeter.
 *
 * @param controllerId fence controller id (the {@code FC-<n>} part of the name)
 * @param line         line index under the controller
 * @param zone         zone index on the line, {@code null} for the global-link device
 */
public record DeviceIdentity(int controllerId, int line, Integer zone) {

    public static DeviceIdentity ofZone(int controllerId, int line, int zone) {
        return new DeviceIdentity(controllerId, line, zone);
    }

    /**
     * Same controller and line, without the zone.
     */
    public DeviceIdentity withoutZone() {
        return new DeviceIdentity(controllerId, line, null);
    }

    public boolean hasZone() {
        return zone != null;
    }

    public boolean sameLine(DeviceIdentity other) {
        return other != null && controllerId == other.controllerId && line == other.line;
    }
}
