package com.perimeter.sync.dto;

import java.time.LocalDateTime;
import java.util.Objects;

/**
 * Immutable value copy of one cached device.
 *
 * Records flow between the cache store, the cascade engine and the
 * production write-back. Nothing outside the cache store ever holds a
 * managed JPA entity, so every change is made by deriving a new record
 * with one of the {@code with*} methods and upserting it.
 *
 * @param name           unique device name, primary key
 * @param rawState       last observed or regenerated status text
 * @param effectiveState derived status, never null
 * @param lastSetTime    production change time of the last applied row
 * @param identity       parsed position, {@code null} when the name is unparseable
 * @param deviceType     FENCE_ZONE iff {@code identity.zone} is present
 */
public record DeviceRecord(
    String name,
    String rawState,
    EffectiveState effectiveState,
    LocalDateTime lastSetTime,
    DeviceIdentity identity,
    DeviceType deviceType
) {

    public DeviceRecord {
        Objects.requireNonNull(name, "name");
        if (effectiveState == null) {
            effectiveState = EffectiveState.UNKNOWN;
        }
        if (deviceType == null) {
            deviceType = DeviceType.UNKNOWN;
        }
        if (deviceType == DeviceType.FENCE_ZONE && (identity == null || !identity.hasZone())) {
            throw new IllegalArgumentException("Fence zone device requires a zone: " + name);
        }
        if (deviceType != DeviceType.FENCE_ZONE && identity != null && identity.hasZone()) {
            throw new IllegalArgumentException("Only fence zone devices carry a zone: " + name);
        }
    }

    /**
     * First sighting of a device: nothing derived yet.
     */
    public static DeviceRecord unseen(String name) {
        return new DeviceRecord(name, null, EffectiveState.UNKNOWN, null, null, DeviceType.UNKNOWN);
    }

    public DeviceRecord withRawState(String newRawState) {
        return new DeviceRecord(name, newRawState, effectiveState, lastSetTime, identity, deviceType);
    }

    public DeviceRecord withEffectiveState(EffectiveState newState) {
        return new DeviceRecord(name, rawState, newState, lastSetTime, identity, deviceType);
    }

    /**
     * Applies a production observation; the effective state is left for the cascade to decide.
     */
    public DeviceRecord observed(String newRawState, LocalDateTime changeTime,
                                 DeviceIdentity newIdentity, DeviceType newType) {
        return new DeviceRecord(name, newRawState, effectiveState, changeTime, newIdentity, newType);
    }

    public boolean isFenceZone() {
        return deviceType == DeviceType.FENCE_ZONE;
    }

    /**
     * Zone index, only meaningful for fence zones.
     */
    public Integer zone() {
        return identity != null ? identity.zone() : null;
    }

    public boolean isOnLine(int controllerId, int line) {
        return identity != null && identity.controllerId() == controllerId && identity.line() == line;
    }

    public String toLogString() {
        return String.format("Device[name=%s, state=%s, type=%s]", name, effectiveState, deviceType);
    }
}
