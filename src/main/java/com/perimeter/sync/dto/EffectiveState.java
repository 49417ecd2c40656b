package com.perimeter.sync.dto;

/**
 * Derived, authoritative status of a tracked device.
 *
 * This is what downstream readers of the cache act on. It is distinct
 * from the raw status text reported by the production store.
 */
public enum EffectiveState {
    NORMAL,
    FAIL,
    ALARM,
    UNKNOWN;

    /**
     * Marker colour used by the diagnostics view.
     */
    public String displayColor() {
        return this == NORMAL ? "blue" : "red";
    }
}
