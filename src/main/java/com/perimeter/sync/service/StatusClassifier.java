package com.perimeter.sync.service;

import com.perimeter.sync.dto.EffectiveState;
import com.perimeter.sync.dto.StatusCategory;
import org.springframework.stereotype.Component;

/**
 * Maps raw production status text to a {@link StatusCategory}.
 *
 * Matching is case-sensitive substring search in a fixed precedence:
 * global-link marker, then fence fail, then normal, then alarm. The result
 * depends only on the text, never on what the cache previously knew about
 * the device.
 */
@Component
public class StatusClassifier {

    public static final String GLOBAL_LINK_MARKER = "axe_Elfar";
    public static final String FENCE_MARKER = "Fence";
    public static final String FAIL_KEYWORD = "Fail";
    public static final String NORMAL_KEYWORD = "Normal";
    public static final String ALARM_KEYWORD = "Alarm";
    public static final String CONNECTED_KEYWORD = "Connected";
    public static final String DISCONNECTED_KEYWORD = "Disconnected";

    public StatusCategory classify(String rawState) {
        if (rawState == null || rawState.isBlank()) {
            return StatusCategory.UNKNOWN;
        }
        if (rawState.contains(GLOBAL_LINK_MARKER)) {
            return StatusCategory.GLOBAL_LINK_EVENT;
        }
        if (rawState.contains(FENCE_MARKER) && rawState.contains(FAIL_KEYWORD)) {
            return StatusCategory.ZONE_FAIL;
        }
        if (rawState.contains(NORMAL_KEYWORD)) {
            return StatusCategory.ZONE_NORMAL;
        }
        if (rawState.contains(ALARM_KEYWORD)) {
            return StatusCategory.ZONE_ALARM;
        }
        return StatusCategory.UNKNOWN;
    }

    /**
     * Whether a global-link status reports the link as up. Anything that is
     * not explicitly connected counts as down.
     */
    public boolean isLinkConnected(String rawState) {
        return rawState != null
            && rawState.contains(CONNECTED_KEYWORD)
            && !rawState.contains(DISCONNECTED_KEYWORD);
    }

    /**
     * Effective state implied by a status on its own, without any cascade.
     * Used when seeding an empty cache.
     */
    public EffectiveState directState(StatusCategory category, String rawState) {
        return switch (category) {
            case GLOBAL_LINK_EVENT -> isLinkConnected(rawState) ? EffectiveState.NORMAL : EffectiveState.FAIL;
            case ZONE_FAIL -> EffectiveState.FAIL;
            case ZONE_NORMAL -> EffectiveState.NORMAL;
            case ZONE_ALARM -> EffectiveState.ALARM;
            case UNKNOWN -> EffectiveState.UNKNOWN;
        };
    }
}
