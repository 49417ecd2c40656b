package com.perimeter.sync.dto;

/**
 * Semantic category of a raw status string.
 *
 * Declaration order is the classification precedence: when a status text
 * carries several keywords, the first matching category wins.
 */
public enum StatusCategory {
    GLOBAL_LINK_EVENT,
    ZONE_FAIL,
    ZONE_NORMAL,
    ZONE_ALARM,
    UNKNOWN
}
