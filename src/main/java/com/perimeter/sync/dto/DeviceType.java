package com.perimeter.sync.dto;

public enum DeviceType {
    FENCE_ZONE,
    GLOBAL_LINK,
    UNKNOWN
}
