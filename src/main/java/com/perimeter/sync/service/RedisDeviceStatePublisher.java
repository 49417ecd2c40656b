package com.perimeter.sync.service;

import com.perimeter.sync.dto.DeviceIdentity;
import com.perimeter.sync.dto.DeviceRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Mirrors committed device states into Redis for read-only consumers.
 *
 * Redis Storage Format:
 * - Key: "device:state:{deviceName}" (hash)
 *   fields: rawState, effectiveState, deviceType, lastSetTime, controllerId, line, zone, color
 * - Key: "devices:tracked" (set of device names)
 *
 * The relational cache stays the source of truth; these keys are
 * overwritten after every committed cycle and carry no TTL.
 */
@Service
@ConditionalOnProperty(name = "perimeter.snapshot.redis.enabled", havingValue = "true", matchIfMissing = true)
@Slf4j
public class RedisDeviceStatePublisher implements DeviceStateChangeListener {

    static final String TRACKED_DEVICES_KEY = "devices:tracked";

    private final StringRedisTemplate stringRedisTemplate;
    private final String keyPrefix;

    public RedisDeviceStatePublisher(
        StringRedisTemplate stringRedisTemplate,
        @Value("${perimeter.snapshot.redis.key-prefix:device:state:}") String keyPrefix
    ) {
        this.stringRedisTemplate = stringRedisTemplate;
        this.keyPrefix = keyPrefix;
    }

    @Override
    public void onDevicesChanged(List<DeviceRecord> changedDevices) {
        for (DeviceRecord device : changedDevices) {
            stringRedisTemplate.opsForHash().putAll(keyFor(device.name()), toHash(device));
        }
        stringRedisTemplate.opsForSet().add(TRACKED_DEVICES_KEY,
            changedDevices.stream().map(DeviceRecord::name).toArray(String[]::new));

        log.debug("Published {} device snapshot(s) to Redis", changedDevices.size());
    }

    String keyFor(String deviceName) {
        return keyPrefix + deviceName;
    }

    static Map<String, String> toHash(DeviceRecord device) {
        Map<String, String> hash = new LinkedHashMap<>();
        hash.put("rawState", device.rawState() != null ? device.rawState() : "");
        hash.put("effectiveState", device.effectiveState().name());
        hash.put("deviceType", device.deviceType().name());
        hash.put("color", device.effectiveState().displayColor());
        hash.put("lastSetTime", device.lastSetTime() != null ? device.lastSetTime().toString() : "");

        DeviceIdentity identity = device.identity();
        hash.put("controllerId", identity != null ? String.valueOf(identity.controllerId()) : "");
        hash.put("line", identity != null ? String.valueOf(identity.line()) : "");
        hash.put("zone", identity != null && identity.hasZone() ? String.valueOf(identity.zone()) : "");
        return hash;
    }
}
