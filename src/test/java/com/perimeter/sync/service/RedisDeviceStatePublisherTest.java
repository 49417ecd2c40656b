package com.perimeter.sync.service;

import com.perimeter.sync.dto.DeviceIdentity;
import com.perimeter.sync.dto.DeviceRecord;
import com.perimeter.sync.dto.DeviceType;
import com.perimeter.sync.dto.EffectiveState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.core.HashOperations;
import org.springframework.data.redis.core.SetOperations;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class RedisDeviceStatePublisherTest {

    @Mock
    private StringRedisTemplate stringRedisTemplate;

    @Mock
    private HashOperations<String, Object, Object> hashOperations;

    @Mock
    private SetOperations<String, String> setOperations;

    private RedisDeviceStatePublisher publisher;

    @BeforeEach
    void setUp() {
        publisher = new RedisDeviceStatePublisher(stringRedisTemplate, "device:state:");
    }

    @Test
    void shouldWriteOneHashPerDeviceAndTrackNames() {
        doReturn(hashOperations).when(stringRedisTemplate).opsForHash();
        doReturn(setOperations).when(stringRedisTemplate).opsForSet();

        DeviceRecord zone = new DeviceRecord("Fence Controller FC-14 Line 0 Zone Z22",
            "Fence Controller FC-14 Line 0 Zone Z22 Fail", EffectiveState.FAIL,
            LocalDateTime.of(2024, 3, 1, 12, 0), DeviceIdentity.ofZone(14, 0, 22), DeviceType.FENCE_ZONE);
        DeviceRecord pump = new DeviceRecord("Pump House", null, EffectiveState.UNKNOWN, null, null, DeviceType.UNKNOWN);

        publisher.onDevicesChanged(List.of(zone, pump));

        verify(hashOperations).putAll("device:state:Fence Controller FC-14 Line 0 Zone Z22",
            RedisDeviceStatePublisher.toHash(zone));
        verify(hashOperations).putAll("device:state:Pump House", RedisDeviceStatePublisher.toHash(pump));
        verify(setOperations).add(RedisDeviceStatePublisher.TRACKED_DEVICES_KEY,
            "Fence Controller FC-14 Line 0 Zone Z22", "Pump House");
    }

    @Test
    void shouldFlattenRecordIntoStringFields() {
        DeviceRecord zone = new DeviceRecord("Fence Controller FC-14 Line 0 Zone Z22",
            "Fence Controller FC-14 Line 0 Zone Z22 Normal", EffectiveState.NORMAL,
            LocalDateTime.of(2024, 3, 1, 12, 0), DeviceIdentity.ofZone(14, 0, 22), DeviceType.FENCE_ZONE);

        Map<String, String> hash = RedisDeviceStatePublisher.toHash(zone);

        assertThat(hash)
            .containsEntry("effectiveState", "NORMAL")
            .containsEntry("color", "blue")
            .containsEntry("controllerId", "14")
            .containsEntry("line", "0")
            .containsEntry("zone", "22")
            .containsEntry("lastSetTime", "2024-03-01T12:00");
    }

    @Test
    void shouldUseEmptyStringsForMissingFields() {
        DeviceRecord link = new DeviceRecord("Gateway", null, EffectiveState.FAIL, null,
            new DeviceIdentity(3, 1, null), DeviceType.GLOBAL_LINK);

        Map<String, String> hash = RedisDeviceStatePublisher.toHash(link);

        assertThat(hash)
            .containsEntry("rawState", "")
            .containsEntry("lastSetTime", "")
            .containsEntry("zone", "")
            .containsEntry("controllerId", "3")
            .containsEntry("color", "red");
        assertThat(publisher.keyFor("Gateway")).isEqualTo("device:state:Gateway");
    }
}
