package com.perimeter.sync.service;

import com.perimeter.sync.dto.DeviceRecord;
import com.perimeter.sync.dto.EffectiveState;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Pushes committed device changes to STOMP subscribers.
 *
 * Topics:
 * - /topic/device-states: every changed device of a cycle, as one message
 * - /topic/alerts: one message per device that went to FAIL or ALARM
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class DeviceStateBroadcaster implements DeviceStateChangeListener {

    static final String STATES_TOPIC = "/topic/device-states";
    static final String ALERTS_TOPIC = "/topic/alerts";

    private final SimpMessagingTemplate messagingTemplate;

    @Override
    public void onDevicesChanged(List<DeviceRecord> changedDevices) {
        List<Map<String, Object>> states = changedDevices.stream()
            .map(DeviceStateBroadcaster::toMessage)
            .toList();

        messagingTemplate.convertAndSend(STATES_TOPIC, Map.of(
            "type", "STATE_CHANGE",
            "devices", states,
            "timestamp", Instant.now().toString()
        ));

        int alerts = 0;
        for (DeviceRecord device : changedDevices) {
            if (device.effectiveState() == EffectiveState.FAIL || device.effectiveState() == EffectiveState.ALARM) {
                messagingTemplate.convertAndSend(ALERTS_TOPIC, alertFor(device));
                alerts++;
            }
        }

        log.debug("Broadcast {} state change(s), {} alert(s)", changedDevices.size(), alerts);
    }

    private static Map<String, Object> alertFor(DeviceRecord device) {
        Map<String, Object> alert = toMessage(device);
        alert.put("type", device.effectiveState() == EffectiveState.FAIL ? "FAIL" : "ALARM");
        alert.put("timestamp", Instant.now().toString());
        return alert;
    }

    // HashMap, since rawState and zone may be null
    private static Map<String, Object> toMessage(DeviceRecord device) {
        Map<String, Object> message = new HashMap<>();
        message.put("name", device.name());
        message.put("rawState", device.rawState());
        message.put("effectiveState", device.effectiveState().name());
        message.put("color", device.effectiveState().displayColor());
        message.put("deviceType", device.deviceType().name());
        message.put("zone", device.zone());
        return message;
    }
}
