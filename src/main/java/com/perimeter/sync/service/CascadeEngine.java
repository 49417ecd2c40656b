package com.perimeter.sync.service;

import com.perimeter.sync.dto.DeviceRecord;
import com.perimeter.sync.dto.EffectiveState;
import com.perimeter.sync.dto.StatusCategory;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Computes which devices change state because of one device's new status.
 *
 * The engine is pure: it reads the records it is given and returns new
 * records, it never touches a store. The caller persists the result and
 * echoes it to production.
 *
 * Rules by category:
 * <ul>
 *   <li>ZONE_FAIL: the zone and every fence zone after it on the same line fail</li>
 *   <li>ZONE_NORMAL: if anything on the line is failed the whole line recovers,
 *       otherwise only the zone itself becomes normal</li>
 *   <li>ZONE_ALARM: the zone alone goes to alarm</li>
 *   <li>GLOBAL_LINK_EVENT: every tracked device follows the link (system-wide)</li>
 *   <li>UNKNOWN: nothing changes</li>
 * </ul>
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CascadeEngine {

    private final StatusClassifier classifier;
    private final CanonicalStatusFormatter formatter;

    /**
     * Applies the business rules for one observed status.
     *
     * @param category       classification of {@code changedDevice.rawState()}
     * @param changedDevice  the device as just observed; wins over any same-named entry below
     * @param devicesOnLine  cached devices sharing the changed device's controller and line
     * @param allDevices     every cached device; only read for global-link events
     * @return records to persist and write back, in order, one per device name
     */
    public List<DeviceRecord> apply(
        StatusCategory category,
        DeviceRecord changedDevice,
        Collection<DeviceRecord> devicesOnLine,
        Collection<DeviceRecord> allDevices
    ) {
        List<DeviceRecord> affected = switch (category) {
            case ZONE_FAIL -> onZoneFail(changedDevice, devicesOnLine);
            case ZONE_NORMAL -> onZoneNormal(changedDevice, devicesOnLine);
            case ZONE_ALARM -> List.of(forZoneEvent(changedDevice, EffectiveState.ALARM));
            case GLOBAL_LINK_EVENT -> onGlobalLink(changedDevice, allDevices);
            case UNKNOWN -> List.of();
        };

        log.debug("Cascade {} from {} affects {} device(s)",
            category, changedDevice.name(), affected.size());
        return affected;
    }

    private List<DeviceRecord> onZoneFail(DeviceRecord changed, Collection<DeviceRecord> devicesOnLine) {
        if (!changed.isFenceZone()) {
            return List.of(forZoneEvent(changed, EffectiveState.FAIL));
        }

        int failedZone = changed.zone();
        List<DeviceRecord> affected = new ArrayList<>();
        for (DeviceRecord device : lineWith(changed, devicesOnLine)) {
            if (device.isFenceZone() && device.zone() >= failedZone) {
                affected.add(forZoneEvent(device, EffectiveState.FAIL));
            }
        }

        log.info("Zone fail on FC-{} Line {} from Z{}: {} zone(s) failed",
            changed.identity().controllerId(), changed.identity().line(), failedZone, affected.size());
        return affected;
    }

    private List<DeviceRecord> onZoneNormal(DeviceRecord changed, Collection<DeviceRecord> devicesOnLine) {
        if (!changed.isFenceZone()) {
            return List.of(forZoneEvent(changed, EffectiveState.NORMAL));
        }

        Collection<DeviceRecord> line = lineWith(changed, devicesOnLine);
        boolean lineHasFailure = line.stream()
            .anyMatch(d -> d.isFenceZone() && d.effectiveState() == EffectiveState.FAIL);

        if (!lineHasFailure) {
            return List.of(forZoneEvent(changed, EffectiveState.NORMAL));
        }

        List<DeviceRecord> recovered = line.stream()
            .filter(DeviceRecord::isFenceZone)
            .map(d -> forZoneEvent(d, EffectiveState.NORMAL))
            .toList();

        log.info("Line recovery on FC-{} Line {}: {} zone(s) back to normal",
            changed.identity().controllerId(), changed.identity().line(), recovered.size());
        return recovered;
    }

    private List<DeviceRecord> onGlobalLink(DeviceRecord changed, Collection<DeviceRecord> allDevices) {
        boolean connected = classifier.isLinkConnected(changed.rawState());
        EffectiveState state = connected ? EffectiveState.NORMAL : EffectiveState.FAIL;

        List<DeviceRecord> affected = withChanged(changed, allDevices).values().stream()
            .map(d -> d.withEffectiveState(state).withRawState(formatter.forLinkEvent(d, connected)))
            .toList();

        log.info("Global link {} reported by {}: {} device(s) set to {}",
            connected ? "connected" : "disconnected", changed.name(), affected.size(), state);
        return affected;
    }

    private DeviceRecord forZoneEvent(DeviceRecord device, EffectiveState state) {
        return device.withEffectiveState(state).withRawState(formatter.forZoneEvent(device, state));
    }

    /**
     * The changed device's line, with the changed device guaranteed present
     * and taking precedence over its cached copy.
     */
    private static Collection<DeviceRecord> lineWith(DeviceRecord changed, Collection<DeviceRecord> devicesOnLine) {
        Map<String, DeviceRecord> byName = new LinkedHashMap<>();
        for (DeviceRecord device : devicesOnLine) {
            if (device.identity() != null && device.identity().sameLine(changed.identity())) {
                byName.put(device.name(), device);
            }
        }
        byName.put(changed.name(), changed);
        return byName.values();
    }

    private static Map<String, DeviceRecord> withChanged(DeviceRecord changed, Collection<DeviceRecord> devices) {
        Map<String, DeviceRecord> byName = new LinkedHashMap<>();
        devices.forEach(d -> byName.put(d.name(), d));
        byName.put(changed.name(), changed);
        return byName;
    }
}
