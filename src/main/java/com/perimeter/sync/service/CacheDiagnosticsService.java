package com.perimeter.sync.service;

import com.perimeter.sync.dto.DeviceIdentity;
import com.perimeter.sync.dto.DeviceRecord;
import com.perimeter.sync.dto.DeviceType;
import com.perimeter.sync.dto.EffectiveState;
import com.perimeter.sync.dto.StatusCategory;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Read-only views over the cache for operators.
 *
 * Use cases:
 * - Which devices exist and what state they are in
 * - Which zones a controller line has
 * - What a zone fail would take down, before it happens
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CacheDiagnosticsService {

    private final CacheStore cacheStore;
    private final CascadeEngine cascadeEngine;
    private final CanonicalStatusFormatter formatter;

    public List<DeviceRecord> getAllDevices() {
        return cacheStore.findAll();
    }

    public List<DeviceRecord> getDevicesOnLine(int controllerId, int line) {
        return cacheStore.findByControllerAndLine(controllerId, line);
    }

    /**
     * Device counts per controller, per line and per device type.
     */
    public CacheStatistics getStatistics() {
        List<DeviceRecord> devices = cacheStore.findAll();

        Map<Integer, Map<Integer, List<DeviceRecord>>> byControllerLine = new TreeMap<>();
        Map<DeviceType, Long> byType = new EnumMap<>(DeviceType.class);

        for (DeviceRecord device : devices) {
            byType.merge(device.deviceType(), 1L, Long::sum);
            DeviceIdentity identity = device.identity();
            if (identity != null) {
                byControllerLine
                    .computeIfAbsent(identity.controllerId(), c -> new TreeMap<>())
                    .computeIfAbsent(identity.line(), l -> new ArrayList<>())
                    .add(device);
            }
        }

        List<ControllerStats> controllers = new ArrayList<>();
        byControllerLine.forEach((controllerId, lines) -> {
            List<LineStats> lineStats = new ArrayList<>();
            int controllerTotal = 0;
            for (Map.Entry<Integer, List<DeviceRecord>> entry : lines.entrySet()) {
                List<DeviceRecord> onLine = entry.getValue();
                List<Integer> zones = onLine.stream()
                    .filter(DeviceRecord::isFenceZone)
                    .map(DeviceRecord::zone)
                    .sorted()
                    .toList();
                long failed = onLine.stream().filter(d -> d.effectiveState() == EffectiveState.FAIL).count();
                lineStats.add(new LineStats(entry.getKey(), onLine.size(), zones, failed));
                controllerTotal += onLine.size();
            }
            controllers.add(new ControllerStats(controllerId, controllerTotal, lineStats));
        });

        return new CacheStatistics(devices.size(), controllers, byType);
    }

    /**
     * Previews a zone fail at (controller, line, zone) against the current
     * cache. Nothing is persisted or written to production.
     */
    public CascadeSimulation simulateZoneFail(int controllerId, int line, int zone) {
        List<DeviceRecord> devicesOnLine = cacheStore.findByControllerAndLine(controllerId, line);
        DeviceIdentity identity = DeviceIdentity.ofZone(controllerId, line, zone);

        Optional<DeviceRecord> cachedTrigger = devicesOnLine.stream()
            .filter(d -> d.isFenceZone() && d.zone() == zone)
            .findFirst();
        DeviceRecord trigger = cachedTrigger.orElseGet(() -> syntheticZone(identity));

        List<DeviceRecord> cascade = cascadeEngine.apply(
            StatusCategory.ZONE_FAIL,
            trigger.withRawState(formatter.zoneStatus(identity, EffectiveState.FAIL)),
            devicesOnLine,
            List.of()
        );
        // only cached devices are reported
        List<DeviceRecord> affected = cachedTrigger.isPresent()
            ? cascade
            : cascade.stream().filter(d -> !d.name().equals(trigger.name())).toList();

        log.debug("Simulated zone fail FC-{} Line {} Z{}: {} device(s) would fail",
            controllerId, line, zone, affected.size());
        return new CascadeSimulation(controllerId, line, zone, affected.size(), affected);
    }

    private DeviceRecord syntheticZone(DeviceIdentity identity) {
        String name = formatter.zoneName(identity);
        return new DeviceRecord(name, null, EffectiveState.UNKNOWN, null, identity, DeviceType.FENCE_ZONE);
    }

    public record CacheStatistics(
        int totalDevices,
        List<ControllerStats> controllers,
        Map<DeviceType, Long> deviceTypes
    ) {}

    public record ControllerStats(int controllerId, int totalDevices, List<LineStats> lines) {}

    public record LineStats(int line, int deviceCount, List<Integer> zones, long failedCount) {}

    public record CascadeSimulation(
        int controllerId,
        int line,
        int failZone,
        int devicesFound,
        List<DeviceRecord> devices
    ) {}
}
