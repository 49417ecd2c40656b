package com.perimeter.sync.service;

import com.perimeter.sync.dto.DeviceRecord;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Map-backed cache store for loop tests. Pairs with
 * {@link SnapshotTransactionManager} to get rollback.
 */
class InMemoryCacheStore implements CacheStore {

    private Map<String, DeviceRecord> devices = new LinkedHashMap<>();
    private Map<String, DeviceRecord> snapshot;
    private String failUpsertFor;
    int upserts;

    void seed(DeviceRecord... records) {
        for (DeviceRecord record : records) {
            devices.put(record.name(), record);
        }
    }

    void failUpsertFor(String name) {
        this.failUpsertFor = name;
    }

    void begin() {
        snapshot = new LinkedHashMap<>(devices);
    }

    void rollback() {
        if (snapshot != null) {
            devices = snapshot;
        }
        snapshot = null;
    }

    void commit() {
        snapshot = null;
    }

    @Override
    public Optional<DeviceRecord> get(String name) {
        return Optional.ofNullable(devices.get(name));
    }

    @Override
    public DeviceRecord upsert(DeviceRecord record) {
        if (Objects.equals(failUpsertFor, record.name())) {
            throw new StoreException(StoreErrorKind.CACHE_WRITE, "Simulated cache write failure for " + record.name());
        }
        devices.put(record.name(), record);
        upserts++;
        return record;
    }

    @Override
    public List<DeviceRecord> findByControllerAndLine(int controllerId, int line) {
        List<DeviceRecord> onLine = new ArrayList<>();
        for (DeviceRecord device : devices.values()) {
            if (device.isOnLine(controllerId, line)) {
                onLine.add(device);
            }
        }
        onLine.sort(Comparator.comparing(DeviceRecord::zone, Comparator.nullsFirst(Comparator.naturalOrder())));
        return onLine;
    }

    @Override
    public List<DeviceRecord> findAll() {
        return devices.values().stream().sorted(Comparator.comparing(DeviceRecord::name)).toList();
    }

    @Override
    public Optional<LocalDateTime> maxLastSetTime() {
        return devices.values().stream()
            .map(DeviceRecord::lastSetTime)
            .filter(Objects::nonNull)
            .max(Comparator.naturalOrder());
    }

    @Override
    public long count() {
        return devices.size();
    }
}
