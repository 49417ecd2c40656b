package com.perimeter.sync.service;

import com.perimeter.sync.dto.DeviceRecord;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Local mirror of every tracked device, keyed by device name.
 *
 * Reads return owned copies; callers change state only through
 * {@link #upsert(DeviceRecord)}. All calls made inside one transaction of
 * the cache transaction manager commit or roll back together, and reads
 * inside that transaction see its earlier upserts.
 *
 * Failures surface as {@link StoreException} with a CACHE_* kind.
 */
public interface CacheStore {

    Optional<DeviceRecord> get(String name);

    /**
     * Inserts or replaces the record with the same name.
     */
    DeviceRecord upsert(DeviceRecord record);

    default void upsertAll(Collection<DeviceRecord> records) {
        records.forEach(this::upsert);
    }

    /**
     * Devices on one controller line, lowest zone first.
     */
    List<DeviceRecord> findByControllerAndLine(int controllerId, int line);

    List<DeviceRecord> findAll();

    /**
     * Newest applied production change time, empty when nothing is cached.
     */
    Optional<LocalDateTime> maxLastSetTime();

    long count();

    default boolean isEmpty() {
        return count() == 0;
    }
}
