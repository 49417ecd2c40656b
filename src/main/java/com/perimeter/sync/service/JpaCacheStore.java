package com.perimeter.sync.service;

import com.perimeter.sync.dto.DeviceIdentity;
import com.perimeter.sync.dto.DeviceRecord;
import com.perimeter.sync.entity.DeviceState;
import com.perimeter.sync.repository.DeviceStateRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * {@link CacheStore} backed by the {@code device_state_cache} table.
 *
 * Entities never leave this class. Transactions are opened by the caller
 * (the reconciliation loop); within one, JPA auto-flush makes earlier
 * upserts visible to the line queries that follow them.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class JpaCacheStore implements CacheStore {

    private final DeviceStateRepository repository;

    @Override
    public Optional<DeviceRecord> get(String name) {
        try {
            return repository.findById(name).map(JpaCacheStore::toRecord);
        } catch (DataAccessException e) {
            throw new StoreException(StoreErrorKind.CACHE_READ, "Failed to read cached device " + name, e);
        }
    }

    @Override
    public DeviceRecord upsert(DeviceRecord record) {
        try {
            DeviceState entity = repository.findById(record.name())
                .orElseGet(() -> DeviceState.builder().deviceName(record.name()).build());
            apply(record, entity);
            repository.save(entity);
            log.debug("Cached {}", record.toLogString());
            return record;
        } catch (DataAccessException e) {
            throw new StoreException(StoreErrorKind.CACHE_WRITE, "Failed to cache device " + record.name(), e);
        }
    }

    @Override
    public List<DeviceRecord> findByControllerAndLine(int controllerId, int line) {
        try {
            return repository.findByControllerIdAndLineNoOrderByZoneNoAsc(controllerId, line).stream()
                .map(JpaCacheStore::toRecord)
                .toList();
        } catch (DataAccessException e) {
            throw new StoreException(StoreErrorKind.CACHE_READ,
                String.format("Failed to read line FC-%d/%d", controllerId, line), e);
        }
    }

    @Override
    public List<DeviceRecord> findAll() {
        try {
            return repository.findAllByOrderByDeviceNameAsc().stream()
                .map(JpaCacheStore::toRecord)
                .toList();
        } catch (DataAccessException e) {
            throw new StoreException(StoreErrorKind.CACHE_READ, "Failed to read cached devices", e);
        }
    }

    @Override
    public Optional<LocalDateTime> maxLastSetTime() {
        try {
            return Optional.ofNullable(repository.findMaxLastSetTime());
        } catch (DataAccessException e) {
            throw new StoreException(StoreErrorKind.CACHE_READ, "Failed to read newest cached change time", e);
        }
    }

    @Override
    public long count() {
        try {
            return repository.count();
        } catch (DataAccessException e) {
            throw new StoreException(StoreErrorKind.CACHE_READ, "Failed to count cached devices", e);
        }
    }

    static DeviceRecord toRecord(DeviceState entity) {
        DeviceIdentity identity = null;
        if (entity.getControllerId() != null && entity.getLineNo() != null) {
            identity = new DeviceIdentity(entity.getControllerId(), entity.getLineNo(), entity.getZoneNo());
        }
        return new DeviceRecord(
            entity.getDeviceName(),
            entity.getLastState(),
            entity.getEffectiveState(),
            entity.getLastSetTime(),
            identity,
            entity.getDeviceType()
        );
    }

    private static void apply(DeviceRecord record, DeviceState entity) {
        DeviceIdentity identity = record.identity();
        entity.setLastState(record.rawState());
        entity.setEffectiveState(record.effectiveState());
        entity.setLastSetTime(record.lastSetTime());
        entity.setControllerId(identity != null ? identity.controllerId() : null);
        entity.setLineNo(identity != null ? identity.line() : null);
        entity.setZoneNo(identity != null ? identity.zone() : null);
        entity.setDeviceType(record.deviceType());
    }
}
