package com.perimeter.sync.repository;

import com.perimeter.sync.entity.DeviceState;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Repository for the local device state cache.
 *
 * Line-scoped queries use the (controller_id, line_no) index; they back
 * every cascade decision, so one cycle issues at least one per applied row.
 */
@Repository
public interface DeviceStateRepository extends JpaRepository<DeviceState, String> {

    /**
     * All devices on one controller line, lowest zone first.
     */
    List<DeviceState> findByControllerIdAndLineNoOrderByZoneNoAsc(Integer controllerId, Integer lineNo);

    List<DeviceState> findAllByOrderByDeviceNameAsc();

    /**
     * Newest applied production change time; null on an empty cache.
     */
    @Query("SELECT MAX(d.lastSetTime) FROM DeviceState d")
    LocalDateTime findMaxLastSetTime();
}
