package com.perimeter.sync.entity;

import com.perimeter.sync.dto.DeviceType;
import com.perimeter.sync.dto.EffectiveState;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.LocalDateTime;

/**
 * Cached state of one perimeter device.
 *
 * The parsed identity columns (controller, line, zone) are stored next to
 * the raw text so that line-scoped cascade queries hit an index instead of
 * re-parsing device names.
 *
 * Only {@code JpaCacheStore} touches this entity; everything else works on
 * {@link com.perimeter.sync.dto.DeviceRecord} copies.
 */
@Entity
@Table(name = "device_state_cache", indexes = {
    @Index(name = "idx_device_controller_line", columnList = "controller_id, line_no"),
    @Index(name = "idx_device_last_set_time", columnList = "last_set_time")
})
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class DeviceState {

    /**
     * Production device name ({@code dvcname_txt}).
     */
    @Id
    @Column(name = "device_name", length = 255)
    private String deviceName;

    @Column(name = "last_state", length = 1000)
    private String lastState;

    @Enumerated(EnumType.STRING)
    @Column(name = "effective_state", nullable = false, length = 20)
    @Builder.Default
    private EffectiveState effectiveState = EffectiveState.UNKNOWN;

    /**
     * Production change time of the last applied row.
     */
    @Column(name = "last_set_time")
    private LocalDateTime lastSetTime;

    @Column(name = "controller_id")
    private Integer controllerId;

    @Column(name = "line_no")
    private Integer lineNo;

    /**
     * Null for the global-link device and for unparseable names.
     */
    @Column(name = "zone_no")
    private Integer zoneNo;

    @Enumerated(EnumType.STRING)
    @Column(name = "device_type", nullable = false, length = 20)
    @Builder.Default
    private DeviceType deviceType = DeviceType.UNKNOWN;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private LocalDateTime updatedAt;
}
