package com.perimeter.sync.service;

import com.perimeter.sync.dto.DeviceIdentity;
import com.perimeter.sync.dto.DeviceRecord;
import com.perimeter.sync.dto.DeviceType;
import com.perimeter.sync.dto.EffectiveState;
import com.perimeter.sync.repository.DeviceStateRepository;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;

import java.time.LocalDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DataJpaTest
@Import(JpaCacheStore.class)
class JpaCacheStoreTest {

    private static final LocalDateTime T0 = LocalDateTime.of(2024, 3, 1, 12, 0);

    @Autowired
    private JpaCacheStore cacheStore;

    @Autowired
    private DeviceStateRepository repository;

    @Test
    void shouldRoundTripEveryField() {
        DeviceRecord record = zone(14, 0, 22, EffectiveState.FAIL, T0);

        cacheStore.upsert(record);

        assertThat(cacheStore.get(record.name())).contains(record);
    }

    @Test
    void shouldReplaceExistingRecordByName() {
        DeviceRecord original = zone(14, 0, 22, EffectiveState.NORMAL, T0);
        cacheStore.upsert(original);

        cacheStore.upsert(original.withEffectiveState(EffectiveState.FAIL).withRawState("changed"));

        assertThat(repository.count()).isEqualTo(1);
        DeviceRecord stored = cacheStore.get(original.name()).orElseThrow();
        assertThat(stored.effectiveState()).isEqualTo(EffectiveState.FAIL);
        assertThat(stored.rawState()).isEqualTo("changed");
    }

    @Test
    void shouldStoreDevicesWithoutIdentity() {
        DeviceRecord pump = new DeviceRecord("Pump House", "Offline", EffectiveState.UNKNOWN, T0, null, DeviceType.UNKNOWN);
        DeviceRecord link = new DeviceRecord("Gateway FC-3", "axe_ElfarConnected", EffectiveState.NORMAL, T0,
            new DeviceIdentity(3, 0, null), DeviceType.GLOBAL_LINK);

        cacheStore.upsertAll(List.of(pump, link));

        assertThat(cacheStore.get("Pump House")).contains(pump);
        assertThat(cacheStore.get("Gateway FC-3")).contains(link);
    }

    @Test
    void shouldQueryLineOrderedByZone() {
        cacheStore.upsertAll(List.of(
            zone(14, 0, 23, EffectiveState.NORMAL, T0),
            zone(14, 0, 21, EffectiveState.NORMAL, T0),
            zone(14, 1, 5, EffectiveState.NORMAL, T0),
            zone(15, 0, 22, EffectiveState.NORMAL, T0),
            zone(14, 0, 22, EffectiveState.NORMAL, T0)
        ));

        assertThat(cacheStore.findByControllerAndLine(14, 0))
            .extracting(DeviceRecord::zone)
            .containsExactly(21, 22, 23);
    }

    @Test
    void shouldSeeUpsertsOfSameTransactionInLineQuery() {
        cacheStore.upsert(zone(14, 0, 21, EffectiveState.NORMAL, T0));
        cacheStore.upsert(zone(14, 0, 21, EffectiveState.FAIL, T0));

        assertThat(cacheStore.findByControllerAndLine(14, 0))
            .singleElement()
            .satisfies(d -> assertThat(d.effectiveState()).isEqualTo(EffectiveState.FAIL));
    }

    @Test
    void shouldReportNewestChangeTime() {
        assertThat(cacheStore.maxLastSetTime()).isEmpty();
        assertThat(cacheStore.isEmpty()).isTrue();

        cacheStore.upsertAll(List.of(
            zone(1, 0, 1, EffectiveState.NORMAL, T0),
            zone(1, 0, 2, EffectiveState.NORMAL, T0.plusMinutes(7)),
            zone(1, 0, 3, EffectiveState.NORMAL, null)
        ));

        assertThat(cacheStore.maxLastSetTime()).contains(T0.plusMinutes(7));
        assertThat(cacheStore.count()).isEqualTo(3);
    }

    private static DeviceRecord zone(int controller, int line, int zone, EffectiveState state, LocalDateTime time) {
        String name = String.format("Fence Controller FC-%d Line %d Zone Z%d", controller, line, zone);
        return new DeviceRecord(name, name + " Normal", state, time,
            DeviceIdentity.ofZone(controller, line, zone), DeviceType.FENCE_ZONE);
    }
}
