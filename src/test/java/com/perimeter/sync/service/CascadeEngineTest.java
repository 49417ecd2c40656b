package com.perimeter.sync.service;

import com.perimeter.sync.dto.DeviceIdentity;
import com.perimeter.sync.dto.DeviceRecord;
import com.perimeter.sync.dto.DeviceType;
import com.perimeter.sync.dto.EffectiveState;
import com.perimeter.sync.dto.StatusCategory;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;

class CascadeEngineTest {

    private final CanonicalStatusFormatter formatter = new CanonicalStatusFormatter();
    private final CascadeEngine engine = new CascadeEngine(new StatusClassifier(), formatter);

    @Test
    void shouldFailTriggerZoneAndEveryLaterZoneOnLine() {
        List<DeviceRecord> line = List.of(
            zone(14, 0, 21, EffectiveState.NORMAL),
            zone(14, 0, 22, EffectiveState.NORMAL),
            zone(14, 0, 23, EffectiveState.NORMAL),
            zone(14, 0, 30, EffectiveState.ALARM)
        );
        DeviceRecord trigger = zone(14, 0, 22, EffectiveState.NORMAL)
            .withRawState("Fence Controller FC-14 Line 0 Zone Z22 Fail");

        Map<Integer, DeviceRecord> affected = byZone(engine.apply(StatusCategory.ZONE_FAIL, trigger, line, List.of()));

        assertThat(affected).containsOnlyKeys(22, 23, 30);
        assertThat(affected.values()).allMatch(d -> d.effectiveState() == EffectiveState.FAIL);
        assertThat(affected.get(23).rawState()).isEqualTo("Fence Controller FC-14 Line 0 Zone Z23 Fail");
    }

    @Test
    void shouldIgnoreDevicesOnOtherLinesDuringFail() {
        DeviceRecord otherLine = zone(14, 1, 25, EffectiveState.NORMAL);
        DeviceRecord otherController = zone(15, 0, 25, EffectiveState.NORMAL);
        DeviceRecord trigger = zone(14, 0, 22, EffectiveState.NORMAL);

        List<DeviceRecord> affected = engine.apply(StatusCategory.ZONE_FAIL, trigger,
            List.of(otherLine, otherController), List.of());

        assertThat(affected).extracting(DeviceRecord::name).containsExactly(trigger.name());
    }

    @Test
    void shouldFailTriggerEvenWhenNotYetCached() {
        DeviceRecord trigger = zone(3, 2, 5, EffectiveState.UNKNOWN);

        List<DeviceRecord> affected = engine.apply(StatusCategory.ZONE_FAIL, trigger, List.of(), List.of());

        assertThat(affected).singleElement()
            .satisfies(d -> assertThat(d.effectiveState()).isEqualTo(EffectiveState.FAIL));
    }

    @Test
    void shouldRecoverWholeLineWhenAnyZoneIsFailed() {
        List<DeviceRecord> line = List.of(
            zone(1, 0, 1, EffectiveState.ALARM),
            zone(1, 0, 2, EffectiveState.FAIL),
            zone(1, 0, 3, EffectiveState.FAIL)
        );
        DeviceRecord trigger = zone(1, 0, 2, EffectiveState.FAIL);

        List<DeviceRecord> affected = engine.apply(StatusCategory.ZONE_NORMAL, trigger, line, List.of());

        assertThat(affected).hasSize(3);
        assertThat(affected).allMatch(d -> d.effectiveState() == EffectiveState.NORMAL);
        assertThat(affected).extracting(DeviceRecord::rawState)
            .allMatch(raw -> raw.endsWith(" Normal"));
    }

    @Test
    void shouldRecoverOnlyTriggerWhenLineHasNoFailure() {
        List<DeviceRecord> line = List.of(
            zone(1, 0, 1, EffectiveState.ALARM),
            zone(1, 0, 2, EffectiveState.ALARM)
        );
        DeviceRecord trigger = zone(1, 0, 2, EffectiveState.ALARM);

        List<DeviceRecord> affected = engine.apply(StatusCategory.ZONE_NORMAL, trigger, line, List.of());

        assertThat(affected).singleElement().satisfies(d -> {
            assertThat(d.name()).isEqualTo(trigger.name());
            assertThat(d.effectiveState()).isEqualTo(EffectiveState.NORMAL);
        });
    }

    @Test
    void shouldRaiseAlarmOnTriggerOnly() {
        List<DeviceRecord> line = List.of(zone(1, 0, 1, EffectiveState.NORMAL), zone(1, 0, 2, EffectiveState.NORMAL));

        List<DeviceRecord> affected = engine.apply(StatusCategory.ZONE_ALARM, zone(1, 0, 1, EffectiveState.NORMAL),
            line, List.of());

        assertThat(affected).singleElement().satisfies(d -> {
            assertThat(d.effectiveState()).isEqualTo(EffectiveState.ALARM);
            assertThat(d.rawState()).isEqualTo("Fence Controller FC-1 Line 0 Zone Z1 Alarm");
        });
    }

    @Test
    void shouldFailEveryDeviceOnLinkDisconnect() {
        DeviceRecord link = new DeviceRecord("Fence Controller FC-9 Line 0 Zone Z1", "axe_ElfarDisconnected",
            EffectiveState.NORMAL, null, new DeviceIdentity(9, 0, null), DeviceType.GLOBAL_LINK);
        List<DeviceRecord> all = List.of(
            zone(1, 0, 1, EffectiveState.NORMAL),
            zone(2, 3, 4, EffectiveState.ALARM),
            new DeviceRecord("Unnamed sensor", "Offline", EffectiveState.UNKNOWN, null, null, DeviceType.UNKNOWN)
        );

        List<DeviceRecord> affected = engine.apply(StatusCategory.GLOBAL_LINK_EVENT, link, List.of(), all);

        assertThat(affected).hasSize(4);
        assertThat(affected).allMatch(d -> d.effectiveState() == EffectiveState.FAIL);
        Map<String, String> raw = affected.stream()
            .collect(Collectors.toMap(DeviceRecord::name, DeviceRecord::rawState));
        assertThat(raw.get("Fence Controller FC-1 Line 0 Zone Z1")).isEqualTo("Fence Controller FC-1 Line 0 Zone Z1 Fail");
        assertThat(raw.get("Unnamed sensor")).isEqualTo("axe_ElfarDisconnected");
        assertThat(raw.get(link.name())).isEqualTo("axe_ElfarDisconnected");
    }

    @Test
    void shouldRestoreEveryDeviceOnLinkConnect() {
        DeviceRecord link = new DeviceRecord("Fence Controller FC-9 Line 0 Zone Z1", "axe_ElfarConnected",
            EffectiveState.FAIL, null, new DeviceIdentity(9, 0, null), DeviceType.GLOBAL_LINK);
        List<DeviceRecord> all = List.of(zone(1, 0, 1, EffectiveState.FAIL), link);

        List<DeviceRecord> affected = engine.apply(StatusCategory.GLOBAL_LINK_EVENT, link, List.of(), all);

        assertThat(affected).hasSize(2);
        assertThat(affected).allMatch(d -> d.effectiveState() == EffectiveState.NORMAL);
        assertThat(affected).allMatch(d -> d.deviceType() != DeviceType.UNKNOWN);
    }

    @Test
    void shouldChangeNothingForUnknownCategory() {
        List<DeviceRecord> affected = engine.apply(StatusCategory.UNKNOWN, zone(1, 0, 1, EffectiveState.NORMAL),
            List.of(zone(1, 0, 2, EffectiveState.FAIL)), List.of());

        assertThat(affected).isEmpty();
    }

    @Test
    void shouldKeepRawTextForZoneEventOnUnparseableDevice() {
        DeviceRecord odd = new DeviceRecord("Pump House", "Pump Fence Fail", EffectiveState.UNKNOWN,
            null, null, DeviceType.UNKNOWN);

        List<DeviceRecord> affected = engine.apply(StatusCategory.ZONE_FAIL, odd, List.of(), List.of());

        assertThat(affected).singleElement().satisfies(d -> {
            assertThat(d.effectiveState()).isEqualTo(EffectiveState.FAIL);
            assertThat(d.rawState()).isEqualTo("Pump Fence Fail");
        });
    }

    private DeviceRecord zone(int controller, int line, int zone, EffectiveState state) {
        DeviceIdentity identity = DeviceIdentity.ofZone(controller, line, zone);
        return new DeviceRecord(formatter.zoneName(identity), null, state, null, identity, DeviceType.FENCE_ZONE);
    }

    private static Map<Integer, DeviceRecord> byZone(List<DeviceRecord> devices) {
        return devices.stream().collect(Collectors.toMap(DeviceRecord::zone, Function.identity()));
    }
}
