package com.perimeter.sync.controller;

import com.perimeter.sync.dto.CycleResult;
import com.perimeter.sync.dto.DeviceRecord;
import com.perimeter.sync.service.CacheDiagnosticsService;
import com.perimeter.sync.service.ReconciliationCoordinator;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Operator endpoints for inspecting the device cache and driving reconciliation by hand.
 *
 * Display rendering lives elsewhere; these endpoints exist to debug cascades
 * and the checkpoint.
 */
@RestController
@RequestMapping("/api/perimeter")
@RequiredArgsConstructor
@Validated
@Slf4j
@Tag(name = "Perimeter Diagnostics", description = "Device cache inspection and manual reconciliation")
public class CacheDiagnosticsController {

    private final CacheDiagnosticsService diagnosticsService;
    private final ReconciliationCoordinator coordinator;

    /**
     * Example:
     * GET /api/perimeter/devices
     */
    @Operation(summary = "List every cached device with its derived state")
    @GetMapping("/devices")
    public ResponseEntity<List<Map<String, Object>>> getAllDevices() {
        return ResponseEntity.ok(toViews(diagnosticsService.getAllDevices()));
    }

    /**
     * Example:
     * GET /api/perimeter/controllers/14/lines/0/devices
     */
    @Operation(summary = "List devices on one controller line, lowest zone first")
    @GetMapping("/controllers/{controllerId}/lines/{line}/devices")
    public ResponseEntity<List<Map<String, Object>>> getDevicesOnLine(
        @Parameter(description = "Controller id", example = "14") @PathVariable @PositiveOrZero int controllerId,
        @Parameter(description = "Line index", example = "0") @PathVariable @PositiveOrZero int line
    ) {
        return ResponseEntity.ok(toViews(diagnosticsService.getDevicesOnLine(controllerId, line)));
    }

    @Operation(summary = "Device counts per controller, line and device type")
    @GetMapping("/cache/stats")
    public ResponseEntity<CacheDiagnosticsService.CacheStatistics> getCacheStats() {
        return ResponseEntity.ok(diagnosticsService.getStatistics());
    }

    /**
     * Example:
     * GET /api/perimeter/cascade/simulate?controllerId=14&line=0&zone=22
     */
    @Operation(
            summary = "Preview a zone fail",
            description = "Lists the devices a fail at the given zone would take down. Nothing is persisted."
    )
    @GetMapping("/cascade/simulate")
    public ResponseEntity<CacheDiagnosticsService.CascadeSimulation> simulateCascade(
        @RequestParam @PositiveOrZero int controllerId,
        @RequestParam @PositiveOrZero int line,
        @RequestParam @PositiveOrZero int zone
    ) {
        return ResponseEntity.ok(diagnosticsService.simulateZoneFail(controllerId, line, zone));
    }

    @Operation(summary = "Current reconciliation checkpoint")
    @GetMapping("/checkpoint")
    public ResponseEntity<Map<String, Object>> getCheckpoint() {
        Map<String, Object> body = new HashMap<>();
        body.put("initialized", coordinator.currentCheckpoint().isPresent());
        body.put("checkpoint", coordinator.currentCheckpoint().map(c -> c.value().toString()).orElse(null));
        return ResponseEntity.ok(body);
    }

    /**
     * Runs one reconciliation cycle now. Shares the lock with the scheduler,
     * so a trigger during a running cycle answers 409.
     */
    @Operation(summary = "Run one reconciliation cycle immediately")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Cycle committed or nothing to do"),
            @ApiResponse(responseCode = "409", description = "Another cycle is running"),
            @ApiResponse(responseCode = "503", description = "Cycle failed on a store, checkpoint unchanged")
    })
    @PostMapping("/poll")
    public ResponseEntity<Map<String, Object>> poll() {
        CycleResult result = coordinator.pollOnce();
        log.info("Manual poll: {}", result.toLogString());

        Map<String, Object> body = new HashMap<>();
        body.put("status", result.status().name());
        body.put("rowsFetched", result.rowsFetched());
        body.put("rowsApplied", result.rowsApplied());
        body.put("rowsSkipped", result.rowsSkipped());
        body.put("devicesWritten", result.changedDevices().size());
        body.put("checkpoint", result.checkpoint() != null ? result.checkpoint().value().toString() : null);
        if (result.errorKind() != null) {
            body.put("error", result.errorKind().name());
            body.put("message", result.errorMessage());
        }

        HttpStatus status = switch (result.status()) {
            case FAILED -> HttpStatus.SERVICE_UNAVAILABLE;
            case BUSY -> HttpStatus.CONFLICT;
            default -> HttpStatus.OK;
        };
        return ResponseEntity.status(status).body(body);
    }

    @GetMapping("/health")
    public ResponseEntity<?> health() {
        return ResponseEntity.ok(Map.of(
            "status", "UP",
            "service", "Perimeter State Sync",
            "timestamp", Instant.now()
        ));
    }

    private static List<Map<String, Object>> toViews(List<DeviceRecord> devices) {
        return devices.stream().map(CacheDiagnosticsController::toView).toList();
    }

    private static Map<String, Object> toView(DeviceRecord device) {
        Map<String, Object> view = new HashMap<>();
        view.put("name", device.name());
        view.put("lastState", device.rawState());
        view.put("effectiveState", device.effectiveState().name());
        view.put("color", device.effectiveState().displayColor());
        view.put("lastSetTime", device.lastSetTime() != null ? device.lastSetTime().toString() : null);
        view.put("deviceType", device.deviceType().name());
        view.put("controllerId", device.identity() != null ? device.identity().controllerId() : null);
        view.put("line", device.identity() != null ? device.identity().line() : null);
        view.put("zone", device.zone());
        return view;
    }
}
