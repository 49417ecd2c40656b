package com.perimeter.sync.dto;

import com.perimeter.sync.service.StoreErrorKind;

import java.util.List;

/**
 * Outcome of one reconciliation cycle.
 *
 * A cycle never throws to its caller; store failures come back as a
 * {@link Status#FAILED} result carrying the unchanged checkpoint.
 *
 * @param status         how the cycle ended
 * @param checkpoint     checkpoint to use for the next cycle, null if initialization never succeeded
 * @param rowsFetched    production rows returned by the fetch
 * @param rowsApplied    rows that went through classification and cascade
 * @param rowsSkipped    rows skipped as unchanged
 * @param changedDevices records persisted and written back, in write order
 * @param errorKind      failing store operation, only for FAILED
 * @param errorMessage   failure detail, only for FAILED
 */
public record CycleResult(
    Status status,
    Checkpoint checkpoint,
    int rowsFetched,
    int rowsApplied,
    int rowsSkipped,
    List<DeviceRecord> changedDevices,
    StoreErrorKind errorKind,
    String errorMessage
) {

    public enum Status {
        /** Nothing new in production. */
        EMPTY,
        /** Cache committed, write-back done, checkpoint advanced. */
        COMMITTED,
        /** Rolled back, checkpoint unchanged. */
        FAILED,
        /** Another cycle held the lock. */
        BUSY
    }

    public CycleResult {
        changedDevices = changedDevices == null ? List.of() : List.copyOf(changedDevices);
    }

    public static CycleResult empty(Checkpoint checkpoint) {
        return new CycleResult(Status.EMPTY, checkpoint, 0, 0, 0, List.of(), null, null);
    }

    public static CycleResult busy(Checkpoint checkpoint) {
        return new CycleResult(Status.BUSY, checkpoint, 0, 0, 0, List.of(), null, null);
    }

    public static CycleResult committed(Checkpoint next, int fetched, int applied, int skipped,
                                        List<DeviceRecord> changed) {
        return new CycleResult(Status.COMMITTED, next, fetched, applied, skipped, changed, null, null);
    }

    public static CycleResult failed(Checkpoint unchanged, int fetched, StoreErrorKind kind, String message) {
        return new CycleResult(Status.FAILED, unchanged, fetched, 0, 0, List.of(), kind, message);
    }

    public boolean isCommitted() {
        return status == Status.COMMITTED;
    }

    public String toLogString() {
        return String.format(
            "Cycle[status=%s, fetched=%d, applied=%d, skipped=%d, written=%d, checkpoint=%s]",
            status, rowsFetched, rowsApplied, rowsSkipped, changedDevices.size(), checkpoint != null ? checkpoint.value() : null
        );
    }
}
