package com.perimeter.sync.service;

import com.perimeter.sync.dto.Checkpoint;
import com.perimeter.sync.dto.CycleResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Owns the process-wide checkpoint and serializes reconciliation cycles.
 *
 * Both the scheduler and the manual trigger go through {@link #pollOnce()}.
 * A call that finds a cycle already running returns BUSY immediately
 * instead of queueing behind it.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ReconciliationCoordinator {

    private final ReconciliationService reconciliationService;
    private final ReentrantLock cycleLock = new ReentrantLock();

    private volatile Checkpoint checkpoint;
    private StoreException lastInitializationError;

    /**
     * Establishes the checkpoint (backfilling an empty cache) if not done yet.
     *
     * @return true if a checkpoint is available afterwards
     */
    public boolean initialize() {
        cycleLock.lock();
        try {
            return ensureInitialized();
        } finally {
            cycleLock.unlock();
        }
    }

    /**
     * Runs one cycle from the current checkpoint and keeps the checkpoint it
     * returns when the cycle committed.
     */
    public CycleResult pollOnce() {
        if (!cycleLock.tryLock()) {
            log.warn("Reconciliation cycle already running, skipping this trigger");
            return CycleResult.busy(checkpoint);
        }
        try {
            if (!ensureInitialized()) {
                return CycleResult.failed(null, 0,
                    lastInitializationError.getKind(), lastInitializationError.getMessage());
            }

            CycleResult result = reconciliationService.runCycle(checkpoint);
            if (result.isCommitted()) {
                checkpoint = result.checkpoint();
            }
            return result;
        } finally {
            cycleLock.unlock();
        }
    }

    public Optional<Checkpoint> currentCheckpoint() {
        return Optional.ofNullable(checkpoint);
    }

    private boolean ensureInitialized() {
        if (checkpoint != null) {
            return true;
        }
        try {
            checkpoint = reconciliationService.initialize();
            lastInitializationError = null;
            return true;
        } catch (StoreException e) {
            lastInitializationError = e;
            log.error("Checkpoint initialization failed ({}), will retry on next poll", e.getKind(), e);
            return false;
        }
    }
}
