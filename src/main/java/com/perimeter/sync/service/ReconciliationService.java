package com.perimeter.sync.service;

import com.perimeter.sync.dto.Checkpoint;
import com.perimeter.sync.dto.CycleResult;
import com.perimeter.sync.dto.DeviceIdentity;
import com.perimeter.sync.dto.DeviceRecord;
import com.perimeter.sync.dto.DeviceType;
import com.perimeter.sync.dto.EffectiveState;
import com.perimeter.sync.dto.ProductionStatusRow;
import com.perimeter.sync.dto.StatusCategory;
import com.perimeter.sync.repository.ProductionStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Reconciles production device states into the cache, one poll cycle at a time.
 *
 * Cycle:
 * 1. Fetch production rows changed after the checkpoint, oldest first
 * 2. For each row that is new, changed, or a fail the cache never cascaded:
 *    re-parse identity, classify, run the cascade, upsert the results
 * 3. Write every affected device's status text back to production
 * 4. Commit the cache transaction and return the advanced checkpoint
 *
 * Failure semantics:
 * Any {@link StoreException} rolls the cache transaction back and the
 * cycle returns the checkpoint it was given, so the next cycle re-fetches
 * the same rows and reaches the same outcome. Production writes issued
 * before the failure stay applied; they are reported as a partial
 * write-back.
 *
 * This class holds no checkpoint of its own. The caller owns it and must
 * not run two cycles at once (see {@link ReconciliationCoordinator}).
 */
@Service
@Slf4j
public class ReconciliationService {

    private final ProductionStore productionStore;
    private final CacheStore cacheStore;
    private final DeviceIdentityParser identityParser;
    private final StatusClassifier classifier;
    private final CascadeEngine cascadeEngine;
    private final TransactionTemplate transactionTemplate;
    private final List<DeviceStateChangeListener> listeners;
    private final Clock clock;
    private final Duration checkpointEpsilon;
    private final Duration initialLookback;

    public ReconciliationService(
        ProductionStore productionStore,
        CacheStore cacheStore,
        DeviceIdentityParser identityParser,
        StatusClassifier classifier,
        CascadeEngine cascadeEngine,
        PlatformTransactionManager transactionManager,
        List<DeviceStateChangeListener> listeners,
        Clock clock,
        @Value("${perimeter.poll.checkpoint-epsilon-micros:1}") long checkpointEpsilonMicros,
        @Value("${perimeter.poll.initial-lookback-minutes:5}") long initialLookbackMinutes
    ) {
        this.productionStore = productionStore;
        this.cacheStore = cacheStore;
        this.identityParser = identityParser;
        this.classifier = classifier;
        this.cascadeEngine = cascadeEngine;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.listeners = List.copyOf(listeners);
        this.clock = clock;
        this.checkpointEpsilon = Duration.of(checkpointEpsilonMicros, ChronoUnit.MICROS);
        this.initialLookback = Duration.ofMinutes(initialLookbackMinutes);

        if (checkpointEpsilon.isZero() || checkpointEpsilon.isNegative()) {
            throw new IllegalArgumentException("perimeter.poll.checkpoint-epsilon-micros must be positive");
        }
    }

    /**
     * Determines the starting checkpoint.
     *
     * Startup Flow:
     * 1. Cache has rows: newest cached change time
     * 2. Cache empty: one-time backfill from production, newest backfilled change time
     * 3. Nothing anywhere: now minus the initial lookback
     *
     * @throws StoreException when the cache or production cannot be read, or the backfill cannot be stored
     */
    public Checkpoint initialize() {
        if (!cacheStore.isEmpty()) {
            Checkpoint checkpoint = cacheStore.maxLastSetTime()
                .map(Checkpoint::at)
                .orElseGet(this::lookbackCheckpoint);
            log.info("Initialized checkpoint from cache: {}", checkpoint.value());
            return checkpoint;
        }

        log.info("Cache is empty, performing initial backfill...");
        return backfill();
    }

    /**
     * Seeds an empty cache with every tracked production device.
     *
     * Each row is mapped directly to its effective state; no cascade rules
     * run and nothing is written back to production.
     */
    Checkpoint backfill() {
        long startTime = System.currentTimeMillis();
        List<ProductionStatusRow> rows = productionStore.fetchAllTracked();

        if (rows.isEmpty()) {
            Checkpoint checkpoint = lookbackCheckpoint();
            log.warn("No tracked devices found in production, starting from {}", checkpoint.value());
            return checkpoint;
        }

        Map<String, DeviceRecord> seeded = new LinkedHashMap<>();
        LocalDateTime newest = null;
        for (ProductionStatusRow row : rows) {
            StatusCategory category = classifier.classify(row.rawStatus());
            DeviceRecord record = observe(DeviceRecord.unseen(row.name()), row, category)
                .withEffectiveState(classifier.directState(category, row.rawStatus()));
            seeded.put(record.name(), record);
            newest = latest(newest, row.changeTime());
        }

        List<DeviceRecord> records = List.copyOf(seeded.values());
        try {
            transactionTemplate.executeWithoutResult(status -> cacheStore.upsertAll(records));
        } catch (TransactionException | DataAccessException e) {
            throw new StoreException(StoreErrorKind.CACHE_WRITE, "Failed to commit backfill", e);
        }

        Checkpoint checkpoint = newest != null ? Checkpoint.at(newest) : lookbackCheckpoint();
        log.info("Backfill complete: {} devices cached in {}ms, checkpoint {}",
            records.size(), System.currentTimeMillis() - startTime, checkpoint.value());

        notifyListeners(records);
        return checkpoint;
    }

    /**
     * Runs one reconciliation cycle.
     *
     * @param checkpoint change time already processed
     * @return the outcome; its checkpoint is the one to pass to the next cycle
     */
    public CycleResult runCycle(Checkpoint checkpoint) {
        List<ProductionStatusRow> rows;
        try {
            rows = productionStore.fetchChangedSince(checkpoint.value());
        } catch (StoreException e) {
            log.error("Fetch from production failed, checkpoint stays at {}", checkpoint.value(), e);
            return CycleResult.failed(checkpoint, 0, e.getKind(), e.getMessage());
        }

        if (rows.isEmpty()) {
            log.debug("No new device state changes since {}", checkpoint.value());
            return CycleResult.empty(checkpoint);
        }

        List<String> writtenToProduction = new ArrayList<>();
        CycleResult result;
        try {
            result = transactionTemplate.execute(status -> {
                try {
                    CycleWork work = processRows(rows);
                    writeBack(work.pending().values(), writtenToProduction);

                    Checkpoint next = work.newestChange() != null
                        ? checkpoint.advancePast(work.newestChange(), checkpointEpsilon)
                        : checkpoint;
                    return CycleResult.committed(next, rows.size(), work.applied(), work.skipped(),
                        List.copyOf(work.pending().values()));
                } catch (StoreException e) {
                    status.setRollbackOnly();
                    log.error("Cycle aborted ({}), cache rolled back, checkpoint stays at {}",
                        e.getKind(), checkpoint.value(), e);
                    return CycleResult.failed(checkpoint, rows.size(), e.getKind(), e.getMessage());
                }
            });
        } catch (TransactionException | DataAccessException e) {
            if (writtenToProduction.isEmpty()) {
                log.error("Cache commit failed, checkpoint stays at {}", checkpoint.value(), e);
                return CycleResult.failed(checkpoint, rows.size(), StoreErrorKind.CACHE_WRITE, e.getMessage());
            }
            log.error("Partial write-back: cache commit failed after {} device(s) were written to production; "
                    + "production now differs from the cache for {}, checkpoint stays at {}",
                writtenToProduction.size(), writtenToProduction, checkpoint.value(), e);
            return CycleResult.failed(checkpoint, rows.size(), StoreErrorKind.CACHE_WRITE,
                "Cache commit failed after " + writtenToProduction.size()
                    + " production write(s): " + e.getMessage());
        }

        if (result.isCommitted()) {
            log.info("Reconciled {}", result.toLogString());
            notifyListeners(result.changedDevices());
        }
        return result;
    }

    private CycleWork processRows(List<ProductionStatusRow> rows) {
        Map<String, DeviceRecord> pending = new LinkedHashMap<>();
        LocalDateTime newest = null;
        int applied = 0;
        int skipped = 0;

        for (ProductionStatusRow row : rows) {
            newest = latest(newest, row.changeTime());

            StatusCategory category = classifier.classify(row.rawStatus());
            Optional<DeviceRecord> cached = cacheStore.get(row.name());

            if (cached.isPresent() && isUnchanged(row, category, cached.get())) {
                log.debug("Unchanged, skipping: {}", row.toLogString());
                skipped++;
                continue;
            }

            DeviceRecord observed = cached.isPresent() && category == StatusCategory.UNKNOWN
                ? cached.get().observed(row.rawStatus(), row.changeTime(),
                    cached.get().identity(), cached.get().deviceType())
                : observe(cached.orElseGet(() -> DeviceRecord.unseen(row.name())), row, category);
            cacheStore.upsert(observed);

            if (category == StatusCategory.UNKNOWN) {
                log.warn("Unrecognized status for {}: '{}', effective state kept at {}",
                    row.name(), row.rawStatus(), observed.effectiveState());
            }

            List<DeviceRecord> affected = cascadeEngine.apply(
                category,
                observed,
                devicesOnLine(observed),
                category == StatusCategory.GLOBAL_LINK_EVENT ? cacheStore.findAll() : List.of()
            );
            cacheStore.upsertAll(affected);
            for (DeviceRecord device : affected) {
                pending.remove(device.name());
                pending.put(device.name(), device);
            }
            applied++;
        }

        return new CycleWork(pending, newest, applied, skipped);
    }

    /**
     * A row is skipped when production repeats the cached text, unless it
     * reports a zone fail that the cache never turned into FAIL.
     */
    private boolean isUnchanged(ProductionStatusRow row, StatusCategory category, DeviceRecord cached) {
        if (!Objects.equals(row.rawStatus(), cached.rawState())) {
            return false;
        }
        boolean forcedReevaluation = category == StatusCategory.ZONE_FAIL
            && cached.effectiveState() != EffectiveState.FAIL;
        return !forcedReevaluation;
    }

    /**
     * Applies the row's text, time and parsed identity. A cached device that
     * reports an unrecognized status keeps its identity and type instead, see
     * {@link #processRows}. Devices whose status
     * carries the global-link marker are typed GLOBAL_LINK and lose their zone.
     */
    private DeviceRecord observe(DeviceRecord base, ProductionStatusRow row, StatusCategory category) {
        Optional<DeviceIdentity> identity = identityParser.parse(row.name());

        if (identity.isEmpty()) {
            return base.observed(row.rawStatus(), row.changeTime(), null, DeviceType.UNKNOWN);
        }
        if (category == StatusCategory.GLOBAL_LINK_EVENT) {
            return base.observed(row.rawStatus(), row.changeTime(), identity.get().withoutZone(), DeviceType.GLOBAL_LINK);
        }
        return base.observed(row.rawStatus(), row.changeTime(), identity.get(), DeviceType.FENCE_ZONE);
    }

    private List<DeviceRecord> devicesOnLine(DeviceRecord device) {
        DeviceIdentity identity = device.identity();
        if (identity == null) {
            return List.of();
        }
        return cacheStore.findByControllerAndLine(identity.controllerId(), identity.line());
    }

    /**
     * Writes pending statuses to production in order.
     *
     * Writes are not undone when a later one fails: production keeps the
     * statuses already written while the cache rolls back. Names of the
     * devices written are appended to {@code written}.
     */
    private void writeBack(Collection<DeviceRecord> pending, List<String> written) {
        for (DeviceRecord device : pending) {
            try {
                productionStore.writeStatus(device.name(), device.rawState());
                written.add(device.name());
            } catch (StoreException e) {
                if (!written.isEmpty()) {
                    log.error("Partial write-back: {} of {} device(s) written before {} failed; "
                            + "production now differs from the cache for {}",
                        written.size(), pending.size(), device.name(), written);
                }
                throw e;
            }
        }
        log.debug("Wrote {} device status(es) back to production", written.size());
    }

    private void notifyListeners(List<DeviceRecord> changed) {
        if (changed.isEmpty()) {
            return;
        }
        for (DeviceStateChangeListener listener : listeners) {
            try {
                listener.onDevicesChanged(changed);
            } catch (RuntimeException e) {
                log.error("Device state listener {} failed for {} device(s)",
                    listener.getClass().getSimpleName(), changed.size(), e);
            }
        }
    }

    private Checkpoint lookbackCheckpoint() {
        return Checkpoint.lookback(LocalDateTime.now(clock), initialLookback);
    }

    private static LocalDateTime latest(LocalDateTime current, LocalDateTime candidate) {
        if (candidate == null) {
            return current;
        }
        return current == null || candidate.isAfter(current) ? candidate : current;
    }

    private record CycleWork(
        Map<String, DeviceRecord> pending,
        LocalDateTime newestChange,
        int applied,
        int skipped
    ) {}
}
