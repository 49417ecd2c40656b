package com.perimeter.sync.service;

import com.perimeter.sync.dto.CycleResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Drives reconciliation on a fixed delay.
 *
 * Fixed delay (not fixed rate) so a slow cycle pushes the next one back
 * instead of overlapping it. Disabled with {@code perimeter.poll.enabled=false}.
 */
@Component
@ConditionalOnProperty(name = "perimeter.poll.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class ReconciliationScheduler {

    private final ReconciliationCoordinator coordinator;

    @EventListener(ApplicationReadyEvent.class)
    public void initializeOnStartup() {
        log.info("Initializing reconciliation checkpoint...");
        if (!coordinator.initialize()) {
            log.warn("Startup initialization failed, first scheduled poll will retry");
        }
    }

    @Scheduled(fixedDelayString = "${perimeter.poll.interval-seconds:10}",
               initialDelayString = "${perimeter.poll.initial-delay-seconds:5}",
               timeUnit = TimeUnit.SECONDS)
    public void scheduledPoll() {
        CycleResult result = coordinator.pollOnce();
        switch (result.status()) {
            case FAILED -> log.warn("Scheduled poll failed ({}): {}", result.errorKind(), result.errorMessage());
            case BUSY -> log.debug("Scheduled poll skipped, previous cycle still running");
            default -> log.debug("Scheduled poll finished: {}", result.toLogString());
        }
    }
}
