package com.perimeter.sync.dto;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.Objects;

/**
 * Boundary between processed and unprocessed production changes.
 *
 * Only rows with a change time strictly after {@link #value()} are fetched.
 *
 * @param value last processed production change time
 */
public record Checkpoint(LocalDateTime value) {

    public Checkpoint {
        Objects.requireNonNull(value, "value");
    }

    public static Checkpoint at(LocalDateTime value) {
        return new Checkpoint(value);
    }

    /**
     * Checkpoint used when neither the cache nor production knows any change.
     */
    public static Checkpoint lookback(LocalDateTime now, Duration lookback) {
        return new Checkpoint(now.minus(lookback));
    }

    /**
     * Moves past the newest processed change so the same instant is never fetched twice.
     *
     * @param maxSeen newest change time of the committed cycle
     * @param epsilon strictly positive step
     */
    public Checkpoint advancePast(LocalDateTime maxSeen, Duration epsilon) {
        if (epsilon.isNegative() || epsilon.isZero()) {
            throw new IllegalArgumentException("Checkpoint epsilon must be positive: " + epsilon);
        }
        LocalDateTime candidate = maxSeen.plus(epsilon);
        return candidate.isAfter(value) ? new Checkpoint(candidate) : new Checkpoint(value.plus(epsilon));
    }
}
