package com.perimeter.sync.repository;

import com.perimeter.sync.dto.ProductionStatusRow;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Authoritative production device table, seen through the tracked population only.
 *
 * The tracked population is every fence controller zone (by name) plus any
 * device whose status text carries the global-link marker.
 *
 * Implementations signal failures with
 * {@link com.perimeter.sync.service.StoreException}.
 */
public interface ProductionStore {

    /**
     * Tracked rows changed strictly after {@code since}, oldest change first.
     */
    List<ProductionStatusRow> fetchChangedSince(LocalDateTime since);

    /**
     * Every tracked row regardless of change time. Used once to seed an empty cache.
     */
    List<ProductionStatusRow> fetchAllTracked();

    /**
     * Overwrites the status text of one device. Safe to repeat.
     *
     * @return number of production rows updated
     */
    int writeStatus(String name, String status);
}
