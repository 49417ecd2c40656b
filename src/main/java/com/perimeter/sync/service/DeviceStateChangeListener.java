package com.perimeter.sync.service;

import com.perimeter.sync.dto.DeviceRecord;

import java.util.List;

/**
 * Receives device records after they have been committed to the cache.
 *
 * Called on the reconciliation thread once per committed cycle (and once
 * after the initial backfill). A listener failure is logged by the caller
 * and never undoes the commit.
 */
public interface DeviceStateChangeListener {

    void onDevicesChanged(List<DeviceRecord> changedDevices);
}
