package com.perimeter.sync.dto;

import java.time.LocalDateTime;

/**
 * One row read from the production device table.
 *
 * @param name       device name ({@code dvcname_txt})
 * @param rawStatus  current status text ({@code dvcCurrentStateUser_TXT})
 * @param changeTime when production last set the status ({@code dvcCurrentStateSetTime_DTM}), may be null on backfill
 */
public record ProductionStatusRow(String name, String rawStatus, LocalDateTime changeTime) {

    public String toLogString() {
        return String.format("Row[name=%s, status=%s, time=%s]", name, rawStatus, changeTime);
    }
}
