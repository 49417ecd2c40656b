package com.perimeter.sync.repository;

import com.perimeter.sync.dto.ProductionStatusRow;
import com.perimeter.sync.service.StoreErrorKind;
import com.perimeter.sync.service.StoreException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.LocalDateTime;
import java.util.List;

/**
 * JDBC access to the production {@code device_tbl}.
 *
 * The production schema belongs to another system, so queries are plain SQL
 * over its column names instead of a mapped entity.
 */
@Repository
@Slf4j
public class JdbcProductionStore implements ProductionStore {

    static final String FENCE_NAME_PATTERN = "Fence Controller FC-%";
    // underscore escaped, it is a LIKE wildcard otherwise
    static final String GLOBAL_LINK_PATTERN = "%axe\\_Elfar%";

    private static final String TRACKED_POPULATION = """
        (dvcname_txt LIKE :namePattern OR dvcCurrentStateUser_TXT LIKE :linkPattern ESCAPE '\\')
        """;

    private static final String FETCH_CHANGED_SQL = """
        SELECT dvcname_txt, dvcCurrentStateUser_TXT, dvcCurrentStateSetTime_DTM
        FROM device_tbl
        WHERE
        """ + TRACKED_POPULATION + """
          AND dvcCurrentStateSetTime_DTM > :since
        ORDER BY dvcCurrentStateSetTime_DTM ASC
        """;

    private static final String FETCH_ALL_SQL = """
        SELECT dvcname_txt, dvcCurrentStateUser_TXT, dvcCurrentStateSetTime_DTM
        FROM device_tbl
        WHERE
        """ + TRACKED_POPULATION;

    private static final String WRITE_STATUS_SQL = """
        UPDATE device_tbl
        SET dvcCurrentStateUser_TXT = :status
        WHERE dvcname_txt = :name
        """;

    private static final RowMapper<ProductionStatusRow> ROW_MAPPER = (rs, rowNum) -> {
        Timestamp setTime = rs.getTimestamp(3);
        return new ProductionStatusRow(
            rs.getString(1),
            rs.getString(2),
            setTime != null ? setTime.toLocalDateTime() : null
        );
    };

    private final NamedParameterJdbcTemplate jdbc;

    public JdbcProductionStore(@Qualifier("productionJdbcTemplate") NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    @Override
    public List<ProductionStatusRow> fetchChangedSince(LocalDateTime since) {
        MapSqlParameterSource params = trackedPopulation()
            .addValue("since", Timestamp.valueOf(since));
        try {
            List<ProductionStatusRow> rows = jdbc.query(FETCH_CHANGED_SQL, params, ROW_MAPPER);
            log.debug("Fetched {} changed production rows since {}", rows.size(), since);
            return rows;
        } catch (DataAccessException e) {
            throw new StoreException(StoreErrorKind.PRODUCTION_READ,
                "Failed to fetch production changes since " + since, e);
        }
    }

    @Override
    public List<ProductionStatusRow> fetchAllTracked() {
        try {
            return jdbc.query(FETCH_ALL_SQL, trackedPopulation(), ROW_MAPPER);
        } catch (DataAccessException e) {
            throw new StoreException(StoreErrorKind.PRODUCTION_READ, "Failed to scan tracked production devices", e);
        }
    }

    @Override
    public int writeStatus(String name, String status) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("status", status)
            .addValue("name", name);
        try {
            int updated = jdbc.update(WRITE_STATUS_SQL, params);
            if (updated == 0) {
                log.warn("Write-back matched no production row: device={}", name);
            }
            return updated;
        } catch (DataAccessException e) {
            throw new StoreException(StoreErrorKind.PRODUCTION_WRITE,
                "Failed to write status for device " + name, e);
        }
    }

    private MapSqlParameterSource trackedPopulation() {
        return new MapSqlParameterSource()
            .addValue("namePattern", FENCE_NAME_PATTERN)
            .addValue("linkPattern", GLOBAL_LINK_PATTERN);
    }
}
