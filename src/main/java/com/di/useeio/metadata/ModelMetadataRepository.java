package com.di.useeio.metadata;

import com.di.useeio.sql.SqlQueriesProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * JDBC repository for the {@code model_metadata} table.
 */
@Repository
@Slf4j
@RequiredArgsConstructor
public class ModelMetadataRepository {

    private final JdbcTemplate jdbc;
    private final SqlQueriesProperties sql;

    // ------------------------------------------------------------------
    // RowMapper
    // ------------------------------------------------------------------

    static final RowMapper<ModelMetadata> ROW_MAPPER = (rs, n) -> {
        ModelMetadata m = new ModelMetadata();
        m.setModelVersion(rs.getString("model_version"));
        m.setEconomicYear(nullableInt(rs.getInt("economic_year"), rs.wasNull()));
        m.setSatelliteYearMin(nullableInt(rs.getInt("satellite_year_min"), rs.wasNull()));
        m.setSatelliteYearMax(nullableInt(rs.getInt("satellite_year_max"), rs.wasNull()));
        m.setIsActive(rs.getBoolean("is_active"));
        m.setCreatedAt(toInstant(rs.getTimestamp("created_at")));
        m.setUpdatedAt(toInstant(rs.getTimestamp("updated_at")));
        return m;
    };

    // ------------------------------------------------------------------
    // Write operations
    // ------------------------------------------------------------------

    /**
     * Inserts a new row. Fails with {@code DuplicateKeyException} when the version exists.
     */
    public void insert(ModelMetadata m) {
        if (m.getIsActive() == null) {
            jdbc.update(sql.getModelMetadata().getInsertWithDefaultFlag(),
                    m.getModelVersion(), m.getEconomicYear(), m.getSatelliteYearMin(), m.getSatelliteYearMax());
        } else {
            jdbc.update(sql.getModelMetadata().getInsert(),
                    m.getModelVersion(), m.getEconomicYear(), m.getSatelliteYearMin(), m.getSatelliteYearMax(),
                    m.getIsActive());
        }
    }

    /**
     * Inserts or, on a primary-key conflict, overwrites years and flag. A null flag is written as false.
     */
    public void upsert(ModelMetadata m) {
        jdbc.update(sql.getModelMetadata().getUpsert(),
                m.getModelVersion(), m.getEconomicYear(), m.getSatelliteYearMin(), m.getSatelliteYearMax(),
                m.active());
    }

    /**
     * Overwrites years and flag of an existing row. {@code updated_at} is left to the trigger.
     *
     * @return rows affected (0 when the version does not exist)
     */
    public int update(ModelMetadata m) {
        return jdbc.update(sql.getModelMetadata().getUpdate(),
                m.getEconomicYear(), m.getSatelliteYearMin(), m.getSatelliteYearMax(), m.active(),
                m.getModelVersion());
    }

    public int setActive(String modelVersion, boolean active) {
        return jdbc.update(sql.getModelMetadata().getSetActive(), active, modelVersion);
    }

    /**
     * Clears the active flag on every other version that has it set.
     *
     * @return rows deactivated
     */
    public int deactivateAllExcept(String modelVersion) {
        return jdbc.update(sql.getModelMetadata().getDeactivateAllExcept(), modelVersion);
    }

    public int deleteByVersion(String modelVersion) {
        return jdbc.update(sql.getModelMetadata().getDeleteByVersion(), modelVersion);
    }

    // ------------------------------------------------------------------
    // Read operations
    // ------------------------------------------------------------------

    public Optional<ModelMetadata> findByVersion(String modelVersion) {
        List<ModelMetadata> rows = jdbc.query(sql.getModelMetadata().getFindByVersion(), ROW_MAPPER, modelVersion);
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    /** Every active row, most recently updated first. The schema allows more than one. */
    public List<ModelMetadata> findActive() {
        return jdbc.query(sql.getModelMetadata().getFindActive(), ROW_MAPPER);
    }

    public List<ModelMetadata> findAll() {
        return jdbc.query(sql.getModelMetadata().getFindAll(), ROW_MAPPER);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static Instant toInstant(Timestamp ts) {
        return ts == null ? null : ts.toInstant();
    }
    private static Integer nullableInt(int v, boolean wasNull) { return wasNull ? null : v; }
}
