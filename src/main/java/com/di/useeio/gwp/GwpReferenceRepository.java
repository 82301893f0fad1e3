package com.di.useeio.gwp;

import com.di.useeio.sql.SqlQueriesProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * JDBC repository for {@code ipcc_ar_gwp}, keyed by (gas_name, ar_version).
 */
@Repository
@RequiredArgsConstructor
public class GwpReferenceRepository {

    static final RowMapper<GwpReference> ROW_MAPPER = (rs, n) -> GwpReference.builder()
            .gasName(rs.getString("gas_name"))
            .arVersion(rs.getString("ar_version"))
            .gwpValue(rs.getBigDecimal("gwp_value"))
            .gwpDisplay(rs.getString("gwp_display"))
            .category(rs.getString("category"))
            .build();

    private final JdbcTemplate jdbc;
    private final SqlQueriesProperties sql;

    /** Fails with {@code DuplicateKeyException} when the (gas, AR) pair exists. */
    public void insert(GwpReference r) {
        jdbc.update(sql.getGwpReference().getInsert(), args(r));
    }

    public void upsert(GwpReference r) {
        jdbc.update(sql.getGwpReference().getUpsert(), args(r));
    }

    /**
     * Upserts all rows as one JDBC batch. Keys must be unique within the list.
     *
     * @return number of rows sent
     */
    public int upsertAll(List<GwpReference> rows) {
        if (rows == null || rows.isEmpty()) {
            return 0;
        }
        List<Object[]> batch = new ArrayList<>(rows.size());
        for (GwpReference r : rows) {
            batch.add(args(r));
        }
        jdbc.batchUpdate(sql.getGwpReference().getUpsert(), batch);
        return rows.size();
    }

    public Optional<GwpReference> findByKey(String gasName, String arVersion) {
        List<GwpReference> rows = jdbc.query(sql.getGwpReference().getFindByKey(), ROW_MAPPER, gasName, arVersion);
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    public List<GwpReference> findByGasName(String gasName) {
        return jdbc.query(sql.getGwpReference().getFindByGasName(), ROW_MAPPER, gasName);
    }

    public List<GwpReference> findByArVersion(String arVersion) {
        return jdbc.query(sql.getGwpReference().getFindByArVersion(), ROW_MAPPER, arVersion);
    }

    public List<GwpReference> findAll() {
        return jdbc.query(sql.getGwpReference().getFindAll(), ROW_MAPPER);
    }

    public int delete(String gasName, String arVersion) {
        return jdbc.update(sql.getGwpReference().getDeleteByKey(), gasName, arVersion);
    }

    /** Deletes every AR version of a gas. */
    public int deleteByGasName(String gasName) {
        return jdbc.update(sql.getGwpReference().getDeleteByGasName(), gasName);
    }

    /** Deletes rows whose gas name ends with {@code suffix} (matched literally, no wildcards expected). */
    public int deleteByGasNameSuffix(String suffix) {
        return jdbc.update(sql.getGwpReference().getDeleteByGasNameSuffix(), suffix);
    }

    private static Object[] args(GwpReference r) {
        return new Object[] {r.getGasName(), r.getArVersion(), r.getGwpValue(), r.getGwpDisplay(), r.getCategory()};
    }
}
