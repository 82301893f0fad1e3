package com.di.useeio.characterization;

import com.di.useeio.sql.SqlQueriesProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * JDBC repository for the characterization matrix table {@code c}.
 * Bulk writes are sent as JDBC batches of {@code useeio.store.loader.batch-size} rows.
 */
@Repository
@Slf4j
public class CharacterizationMatrixRepository {

    static final RowMapper<CharacterizationFactor> ROW_MAPPER = (rs, n) -> CharacterizationFactor.builder()
            .modelVersion(rs.getString("model_version"))
            .indicatorCode(rs.getString("indicator_code"))
            .flow(rs.getString("flow"))
            .value(rs.getBigDecimal("value"))
            .build();

    private final JdbcTemplate jdbc;
    private final SqlQueriesProperties sql;
    private final int batchSize;

    public CharacterizationMatrixRepository(JdbcTemplate jdbcTemplate,
                                            SqlQueriesProperties sql,
                                            @Value("${useeio.store.loader.batch-size:2000}") int batchSize) {
        this.jdbc = jdbcTemplate;
        this.sql = sql;
        this.batchSize = Math.max(1, batchSize);
    }

    // ---- writes ----------------------------------------------------------

    public void insert(CharacterizationFactor f) {
        jdbc.update(sql.getCharacterization().getInsert(),
                f.getModelVersion(), f.getIndicatorCode(), f.getFlow(), f.getValue());
    }

    /**
     * Inserts all factors; a duplicate key fails the batch it is in.
     *
     * @return number of rows sent
     */
    public int insertAll(List<CharacterizationFactor> factors) {
        return writeInBatches(sql.getCharacterization().getInsert(), factors);
    }

    /** Like {@link #insertAll} but overwrites the value of existing keys. */
    public int upsertAll(List<CharacterizationFactor> factors) {
        return writeInBatches(sql.getCharacterization().getUpsert(), factors);
    }

    public int deleteByModelVersion(String modelVersion) {
        return jdbc.update(sql.getCharacterization().getDeleteByModelVersion(), modelVersion);
    }

    // ---- reads -----------------------------------------------------------

    public Optional<CharacterizationFactor> findByKey(String modelVersion, String indicatorCode, String flow) {
        List<CharacterizationFactor> rows = jdbc.query(sql.getCharacterization().getFindByKey(),
                ROW_MAPPER, modelVersion, indicatorCode, flow);
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    public List<CharacterizationFactor> findByModelVersion(String modelVersion) {
        return jdbc.query(sql.getCharacterization().getFindByModelVersion(), ROW_MAPPER, modelVersion);
    }

    public List<CharacterizationFactor> findByIndicator(String modelVersion, String indicatorCode) {
        return jdbc.query(sql.getCharacterization().getFindByIndicator(), ROW_MAPPER, modelVersion, indicatorCode);
    }

    public long countByModelVersion(String modelVersion) {
        Long count = jdbc.queryForObject(sql.getCharacterization().getCountByModelVersion(), Long.class, modelVersion);
        return count != null ? count : 0L;
    }

    // ---- helpers ---------------------------------------------------------

    private int writeInBatches(String statement, List<CharacterizationFactor> factors) {
        if (factors == null || factors.isEmpty()) {
            return 0;
        }
        int sent = 0;
        for (int from = 0; from < factors.size(); from += batchSize) {
            List<CharacterizationFactor> chunk = factors.subList(from, Math.min(from + batchSize, factors.size()));
            List<Object[]> args = new ArrayList<>(chunk.size());
            for (CharacterizationFactor f : chunk) {
                args.add(new Object[] {f.getModelVersion(), f.getIndicatorCode(), f.getFlow(), f.getValue()});
            }
            jdbc.batchUpdate(statement, args);
            sent += chunk.size();
            log.debug("[C] Batch of {} row(s) written ({}/{})", chunk.size(), sent, factors.size());
        }
        return sent;
    }
}
