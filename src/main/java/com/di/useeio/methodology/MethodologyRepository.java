package com.di.useeio.methodology;

import com.di.useeio.config.StoreProperties;
import com.di.useeio.gwp.GwpReference;
import com.di.useeio.sql.SqlQueriesProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * Read-side joins of {@code c} with {@code ipcc_ar_gwp} on the flow's implied gas name.
 */
@Repository
@RequiredArgsConstructor
public class MethodologyRepository {

    static final RowMapper<ResolvedFactor> ROW_MAPPER = (rs, n) -> {
        String gasName = rs.getString("gas_name");
        GwpReference gwp = gasName == null ? null : GwpReference.builder()
                .gasName(gasName)
                .arVersion(rs.getString("ar_version"))
                .gwpValue(rs.getBigDecimal("gwp_value"))
                .gwpDisplay(rs.getString("gwp_display"))
                .category(rs.getString("category"))
                .build();
        return ResolvedFactor.builder()
                .modelVersion(rs.getString("model_version"))
                .indicatorCode(rs.getString("indicator_code"))
                .flow(rs.getString("flow"))
                .substance(rs.getString("substance"))
                .characterizationValue(rs.getBigDecimal("value"))
                .gwp(gwp)
                .build();
    };

    private final JdbcTemplate jdbc;
    private final SqlQueriesProperties sql;
    private final StoreProperties properties;

    /** Every flow of the indicator, ordered by flow, each with its best GWP match or none. */
    public List<ResolvedFactor> resolveFactors(String modelVersion, String indicatorCode, String arVersion) {
        return jdbc.query(sql.getMethodology().getResolveFactors(), ROW_MAPPER,
                modelVersion, indicatorCode, arVersion, preferredQualifiers());
    }

    public Optional<ResolvedFactor> resolveFactor(String modelVersion, String indicatorCode, String flow, String arVersion) {
        List<ResolvedFactor> rows = jdbc.query(sql.getMethodology().getResolveFactor(), ROW_MAPPER,
                modelVersion, indicatorCode, flow, arVersion, preferredQualifiers());
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    private String preferredQualifiers() {
        return properties.getMethodology().preferredQualifierList();
    }
}
