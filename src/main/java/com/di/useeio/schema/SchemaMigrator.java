package com.di.useeio.schema;

import com.di.useeio.aspect.LogStoreOperation;
import com.di.useeio.config.StoreProperties;
import lombok.extern.slf4j.Slf4j;
import org.flywaydb.core.Flyway;
import org.flywaydb.core.api.MigrationInfo;
import org.flywaydb.core.api.output.MigrateResult;

import javax.sql.DataSource;
import java.util.Arrays;

/**
 * Applies the store's Flyway migrations: V1-V3 create the three tables, V4 relaxes legacy
 * {@code ipcc_ar_gwp} columns and the repeatable script (re)installs the
 * {@code updated_at} trigger.
 */
@Slf4j
public class SchemaMigrator {

    private final Flyway flyway;

    public SchemaMigrator(DataSource dataSource, StoreProperties.Migration migration) {
        String[] locations = Arrays.stream(migration.getLocations().split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .toArray(String[]::new);
        this.flyway = Flyway.configure()
                .dataSource(dataSource)
                .locations(locations)
                .baselineOnMigrate(migration.isBaselineOnMigrate())
                .baselineVersion("0")
                .load();
    }

    /**
     * Brings the schema up to date.
     *
     * @return number of migrations executed (0 when already current)
     */
    @LogStoreOperation(eventType = "SCHEMA_MIGRATE")
    public int migrate() {
        MigrateResult result = flyway.migrate();
        log.info("[SCHEMA] Migrated {} -> {} ({} migration(s) executed)",
                result.initialSchemaVersion, result.targetSchemaVersion, result.migrationsExecuted);
        return result.migrationsExecuted;
    }

    public int pendingCount() {
        return flyway.info().pending().length;
    }

    /** Version of the latest applied versioned migration, or null before the first migrate. */
    public String currentVersion() {
        MigrationInfo current = flyway.info().current();
        return current != null && current.getVersion() != null ? current.getVersion().getVersion() : null;
    }
}
