package com.di.useeio.config;

import com.di.useeio.aspect.StoreOperationAspect;
import com.di.useeio.gwp.GwpReferenceLoader;
import com.di.useeio.methodology.MethodologyService;
import com.di.useeio.schema.SchemaInspector;
import com.di.useeio.schema.SchemaMigrator;
import com.di.useeio.schema.SchemaStatus;
import com.di.useeio.schema.StoreTables;
import com.di.useeio.util.HikariPools;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.UUID;

/**
 * At startup: applies migrations, logs what is installed, refreshes the GWP reference rows and
 * reports the active methodology. A failed migration stops the application.
 */
@Component
@Order(1)
@RequiredArgsConstructor
@Slf4j
public class SchemaStartupInitializer implements ApplicationRunner {

    private final StoreProperties properties;
    private final SchemaMigrator schemaMigrator;
    private final SchemaInspector schemaInspector;
    private final GwpReferenceLoader gwpReferenceLoader;
    private final MethodologyService methodologyService;

    @Override
    public void run(ApplicationArguments args) {
        MDC.put(StoreOperationAspect.RUN_ID_KEY, UUID.randomUUID().toString().substring(0, 8));
        try {
            log.info("[STARTUP] Store datasource: {}",
                    HikariPools.sanitizeUrl(properties.getDatasource().getJdbcUrl()));

            if (properties.getMigration().isEnabled()) {
                schemaMigrator.migrate();
            } else {
                log.info("[STARTUP] Migrations disabled (useeio.store.migration.enabled=false); {} pending",
                        schemaMigrator.pendingCount());
            }

            SchemaStatus status = schemaInspector.inspect();
            if (status.isComplete()) {
                log.info("[SCHEMA] Schema complete (version {}): primary keys {}",
                        schemaMigrator.currentVersion(), status.primaryKeys());
            } else {
                log.warn("[SCHEMA] Schema incomplete: missing tables {}, updated_at trigger installed {} time(s), {}() present: {}",
                        status.missingTables(), status.updatedAtTriggerCount(),
                        StoreTables.UPDATED_AT_FUNCTION, status.updatedAtFunctionPresent());
            }

            if (properties.getReference().isSeedOnStartup()) {
                gwpReferenceLoader.refresh();
            }

            if (!status.tables().getOrDefault(StoreTables.MODEL_METADATA, false)) {
                log.warn("[STARTUP] model_metadata does not exist; no active methodology to report");
                return;
            }
            methodologyService.describeActive().ifPresentOrElse(
                    text -> log.info("[STARTUP] Active methodology: {}", text),
                    () -> log.warn("[STARTUP] No active model version in model_metadata"));
        } finally {
            MDC.remove(StoreOperationAspect.RUN_ID_KEY);
        }
    }
}
