package com.di.useeio.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Binding for everything under {@code useeio.store}.
 *
 * <pre>
 * useeio:
 *   store:
 *     datasource:
 *       jdbc-url: jdbc:postgresql://localhost:5432/postgres
 *       username: postgres
 *       password: ${USEEIO_DB_PASSWORD:}
 *     migration:
 *       enabled: true
 *       locations: classpath:db/migration
 *       baseline-on-migrate: true
 *     reference:
 *       seed-on-startup: true
 *       catalog: classpath:reference/ipcc-ar-gwp.yml
 *     loader:
 *       batch-size: 2000
 *     methodology:
 *       preferred-qualifiers: non-fossil
 * </pre>
 */
@Data
@ConfigurationProperties(prefix = "useeio.store")
public class StoreProperties {

    private Datasource datasource = new Datasource();
    private Migration migration = new Migration();
    private Reference reference = new Reference();
    private Loader loader = new Loader();
    private Methodology methodology = new Methodology();

    @Data
    public static class Datasource {
        private String jdbcUrl;
        private String username;
        private String password;
        private String driverClassName = "org.postgresql.Driver";
        private int maximumPoolSize = 4;
        private int minimumIdle = 1;
        private long idleTimeoutMs = 300_000L;
        private long connectionTimeoutMs = 10_000L;
        private long maxLifetimeMs = 1_800_000L;

        public DbConfigSnapshot toDbConfigSnapshot() {
            if (jdbcUrl == null || jdbcUrl.isBlank()) {
                throw new IllegalStateException("useeio.store.datasource.jdbc-url is required");
            }
            return new DbConfigSnapshot(jdbcUrl.trim(), username, password, driverClassName,
                    maximumPoolSize, minimumIdle, idleTimeoutMs, connectionTimeoutMs, maxLifetimeMs);
        }
    }

    @Data
    public static class Migration {
        /** When false, start-up only inspects the schema. */
        private boolean enabled = true;
        /** Comma-separated Flyway locations. */
        private String locations = "classpath:db/migration";
        /**
         * Adopt databases whose tables were created by hand (SQL editor) at baseline 0;
         * the create scripts are guarded so they run harmlessly afterwards.
         */
        private boolean baselineOnMigrate = true;
    }

    @Data
    public static class Reference {
        private boolean seedOnStartup = true;
        private String catalog = "classpath:reference/ipcc-ar-gwp.yml";
    }

    @Data
    public static class Loader {
        /** Rows per JDBC batch for bulk writes to the characterization matrix. */
        private int batchSize = 2000;
    }

    @Data
    public static class Methodology {
        /**
         * Gas-name qualifiers in order of preference, used when a flow's substance matches several
         * qualified reference rows and none carries the flow's own GWP value.
         */
        private List<String> preferredQualifiers = new ArrayList<>(List.of("non-fossil"));

        public String preferredQualifierList() {
            return String.join(",", preferredQualifiers);
        }
    }
}
