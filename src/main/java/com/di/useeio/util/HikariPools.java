package com.di.useeio.util;

import com.di.useeio.config.DbConfigSnapshot;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Builds HikariCP pools from a {@link DbConfigSnapshot}.
 * Pool names carry a readable host/database/user key and never the password.
 */
@Slf4j
public final class HikariPools {

    /** Incrementing counter for stable, positive pool IDs. */
    private static final AtomicInteger POOL_ID_COUNTER = new AtomicInteger(0);

    private HikariPools() {}

    public static HikariDataSource create(DbConfigSnapshot snapshot) {
        int maxPool = Math.max(1, snapshot.maximumPoolSize());
        int minIdle = Math.max(0, Math.min(snapshot.minimumIdle(), maxPool));

        HikariConfig config = new HikariConfig();
        config.setJdbcUrl(snapshot.jdbcUrl());
        config.setUsername(snapshot.username());
        config.setPassword(snapshot.password());
        if (snapshot.driverClassName() != null && !snapshot.driverClassName().isBlank()) {
            config.setDriverClassName(snapshot.driverClassName());
        }
        config.setMaximumPoolSize(maxPool);
        config.setMinimumIdle(minIdle);
        config.setIdleTimeout(snapshot.idleTimeoutMs());
        config.setConnectionTimeout(snapshot.connectionTimeoutMs());
        config.setMaxLifetime(snapshot.maxLifetimeMs());
        // Repositories run statements outside transactions too; TransactionTemplate turns this off per transaction.
        config.setAutoCommit(true);

        if (snapshot.jdbcUrl() != null && snapshot.jdbcUrl().contains("postgresql")) {
            config.addDataSourceProperty("tcpKeepAlive", "true");
            config.addDataSourceProperty("reWriteBatchedInserts", "true");
        }

        String leakThreshold = System.getProperty("HikariCP.leakDetectionThreshold");
        if (leakThreshold != null && !leakThreshold.isEmpty()) {
            try {
                config.setLeakDetectionThreshold(Long.parseLong(leakThreshold));
            } catch (NumberFormatException e) {
                log.warn("[POOL] Ignoring HikariCP.leakDetectionThreshold={}: not a number", leakThreshold);
            }
        }

        config.setPoolName("HikariPool-" + POOL_ID_COUNTER.incrementAndGet() + "-" + shortPoolKey(snapshot));

        log.info("[POOL] Creating | url={} | user={} | maxPoolSize={}, minIdle={}",
                sanitizeUrl(snapshot.jdbcUrl()), snapshot.username(), maxPool, minIdle);
        return new HikariDataSource(config);
    }

    /**
     * Short, readable key for pool names: {@code host_database_user}, non-alphanumerics folded to '_'.
     */
    public static String shortPoolKey(DbConfigSnapshot snapshot) {
        String url = snapshot.jdbcUrl();
        String user = snapshot.username() != null ? snapshot.username() : "unknown";
        if (url == null || url.isBlank()) {
            return user.replaceAll("[^a-zA-Z0-9_]", "_");
        }
        String safeUrl = sanitizeUrl(url);
        String part = safeUrl;
        int slashSlash = safeUrl.indexOf("//");
        if (slashSlash >= 0) {
            part = safeUrl.substring(slashSlash + 2);
        }
        int slashDb = part.indexOf('/');
        String hostPort = slashDb >= 0 ? part.substring(0, slashDb) : part;
        String db = slashDb >= 0 && slashDb < part.length() - 1 ? part.substring(slashDb + 1).split("[?;]")[0] : "";
        String host = hostPort.split(":")[0];
        String safe = (host + "_" + db + "_" + user).replaceAll("[^a-zA-Z0-9_]", "_").replaceAll("_+", "_");
        return safe.isEmpty() ? "pool" : safe;
    }

    /** Masks {@code password=} parameters in a JDBC URL. */
    public static String sanitizeUrl(String jdbcUrl) {
        if (jdbcUrl == null) {
            return "null";
        }
        return jdbcUrl.replaceAll("password=[^;&]+", "password=***");
    }
}
