package com.di.useeio.config;

import java.io.Serializable;

/**
 * Immutable copy of the connection settings a pool is built from.
 * {@link #toString()} masks the password so the snapshot can be logged.
 */
public record DbConfigSnapshot(String jdbcUrl, String username, String password, String driverClassName,
                               int maximumPoolSize, int minimumIdle, long idleTimeoutMs, long connectionTimeoutMs,
                               long maxLifetimeMs) implements Serializable {

    @Override
    public String toString() {
        return "DbConfigSnapshot[jdbcUrl=" + jdbcUrl
                + ", username=" + username
                + ", password=" + (password == null || password.isEmpty() ? "" : "***")
                + ", driverClassName=" + driverClassName
                + ", maximumPoolSize=" + maximumPoolSize
                + ", minimumIdle=" + minimumIdle
                + ", idleTimeoutMs=" + idleTimeoutMs
                + ", connectionTimeoutMs=" + connectionTimeoutMs
                + ", maxLifetimeMs=" + maxLifetimeMs + "]";
    }
}
