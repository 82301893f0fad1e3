package com.di.useeio.util;

import com.di.useeio.config.DbConfigSnapshot;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("HikariPools Tests")
class HikariPoolsTest {

    private static DbConfigSnapshot snapshot(String url, String user) {
        return new DbConfigSnapshot(url, user, "pw", "org.postgresql.Driver", 4, 1, 300000L, 10000L, 1800000L);
    }

    @Test
    @DisplayName("Should mask password parameters in JDBC URLs")
    void testSanitizeUrl() {
        assertEquals("jdbc:postgresql://db:5432/useeio?user=a&password=***&ssl=true",
            HikariPools.sanitizeUrl("jdbc:postgresql://db:5432/useeio?user=a&password=s3cret&ssl=true"));
        assertEquals("jdbc:postgresql://db:5432/useeio",
            HikariPools.sanitizeUrl("jdbc:postgresql://db:5432/useeio"));
        assertEquals("null", HikariPools.sanitizeUrl(null));
    }

    @Test
    @DisplayName("Should build pool keys from host, database and user")
    void testShortPoolKey() {
        assertEquals("localhost_postgres_postgres",
            HikariPools.shortPoolKey(snapshot("jdbc:postgresql://localhost:5432/postgres", "postgres")));
        assertEquals("db_example_com_useeio_loader",
            HikariPools.shortPoolKey(snapshot("jdbc:postgresql://db.example.com:6543/useeio?sslmode=require", "loader")));
    }

    @Test
    @DisplayName("Should fall back to the user when there is no URL")
    void testShortPoolKey_NoUrl() {
        assertEquals("loader", HikariPools.shortPoolKey(snapshot(null, "loader")));
        assertEquals("unknown", HikariPools.shortPoolKey(snapshot("", null)));
    }
}
