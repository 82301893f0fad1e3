package com.di.useeio.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("DbConfigSnapshot Tests")
class DbConfigSnapshotTest {

    private static DbConfigSnapshot snapshot(String user, String password) {
        return new DbConfigSnapshot(
            "jdbc:postgresql://localhost:5432/useeio",
            user,
            password,
            "org.postgresql.Driver",
            10,
            2,
            600000L,
            30000L,
            1800000L
        );
    }

    @Test
    @DisplayName("Should expose every connection setting")
    void testCreateDbConfigSnapshot_AllFields() {
        DbConfigSnapshot config = snapshot("postgres", "secret");

        assertEquals("jdbc:postgresql://localhost:5432/useeio", config.jdbcUrl());
        assertEquals("postgres", config.username());
        assertEquals("secret", config.password());
        assertEquals("org.postgresql.Driver", config.driverClassName());
        assertEquals(10, config.maximumPoolSize());
        assertEquals(2, config.minimumIdle());
        assertEquals(600000L, config.idleTimeoutMs());
        assertEquals(30000L, config.connectionTimeoutMs());
        assertEquals(1800000L, config.maxLifetimeMs());
    }

    @Test
    @DisplayName("Should mask the password in toString")
    void testToString_MasksPassword() {
        String text = snapshot("postgres", "secret").toString();

        assertTrue(text.contains("jdbc:postgresql://localhost:5432/useeio"));
        assertTrue(text.contains("password=***"));
        assertFalse(text.contains("secret"));
    }

    @Test
    @DisplayName("Should print an empty password as empty")
    void testToString_EmptyPassword() {
        assertTrue(snapshot("postgres", "").toString().contains("password=,"));
        assertTrue(snapshot("postgres", null).toString().contains("password=,"));
    }

    @Test
    @DisplayName("Should compare by value")
    void testEquals() {
        assertEquals(snapshot("postgres", "secret"), snapshot("postgres", "secret"));
        assertEquals(snapshot("postgres", "secret").hashCode(), snapshot("postgres", "secret").hashCode());
        assertNotEquals(snapshot("postgres", "secret"), snapshot("loader", "secret"));
    }
}
